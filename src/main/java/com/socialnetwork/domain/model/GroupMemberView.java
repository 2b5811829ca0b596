package com.socialnetwork.domain.model;

import com.socialnetwork.infrastructure.persistence.entity.GroupMemberEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GroupMemberView {

    private Long userId;
    private String firstName;
    private String lastName;
    private String avatar;
    private String nickname;
    private GroupMemberEntity.Role role;
    private Instant joinedAt;
}
