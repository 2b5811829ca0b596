package com.socialnetwork.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Profile as seen by a particular viewer.
 *
 * When {@code limited} is true the viewer may not see private details
 * (email, birthday, about), which are left null.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserProfile {

    private Long id;
    private String email;
    private String firstName;
    private String lastName;
    private LocalDate dateOfBirth;
    private String avatar;
    private String nickname;
    private String aboutMe;
    private Boolean isPublic;
    private Instant createdAt;

    private long followersCount;
    private long followingCount;
    private Boolean isFollowing;
    private Boolean followRequestSent;
    private Boolean isOwnProfile;
    private Boolean limited;
}
