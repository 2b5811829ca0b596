package com.socialnetwork.domain.model;

import com.socialnetwork.infrastructure.persistence.entity.PostEntity;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreatePostRequest {

    private String title;

    @NotBlank(message = "Content is required")
    private String content;

    private String imageUrl;
    private PostEntity.Privacy privacy;

    // Only used for PRIVATE posts
    private List<Long> allowedFollowers;
}
