package com.socialnetwork.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Text and optional image, shared by comments, group posts and group comments.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentRequest {

    private String content;
    private String imageUrl;
}
