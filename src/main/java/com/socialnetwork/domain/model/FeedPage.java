package com.socialnetwork.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedPage {

    private List<PostView> posts;
    private int page;
    private int limit;
    private boolean hasMore;
}
