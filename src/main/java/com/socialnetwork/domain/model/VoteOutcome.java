package com.socialnetwork.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What a vote call did to the user's existing vote.
 */
public enum VoteOutcome {
    @JsonProperty("added") ADDED,
    @JsonProperty("removed") REMOVED,
    @JsonProperty("switched") SWITCHED
}
