package com.socialnetwork.domain.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Event RSVP: {@code going}, {@code not_going}, or {@code remove}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventResponseRequest {

    @NotBlank(message = "Response is required")
    private String response;
}
