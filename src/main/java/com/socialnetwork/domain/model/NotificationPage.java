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
public class NotificationPage {

    private List<NotificationView> notifications;
    private long unreadCount;
    private int total;
    private int offset;
    private int limit;
}
