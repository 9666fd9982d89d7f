package com.cred.freestyle.jewelryauction.api.dto;

import com.cred.freestyle.jewelryauction.domain.model.Notification;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
public class NotificationResponse {

    private String notificationId;
    private String type;
    private String priority;
    private String title;
    private String message;
    private String referenceId;
    private String sessionId;
    private String status;
    private Instant createdAt;
    private Instant readAt;

    public static NotificationResponse fromEntity(Notification notification) {
        NotificationResponse response = new NotificationResponse();
        response.setNotificationId(notification.getNotificationId());
        response.setType(notification.getType().name());
        response.setPriority(notification.getPriority().name());
        response.setTitle(notification.getTitle());
        response.setMessage(notification.getMessage());
        response.setReferenceId(notification.getReferenceId());
        response.setSessionId(notification.getSessionId());
        response.setStatus(notification.getStatus().name());
        response.setCreatedAt(notification.getCreatedAt());
        response.setReadAt(notification.getReadAt());
        return response;
    }
}
