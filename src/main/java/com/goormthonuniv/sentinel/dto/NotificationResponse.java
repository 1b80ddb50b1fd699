package com.goormthonuniv.sentinel.dto;

import com.goormthonuniv.sentinel.entity.Notification;

import java.time.Instant;
import java.util.UUID;

public record NotificationResponse(
        UUID id,
        String content,
        String notificationType,
        UUID crisisId,          // 첫 주기 요약 알림은 null
        Instant createdAt
) {
    public static NotificationResponse from(Notification n) {
        return new NotificationResponse(n.getId(), n.getContent(), n.getNotificationType(), n.getCrisisId(), n.getCreatedAt());
    }
}
