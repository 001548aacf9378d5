package com.kmg.repost.dto;

public record EventMessage(
        String type,
        String scheduleId,
        String message,
        String timestamp,
        Object payload
) {
}
