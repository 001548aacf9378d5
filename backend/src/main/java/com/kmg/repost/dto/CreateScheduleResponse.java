package com.kmg.repost.dto;

public record CreateScheduleResponse(String id) {
}
