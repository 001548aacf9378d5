package com.kmg.repost.dto;

public record ToggleResponse(String id, boolean active) {
}
