package com.kmg.repost.dto;

public record RunNowResponse(String id, boolean ok, String detail, String lastResult) {
}
