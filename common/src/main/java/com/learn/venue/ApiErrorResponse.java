package com.learn.venue;

public record ApiErrorResponse(ApiError error, String data, String message) {
}
