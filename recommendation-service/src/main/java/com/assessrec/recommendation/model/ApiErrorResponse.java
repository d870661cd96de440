package com.assessrec.recommendation.model;

public class ApiErrorResponse {
    private final int status;
    private final String message;

    public ApiErrorResponse(int status, String message) {
        this.status = status;
        this.message = message;
    }

    public int getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }
}
