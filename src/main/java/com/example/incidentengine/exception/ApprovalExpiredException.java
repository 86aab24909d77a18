package com.example.incidentengine.exception;

public class ApprovalExpiredException extends RuntimeException {

    public ApprovalExpiredException(String message) {
        super(message);
    }
}
