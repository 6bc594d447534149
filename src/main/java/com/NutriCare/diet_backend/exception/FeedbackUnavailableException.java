package com.NutriCare.diet_backend.exception;

import org.springframework.http.HttpStatus;

public class FeedbackUnavailableException extends ApiException {
    public FeedbackUnavailableException(String message) {
        super(message, HttpStatus.BAD_GATEWAY, "FEEDBACK_UNAVAILABLE");
    }

    public FeedbackUnavailableException(String message, Throwable cause) {
        super(message, HttpStatus.BAD_GATEWAY, "FEEDBACK_UNAVAILABLE", cause);
    }
}
