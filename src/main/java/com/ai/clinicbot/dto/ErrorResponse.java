package com.ai.clinicbot.dto;

/**
 * Body of every structured failure returned to internal callers.
 */
public record ErrorResponse(boolean ok, String error, String errorCode) {

    public static ErrorResponse of(String error, String errorCode) {
        return new ErrorResponse(false, error, errorCode);
    }
}
