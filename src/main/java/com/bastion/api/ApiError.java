package com.bastion.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body returned by every endpoint: {@code {"error": message, "code": code}}.
 */
public class ApiError {

    @JsonProperty("error")
    private final String error;

    @JsonProperty("code")
    private final String code;

    public ApiError(String error, String code) {
        this.error = error;
        this.code = code;
    }

    public String getError() {
        return error;
    }

    public String getCode() {
        return code;
    }
}
