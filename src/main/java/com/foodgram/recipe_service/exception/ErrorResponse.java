package com.foodgram.recipe_service.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;

@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private final String code;
    private final String detail;
    private String errorId;

    public ErrorResponse(String code, String detail) {
        this.code = code;
        this.detail = detail;
    }

    public ErrorResponse(String code, String detail, String errorId) {
        this.code = code;
        this.detail = detail;
        this.errorId = errorId;
    }

    public static ErrorResponse of(ErrorCode errorCode) {
        return new ErrorResponse(errorCode.getCode(), errorCode.getMessage());
    }
}
