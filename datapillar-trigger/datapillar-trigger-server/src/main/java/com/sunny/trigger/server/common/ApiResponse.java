package com.sunny.trigger.server.common;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 统一响应结构
 *
 * @author SunnyX6
 * @date 2025-12-13
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private static final int SUCCESS_CODE = 0;

    private int code;
    private String message;
    private T data;

    public ApiResponse() {
    }

    public int getCode() {
        return code;
    }

    public void setCode(int code) {
        this.code = code;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public T getData() {
        return data;
    }

    public void setData(T data) {
        this.data = data;
    }

    public static <T> ApiResponse<T> ok(T data) {
        ApiResponse<T> response = new ApiResponse<>();
        response.code = SUCCESS_CODE;
        response.data = data;
        return response;
    }

    public static ApiResponse<Void> ok() {
        return ok(null);
    }

    public static ApiResponse<Void> error(int code, String message) {
        ApiResponse<Void> response = new ApiResponse<>();
        response.code = code;
        response.message = message;
        return response;
    }

    public static ApiResponse<Void> error(String message) {
        return error(500, message);
    }
}
