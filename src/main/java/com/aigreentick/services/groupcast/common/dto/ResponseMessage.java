package com.aigreentick.services.groupcast.common.dto;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Envelope for every REST response: {@code status} is SUCCESS or ERROR.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ResponseMessage<T> {

    private static final String SUCCESS = "SUCCESS";
    private static final String ERROR = "ERROR";

    private final String status;
    private final String message;
    private final T data;

    public static <T> ResponseMessage<T> success(String message, T data) {
        return new ResponseMessage<>(SUCCESS, message, data);
    }

    public static <T> ResponseMessage<T> error(String message) {
        return new ResponseMessage<>(ERROR, message, null);
    }
}
