package com.depegscan.client.exception;

/** Marker exception indicating the request failed transiently and may be sent again. */
public class RetryableApiException extends RuntimeException {
    public RetryableApiException(String message) { super(message); }
    public RetryableApiException(String message, Throwable cause) { super(message, cause); }
}
