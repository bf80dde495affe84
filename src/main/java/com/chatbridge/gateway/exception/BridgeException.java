package com.chatbridge.gateway.exception;

import lombok.Getter;

/**
 * 网关异常基类
 */
@Getter
public class BridgeException extends RuntimeException {

    private final int statusCode;

    public BridgeException(String message) {
        super(message);
        this.statusCode = 500;
    }

    public BridgeException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public BridgeException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

}
