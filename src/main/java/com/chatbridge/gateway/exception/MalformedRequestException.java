package com.chatbridge.gateway.exception;

/**
 * 请求缺少必填字段或字段类型错误
 */
public class MalformedRequestException extends BridgeException {

    public MalformedRequestException(String message) {
        super(message, 400);
    }

    public MalformedRequestException(String message, Throwable cause) {
        super(message, 400, cause);
    }
}
