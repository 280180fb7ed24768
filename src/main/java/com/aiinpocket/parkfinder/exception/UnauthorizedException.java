package com.aiinpocket.parkfinder.exception;

/**
 * 呼叫者沒有執行此操作的權限。
 */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException(String message) {
        super(message);
    }
}
