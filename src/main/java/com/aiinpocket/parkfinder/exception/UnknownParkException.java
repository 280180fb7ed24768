package com.aiinpocket.parkfinder.exception;

import lombok.Getter;

/**
 * 引用的公園不存在。
 */
@Getter
public class UnknownParkException extends RuntimeException {

    private final Long parkId;

    public UnknownParkException(Long parkId) {
        super("公園不存在");
        this.parkId = parkId;
    }
}
