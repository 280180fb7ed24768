package com.aiinpocket.parkfinder.model.enums;

public enum WriteOperation {
    INSERT,
    UPDATE,
    DELETE
}
