package com.aiinpocket.parkfinder.exception;

/**
 * 資料不存在，或呼叫者無權看到。兩種情況對外回應相同，避免洩漏隱藏資料是否存在。
 */
public class NotFoundOrHiddenException extends RuntimeException {

    public NotFoundOrHiddenException(String resource, Long id) {
        super(resource + " 不存在 (id=" + id + ")");
    }
}
