package com.aiinpocket.parkfinder.util;

import org.springframework.dao.DataIntegrityViolationException;

import java.util.Locale;

/**
 * 判斷資料完整性錯誤是否來自指定的約束。
 * 各資料庫回報約束名稱的大小寫與前後綴不同（PostgreSQL 原樣、H2 轉大寫並加上 _INDEX_x），
 * 因此沿著 cause 鏈不分大小寫比對訊息。
 */
public final class ConstraintViolations {

    private ConstraintViolations() {
    }

    public static boolean isViolationOf(DataIntegrityViolationException e, String constraintName) {
        String target = constraintName.toLowerCase(Locale.ROOT);
        for (Throwable t = e; t != null; t = t.getCause()) {
            String message = t.getMessage();
            if (message != null && message.toLowerCase(Locale.ROOT).contains(target)) {
                return true;
            }
        }
        return false;
    }
}
