package com.aiinpocket.parkfinder.security;

/**
 * 呼叫者身分。由 Web 邊界建立一次後，明確傳入每個服務方法，服務層不讀取任何全域的「目前使用者」。
 *
 * @param userId 外部身分提供者的 subject；匿名時為 null
 * @param admin  是否具備管理員能力
 */
public record Caller(String userId, boolean admin) {

    private static final Caller ANONYMOUS = new Caller(null, false);

    public static Caller anonymous() {
        return ANONYMOUS;
    }

    public static Caller user(String userId) {
        return new Caller(userId, false);
    }

    public static Caller admin(String userId) {
        return new Caller(userId, true);
    }

    public boolean isAuthenticated() {
        return userId != null;
    }

    /** 呼叫者是否就是指定的身分（匿名永遠為 false） */
    public boolean is(String identity) {
        return userId != null && userId.equals(identity);
    }
}
