package com.aiinpocket.parkfinder.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 公園定位服務設定（{@code parkfinder.*}）。
 *
 * @param moderation 投票審核門檻
 * @param identity   外部身分提供者的 JWT claim 對應
 */
@ConfigurationProperties(prefix = "parkfinder")
public record ParkFinderProperties(
        Moderation moderation,
        Identity identity
) {
    /**
     * 審核門檻。兩個條件都要成立才會轉換狀態：絕對票數 + 佔總票數比例。
     */
    public record Moderation(
            int approvalMinUpvotes,
            double approvalRatio,
            int rejectionMinDownvotes,
            double rejectionRatio
    ) {}

    /**
     * 管理員判定：JWT 中 {@code adminClaim} 的值等於 {@code adminValue} 即為管理員。
     */
    public record Identity(
            String adminClaim,
            String adminValue
    ) {}
}
