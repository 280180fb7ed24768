package com.aiinpocket.parkfinder.model.entity;

import com.aiinpocket.parkfinder.model.enums.ParkStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 公園提交 Entity。
 * 用戶提交候選公園位置，由社群投票（讚/噓）決定通過或駁回。
 *
 * <p>生命週期：
 * <ol>
 *   <li>用戶提交 → 建立 PENDING 公園，upvotes = downvotes = 0</li>
 *   <li>其他用戶投票 → 依投票帳本重新計算 upvotes/downvotes</li>
 *   <li>讚 ≥ 10 且讚佔 70%+ → APPROVED（終態）</li>
 *   <li>噓 ≥ 5 且噓佔 70%+ → REJECTED（終態）</li>
 * </ol>
 *
 * <p>建立後只有 status、upvotes、downvotes、decidedAt 會被修改。
 */
@Entity
@Table(name = "park", indexes = {
        @Index(name = "idx_park_status", columnList = "status"),
        @Index(name = "idx_park_created_by", columnList = "created_by")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Park {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(length = 2000)
    private String description;

    @Column(nullable = false)
    private double latitude;

    @Column(nullable = false)
    private double longitude;

    @Column(length = 500)
    private String address;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private ParkStatus status = ParkStatus.PENDING;

    /** 提交者（外部身分提供者的 subject） */
    @Column(name = "created_by", nullable = false, length = 100)
    private String createdBy;

    /** 讚數（反正規化，與投票帳本在同一交易內同步） */
    @Column(nullable = false)
    @Builder.Default
    private int upvotes = 0;

    /** 噓數 */
    @Column(nullable = false)
    @Builder.Default
    private int downvotes = 0;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /** 進入終態的時間，PENDING 時為 null */
    @Column(name = "decided_at")
    private Instant decidedAt;

    public boolean isOwnedBy(String userId) {
        return userId != null && userId.equals(createdBy);
    }

    @PrePersist
    void prePersist() {
        createdAt = Instant.now();
        if (status == null) status = ParkStatus.PENDING;
    }
}
