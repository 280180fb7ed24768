package com.aiinpocket.parkfinder.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;

/**
 * 公園留言 Entity。
 * 被檢舉（reported）的留言只有作者本人與管理員看得到。
 */
@Entity
@Table(name = "park_comment", indexes = {
        @Index(name = "idx_comment_park", columnList = "park_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ParkComment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "park_id", nullable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Park park;

    @Column(name = "author_id", nullable = false, updatable = false, length = 100)
    private String authorId;

    @Column(nullable = false, length = 2000)
    private String content;

    @Column(name = "is_reported", nullable = false)
    @Builder.Default
    private boolean reported = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void prePersist() {
        createdAt = Instant.now();
    }
}
