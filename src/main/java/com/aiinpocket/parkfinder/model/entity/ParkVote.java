package com.aiinpocket.parkfinder.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;

/**
 * 公園投票 Entity（投票帳本的一筆紀錄）。
 * 每位用戶對每個公園只能投一票，投出後不可修改或撤回。
 */
@Entity
@Table(name = "park_vote",
        uniqueConstraints = {
                @UniqueConstraint(name = ParkVote.UNIQUE_PARK_VOTER,
                        columnNames = {"park_id", "voter_id"})
        },
        indexes = {
                @Index(name = "idx_vote_park", columnList = "park_id")
        })
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ParkVote {

    public static final String UNIQUE_PARK_VOTER = "uk_vote_park_voter";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "park_id", nullable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Park park;

    /** 投票者 */
    @Column(name = "voter_id", nullable = false, updatable = false, length = 100)
    private String voterId;

    /** true=讚, false=噓 */
    @Column(nullable = false, updatable = false)
    private boolean upvote;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void prePersist() {
        createdAt = Instant.now();
    }
}
