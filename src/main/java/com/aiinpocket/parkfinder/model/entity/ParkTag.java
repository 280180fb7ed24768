package com.aiinpocket.parkfinder.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

/**
 * 公園標籤 Entity。不需審核，所有人可見。
 */
@Entity
@Table(name = "park_tag",
        uniqueConstraints = {
                @UniqueConstraint(name = ParkTag.UNIQUE_PARK_TAG,
                        columnNames = {"park_id", "tag"})
        },
        indexes = {
                @Index(name = "idx_tag_park", columnList = "park_id")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ParkTag {

    public static final String UNIQUE_PARK_TAG = "uk_tag_park_tag";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "park_id", nullable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Park park;

    @Column(nullable = false, length = 50)
    private String tag;

    /** 新增者，僅供稽核 */
    @Column(name = "added_by", length = 100)
    private String addedBy;
}
