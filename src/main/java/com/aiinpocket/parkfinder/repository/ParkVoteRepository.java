package com.aiinpocket.parkfinder.repository;

import com.aiinpocket.parkfinder.model.entity.ParkVote;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * 投票帳本 Repository。只有新增與查詢，沒有更新。
 */
public interface ParkVoteRepository extends JpaRepository<ParkVote, Long> {

    Optional<ParkVote> findByParkIdAndVoterId(Long parkId, String voterId);

    boolean existsByParkIdAndVoterId(Long parkId, String voterId);

    List<ParkVote> findByParkIdOrderByCreatedAtAsc(Long parkId);

    /** 統計某公園的讚數（upvote=true）或噓數（upvote=false） */
    long countByParkIdAndUpvote(Long parkId, boolean upvote);

    @Modifying
    @Query("DELETE FROM ParkVote v WHERE v.park.id = :parkId")
    int deleteByParkId(@Param("parkId") Long parkId);
}
