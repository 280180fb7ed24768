package com.aiinpocket.parkfinder.repository;

import com.aiinpocket.parkfinder.model.entity.ParkComment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

/**
 * 公園留言 Repository。
 */
public interface ParkCommentRepository extends JpaRepository<ParkComment, Long> {

    List<ParkComment> findByParkIdOrderByCreatedAtAsc(Long parkId);

    @Modifying
    @Query("DELETE FROM ParkComment x WHERE x.park.id = :parkId")
    int deleteByParkId(@Param("parkId") Long parkId);
}
