package com.aiinpocket.parkfinder.repository;

import com.aiinpocket.parkfinder.model.entity.ParkPhoto;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

/**
 * 公園照片 Repository。
 */
public interface ParkPhotoRepository extends JpaRepository<ParkPhoto, Long> {

    List<ParkPhoto> findByParkIdOrderByCreatedAtAsc(Long parkId);

    @Modifying
    @Query("DELETE FROM ParkPhoto x WHERE x.park.id = :parkId")
    int deleteByParkId(@Param("parkId") Long parkId);
}
