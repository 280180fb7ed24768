package com.aiinpocket.parkfinder.repository;

import com.aiinpocket.parkfinder.model.entity.ParkTag;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

/**
 * 公園標籤 Repository。
 */
public interface ParkTagRepository extends JpaRepository<ParkTag, Long> {

    List<ParkTag> findByParkIdOrderByIdAsc(Long parkId);

    boolean existsByParkIdAndTag(Long parkId, String tag);

    @Modifying
    @Query("DELETE FROM ParkTag x WHERE x.park.id = :parkId")
    int deleteByParkId(@Param("parkId") Long parkId);
}
