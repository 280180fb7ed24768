package com.aiinpocket.parkfinder.repository;

import com.aiinpocket.parkfinder.model.entity.Park;
import com.aiinpocket.parkfinder.model.enums.ParkStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * 公園 Repository。
 */
public interface ParkRepository extends JpaRepository<Park, Long> {

    /**
     * 以寫鎖讀取公園（SELECT ... FOR UPDATE）。
     * 投票流程先鎖住公園列，同一公園的投票因此依序進行，計數與狀態不會遺失更新。
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Park p WHERE p.id = :id")
    Optional<Park> findByIdForUpdate(@Param("id") Long id);

    List<Park> findAllByOrderByCreatedAtDesc();

    List<Park> findByStatusOrderByCreatedAtDesc(ParkStatus status);

    /** 公開可見的公園 + 指定用戶自己仍在審核中的公園 */
    @Query("SELECT p FROM Park p " +
           "WHERE p.status = com.aiinpocket.parkfinder.model.enums.ParkStatus.APPROVED " +
           "OR (p.status = com.aiinpocket.parkfinder.model.enums.ParkStatus.PENDING AND p.createdBy = :userId) " +
           "ORDER BY p.createdAt DESC")
    List<Park> findVisibleToUser(@Param("userId") String userId);
}
