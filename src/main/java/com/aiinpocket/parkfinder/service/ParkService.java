package com.aiinpocket.parkfinder.service;

import com.aiinpocket.parkfinder.exception.NotFoundOrHiddenException;
import com.aiinpocket.parkfinder.exception.UnauthorizedException;
import com.aiinpocket.parkfinder.exception.UnknownParkException;
import com.aiinpocket.parkfinder.model.entity.Park;
import com.aiinpocket.parkfinder.model.enums.ParkStatus;
import com.aiinpocket.parkfinder.model.enums.WriteOperation;
import com.aiinpocket.parkfinder.repository.*;
import com.aiinpocket.parkfinder.security.AccessPolicyEvaluator;
import com.aiinpocket.parkfinder.security.Caller;
import com.aiinpocket.parkfinder.util.GeoValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 公園提交服務。
 * 負責公園的建立、查詢（經存取政策過濾）與管理員刪除。
 *
 * <p>可見性：
 * <ul>
 *   <li>匿名：只看得到 APPROVED</li>
 *   <li>登入用戶：APPROVED + 自己仍在 PENDING 的公園</li>
 *   <li>管理員：全部</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ParkService {

    private final ParkRepository parkRepo;
    private final ParkVoteRepository voteRepo;
    private final ParkPhotoRepository photoRepo;
    private final ParkCommentRepository commentRepo;
    private final ParkTagRepository tagRepo;
    private final AccessPolicyEvaluator policy;

    /**
     * 提交新公園，初始狀態 PENDING、讚噓皆為 0。
     *
     * @throws UnauthorizedException    匿名呼叫
     * @throws IllegalArgumentException 名稱空白或座標超出範圍
     */
    @Transactional
    public Park createPark(Caller caller, String name, String description,
                           double latitude, double longitude, String address) {
        if (!caller.isAuthenticated()) {
            throw new UnauthorizedException("請先登入才能提交公園");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("公園名稱不可為空");
        }
        if (!GeoValidator.isValidCoordinate(latitude, longitude)) {
            throw new IllegalArgumentException("座標超出範圍");
        }

        Park park = Park.builder()
                .name(name.trim())
                .description(description)
                .latitude(latitude)
                .longitude(longitude)
                .address(address)
                .createdBy(caller.userId())
                .build();
        if (!policy.canWrite(caller, park, WriteOperation.INSERT)) {
            throw new UnauthorizedException("無權提交公園");
        }

        parkRepo.save(park);
        log.info("[公園] 用戶 {} 提交公園 '{}' (parkId={})", caller.userId(), park.getName(), park.getId());
        return park;
    }

    /**
     * 查詢單一公園。
     *
     * @throws NotFoundOrHiddenException 不存在或呼叫者看不到
     */
    @Transactional(readOnly = true)
    public Park getPark(Caller caller, Long parkId) {
        return requireReadable(caller, parkId);
    }

    /**
     * 列出呼叫者看得到的公園（新到舊）。
     *
     * @param status 只列出此狀態，null 表示不限
     */
    @Transactional(readOnly = true)
    public List<Park> listVisibleParks(Caller caller, ParkStatus status) {
        List<Park> candidates;
        if (caller.admin()) {
            candidates = status != null
                    ? parkRepo.findByStatusOrderByCreatedAtDesc(status)
                    : parkRepo.findAllByOrderByCreatedAtDesc();
        } else if (caller.isAuthenticated()) {
            candidates = parkRepo.findVisibleToUser(caller.userId());
        } else {
            candidates = parkRepo.findByStatusOrderByCreatedAtDesc(ParkStatus.APPROVED);
        }
        return candidates.stream()
                .filter(p -> status == null || p.getStatus() == status)
                .filter(p -> policy.canRead(caller, p))
                .toList();
    }

    /**
     * 刪除公園，連帶刪除其投票、照片、留言、標籤。
     */
    @Transactional
    public void deletePark(Caller caller, Long parkId) {
        Park park = requireReadable(caller, parkId);
        if (!policy.canWrite(caller, park, WriteOperation.DELETE)) {
            log.warn("[公園] 用戶 {} 無權刪除公園 parkId={}", caller.userId(), parkId);
            throw new UnauthorizedException("只有管理員可以刪除公園");
        }

        int votes = voteRepo.deleteByParkId(parkId);
        int photos = photoRepo.deleteByParkId(parkId);
        int comments = commentRepo.deleteByParkId(parkId);
        int tags = tagRepo.deleteByParkId(parkId);
        parkRepo.delete(park);
        log.info("[公園] 管理員 {} 刪除公園 '{}' (parkId={}, 投票:{}, 照片:{}, 留言:{}, 標籤:{})",
                caller.userId(), park.getName(), parkId, votes, photos, comments, tags);
    }

    // ── 供其他服務使用 ──

    /**
     * 取得公園並確認呼叫者看得到；看不到與不存在一律回報 NotFoundOrHidden。
     */
    public Park requireReadable(Caller caller, Long parkId) {
        Park park = parkRepo.findById(parkId)
                .orElseThrow(() -> new NotFoundOrHiddenException("公園", parkId));
        if (!policy.canRead(caller, park)) {
            log.debug("[公園] 用戶 {} 看不到公園 parkId={} status={}", caller.userId(), parkId, park.getStatus());
            throw new NotFoundOrHiddenException("公園", parkId);
        }
        return park;
    }

    /**
     * 取得公園，只要求存在（新增投票、照片、留言、標籤時使用）。
     */
    public Park requireExisting(Long parkId) {
        return parkRepo.findById(parkId)
                .orElseThrow(() -> new UnknownParkException(parkId));
    }
}
