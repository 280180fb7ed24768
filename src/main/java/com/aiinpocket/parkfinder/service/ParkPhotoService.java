package com.aiinpocket.parkfinder.service;

import com.aiinpocket.parkfinder.exception.NotFoundOrHiddenException;
import com.aiinpocket.parkfinder.exception.UnauthorizedException;
import com.aiinpocket.parkfinder.model.entity.Park;
import com.aiinpocket.parkfinder.model.entity.ParkPhoto;
import com.aiinpocket.parkfinder.model.enums.WriteOperation;
import com.aiinpocket.parkfinder.repository.ParkPhotoRepository;
import com.aiinpocket.parkfinder.security.AccessPolicyEvaluator;
import com.aiinpocket.parkfinder.security.Caller;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 公園照片服務。
 * 上傳後預設未核准，只有上傳者與管理員看得到；管理員核准後公開。
 * 照片本體存在外部物件儲存，這裡只記錄 URL。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ParkPhotoService {

    private final ParkPhotoRepository photoRepo;
    private final ParkService parkService;
    private final AccessPolicyEvaluator policy;

    @Transactional
    public ParkPhoto addPhoto(Caller caller, Long parkId, String url) {
        if (!caller.isAuthenticated()) {
            throw new UnauthorizedException("請先登入才能上傳照片");
        }
        Park park = parkService.requireExisting(parkId);
        ParkPhoto photo = ParkPhoto.builder()
                .park(park)
                .url(url)
                .uploadedBy(caller.userId())
                .build();
        if (!policy.canWrite(caller, photo, WriteOperation.INSERT)) {
            throw new UnauthorizedException("無權上傳照片");
        }
        photoRepo.save(photo);
        log.info("[照片] 用戶 {} 上傳照片到公園 {} (photoId={})", caller.userId(), parkId, photo.getId());
        return photo;
    }

    /**
     * 列出某公園中呼叫者看得到的照片。公園本身看不到時回報 NotFoundOrHidden。
     */
    @Transactional(readOnly = true)
    public List<ParkPhoto> listPhotos(Caller caller, Long parkId) {
        parkService.requireReadable(caller, parkId);
        return photoRepo.findByParkIdOrderByCreatedAtAsc(parkId).stream()
                .filter(p -> policy.canRead(caller, p))
                .toList();
    }

    /**
     * 查詢單張照片；照片或所屬公園看不到時回報 NotFoundOrHidden。
     */
    @Transactional(readOnly = true)
    public ParkPhoto getPhoto(Caller caller, Long photoId) {
        ParkPhoto photo = requireReadable(caller, photoId);
        parkService.requireReadable(caller, photo.getPark().getId());
        return photo;
    }

    /**
     * 管理員核准 / 撤銷核准照片。
     */
    @Transactional
    public ParkPhoto setApproval(Caller caller, Long photoId, boolean approved) {
        ParkPhoto photo = requireReadable(caller, photoId);
        if (!policy.canWrite(caller, photo, WriteOperation.UPDATE)) {
            log.warn("[照片] 用戶 {} 無權審核照片 photoId={}", caller.userId(), photoId);
            throw new UnauthorizedException("只有管理員可以審核照片");
        }
        photo.setApproved(approved);
        photoRepo.save(photo);
        log.info("[照片] 管理員 {} 將照片 {} 設為 {}", caller.userId(), photoId, approved ? "已核准" : "未核准");
        return photo;
    }

    @Transactional
    public void deletePhoto(Caller caller, Long photoId) {
        ParkPhoto photo = requireReadable(caller, photoId);
        if (!policy.canWrite(caller, photo, WriteOperation.DELETE)) {
            log.warn("[照片] 用戶 {} 無權刪除照片 photoId={}", caller.userId(), photoId);
            throw new UnauthorizedException("只有管理員可以刪除照片");
        }
        photoRepo.delete(photo);
        log.info("[照片] 管理員 {} 刪除照片 {}", caller.userId(), photoId);
    }

    private ParkPhoto requireReadable(Caller caller, Long photoId) {
        return photoRepo.findById(photoId)
                .filter(p -> policy.canRead(caller, p))
                .orElseThrow(() -> new NotFoundOrHiddenException("照片", photoId));
    }
}
