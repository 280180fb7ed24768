package com.aiinpocket.parkfinder.service;

import com.aiinpocket.parkfinder.exception.NotFoundOrHiddenException;
import com.aiinpocket.parkfinder.exception.UnauthorizedException;
import com.aiinpocket.parkfinder.model.entity.Park;
import com.aiinpocket.parkfinder.model.entity.ParkTag;
import com.aiinpocket.parkfinder.model.enums.WriteOperation;
import com.aiinpocket.parkfinder.repository.ParkTagRepository;
import com.aiinpocket.parkfinder.security.AccessPolicyEvaluator;
import com.aiinpocket.parkfinder.security.Caller;
import com.aiinpocket.parkfinder.util.ConstraintViolations;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;

/**
 * 公園標籤服務。標籤不審核，統一存成小寫，同一公園不可重複。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ParkTagService {

    private final ParkTagRepository tagRepo;
    private final ParkService parkService;
    private final AccessPolicyEvaluator policy;

    @Transactional
    public ParkTag addTag(Caller caller, Long parkId, String tag) {
        if (!caller.isAuthenticated()) {
            throw new UnauthorizedException("請先登入才能新增標籤");
        }
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("標籤不可為空");
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        Park park = parkService.requireExisting(parkId);
        if (tagRepo.existsByParkIdAndTag(parkId, normalized)) {
            throw new IllegalArgumentException("標籤 " + normalized + " 已存在");
        }

        ParkTag entry = ParkTag.builder()
                .park(park)
                .tag(normalized)
                .addedBy(caller.userId())
                .build();
        if (!policy.canWrite(caller, entry, WriteOperation.INSERT)) {
            throw new UnauthorizedException("無權新增標籤");
        }
        try {
            tagRepo.saveAndFlush(entry);
        } catch (DataIntegrityViolationException e) {
            if (!ConstraintViolations.isViolationOf(e, ParkTag.UNIQUE_PARK_TAG)) {
                throw e;
            }
            log.warn("[標籤] 公園 {} 標籤 '{}' 同時被重複新增（唯一約束）", parkId, normalized);
            throw new IllegalArgumentException("標籤 " + normalized + " 已存在", e);
        }
        log.info("[標籤] 用戶 {} 為公園 {} 加上標籤 '{}'", caller.userId(), parkId, normalized);
        return entry;
    }

    /**
     * 標籤本身永遠可見，但所屬公園看不到時整個列表回報 NotFoundOrHidden。
     */
    @Transactional(readOnly = true)
    public List<ParkTag> listTags(Caller caller, Long parkId) {
        parkService.requireReadable(caller, parkId);
        return tagRepo.findByParkIdOrderByIdAsc(parkId).stream()
                .filter(t -> policy.canRead(caller, t))
                .toList();
    }

    @Transactional(readOnly = true)
    public ParkTag getTag(Caller caller, Long tagId) {
        ParkTag tag = tagRepo.findById(tagId)
                .filter(t -> policy.canRead(caller, t))
                .orElseThrow(() -> new NotFoundOrHiddenException("標籤", tagId));
        parkService.requireReadable(caller, tag.getPark().getId());
        return tag;
    }

    @Transactional
    public void deleteTag(Caller caller, Long tagId) {
        ParkTag tag = tagRepo.findById(tagId)
                .orElseThrow(() -> new NotFoundOrHiddenException("標籤", tagId));
        if (!policy.canWrite(caller, tag, WriteOperation.DELETE)) {
            log.warn("[標籤] 用戶 {} 無權刪除標籤 tagId={}", caller.userId(), tagId);
            throw new UnauthorizedException("只有管理員可以刪除標籤");
        }
        tagRepo.delete(tag);
        log.info("[標籤] 管理員 {} 刪除標籤 {} ('{}')", caller.userId(), tagId, tag.getTag());
    }
}
