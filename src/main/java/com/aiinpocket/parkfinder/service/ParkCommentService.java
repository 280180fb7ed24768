package com.aiinpocket.parkfinder.service;

import com.aiinpocket.parkfinder.exception.NotFoundOrHiddenException;
import com.aiinpocket.parkfinder.exception.UnauthorizedException;
import com.aiinpocket.parkfinder.model.entity.Park;
import com.aiinpocket.parkfinder.model.entity.ParkComment;
import com.aiinpocket.parkfinder.model.enums.WriteOperation;
import com.aiinpocket.parkfinder.repository.ParkCommentRepository;
import com.aiinpocket.parkfinder.security.AccessPolicyEvaluator;
import com.aiinpocket.parkfinder.security.Caller;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 公園留言服務。
 * 被標記為 reported 的留言對其他人隱藏，作者本人與管理員仍看得到。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ParkCommentService {

    private final ParkCommentRepository commentRepo;
    private final ParkService parkService;
    private final AccessPolicyEvaluator policy;

    @Transactional
    public ParkComment addComment(Caller caller, Long parkId, String content) {
        if (!caller.isAuthenticated()) {
            throw new UnauthorizedException("請先登入才能留言");
        }
        Park park = parkService.requireExisting(parkId);
        ParkComment comment = ParkComment.builder()
                .park(park)
                .authorId(caller.userId())
                .content(content)
                .build();
        if (!policy.canWrite(caller, comment, WriteOperation.INSERT)) {
            throw new UnauthorizedException("無權留言");
        }
        commentRepo.save(comment);
        log.info("[留言] 用戶 {} 在公園 {} 留言 (commentId={})", caller.userId(), parkId, comment.getId());
        return comment;
    }

    @Transactional(readOnly = true)
    public List<ParkComment> listComments(Caller caller, Long parkId) {
        parkService.requireReadable(caller, parkId);
        return commentRepo.findByParkIdOrderByCreatedAtAsc(parkId).stream()
                .filter(c -> policy.canRead(caller, c))
                .toList();
    }

    @Transactional(readOnly = true)
    public ParkComment getComment(Caller caller, Long commentId) {
        ParkComment comment = requireReadable(caller, commentId);
        parkService.requireReadable(caller, comment.getPark().getId());
        return comment;
    }

    /**
     * 管理員標記 / 取消標記留言為被檢舉。
     */
    @Transactional
    public ParkComment setReported(Caller caller, Long commentId, boolean reported) {
        ParkComment comment = requireReadable(caller, commentId);
        if (!policy.canWrite(caller, comment, WriteOperation.UPDATE)) {
            log.warn("[留言] 用戶 {} 無權修改留言 commentId={}", caller.userId(), commentId);
            throw new UnauthorizedException("只有管理員可以處理檢舉");
        }
        comment.setReported(reported);
        commentRepo.save(comment);
        log.info("[留言] 管理員 {} 將留言 {} 設為 {}", caller.userId(), commentId, reported ? "已檢舉" : "正常");
        return comment;
    }

    @Transactional
    public void deleteComment(Caller caller, Long commentId) {
        ParkComment comment = requireReadable(caller, commentId);
        if (!policy.canWrite(caller, comment, WriteOperation.DELETE)) {
            log.warn("[留言] 用戶 {} 無權刪除留言 commentId={}", caller.userId(), commentId);
            throw new UnauthorizedException("只有管理員可以刪除留言");
        }
        commentRepo.delete(comment);
        log.info("[留言] 管理員 {} 刪除留言 {}", caller.userId(), commentId);
    }

    private ParkComment requireReadable(Caller caller, Long commentId) {
        return commentRepo.findById(commentId)
                .filter(c -> policy.canRead(caller, c))
                .orElseThrow(() -> new NotFoundOrHiddenException("留言", commentId));
    }
}
