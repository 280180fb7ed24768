package com.aiinpocket.parkfinder.security;

import com.aiinpocket.parkfinder.model.entity.*;
import com.aiinpocket.parkfinder.model.enums.ParkStatus;
import com.aiinpocket.parkfinder.model.enums.WriteOperation;
import org.springframework.stereotype.Component;

/**
 * 逐列存取政策。
 * 依呼叫者身分與資料列的審核狀態、擁有者判斷能否讀取或寫入，
 * 所有讀寫公園、投票、照片、留言、標籤的路徑都會經過這裡。
 *
 * <p>純函式：不查資料庫、不看全域狀態，結果只取決於傳入的 (caller, row)。
 *
 * <p>寫入規則共通點：
 * <ul>
 *   <li>管理員可對公園、照片、留言、標籤做任何寫入</li>
 *   <li>一般登入用戶只能 INSERT，且新資料列必須以自己的身分建立、處於初始審核狀態</li>
 *   <li>投票一律不可 UPDATE/DELETE（刪除公園時隨之連帶刪除）</li>
 * </ul>
 */
@Component
public class AccessPolicyEvaluator {

    // ── 公園 ──

    public boolean canRead(Caller caller, Park park) {
        if (caller.admin()) return true;
        if (park.getStatus() == ParkStatus.APPROVED) return true;
        return park.getStatus() == ParkStatus.PENDING && park.isOwnedBy(caller.userId());
    }

    public boolean canWrite(Caller caller, Park park, WriteOperation operation) {
        if (caller.admin()) return true;
        if (operation != WriteOperation.INSERT) return false;
        return park.isOwnedBy(caller.userId())
                && park.getStatus() == ParkStatus.PENDING
                && park.getUpvotes() == 0
                && park.getDownvotes() == 0;
    }

    // ── 投票 ──

    public boolean canRead(Caller caller, ParkVote vote) {
        return caller.admin() || caller.is(vote.getVoterId());
    }

    public boolean canWrite(Caller caller, ParkVote vote, WriteOperation operation) {
        // 管理員也不能代替他人投票
        return operation == WriteOperation.INSERT && caller.is(vote.getVoterId());
    }

    // ── 照片 ──

    public boolean canRead(Caller caller, ParkPhoto photo) {
        return caller.admin() || photo.isApproved() || caller.is(photo.getUploadedBy());
    }

    public boolean canWrite(Caller caller, ParkPhoto photo, WriteOperation operation) {
        if (caller.admin()) return true;
        return operation == WriteOperation.INSERT
                && caller.is(photo.getUploadedBy())
                && !photo.isApproved();
    }

    // ── 留言 ──

    public boolean canRead(Caller caller, ParkComment comment) {
        return caller.admin() || !comment.isReported() || caller.is(comment.getAuthorId());
    }

    public boolean canWrite(Caller caller, ParkComment comment, WriteOperation operation) {
        if (caller.admin()) return true;
        return operation == WriteOperation.INSERT
                && caller.is(comment.getAuthorId())
                && !comment.isReported();
    }

    // ── 標籤 ──

    public boolean canRead(Caller caller, ParkTag tag) {
        return true;
    }

    public boolean canWrite(Caller caller, ParkTag tag, WriteOperation operation) {
        if (caller.admin()) return true;
        return operation == WriteOperation.INSERT && caller.is(tag.getAddedBy());
    }
}
