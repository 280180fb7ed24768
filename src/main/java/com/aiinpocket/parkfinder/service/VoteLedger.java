package com.aiinpocket.parkfinder.service;

import com.aiinpocket.parkfinder.exception.DuplicateVoteException;
import com.aiinpocket.parkfinder.exception.UnauthorizedException;
import com.aiinpocket.parkfinder.model.entity.Park;
import com.aiinpocket.parkfinder.model.entity.ParkVote;
import com.aiinpocket.parkfinder.model.enums.WriteOperation;
import com.aiinpocket.parkfinder.repository.ParkVoteRepository;
import com.aiinpocket.parkfinder.security.AccessPolicyEvaluator;
import com.aiinpocket.parkfinder.security.Caller;
import com.aiinpocket.parkfinder.util.ConstraintViolations;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

/**
 * 投票帳本。只允許新增，每個 (公園, 投票者) 最多一筆。
 *
 * <p>呼叫者必須已在交易內以寫鎖持有該公園列（見 {@code ParkRepository#findByIdForUpdate}），
 * 「檢查是否已投票 + 寫入」才會是不可分割的一步；資料庫的唯一約束作為最後防線。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VoteLedger {

    private final ParkVoteRepository voteRepo;
    private final AccessPolicyEvaluator policy;

    /**
     * 寫入一筆投票。
     *
     * @throws UnauthorizedException  呼叫者不能以此身分投票
     * @throws DuplicateVoteException 已投過票
     */
    public ParkVote append(Caller caller, Park park, boolean upvote) {
        ParkVote vote = ParkVote.builder()
                .park(park)
                .voterId(caller.userId())
                .upvote(upvote)
                .build();

        if (!policy.canWrite(caller, vote, WriteOperation.INSERT)) {
            throw new UnauthorizedException("只能以自己的身分投票");
        }
        if (voteRepo.existsByParkIdAndVoterId(park.getId(), caller.userId())) {
            log.warn("[投票] 用戶 {} 重複投票 parkId={}", caller.userId(), park.getId());
            throw new DuplicateVoteException(park.getId(), caller.userId());
        }

        try {
            return voteRepo.saveAndFlush(vote);
        } catch (DataIntegrityViolationException e) {
            if (!ConstraintViolations.isViolationOf(e, ParkVote.UNIQUE_PARK_VOTER)) {
                throw e;
            }
            log.warn("[投票] 用戶 {} 重複投票（唯一約束）parkId={}", caller.userId(), park.getId());
            throw new DuplicateVoteException(park.getId(), caller.userId(), e);
        }
    }
}
