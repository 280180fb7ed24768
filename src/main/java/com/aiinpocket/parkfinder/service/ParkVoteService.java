package com.aiinpocket.parkfinder.service;

import com.aiinpocket.parkfinder.exception.UnauthorizedException;
import com.aiinpocket.parkfinder.exception.UnknownParkException;
import com.aiinpocket.parkfinder.model.dto.VoteResult;
import com.aiinpocket.parkfinder.model.dto.VoteTally;
import com.aiinpocket.parkfinder.model.entity.Park;
import com.aiinpocket.parkfinder.model.entity.ParkVote;
import com.aiinpocket.parkfinder.repository.ParkRepository;
import com.aiinpocket.parkfinder.repository.ParkVoteRepository;
import com.aiinpocket.parkfinder.security.AccessPolicyEvaluator;
import com.aiinpocket.parkfinder.security.Caller;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * 公園投票服務。
 * 一次投票在同一個交易內依序完成：鎖定公園列 → 寫入投票帳本 → 從帳本重新統計 → 審核狀態機 → 更新公園。
 * 讀取端因此不會看到計數已更新但狀態未更新（或反過來）的公園。
 *
 * <p>規則：
 * <ul>
 *   <li>每人每公園只能投一票，不可改票或撤回</li>
 *   <li>只要公園存在即可投票（包含提交者自己）</li>
 *   <li>公園進入終態後仍接受投票並計入讚噓數，但不再改變狀態</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ParkVoteService {

    private final ParkRepository parkRepo;
    private final ParkVoteRepository voteRepo;
    private final VoteLedger ledger;
    private final TallyAggregator aggregator;
    private final ModerationStateMachine stateMachine;
    private final AccessPolicyEvaluator policy;
    private final ParkService parkService;

    /**
     * 投票（讚/噓）。
     *
     * @param parkId 公園 ID
     * @param upvote true=讚, false=噓
     * @return 新投票 ID 與投票後的計數、狀態
     * @throws UnauthorizedException 匿名呼叫
     * @throws UnknownParkException  公園不存在
     * @throws com.aiinpocket.parkfinder.exception.DuplicateVoteException 已投過票
     */
    @Transactional
    public VoteResult castVote(Caller caller, Long parkId, boolean upvote) {
        if (!caller.isAuthenticated()) {
            throw new UnauthorizedException("請先登入才能投票");
        }
        Park park = parkRepo.findByIdForUpdate(parkId)
                .orElseThrow(() -> new UnknownParkException(parkId));

        ParkVote vote = ledger.append(caller, park, upvote);
        VoteTally tally = aggregator.recompute(parkId);
        stateMachine.apply(park, tally);
        parkRepo.save(park);

        log.info("[投票] 用戶 {} 對公園 {} 投{}（讚:{}, 噓:{}, 狀態:{}）",
                caller.userId(), parkId, upvote ? "讚" : "噓",
                park.getUpvotes(), park.getDownvotes(), park.getStatus());
        return new VoteResult(vote.getId(), parkId, park.getUpvotes(), park.getDownvotes(), park.getStatus());
    }

    /**
     * 查詢呼叫者對某公園的投票。
     *
     * @return empty 表示尚未投票
     */
    @Transactional(readOnly = true)
    public Optional<ParkVote> getMyVote(Caller caller, Long parkId) {
        if (!caller.isAuthenticated()) {
            throw new UnauthorizedException("請先登入");
        }
        return voteRepo.findByParkIdAndVoterId(parkId, caller.userId())
                .filter(v -> policy.canRead(caller, v));
    }

    /**
     * 列出某公園的投票：一般用戶只會拿到自己的那一票，管理員拿到全部。
     */
    @Transactional(readOnly = true)
    public List<ParkVote> listVotes(Caller caller, Long parkId) {
        if (!caller.isAuthenticated()) {
            throw new UnauthorizedException("請先登入");
        }
        parkService.requireExisting(parkId);
        return voteRepo.findByParkIdOrderByCreatedAtAsc(parkId).stream()
                .filter(v -> policy.canRead(caller, v))
                .toList();
    }

    /**
     * 管理員對帳：從投票帳本重算計數並重新套用狀態機。
     */
    @Transactional
    public VoteTally recomputeTally(Caller caller, Long parkId) {
        if (!caller.admin()) {
            throw new UnauthorizedException("只有管理員可以重算票數");
        }
        Park park = parkRepo.findByIdForUpdate(parkId)
                .orElseThrow(() -> new UnknownParkException(parkId));
        VoteTally tally = aggregator.recompute(parkId);
        if (tally.upvotes() != park.getUpvotes() || tally.downvotes() != park.getDownvotes()) {
            log.warn("[投票] 公園 {} 計數與帳本不一致，已修正（讚:{}→{}, 噓:{}→{}）",
                    parkId, park.getUpvotes(), tally.upvotes(), park.getDownvotes(), tally.downvotes());
        }
        stateMachine.apply(park, tally);
        parkRepo.save(park);
        return tally;
    }
}
