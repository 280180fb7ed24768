package com.aiinpocket.parkfinder.service;

import com.aiinpocket.parkfinder.config.ParkFinderProperties;
import com.aiinpocket.parkfinder.model.dto.VoteTally;
import com.aiinpocket.parkfinder.model.entity.Park;
import com.aiinpocket.parkfinder.model.enums.ParkStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * 審核狀態機。
 * 每次計數更新後呼叫，依下列順序判斷（預設門檻，可由 {@code parkfinder.moderation.*} 調整）：
 * <ol>
 *   <li>讚 ≥ 10 且 讚 / (讚 + 噓) ≥ 0.70 → APPROVED</li>
 *   <li>否則噓 ≥ 5 且 噓 / (讚 + 噓) ≥ 0.70 → REJECTED</li>
 *   <li>否則維持原狀態</li>
 * </ol>
 * APPROVED 與 REJECTED 為終態，之後的投票不會再改變狀態。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ModerationStateMachine {

    private final ParkFinderProperties properties;

    /**
     * 依計數計算下一個狀態（純函式）。
     */
    public ParkStatus evaluate(ParkStatus current, VoteTally tally) {
        if (current.isTerminal()) {
            return current;
        }
        ParkFinderProperties.Moderation rules = properties.moderation();
        int total = tally.total();

        if (tally.upvotes() >= rules.approvalMinUpvotes()
                && ratio(tally.upvotes(), total) >= rules.approvalRatio()) {
            return ParkStatus.APPROVED;
        }
        if (tally.downvotes() >= rules.rejectionMinDownvotes()
                && ratio(tally.downvotes(), total) >= rules.rejectionRatio()) {
            return ParkStatus.REJECTED;
        }
        return current;
    }

    /**
     * 把計數寫入公園並推進狀態。
     *
     * @return true 如果這次呼叫讓公園進入終態
     */
    public boolean apply(Park park, VoteTally tally) {
        park.setUpvotes(tally.upvotes());
        park.setDownvotes(tally.downvotes());

        ParkStatus current = park.getStatus();
        ParkStatus next = evaluate(current, tally);
        if (next == current) {
            return false;
        }
        park.setStatus(next);
        park.setDecidedAt(Instant.now());
        log.info("[審核] 公園 '{}' (id={}) {} → {}（讚:{}, 噓:{}）",
                park.getName(), park.getId(), current, next, tally.upvotes(), tally.downvotes());
        return true;
    }

    private static double ratio(int part, int total) {
        return total == 0 ? 0.0 : (double) part / total;
    }
}
