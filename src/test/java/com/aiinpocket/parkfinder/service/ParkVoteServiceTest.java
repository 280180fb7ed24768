package com.aiinpocket.parkfinder.service;

import com.aiinpocket.parkfinder.BaseIntegrationTest;
import com.aiinpocket.parkfinder.exception.DuplicateVoteException;
import com.aiinpocket.parkfinder.exception.UnauthorizedException;
import com.aiinpocket.parkfinder.exception.UnknownParkException;
import com.aiinpocket.parkfinder.model.dto.VoteResult;
import com.aiinpocket.parkfinder.model.dto.VoteTally;
import com.aiinpocket.parkfinder.model.entity.Park;
import com.aiinpocket.parkfinder.model.entity.ParkVote;
import com.aiinpocket.parkfinder.model.enums.ParkStatus;
import com.aiinpocket.parkfinder.security.Caller;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

public class ParkVoteServiceTest extends BaseIntegrationTest {

    @Test
    public void testVoteUpdatesTallyInSameCall() {
        Park park = createPark(OWNER, "大安森林公園");

        VoteResult result = voteService.castVote(OTHER, park.getId(), true);

        assertNotNull(result.voteId());
        assertEquals(1, result.upvotes());
        assertEquals(0, result.downvotes());
        assertEquals(ParkStatus.PENDING, result.status());
        assertEquals(1, reload(park.getId()).getUpvotes());
    }

    @Test
    public void testTenUpvotesApprove() {
        Park park = createPark(OWNER, "榮星花園");
        castVotes(park.getId(), "up", 10, true);

        Park reloaded = reload(park.getId());
        assertEquals(ParkStatus.APPROVED, reloaded.getStatus());
        assertNotNull(reloaded.getDecidedAt());
    }

    @Test
    public void testNineUpOneDownStaysPending() {
        Park park = createPark(OWNER, "青年公園");
        castVotes(park.getId(), "up", 9, true);
        castVotes(park.getId(), "down", 1, false);

        assertEquals(ParkStatus.PENDING, reload(park.getId()).getStatus());
    }

    @Test
    public void testFiveDownvotesReject() {
        Park park = createPark(OWNER, "廢棄停車場");
        castVotes(park.getId(), "down", 5, false);

        assertEquals(ParkStatus.REJECTED, reload(park.getId()).getStatus());
    }

    @Test
    public void testMixedVotesBelowThresholdsStayPending() {
        Park park = createPark(OWNER, "社區小公園");
        castVotes(park.getId(), "up", 3, true);
        castVotes(park.getId(), "down", 4, false);

        Park reloaded = reload(park.getId());
        assertEquals(ParkStatus.PENDING, reloaded.getStatus());
        assertEquals(3, reloaded.getUpvotes());
        assertEquals(4, reloaded.getDownvotes());
    }

    @Test
    public void testVotesAfterTerminalStateAreCountedButInert() {
        Park park = createPark(OWNER, "二二八和平公園");
        castVotes(park.getId(), "up", 10, true);
        castVotes(park.getId(), "down", 30, false);

        Park reloaded = reload(park.getId());
        assertEquals(ParkStatus.APPROVED, reloaded.getStatus());
        assertEquals(10, reloaded.getUpvotes());
        assertEquals(30, reloaded.getDownvotes());
    }

    @Test
    public void testDuplicateVoteRejectedAndTallyUnchanged() {
        Park park = createPark(OWNER, "碧潭");
        voteService.castVote(OTHER, park.getId(), true);

        assertThrows(DuplicateVoteException.class, () -> voteService.castVote(OTHER, park.getId(), true));
        assertThrows(DuplicateVoteException.class, () -> voteService.castVote(OTHER, park.getId(), false));

        Park reloaded = reload(park.getId());
        assertEquals(1, reloaded.getUpvotes());
        assertEquals(0, reloaded.getDownvotes());
        assertEquals(1, voteRepo.findByParkIdOrderByCreatedAtAsc(park.getId()).size());
    }

    @Test
    public void testUnknownPark() {
        assertThrows(UnknownParkException.class, () -> voteService.castVote(OTHER, 987654L, true));
    }

    @Test
    public void testAnonymousCannotVote() {
        Park park = createPark(OWNER, "華山草原");
        assertThrows(UnauthorizedException.class,
                () -> voteService.castVote(Caller.anonymous(), park.getId(), true));
        assertEquals(0, reload(park.getId()).getUpvotes());
    }

    @Test
    public void testOwnerMayVoteOnOwnPark() {
        Park park = createPark(OWNER, "自家巷口");
        VoteResult result = voteService.castVote(OWNER, park.getId(), true);
        assertEquals(1, result.upvotes());
    }

    @Test
    public void testVoteReadableOnlyByVoterOrAdmin() {
        Park park = createPark(OWNER, "美堤河濱公園");
        voteService.castVote(OTHER, park.getId(), false);
        voteService.castVote(Caller.user("third"), park.getId(), true);

        Optional<ParkVote> mine = voteService.getMyVote(OTHER, park.getId());
        assertTrue(mine.isPresent());
        assertFalse(mine.get().isUpvote());
        assertTrue(voteService.getMyVote(OWNER, park.getId()).isEmpty());

        List<ParkVote> seenByOther = voteService.listVotes(OTHER, park.getId());
        assertEquals(1, seenByOther.size());
        assertEquals("other", seenByOther.get(0).getVoterId());
        assertEquals(2, voteService.listVotes(ADMIN, park.getId()).size());
        assertTrue(voteService.listVotes(OWNER, park.getId()).isEmpty());
    }

    @Test
    public void testRecomputeTallyRepairsCounters() {
        Park park = createPark(OWNER, "大湖公園");
        castVotes(park.getId(), "up", 4, true);

        Park drifted = reload(park.getId());
        drifted.setUpvotes(99);
        parkRepo.save(drifted);

        VoteTally tally = voteService.recomputeTally(ADMIN, park.getId());
        assertEquals(new VoteTally(4, 0), tally);
        assertEquals(4, reload(park.getId()).getUpvotes());
        assertThrows(UnauthorizedException.class, () -> voteService.recomputeTally(OWNER, park.getId()));
    }

    @Test
    public void testConcurrentVotesFromDistinctVotersAreAllCounted() throws Exception {
        Park park = createPark(OWNER, "關渡自然公園");
        int upvoters = 10;
        int downvoters = 2;
        ExecutorService pool = Executors.newFixedThreadPool(6);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<VoteResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < upvoters + downvoters; i++) {
                Caller voter = Caller.user("voter-" + i);
                boolean upvote = i < upvoters;
                futures.add(pool.submit(() -> {
                    start.await();
                    return voteService.castVote(voter, park.getId(), upvote);
                }));
            }
            start.countDown();
            for (Future<VoteResult> future : futures) {
                assertNotNull(future.get(30, TimeUnit.SECONDS).voteId());
            }
        } finally {
            pool.shutdownNow();
        }

        Park reloaded = reload(park.getId());
        assertEquals(upvoters, reloaded.getUpvotes());
        assertEquals(downvoters, reloaded.getDownvotes());
        assertEquals(ParkStatus.APPROVED, reloaded.getStatus());
        assertEquals(upvoters + downvoters, voteRepo.findByParkIdOrderByCreatedAtAsc(park.getId()).size());
    }

    @Test
    public void testConcurrentVotesFromSameVoterAcceptOnlyOne() throws Exception {
        Park park = createPark(OWNER, "陽明山");
        int attempts = 8;
        ExecutorService pool = Executors.newFixedThreadPool(attempts);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<VoteResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < attempts; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return voteService.castVote(OTHER, park.getId(), true);
                }));
            }
            start.countDown();

            int accepted = 0;
            int duplicates = 0;
            for (Future<VoteResult> future : futures) {
                try {
                    future.get(30, TimeUnit.SECONDS);
                    accepted++;
                } catch (ExecutionException e) {
                    assertInstanceOf(DuplicateVoteException.class, e.getCause());
                    duplicates++;
                }
            }
            assertEquals(1, accepted);
            assertEquals(attempts - 1, duplicates);
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, reload(park.getId()).getUpvotes());
    }

}
