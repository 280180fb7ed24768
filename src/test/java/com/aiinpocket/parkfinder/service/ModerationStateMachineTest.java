package com.aiinpocket.parkfinder.service;

import com.aiinpocket.parkfinder.config.ParkFinderProperties;
import com.aiinpocket.parkfinder.model.dto.VoteTally;
import com.aiinpocket.parkfinder.model.entity.Park;
import com.aiinpocket.parkfinder.model.enums.ParkStatus;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ModerationStateMachineTest {

    private final ModerationStateMachine stateMachine = new ModerationStateMachine(new ParkFinderProperties(
            new ParkFinderProperties.Moderation(10, 0.70, 5, 0.70),
            new ParkFinderProperties.Identity("role", "admin")));

    private ParkStatus evaluate(int up, int down) {
        return stateMachine.evaluate(ParkStatus.PENDING, new VoteTally(up, down));
    }

    @Test
    public void testTenUpvotesApproves() {
        assertEquals(ParkStatus.APPROVED, evaluate(10, 0));
    }

    @Test
    public void testNineUpvotesStaysPending() {
        assertEquals(ParkStatus.PENDING, evaluate(9, 1));
    }

    @Test
    public void testFiveDownvotesRejects() {
        assertEquals(ParkStatus.REJECTED, evaluate(0, 5));
    }

    @Test
    public void testNoThresholdMetStaysPending() {
        assertEquals(ParkStatus.PENDING, evaluate(3, 4));
        assertEquals(ParkStatus.PENDING, evaluate(0, 0));
    }

    @Test
    public void testApprovalRatioBoundary() {
        // 14 / 20 = 0.70
        assertEquals(ParkStatus.APPROVED, evaluate(14, 6));
        // 14 / 21 < 0.70
        assertEquals(ParkStatus.PENDING, evaluate(14, 7));
    }

    @Test
    public void testRejectionRatioBoundary() {
        // 7 / 10 = 0.70
        assertEquals(ParkStatus.REJECTED, evaluate(3, 7));
        // 5 / 8 < 0.70
        assertEquals(ParkStatus.PENDING, evaluate(3, 5));
    }

    @Test
    public void testTerminalStatesNeverChange() {
        assertEquals(ParkStatus.APPROVED,
                stateMachine.evaluate(ParkStatus.APPROVED, new VoteTally(10, 50)));
        assertEquals(ParkStatus.REJECTED,
                stateMachine.evaluate(ParkStatus.REJECTED, new VoteTally(100, 5)));
    }

    @Test
    public void testApplyWritesCountsAndDecisionTime() {
        Park park = Park.builder().name("河濱公園").createdBy("alice").build();

        assertFalse(stateMachine.apply(park, new VoteTally(9, 0)));
        assertEquals(9, park.getUpvotes());
        assertEquals(ParkStatus.PENDING, park.getStatus());
        assertNull(park.getDecidedAt());

        assertTrue(stateMachine.apply(park, new VoteTally(10, 0)));
        assertEquals(ParkStatus.APPROVED, park.getStatus());
        assertNotNull(park.getDecidedAt());

        assertFalse(stateMachine.apply(park, new VoteTally(10, 30)));
        assertEquals(30, park.getDownvotes());
        assertEquals(ParkStatus.APPROVED, park.getStatus());
    }

}
