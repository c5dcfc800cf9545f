package com.bit.poa.schedule;

import com.bit.poa.authority.Authority;
import com.bit.poa.authority.AuthorityHistory;
import com.bit.poa.authority.AuthoritySnapshot;
import com.bit.poa.engine.ErrorType;
import com.bit.poa.engine.PoaException;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class LeaderScheduleTest {

    private static LeaderSchedule scheduleOf(AuthoritySnapshot... snapshots) {
        AuthorityHistory history = new AuthorityHistory();
        for (AuthoritySnapshot snapshot : snapshots) {
            history.record(snapshot);
        }
        return new LeaderSchedule(history);
    }

    @Test
    void testWeightedRoundRobinOrder() {
        LeaderSchedule schedule = scheduleOf(new AuthoritySnapshot(1,
                List.of(Authority.of("B", "s", 1), Authority.of("A", "s", 2))));

        assertEquals("A", schedule.authorityForSlot(1).getIdentifier());
        assertEquals("A", schedule.authorityForSlot(2).getIdentifier());
        assertEquals("B", schedule.authorityForSlot(3).getIdentifier());
        // 下一个轮转周期
        assertEquals("A", schedule.authorityForSlot(4).getIdentifier());
        assertEquals("B", schedule.authorityForSlot(6).getIdentifier());
    }

    @Test
    void testSlotZeroIsReserved() {
        LeaderSchedule schedule = scheduleOf(new AuthoritySnapshot(1, List.of(Authority.of("A", "s", 1))));
        PoaException e = assertThrows(PoaException.class, () -> schedule.authorityForSlot(0));
        assertEquals(ErrorType.INVALID_SLOT, e.getErrorType());
    }

    @Test
    void testNoSnapshotIsInvalidSlot() {
        LeaderSchedule schedule = scheduleOf(new AuthoritySnapshot(10, List.of(Authority.of("A", "s", 1))));
        PoaException e = assertThrows(PoaException.class, () -> schedule.authorityForSlot(9));
        assertEquals(ErrorType.INVALID_SLOT, e.getErrorType());
    }

    @Test
    void testNoActiveAuthorities() {
        LeaderSchedule schedule = scheduleOf(new AuthoritySnapshot(1,
                List.of(new Authority("A", "s", 1, false, null))));
        PoaException e = assertThrows(PoaException.class, () -> schedule.authorityForSlot(1));
        assertEquals(ErrorType.NO_ACTIVE_AUTHORITIES, e.getErrorType());
    }

    @Test
    void testInactiveAuthoritiesAreSkipped() {
        LeaderSchedule schedule = scheduleOf(new AuthoritySnapshot(1, List.of(
                Authority.of("A", "s", 1),
                new Authority("B", "s", 5, false, null),
                Authority.of("C", "s", 1))));
        assertEquals("A", schedule.authorityForSlot(1).getIdentifier());
        assertEquals("C", schedule.authorityForSlot(2).getIdentifier());
        assertEquals("A", schedule.authorityForSlot(3).getIdentifier());
    }

    @Test
    void testRepeatedCallsAreIdentical() {
        LeaderSchedule schedule = scheduleOf(new AuthoritySnapshot(1, List.of(
                Authority.of("A", "s", 3), Authority.of("B", "s", 2), Authority.of("C", "s", 4))));
        for (long slot = 1; slot <= 200; slot++) {
            Authority first = schedule.authorityForSlot(slot);
            assertEquals(first, schedule.authorityForSlot(slot));
            assertEquals(first, LeaderSchedule.resolve(slot, schedule.snapshotForSlot(slot)));
        }
    }

    @Test
    void testFrequencyMatchesWeights() {
        LeaderSchedule schedule = scheduleOf(new AuthoritySnapshot(1, List.of(
                Authority.of("A", "s", 3), Authority.of("B", "s", 1), Authority.of("C", "s", 2))));
        Map<String, Integer> counts = new HashMap<>();
        int slots = 6_000;
        for (long slot = 1; slot <= slots; slot++) {
            counts.merge(schedule.authorityForSlot(slot).getIdentifier(), 1, Integer::sum);
        }
        log.info("调度分布: {}", counts);
        assertEquals(3_000, counts.get("A"));
        assertEquals(1_000, counts.get("B"));
        assertEquals(2_000, counts.get("C"));
    }

    @Test
    void testUsesSnapshotEffectiveAtSlot() {
        AuthorityHistory history = new AuthorityHistory();
        history.record(new AuthoritySnapshot(1, List.of(Authority.of("A", "s", 1))));
        LeaderSchedule schedule = new LeaderSchedule(history);
        assertEquals("A", schedule.authorityForSlot(5).getIdentifier());

        history.record(new AuthoritySnapshot(5, List.of(Authority.of("B", "s", 1))));
        assertEquals("A", schedule.authorityForSlot(4).getIdentifier());
        assertEquals("B", schedule.authorityForSlot(5).getIdentifier());

        // 同一起始槽位的快照被替换后，缓存结果随之失效
        history.record(new AuthoritySnapshot(5, List.of(Authority.of("C", "s", 1))));
        assertEquals("C", schedule.authorityForSlot(5).getIdentifier());
        assertTrue(schedule.authorityFromSnapshot(4, "A").isPresent());
        assertFalse(schedule.authorityFromSnapshot(5, "A").isPresent());
    }
}
