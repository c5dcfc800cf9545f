package com.bit.poa.clock;

import com.bit.poa.engine.ErrorType;
import com.bit.poa.engine.PoaException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class SlotClockTest {

    private static final Instant GENESIS = Instant.parse("2025-01-01T00:00:00Z");

    private final SlotClock clock = new SlotClock(GENESIS, Duration.ofSeconds(5));

    @Test
    void testSlotForTimestamp() {
        assertEquals(0, clock.slotForTimestamp(GENESIS));
        assertEquals(0, clock.slotForTimestamp(GENESIS.plusMillis(4999)));
        assertEquals(1, clock.slotForTimestamp(GENESIS.plusSeconds(5)));
        assertEquals(12, clock.slotForTimestamp(GENESIS.plusSeconds(62)));
    }

    @Test
    void testSlotStartTime() {
        assertEquals(GENESIS, clock.slotStartTime(0));
        assertEquals(GENESIS.plusSeconds(50), clock.slotStartTime(10));
        PoaException e = assertThrows(PoaException.class, () -> clock.slotStartTime(-1));
        assertEquals(ErrorType.INVALID_SLOT, e.getErrorType());
    }

    @Test
    void testSlotStartTimeBeyondInstantRangeIsOutOfRange() {
        PoaException duration = assertThrows(PoaException.class, () -> clock.slotStartTime(Long.MAX_VALUE / 2));
        assertEquals(ErrorType.OUT_OF_RANGE, duration.getErrorType());
        // Duration 可表示但 Instant 溢出
        PoaException instant = assertThrows(PoaException.class, () -> clock.slotStartTime(Long.MAX_VALUE / 10));
        assertEquals(ErrorType.OUT_OF_RANGE, instant.getErrorType());
    }

    @Test
    void testTimestampBeforeGenesisIsOutOfRange() {
        PoaException e = assertThrows(PoaException.class, () -> clock.slotForTimestamp(GENESIS.minusNanos(1)));
        assertEquals(ErrorType.OUT_OF_RANGE, e.getErrorType());
    }

    @Test
    void testNonPositiveSlotDurationRejected() {
        PoaException zero = assertThrows(PoaException.class, () -> new SlotClock(GENESIS, Duration.ZERO));
        assertEquals(ErrorType.CONFIG_INVALID, zero.getErrorType());
        PoaException negative = assertThrows(PoaException.class, () -> new SlotClock(GENESIS, Duration.ofSeconds(-1)));
        assertEquals(ErrorType.CONFIG_INVALID, negative.getErrorType());
    }

    /**
     * slotStartTime(slot(t)) <= t < slotStartTime(slot(t) + 1)
     */
    @Test
    void testRoundTripWindow() {
        SlotClock odd = new SlotClock(GENESIS, Duration.ofMillis(1337));
        Random random = new Random(42);
        for (int i = 0; i < 10_000; i++) {
            Instant t = GENESIS.plusNanos(Math.abs(random.nextLong() % 1_000_000_000_000_000L));
            long slot = odd.slotForTimestamp(t);
            assertFalse(odd.slotStartTime(slot).isAfter(t));
            assertTrue(t.isBefore(odd.slotStartTime(slot + 1)));
        }
    }
}
