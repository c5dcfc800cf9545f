package com.bit.poa.authority;

import com.bit.poa.engine.ErrorType;
import com.bit.poa.engine.PoaException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class AuthorityRegistryTest {

    // 模拟链头槽位
    private final AtomicLong headSlot = new AtomicLong();

    private AuthorityRegistry registry;

    @BeforeEach
    void setUp() {
        headSlot.set(0);
        registry = new AuthorityRegistry(() -> headSlot.get() + 1);
    }

    @Test
    void testRegisterDuplicateWithoutOverwriteFails() {
        registry.register("A", "secret-a", 1, true, null, false);
        PoaException e = assertThrows(PoaException.class,
                () -> registry.register("A", "other", 2, true, null, false));
        assertEquals(ErrorType.DUPLICATE_AUTHORITY, e.getErrorType());

        Authority replaced = registry.register("A", "other", 2, true, null, true);
        assertEquals(2, replaced.getWeight());
        assertEquals("other", registry.find("A").orElseThrow().getSecret());
    }

    @Test
    void testInvalidRegistrationFailsFast() {
        assertEquals(ErrorType.CONFIG_INVALID, assertThrows(PoaException.class,
                () -> registry.register("  ", "s", 1, true, null, false)).getErrorType());
        assertEquals(ErrorType.CONFIG_INVALID, assertThrows(PoaException.class,
                () -> registry.register("A", "", 1, true, null, false)).getErrorType());
        assertEquals(ErrorType.CONFIG_INVALID, assertThrows(PoaException.class,
                () -> registry.register("A", "s", 0, true, null, false)).getErrorType());
        assertTrue(registry.authorities().isEmpty());
        assertTrue(registry.history().entries().isEmpty());
    }

    @Test
    void testIdentifierIsTrimmedAndCaseSensitive() {
        registry.register(" A ", "s", 1, true, null, false);
        registry.register("a", "s", 1, true, null, false);
        assertEquals(List.of("A", "a"), registry.authorities().stream().map(Authority::getIdentifier).collect(Collectors.toList()));
    }

    @Test
    void testDeregisterUnknownFails() {
        PoaException e = assertThrows(PoaException.class, () -> registry.deregister("ghost"));
        assertEquals(ErrorType.UNKNOWN_AUTHORITY, e.getErrorType());
    }

    @Test
    void testPartialUpdateKeepsUnspecifiedFields() {
        registry.register("A", "secret-a", 3, true, Map.of("region", "eu"), false);
        Authority updated = registry.update("A", null, null, false, null);

        assertFalse(updated.isActive());
        assertEquals(3, updated.getWeight());
        assertEquals("secret-a", updated.getSecret());
        assertEquals(Map.of("region", "eu"), updated.getMetadata());

        PoaException e = assertThrows(PoaException.class, () -> registry.update("B", "x", null, null, null));
        assertEquals(ErrorType.UNKNOWN_AUTHORITY, e.getErrorType());
    }

    @Test
    void testActiveAuthoritiesSortedAndFiltered() {
        registry.register("carol", "s", 1, true, null, false);
        registry.register("alice", "s", 1, false, null, false);
        registry.register("bob", "s", 1, true, null, false);

        assertEquals(List.of("bob", "carol"),
                registry.activeAuthorities().stream().map(Authority::getIdentifier).collect(Collectors.toList()));
    }

    @Test
    void testEditsWithinSameUnfilledSlotCoalesce() {
        registry.register("A", "s", 1, true, null, false);
        registry.register("B", "s", 1, true, null, false);
        registry.update("A", null, 5, null, null);

        assertEquals(1, registry.history().entries().size());
        AuthoritySnapshot only = registry.history().effectiveAt(1);
        assertEquals(1, only.getStartSlot());
        assertEquals(5, only.find("A").orElseThrow().getWeight());
    }

    @Test
    void testChangesTakeEffectFromNextUnfilledSlot() {
        registry.register("A", "secret-1", 1, true, null, false);
        headSlot.set(7);
        registry.update("A", "secret-2", null, null, null);
        registry.deregister("A");
        registry.register("B", "s", 1, true, null, false);

        List<AuthoritySnapshot> entries = registry.history().entries();
        assertEquals(2, entries.size());
        assertEquals(1, entries.get(0).getStartSlot());
        assertEquals(8, entries.get(1).getStartSlot());

        // 历史快照不受后续修改影响
        assertEquals("secret-1", registry.history().effectiveAt(7).find("A").orElseThrow().getSecret());
        assertFalse(registry.history().effectiveAt(8).find("A").isPresent());
    }
}
