package com.buildsync.reconcile;

import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IdentifierMinterTest {

    @Test
    void mint_producesTwentyOneCharacterHexTokens() {
        IdentifierMinter minter = new IdentifierMinter(List.of());

        String id = minter.mint();

        assertEquals(IdentifierMinter.LENGTH, id.length());
        assertTrue(id.matches("[0-9a-f]{21}"), id);
        assertFalse(id.contains("-"));
    }

    @Test
    void mint_neverRepeatsWithinOneRun() {
        IdentifierMinter minter = new IdentifierMinter(List.of());
        Set<String> seen = new HashSet<>();

        for (int i = 0; i < 5_000; i++) {
            assertTrue(seen.add(minter.mint()));
        }
    }

    @Test
    void mint_redrawsOnCollisionWithReservedOrMintedIds() {
        Deque<String> tokens = new ArrayDeque<>(List.of("taken", "fresh-1", "fresh-1", "fresh-2"));
        IdentifierMinter minter = new IdentifierMinter(List.of("taken"), tokens::poll);

        assertEquals("fresh-1", minter.mint());
        assertEquals("fresh-2", minter.mint());
        assertTrue(tokens.isEmpty());
    }
}
