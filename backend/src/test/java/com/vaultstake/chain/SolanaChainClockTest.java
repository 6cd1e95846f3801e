package com.vaultstake.chain;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SolanaChainClockTest {

    private final Clock clock = Clock.fixed(Instant.parse("2025-06-01T12:00:00Z"), ZoneOffset.UTC);

    @Mock
    private SolanaSlotReader solanaSlotReader;

    @Test
    void currentBlockHeight_usesSlot() {
        when(solanaSlotReader.currentSlot()).thenReturn(312_456_789L);

        SolanaChainClock chainClock = new SolanaChainClock(clock, solanaSlotReader);

        assertEquals(312_456_789L, chainClock.currentBlockHeight());
        assertEquals("solana", chainClock.mode());
        assertEquals(OffsetDateTime.parse("2025-06-01T12:00:00Z"), chainClock.now());
    }
}
