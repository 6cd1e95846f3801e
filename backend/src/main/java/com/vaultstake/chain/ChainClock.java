package com.vaultstake.chain;

import java.time.OffsetDateTime;

/**
 * Time source for the ledger: wall-clock time plus the current block height.
 */
public interface ChainClock {

    OffsetDateTime now();

    long currentBlockHeight();

    String mode();
}
