package com.vaultstake.custody;

import java.util.Optional;

/**
 * Ownership query and transfer of unique assets into and out of staking custody.
 */
public interface AssetCustodian {

    Optional<String> holderOf(String assetId);

    void depositIntoCustody(String from, String assetId);

    void releaseFromCustody(String to, String assetId);
}
