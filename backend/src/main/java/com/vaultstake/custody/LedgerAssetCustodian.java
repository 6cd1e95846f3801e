package com.vaultstake.custody;

import com.vaultstake.config.StakingProperties;
import com.vaultstake.model.CustodyAsset;
import com.vaultstake.repository.CustodyAssetRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * Asset custodian backed by the {@code custody_assets} table. Transfers join
 * the caller's transaction, so they roll back with it.
 */
@Component
public class LedgerAssetCustodian implements AssetCustodian {

    private static final Logger log = LoggerFactory.getLogger(LedgerAssetCustodian.class);

    private final CustodyAssetRepository custodyAssetRepository;
    private final StakingProperties stakingProperties;

    public LedgerAssetCustodian(CustodyAssetRepository custodyAssetRepository, StakingProperties stakingProperties) {
        this.custodyAssetRepository = custodyAssetRepository;
        this.stakingProperties = stakingProperties;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<String> holderOf(String assetId) {
        return custodyAssetRepository.findById(assetId).map(CustodyAsset::getHolder);
    }

    @Override
    @Transactional
    public void depositIntoCustody(String from, String assetId) {
        move(assetId, from, vaultAccount());
    }

    @Override
    @Transactional
    public void releaseFromCustody(String to, String assetId) {
        move(assetId, vaultAccount(), to);
    }

    /**
     * Registers or reassigns an asset outside of custody. Used by the local faucet.
     */
    @Transactional
    public void mint(String assetId, String holder) {
        CustodyAsset asset = custodyAssetRepository.findByAssetIdForUpdate(assetId).orElseGet(() -> {
            CustodyAsset created = new CustodyAsset();
            created.setAssetId(assetId);
            return created;
        });
        if (vaultAccount().equals(asset.getHolder())) {
            throw new CustodyTransferException("Asset is held in custody: " + assetId);
        }
        asset.setHolder(holder);
        asset.setUpdatedAt(OffsetDateTime.now());
        custodyAssetRepository.save(asset);
        log.info("Minted asset {} to {}", assetId, holder);
    }

    private void move(String assetId, String from, String to) {
        CustodyAsset asset = custodyAssetRepository.findByAssetIdForUpdate(assetId)
                .orElseThrow(() -> new CustodyTransferException("Unknown asset: " + assetId));
        if (!from.equals(asset.getHolder())) {
            throw new CustodyTransferException("Asset " + assetId + " is not held by " + from);
        }
        asset.setHolder(to);
        asset.setUpdatedAt(OffsetDateTime.now());
        custodyAssetRepository.save(asset);
        log.debug("Moved asset {} from {} to {}", assetId, from, to);
    }

    private String vaultAccount() {
        return stakingProperties.getCustody().getVaultAccount();
    }
}
