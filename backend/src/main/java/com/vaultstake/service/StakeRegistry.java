package com.vaultstake.service;

import com.vaultstake.model.OwnerStake;
import com.vaultstake.model.StakeEntry;
import com.vaultstake.model.StakingPool;
import com.vaultstake.repository.OwnerStakeRepository;
import com.vaultstake.repository.StakeEntryRepository;
import com.vaultstake.web.StakingException;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Durable stake records: the asset to entry map, each owner's asset list, the
 * tracking sets and {@code stakesCount}. Holds no staking policy; callers run
 * inside the transaction that locked the pool row.
 */
@Service
public class StakeRegistry {

    private final StakeEntryRepository stakeEntryRepository;
    private final OwnerStakeRepository ownerStakeRepository;
    private final TrackingSets trackingSets;

    public StakeRegistry(
            StakeEntryRepository stakeEntryRepository,
            OwnerStakeRepository ownerStakeRepository,
            TrackingSets trackingSets
    ) {
        this.stakeEntryRepository = stakeEntryRepository;
        this.ownerStakeRepository = ownerStakeRepository;
        this.trackingSets = trackingSets;
    }

    public StakeEntry add(StakingPool pool, StakeEntry entry, OffsetDateTime now) {
        String assetId = entry.getAssetId();
        if (stakeEntryRepository.existsById(assetId)) {
            throw StakingException.assetAlreadyStaked(assetId);
        }

        StakeEntry saved = stakeEntryRepository.save(entry);

        OwnerStake slot = new OwnerStake();
        slot.setOwnerWallet(entry.getOwnerWallet());
        slot.setAssetId(assetId);
        slot.setSlotIndex(Math.toIntExact(ownerStakeRepository.countByOwnerWallet(entry.getOwnerWallet())));
        ownerStakeRepository.save(slot);

        trackingSets.trackAsset(assetId, now);
        trackingSets.trackOwner(entry.getOwnerWallet(), now);
        pool.setStakesCount(pool.getStakesCount() + 1);
        return saved;
    }

    public StakeEntry remove(StakingPool pool, String assetId) {
        StakeEntry entry = stakeEntryRepository.findById(assetId)
                .orElseThrow(() -> StakingException.entryNotFound(assetId));
        String ownerWallet = entry.getOwnerWallet();

        OwnerStake slot = ownerStakeRepository.findByAssetId(assetId)
                .orElseThrow(() -> new IllegalStateException("Owner index is missing asset " + assetId));
        OwnerStake last = ownerStakeRepository.findFirstByOwnerWalletOrderBySlotIndexDesc(ownerWallet)
                .orElseThrow(() -> new IllegalStateException("Owner index is empty for " + ownerWallet));

        // swap-and-pop; the delete is flushed first so the vacated slot index is free
        ownerStakeRepository.delete(slot);
        ownerStakeRepository.flush();
        if (!Objects.equals(last.getId(), slot.getId())) {
            last.setSlotIndex(slot.getSlotIndex());
            ownerStakeRepository.save(last);
        }

        trackingSets.untrackAsset(assetId);
        if (ownerStakeRepository.countByOwnerWallet(ownerWallet) == 0) {
            trackingSets.untrackOwner(ownerWallet);
        }

        stakeEntryRepository.delete(entry);
        pool.setStakesCount(pool.getStakesCount() - 1);
        return entry;
    }

    public StakeEntry save(StakeEntry entry) {
        return stakeEntryRepository.save(entry);
    }

    public Optional<StakeEntry> get(String assetId) {
        return stakeEntryRepository.findById(assetId);
    }

    public List<StakeEntry> listByOwner(String ownerWallet) {
        List<String> assetIds = ownerStakeRepository.findByOwnerWalletOrderBySlotIndexAsc(ownerWallet).stream()
                .map(OwnerStake::getAssetId)
                .toList();
        if (assetIds.isEmpty()) {
            return List.of();
        }
        Map<String, StakeEntry> entriesById = stakeEntryRepository.findAllById(assetIds).stream()
                .collect(Collectors.toMap(StakeEntry::getAssetId, Function.identity()));
        return assetIds.stream()
                .map(entriesById::get)
                .filter(Objects::nonNull)
                .toList();
    }

    public long countByOwner(String ownerWallet) {
        return ownerStakeRepository.countByOwnerWallet(ownerWallet);
    }

    public List<String> trackedAssets() {
        return trackingSets.trackedAssets();
    }

    public List<String> trackedOwners() {
        return trackingSets.trackedOwners();
    }
}
