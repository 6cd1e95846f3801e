package com.vaultstake.service;

import com.vaultstake.model.TrackedAsset;
import com.vaultstake.model.TrackedOwner;
import com.vaultstake.repository.TrackedAssetRepository;
import com.vaultstake.repository.TrackedOwnerRepository;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Enumeration-only membership sets of the assets and owners with a live entry.
 * Iteration order is not significant.
 */
@Component
public class TrackingSets {

    private final TrackedAssetRepository trackedAssetRepository;
    private final TrackedOwnerRepository trackedOwnerRepository;

    public TrackingSets(TrackedAssetRepository trackedAssetRepository, TrackedOwnerRepository trackedOwnerRepository) {
        this.trackedAssetRepository = trackedAssetRepository;
        this.trackedOwnerRepository = trackedOwnerRepository;
    }

    public void trackAsset(String assetId, OffsetDateTime now) {
        if (!trackedAssetRepository.existsById(assetId)) {
            trackedAssetRepository.save(new TrackedAsset(assetId, now));
        }
    }

    public void untrackAsset(String assetId) {
        trackedAssetRepository.deleteById(assetId);
    }

    public void trackOwner(String ownerWallet, OffsetDateTime now) {
        if (!trackedOwnerRepository.existsById(ownerWallet)) {
            trackedOwnerRepository.save(new TrackedOwner(ownerWallet, now));
        }
    }

    public void untrackOwner(String ownerWallet) {
        trackedOwnerRepository.deleteById(ownerWallet);
    }

    public List<String> trackedAssets() {
        return trackedAssetRepository.findAll().stream()
                .map(TrackedAsset::getAssetId)
                .toList();
    }

    public List<String> trackedOwners() {
        return trackedOwnerRepository.findAll().stream()
                .map(TrackedOwner::getOwnerWallet)
                .toList();
    }
}
