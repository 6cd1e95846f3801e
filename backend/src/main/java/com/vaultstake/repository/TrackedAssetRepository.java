package com.vaultstake.repository;

import com.vaultstake.model.TrackedAsset;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TrackedAssetRepository extends JpaRepository<TrackedAsset, String> {
}
