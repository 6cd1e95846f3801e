package com.vaultstake.repository;

import com.vaultstake.model.OwnerStake;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface OwnerStakeRepository extends JpaRepository<OwnerStake, Long> {
    List<OwnerStake> findByOwnerWalletOrderBySlotIndexAsc(String ownerWallet);

    Optional<OwnerStake> findByAssetId(String assetId);

    Optional<OwnerStake> findFirstByOwnerWalletOrderBySlotIndexDesc(String ownerWallet);

    long countByOwnerWallet(String ownerWallet);
}
