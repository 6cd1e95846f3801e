package com.vaultstake.repository;

import com.vaultstake.model.CustodyAsset;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CustodyAssetRepository extends JpaRepository<CustodyAsset, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from CustodyAsset a where a.assetId = :assetId")
    Optional<CustodyAsset> findByAssetIdForUpdate(@Param("assetId") String assetId);
}
