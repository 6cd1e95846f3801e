package com.vaultstake.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * Holder of a unique asset as tracked by the ledger-backed custodian.
 */
@Getter
@Setter
@Entity
@Table(name = "custody_assets")
public class CustodyAsset {

    @Id
    @Column(name = "asset_id", nullable = false, updatable = false, length = 128)
    private String assetId;

    @Column(name = "holder", nullable = false, length = 128)
    private String holder;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
