package com.vaultstake.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

/**
 * Slot in an owner's asset list. Positions are dense from zero so removal can
 * swap the last slot into the vacated one.
 */
@Getter
@Setter
@Entity
@Table(name = "owner_stakes")
public class OwnerStake {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_wallet", nullable = false, updatable = false, length = 128)
    private String ownerWallet;

    @Column(name = "asset_id", nullable = false, updatable = false, length = 128)
    private String assetId;

    @Column(name = "slot_index", nullable = false)
    private int slotIndex;
}
