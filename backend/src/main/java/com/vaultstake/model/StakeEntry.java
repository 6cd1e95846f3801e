package com.vaultstake.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * One record per asset currently held in custody for staking.
 * A {@link StakeState#FREE} entry has paid its exit tax and waits for withdraw.
 */
@Getter
@Setter
@Entity
@Table(name = "stake_entries")
public class StakeEntry {

    @Id
    @Column(name = "asset_id", nullable = false, updatable = false, length = 128)
    private String assetId;

    @Column(name = "owner_wallet", nullable = false, updatable = false, length = 128)
    private String ownerWallet;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 16)
    private StakeState state = StakeState.STAKED;

    @Column(name = "staked_at", nullable = false, updatable = false)
    private OffsetDateTime stakedAt;

    /**
     * Unbonding completion time after a voluntary unstake, or the tax payment
     * time after a forced exit. Null while staked.
     */
    @Column(name = "unbonding_at")
    private OffsetDateTime unbondingAt;

    @Column(name = "last_claimed_block", nullable = false)
    private long lastClaimedBlock;

    @Column(name = "carry_deposit", nullable = false, updatable = false)
    private long carryDeposit;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    public boolean isStaked() {
        return state == StakeState.STAKED;
    }
}
