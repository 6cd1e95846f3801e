package com.vaultstake.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * Singleton row holding the ledger configuration and its global counters.
 * Created uninitialised by the schema migration.
 */
@Getter
@Setter
@Entity
@Table(name = "staking_pool")
public class StakingPool {

    public static final int SINGLETON_ID = 1;

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private Integer id = SINGLETON_ID;

    @Column(name = "initialized", nullable = false)
    private boolean initialized;

    @Column(name = "paused", nullable = false)
    private boolean paused;

    @Column(name = "collection_address", length = 128)
    private String collectionAddress;

    @Column(name = "reward_token_address", length = 128)
    private String rewardTokenAddress;

    @Column(name = "reward_per_block", nullable = false)
    private long rewardPerBlock;

    @Column(name = "early_exit_tax", nullable = false)
    private long earlyExitTax;

    @Column(name = "stake_limit", nullable = false)
    private long stakeLimit;

    @Column(name = "carry_amount", nullable = false)
    private long carryAmount;

    @Column(name = "staking_end_time")
    private OffsetDateTime stakingEndTime;

    @Column(name = "unbonding_period_seconds", nullable = false)
    private long unbondingPeriodSeconds;

    @Column(name = "stakes_count", nullable = false)
    private long stakesCount;

    @Column(name = "active_stakes_count", nullable = false)
    private long activeStakesCount;

    @Column(name = "carry_deposits_held", nullable = false)
    private long carryDepositsHeld;

    @Column(name = "initialized_at")
    private OffsetDateTime initializedAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    public boolean hasStakingEnded(OffsetDateTime now) {
        return stakingEndTime == null || !now.isBefore(stakingEndTime);
    }
}
