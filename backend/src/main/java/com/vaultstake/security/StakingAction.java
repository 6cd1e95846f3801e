package com.vaultstake.security;

public enum StakingAction {
    INITIALIZE,
    SET_STAKE_LIMIT,
    SET_REWARD_PER_BLOCK,
    SET_EARLY_EXIT_TAX,
    SET_CARRY_AMOUNT,
    SET_STAKING_END_TIME,
    SET_UNBONDING_PERIOD,
    PAUSE,
    UNPAUSE,
    WITHDRAW_REWARD_POOL,
    WITHDRAW_ASSET
}
