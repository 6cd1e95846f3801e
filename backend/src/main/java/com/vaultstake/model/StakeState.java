package com.vaultstake.model;

public enum StakeState {
    STAKED,
    UNBONDING,
    FREE
}
