package com.vaultstake.web;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class StakingException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public StakingException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    public static StakingException stakingPeriodEnded() {
        return new StakingException(HttpStatus.CONFLICT, "STAKING_PERIOD_ENDED", "Staking period has ended");
    }

    public static StakingException stakeLimitExceeded(long stakeLimit) {
        return new StakingException(
                HttpStatus.CONFLICT,
                "STAKE_LIMIT_EXCEEDED",
                "Active stake limit reached: " + stakeLimit
        );
    }

    public static StakingException callerNotAssetHolder(String assetId) {
        return new StakingException(
                HttpStatus.FORBIDDEN,
                "CALLER_NOT_ASSET_HOLDER",
                "Caller does not hold asset: " + assetId
        );
    }

    public static StakingException entryNotFound(String assetId) {
        return new StakingException(HttpStatus.NOT_FOUND, "ENTRY_NOT_FOUND", "No stake entry for asset: " + assetId);
    }

    public static StakingException notStaked(String assetId) {
        return new StakingException(HttpStatus.CONFLICT, "NOT_STAKED", "Asset is not in staked state: " + assetId);
    }

    public static StakingException assetAlreadyStaked(String assetId) {
        return new StakingException(
                HttpStatus.CONFLICT,
                "ASSET_ALREADY_STAKED",
                "Asset already has a stake entry: " + assetId
        );
    }

    public static StakingException callerNotEntryOwner(String assetId) {
        return new StakingException(
                HttpStatus.FORBIDDEN,
                "CALLER_NOT_ENTRY_OWNER",
                "Caller does not own stake entry: " + assetId
        );
    }

    public static StakingException forcedExitRequired(String assetId) {
        return new StakingException(
                HttpStatus.CONFLICT,
                "FORCED_EXIT_REQUIRED",
                "Asset is still locked; withdraw requires forceWithTax=true: " + assetId
        );
    }

    public static StakingException pastTimestampRequired() {
        return new StakingException(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "PAST_TIMESTAMP_REQUIRED",
                "Timestamp must be strictly in the past"
        );
    }

    public static StakingException unauthorized(String action) {
        return new StakingException(HttpStatus.FORBIDDEN, "UNAUTHORIZED", "Caller is not authorized for " + action);
    }

    public static StakingException systemPaused() {
        return new StakingException(HttpStatus.SERVICE_UNAVAILABLE, "SYSTEM_PAUSED", "Staking is paused");
    }

    public static StakingException notInitialized() {
        return new StakingException(
                HttpStatus.SERVICE_UNAVAILABLE,
                "NOT_INITIALIZED",
                "Staking pool has not been initialized"
        );
    }

    public static StakingException alreadyInitialized() {
        return new StakingException(
                HttpStatus.CONFLICT,
                "ALREADY_INITIALIZED",
                "Staking pool is already initialized"
        );
    }

    public static StakingException reentrantCall() {
        return new StakingException(
                HttpStatus.CONFLICT,
                "REENTRANT_CALL",
                "Re-entrant call into a staking operation"
        );
    }

    public static StakingException invalidWalletAddress(String value) {
        return new StakingException(
                HttpStatus.BAD_REQUEST,
                "INVALID_WALLET_ADDRESS",
                "Invalid wallet address: " + value
        );
    }
}
