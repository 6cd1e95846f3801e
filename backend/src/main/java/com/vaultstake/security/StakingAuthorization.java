package com.vaultstake.security;

public interface StakingAuthorization {

    boolean isAuthorized(String caller, StakingAction action);
}
