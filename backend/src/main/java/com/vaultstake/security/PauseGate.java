package com.vaultstake.security;

public interface PauseGate {

    boolean isPaused();
}
