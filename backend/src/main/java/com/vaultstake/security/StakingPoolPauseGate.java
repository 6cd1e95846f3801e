package com.vaultstake.security;

import com.vaultstake.model.StakingPool;
import com.vaultstake.repository.StakingPoolRepository;
import org.springframework.stereotype.Component;

@Component
public class StakingPoolPauseGate implements PauseGate {

    private final StakingPoolRepository stakingPoolRepository;

    public StakingPoolPauseGate(StakingPoolRepository stakingPoolRepository) {
        this.stakingPoolRepository = stakingPoolRepository;
    }

    @Override
    public boolean isPaused() {
        return stakingPoolRepository.findById(StakingPool.SINGLETON_ID)
                .map(StakingPool::isPaused)
                .orElse(false);
    }
}
