package com.vaultstake.service;

import com.vaultstake.model.StakingPool;
import com.vaultstake.repository.StakingPoolRepository;
import com.vaultstake.web.StakingException;
import org.springframework.stereotype.Service;

/**
 * Access to the singleton pool row. Mutating operations lock it first, which
 * serialises them against each other.
 */
@Service
public class StakingPoolService {

    private final StakingPoolRepository stakingPoolRepository;

    public StakingPoolService(StakingPoolRepository stakingPoolRepository) {
        this.stakingPoolRepository = stakingPoolRepository;
    }

    public StakingPool lockPool() {
        return stakingPoolRepository.findByIdForUpdate(StakingPool.SINGLETON_ID)
                .orElseThrow(() -> new IllegalStateException("Staking pool row not found"));
    }

    public StakingPool lockInitializedPool() {
        return requireInitialized(lockPool());
    }

    public StakingPool readPool() {
        return stakingPoolRepository.findById(StakingPool.SINGLETON_ID)
                .orElseThrow(() -> new IllegalStateException("Staking pool row not found"));
    }

    public StakingPool readInitializedPool() {
        return requireInitialized(readPool());
    }

    public StakingPool save(StakingPool pool) {
        return stakingPoolRepository.save(pool);
    }

    private StakingPool requireInitialized(StakingPool pool) {
        if (!pool.isInitialized()) {
            throw StakingException.notInitialized();
        }
        return pool;
    }
}
