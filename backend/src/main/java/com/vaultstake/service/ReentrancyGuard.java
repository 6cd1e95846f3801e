package com.vaultstake.service;

import com.vaultstake.web.StakingException;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Rejects a state-mutating staking operation started on a thread that is
 * already inside one, e.g. a custody collaborator calling back into the ledger.
 */
@Component
public class ReentrancyGuard {

    private final ThreadLocal<Boolean> entered = ThreadLocal.withInitial(() -> Boolean.FALSE);

    public <T> T guard(Supplier<T> operation) {
        if (entered.get()) {
            throw StakingException.reentrantCall();
        }
        entered.set(Boolean.TRUE);
        try {
            return operation.get();
        } finally {
            entered.remove();
        }
    }
}
