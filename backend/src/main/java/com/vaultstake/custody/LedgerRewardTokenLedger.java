package com.vaultstake.custody;

import com.vaultstake.config.StakingProperties;
import com.vaultstake.model.TokenBalance;
import com.vaultstake.repository.TokenBalanceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;

/**
 * Reward token balances backed by the {@code token_balances} table.
 */
@Component
public class LedgerRewardTokenLedger implements RewardTokenLedger {

    private static final Logger log = LoggerFactory.getLogger(LedgerRewardTokenLedger.class);

    private final TokenBalanceRepository tokenBalanceRepository;
    private final StakingProperties stakingProperties;

    public LedgerRewardTokenLedger(TokenBalanceRepository tokenBalanceRepository, StakingProperties stakingProperties) {
        this.tokenBalanceRepository = tokenBalanceRepository;
        this.stakingProperties = stakingProperties;
    }

    @Override
    @Transactional
    public void transferIn(String from, long amount) {
        move(from, vaultAccount(), amount);
    }

    @Override
    @Transactional
    public void transferOut(String to, long amount) {
        move(vaultAccount(), to, amount);
    }

    @Override
    @Transactional(readOnly = true)
    public long balanceOf(String holder) {
        return tokenBalanceRepository.findById(holder).map(TokenBalance::getBalance).orElse(0L);
    }

    @Override
    @Transactional(readOnly = true)
    public long vaultBalance() {
        return balanceOf(vaultAccount());
    }

    /**
     * Adds tokens to a holder without a counterparty. Used by the local faucet
     * and to fund the reward pool.
     */
    @Transactional
    public void credit(String holder, long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Credit amount must be non-negative");
        }
        TokenBalance balance = lockOrCreate(holder);
        balance.setBalance(Math.addExact(balance.getBalance(), amount));
        balance.setUpdatedAt(OffsetDateTime.now());
        tokenBalanceRepository.save(balance);
        log.info("Credited {} reward tokens to {}, new balance: {}", amount, holder, balance.getBalance());
    }

    private void move(String from, String to, long amount) {
        if (amount < 0) {
            throw new CustodyTransferException("Transfer amount must be non-negative: " + amount);
        }
        if (amount == 0) {
            return;
        }
        TokenBalance source = lockOrCreate(from);
        if (source.getBalance() < amount) {
            throw new CustodyTransferException(
                    "Insufficient reward token balance for " + from + ": " + source.getBalance() + " < " + amount
            );
        }
        TokenBalance target = lockOrCreate(to);

        OffsetDateTime now = OffsetDateTime.now();
        source.setBalance(source.getBalance() - amount);
        source.setUpdatedAt(now);
        target.setBalance(Math.addExact(target.getBalance(), amount));
        target.setUpdatedAt(now);
        tokenBalanceRepository.save(source);
        tokenBalanceRepository.save(target);
        log.debug("Transferred {} reward tokens from {} to {}", amount, from, to);
    }

    private TokenBalance lockOrCreate(String holder) {
        return tokenBalanceRepository.findByHolderForUpdate(holder).orElseGet(() -> {
            TokenBalance created = new TokenBalance();
            created.setHolder(holder);
            created.setBalance(0L);
            return created;
        });
    }

    private String vaultAccount() {
        return stakingProperties.getCustody().getVaultAccount();
    }
}
