package com.vaultstake.chain;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class ChainClockHealthIndicator implements HealthIndicator {

    private final ChainClock chainClock;
    private final ObjectProvider<SolanaSlotReader> solanaSlotReader;

    public ChainClockHealthIndicator(ChainClock chainClock, ObjectProvider<SolanaSlotReader> solanaSlotReader) {
        this.chainClock = chainClock;
        this.solanaSlotReader = solanaSlotReader;
    }

    @Override
    public Health health() {
        try {
            long height = chainClock.currentBlockHeight();
            Optional<SolanaSlotReader.ProgramStatus> program = Optional.ofNullable(solanaSlotReader.getIfAvailable())
                    .flatMap(SolanaSlotReader::programStatus);

            Health.Builder builder = program.map(status -> status.deployed() ? Health.up() : Health.down())
                    .orElseGet(Health::up)
                    .withDetail("mode", chainClock.mode())
                    .withDetail("blockHeight", height);
            program.ifPresent(status -> builder
                    .withDetail("programId", status.programId())
                    .withDetail("programDeployed", status.deployed()));
            return builder.build();
        } catch (Exception e) {
            return Health.down()
                    .withDetail("mode", chainClock.mode())
                    .withException(e)
                    .build();
        }
    }
}
