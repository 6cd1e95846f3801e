package com.vaultstake.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.OffsetDateTime;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "tracked_owners")
public class TrackedOwner {

    @Id
    @Column(name = "owner_wallet", nullable = false, updatable = false, length = 128)
    private String ownerWallet;

    @Column(name = "tracked_at", nullable = false, updatable = false)
    private OffsetDateTime trackedAt;

    public TrackedOwner(String ownerWallet, OffsetDateTime trackedAt) {
        this.ownerWallet = ownerWallet;
        this.trackedAt = trackedAt;
    }
}
