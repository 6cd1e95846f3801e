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
@Table(name = "tracked_assets")
public class TrackedAsset {

    @Id
    @Column(name = "asset_id", nullable = false, updatable = false, length = 128)
    private String assetId;

    @Column(name = "tracked_at", nullable = false, updatable = false)
    private OffsetDateTime trackedAt;

    public TrackedAsset(String assetId, OffsetDateTime trackedAt) {
        this.assetId = assetId;
        this.trackedAt = trackedAt;
    }
}
