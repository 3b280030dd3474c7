package com.vibecoding.ocloud.model.ocloud;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 재조정 단계
 */
public enum OCloudPhase {
    INITIALIZING("Initializing"),
    SMO_RECONCILING("SMOReconciling"),
    O2_RECONCILING("O2Reconciling"),
    POOL_RECONCILING("PoolReconciling"),
    INVENTORY_UPDATING("InventoryUpdating"),
    TELEMETRY_COLLECTING("TelemetryCollecting"),
    READY("Ready"),
    ERROR("Error");

    private final String displayName;

    OCloudPhase(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    @JsonCreator
    public static OCloudPhase fromDisplayName(String value) {
        for (OCloudPhase phase : values()) {
            if (phase.displayName.equals(value) || phase.name().equals(value)) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Unknown O-Cloud phase: " + value);
    }
}
