package com.vigil.aggregation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.vigil.checkmodel.CheckStatus;

import java.util.Collection;

/**
 * Status of a time bucket. Adds {@code nodata} to the probe statuses.
 * <p>
 * Declared in ascending severity: {@code nodata < up < degraded < down}.
 */
public enum BucketStatus {

    NODATA("nodata"),
    UP("up"),
    DEGRADED("degraded"),
    DOWN("down");

    private final String value;

    BucketStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Higher is worse. */
    public int severity() {
        return ordinal();
    }

    public boolean isUnhealthy() {
        return this == DOWN || this == DEGRADED;
    }

    public static BucketStatus of(CheckStatus status) {
        return switch (status) {
            case UP -> UP;
            case DEGRADED -> DEGRADED;
            case DOWN -> DOWN;
        };
    }

    /**
     * Worst-of across checks. {@code nodata} takes part only when every status is {@code nodata};
     * an empty collection is {@code nodata}.
     */
    public static BucketStatus overall(Collection<BucketStatus> statuses) {
        BucketStatus worst = NODATA;
        for (BucketStatus status : statuses) {
            if (status.severity() > worst.severity()) {
                worst = status;
            }
        }
        return worst;
    }

    @JsonCreator
    public static BucketStatus fromValue(String value) {
        for (BucketStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown bucket status: " + value);
    }
}
