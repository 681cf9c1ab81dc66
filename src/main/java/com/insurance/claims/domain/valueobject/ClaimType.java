package com.insurance.claims.domain.valueobject;

import java.util.Locale;

/**
 * Kind of loss being claimed.
 */
public enum ClaimType {

    THEFT,
    WATER_DAMAGE,
    FIRE,
    LIABILITY,
    MEDICAL;

    /** @return snake_case value used on the Decision Service API */
    public String getWireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
