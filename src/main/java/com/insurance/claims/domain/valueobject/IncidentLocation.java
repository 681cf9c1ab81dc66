package com.insurance.claims.domain.valueobject;

/**
 * Where the incident happened, in WGS84 degrees.
 *
 * @param latitude  -90 to 90
 * @param longitude -180 to 180
 */
public record IncidentLocation(double latitude, double longitude) {

    public IncidentLocation {
        if (Double.isNaN(latitude) || latitude < -90 || latitude > 90) {
            throw new IllegalArgumentException("latitude must be within [-90, 90], got: " + latitude);
        }
        if (Double.isNaN(longitude) || longitude < -180 || longitude > 180) {
            throw new IllegalArgumentException("longitude must be within [-180, 180], got: " + longitude);
        }
    }
}
