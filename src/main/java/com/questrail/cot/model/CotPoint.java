package com.questrail.cot.model;

/**
 * The {@code <point>} element of a CoT event.
 *
 * <p>{@code hae}, {@code ce} and {@code le} use {@link #UNKNOWN} (9999999.0) when the
 * producer has no value, which is what receivers expect for "not measured".</p>
 */
public record CotPoint(double lat, double lon, double hae, double ce, double le) {

    public static final double UNKNOWN = 9999999.0;

    public CotPoint {
        if (lat < -90.0 || lat > 90.0) {
            throw new IllegalArgumentException("lat out of range: " + lat);
        }
        if (lon < -180.0 || lon > 180.0) {
            throw new IllegalArgumentException("lon out of range: " + lon);
        }
    }

    public static CotPoint of(double lat, double lon) {
        return new CotPoint(lat, lon, UNKNOWN, UNKNOWN, UNKNOWN);
    }

    public static CotPoint origin() {
        return of(0.0, 0.0);
    }
}
