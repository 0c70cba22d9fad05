package com.fleetinsight.telemetry.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class GeoUtilTest {

    @Test
    @DisplayName("One degree of latitude ≈ 111.19 km")
    void oneDegreeLatitude() {
        assertThat(GeoUtil.distanceKm(12.0, 77.0, 13.0, 77.0)).isCloseTo(111.19, within(0.05));
        assertThat(GeoUtil.calculateDistance(12.0, 77.0, 12.0, 77.0)).isZero();
    }

    @Test
    @DisplayName("isWithinRadius is inclusive of points just inside and rejects points outside")
    void withinRadius() {
        assertThat(GeoUtil.isWithinRadius(12.9716, 77.5946, 12.9720, 77.5946, 50)).isTrue();
        assertThat(GeoUtil.isWithinRadius(12.9716, 77.5946, 12.9760, 77.5946, 50)).isFalse();
    }

    @Test
    @DisplayName("Midpoint does not depend on argument order")
    void midpointSymmetric() {
        double[] ab = GeoUtil.midpoint(12.93, 77.61, 12.94, 77.62);
        double[] ba = GeoUtil.midpoint(12.94, 77.62, 12.93, 77.61);

        assertThat(ab).containsExactly(ba);
        assertThat(ab[0]).isCloseTo(12.935, within(1e-12));
    }

    @Test
    @DisplayName("Bounding box encloses a point exactly at the radius, east and north")
    void boundingDeltasEncloseRadius() {
        double lat = 12.97;
        double[] d = GeoUtil.boundingDeltas(lat, 100);

        assertThat(GeoUtil.calculateDistance(lat, 77.59, lat + d[0], 77.59)).isGreaterThanOrEqualTo(99.0);
        assertThat(GeoUtil.calculateDistance(lat, 77.59, lat, 77.59 + d[1])).isGreaterThanOrEqualTo(99.0);
    }
}
