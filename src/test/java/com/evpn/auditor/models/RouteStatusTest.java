package com.evpn.auditor.models;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RouteStatusTest {

    @Test
    void fromTokenMatchesExactLabels() {
        assertEquals(RouteStatus.ACCEPTED, RouteStatus.fromToken("Accepted").orElseThrow());
        assertEquals(RouteStatus.INVALID, RouteStatus.fromToken("Invalid").orElseThrow());
        assertTrue(RouteStatus.fromToken("rejected").isEmpty());
        assertTrue(RouteStatus.fromToken(null).isEmpty());
    }

    @Test
    void unknownIsNeverMatchedFromWire() {
        assertTrue(RouteStatus.fromToken("Unknown").isEmpty());
    }

    @Test
    void restartOutcomeMarkers() {
        DeviceResult notAttempted = DeviceResult.builder().host("h").displayName("d").connected(true).build();
        DeviceResult failed = DeviceResult.builder().host("h").displayName("d").connected(true)
            .restartAttempted(true).build();
        DeviceResult succeeded = DeviceResult.builder().host("h").displayName("d").connected(true)
            .restartAttempted(true).restartSucceeded(true).build();

        assertEquals("NO", RestartOutcome.of(notAttempted).getMarker());
        assertEquals("FAILED", RestartOutcome.of(failed).getMarker());
        assertEquals("SUCCESS", RestartOutcome.of(succeeded).getMarker());
    }
}
