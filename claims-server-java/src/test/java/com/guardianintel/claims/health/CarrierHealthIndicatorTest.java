package com.guardianintel.claims.health;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import com.guardianintel.claims.integration.carrier.CarrierAdapter;
import com.guardianintel.claims.integration.carrier.CarrierCapabilityRegistry;
import com.guardianintel.claims.integration.carrier.CarrierProperties;

public class CarrierHealthIndicatorTest {

    @Mock
    private CarrierAdapter stateFarm;

    @Mock
    private CarrierAdapter sandbox;

    private CarrierHealthIndicator indicator;

    @BeforeEach
    public void setup() {
        MockitoAnnotations.openMocks(this);
        when(stateFarm.carrierCode()).thenReturn("state-farm");
        when(sandbox.carrierCode()).thenReturn("sandbox");
        indicator = new CarrierHealthIndicator(new CarrierCapabilityRegistry(new CarrierProperties(), List.of(stateFarm, sandbox)));
    }

    @Test
    public void testAllUp() {
        when(stateFarm.ping()).thenReturn(true);
        when(sandbox.ping()).thenReturn(true);

        Health health = indicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertTrue(health.getDetails().get("state-farm").toString().startsWith("UP"));
    }

    @Test
    public void testOneCarrierDownIsDown() {
        when(stateFarm.ping()).thenThrow(new IllegalStateException("connection refused"));
        when(sandbox.ping()).thenReturn(true);

        Health health = indicator.health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("DOWN: connection refused", health.getDetails().get("state-farm"));
    }
}
