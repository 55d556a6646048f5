package com.guardianintel.claims.health;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.guardianintel.claims.integration.carrier.CarrierAdapter;
import com.guardianintel.claims.integration.carrier.CarrierCapabilityRegistry;

/**
 * Pings every carrier that has an adapter. Manual-only carriers are not probed.
 */
@Component
public class CarrierHealthIndicator implements HealthIndicator {

    private final CarrierCapabilityRegistry registry;

    public CarrierHealthIndicator(CarrierCapabilityRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        boolean allUp = true;

        for (Map.Entry<String, CarrierAdapter> entry : registry.adapters().entrySet()) {
            String code = entry.getKey();
            try {
                long start = System.nanoTime();
                boolean up = entry.getValue().ping();
                long millis = (System.nanoTime() - start) / 1_000_000;
                details.put(code, up ? "UP (" + millis + "ms)" : "DOWN: connection refused or timeout");
                allUp &= up;
            } catch (Exception e) {
                details.put(code, "DOWN: " + e.getMessage());
                allUp = false;
            }
        }

        return (allUp ? Health.up() : Health.down()).withDetails(details).build();
    }
}
