package com.guardianintel.claims.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;

import org.junit.jupiter.api.Test;

import com.guardianintel.claims.integration.carrier.CarrierAdapter;
import com.guardianintel.claims.integration.carrier.CarrierCapabilityRegistry;
import com.guardianintel.claims.integration.carrier.CarrierProperties;
import com.guardianintel.claims.integration.carrier.CarrierTestSupport;

public class EngineConfigTest {

    private static CarrierAdapter adapter(String code) {
        CarrierAdapter adapter = mock(CarrierAdapter.class);
        when(adapter.carrierCode()).thenReturn(code);
        return adapter;
    }

    @Test
    public void testSweepPoolHasAThreadPerSyncableCarrier() {
        CarrierProperties properties = new CarrierProperties();
        List<CarrierAdapter> adapters = new ArrayList<>();
        for (int i = 1; i <= 6; i++) {
            properties.getCarriers().put("carrier-" + i, CarrierTestSupport.definition("Carrier " + i, true, true));
            adapters.add(adapter("carrier-" + i));
        }
        properties.getCarriers().put("allstate", CarrierTestSupport.definition("Allstate", false, false));

        ExecutorService pool = new EngineConfig().carrierSweepExecutor(new CarrierCapabilityRegistry(properties, adapters));
        try {
            assertEquals(6, ((ThreadPoolExecutor) pool).getMaximumPoolSize());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    public void testSweepPoolNeverEmpty() {
        CarrierProperties properties = new CarrierProperties();
        properties.getCarriers().put("allstate", CarrierTestSupport.definition("Allstate", false, false));

        assertEquals(1, EngineConfig.sweepThreads(new CarrierCapabilityRegistry(properties, List.of())));
    }
}
