package com.guardianintel.claims.integration.carrier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.guardianintel.claims.exception.UnsupportedCarrierOperationException;

import lombok.extern.slf4j.Slf4j;

/**
 * Carrier code -> capability descriptor and adapter. Built once at startup from
 * {@link CarrierProperties} and the adapter beans. A configured carrier without an
 * adapter is listed for display but supports neither filing nor sync.
 */
@Component
@Slf4j
public class CarrierCapabilityRegistry {

    private final Map<String, CarrierCapabilities> descriptors = new LinkedHashMap<>();
    private final Map<String, CarrierAdapter> adapters = new LinkedHashMap<>();

    public CarrierCapabilityRegistry(CarrierProperties properties, List<CarrierAdapter> adapterBeans) {
        for (CarrierAdapter adapter : adapterBeans) {
            adapters.put(adapter.carrierCode(), adapter);
        }

        properties.getCarriers().keySet().forEach(code -> {
            CarrierCapabilities configured = properties.capabilitiesOf(code);
            if (!adapters.containsKey(code)) {
                if (configured.supportsDirectFiling() || configured.supportsStatusSync()) {
                    log.warn("Carrier '{}' is configured with capabilities but has no adapter; treating it as manual-only", code);
                }
                configured = CarrierCapabilities.none(code, configured.displayName());
            }
            descriptors.put(code, configured);
        });

        adapters.keySet().stream()
                .filter(code -> !descriptors.containsKey(code))
                .forEach(code -> {
                    log.warn("Adapter for '{}' has no configuration entry; all operations disabled", code);
                    descriptors.put(code, CarrierCapabilities.none(code, code));
                });

        log.info("✓ Carrier registry ready: {}", descriptors.values());
    }

    public Optional<CarrierCapabilities> describe(String carrierCode) {
        return Optional.ofNullable(carrierCode).map(descriptors::get);
    }

    public List<CarrierCapabilities> carriers() {
        return Collections.unmodifiableList(new ArrayList<>(descriptors.values()));
    }

    public String displayName(String carrierCode) {
        return describe(carrierCode).map(CarrierCapabilities::displayName).orElse(carrierCode);
    }

    public boolean supportsDirectFiling(String carrierCode) {
        return describe(carrierCode).map(CarrierCapabilities::supportsDirectFiling).orElse(false);
    }

    public boolean supportsStatusSync(String carrierCode) {
        return describe(carrierCode).map(CarrierCapabilities::supportsStatusSync).orElse(false);
    }

    public CarrierAdapter requireFiling(String carrierCode) {
        if (!supportsDirectFiling(carrierCode)) {
            throw new UnsupportedCarrierOperationException(carrierCode, "direct filing");
        }
        return adapters.get(carrierCode);
    }

    public CarrierAdapter requireStatusSync(String carrierCode) {
        if (!supportsStatusSync(carrierCode)) {
            throw new UnsupportedCarrierOperationException(carrierCode, "status sync");
        }
        return adapters.get(carrierCode);
    }

    public Map<String, CarrierAdapter> adapters() {
        return Collections.unmodifiableMap(adapters);
    }
}
