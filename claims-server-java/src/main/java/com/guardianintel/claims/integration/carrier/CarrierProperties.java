package com.guardianintel.claims.integration.carrier;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "claims")
public class CarrierProperties {

    // Carrier code (e.g. "state-farm") -> integration settings
    private Map<String, CarrierDefinition> carriers = new LinkedHashMap<>();

    public Map<String, CarrierDefinition> getCarriers() {
        return carriers;
    }

    public void setCarriers(Map<String, CarrierDefinition> carriers) {
        this.carriers = carriers;
    }

    public CarrierDefinition definition(String code) {
        return carriers.get(code);
    }

    public CarrierCapabilities capabilitiesOf(String code) {
        CarrierDefinition def = carriers.get(code);
        if (def == null) {
            return CarrierCapabilities.none(code, code);
        }
        return new CarrierCapabilities(code, def.getDisplayName() != null ? def.getDisplayName() : code,
                def.isDirectFiling(), def.isStatusSync(), def.isTestMode());
    }

    public static class CarrierDefinition {
        private String displayName;
        private boolean directFiling;
        private boolean statusSync;
        private boolean testMode;
        private String baseUrl;
        private String apiKey;

        public String getDisplayName() { return displayName; }
        public void setDisplayName(String displayName) { this.displayName = displayName; }

        public boolean isDirectFiling() { return directFiling; }
        public void setDirectFiling(boolean directFiling) { this.directFiling = directFiling; }

        public boolean isStatusSync() { return statusSync; }
        public void setStatusSync(boolean statusSync) { this.statusSync = statusSync; }

        public boolean isTestMode() { return testMode; }
        public void setTestMode(boolean testMode) { this.testMode = testMode; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
    }
}
