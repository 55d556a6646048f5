package com.guardianintel.claims.features.claims.controller;

import java.util.List;

import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.guardianintel.claims.exception.NotFoundException;
import com.guardianintel.claims.features.claims.sync.CarrierSyncSweeper;
import com.guardianintel.claims.features.claims.sync.SweepReport;
import com.guardianintel.claims.integration.carrier.CarrierCapabilities;
import com.guardianintel.claims.integration.carrier.CarrierCapabilityRegistry;

@RestController
@RequestMapping("/api/carriers")
public class CarrierController {

    private final CarrierCapabilityRegistry registry;
    private final CarrierSyncSweeper sweeper;

    public CarrierController(CarrierCapabilityRegistry registry, CarrierSyncSweeper sweeper) {
        this.registry = registry;
        this.sweeper = sweeper;
    }

    @GetMapping
    public List<CarrierCapabilities> carriers() {
        return registry.carriers();
    }

    @GetMapping("/{code}")
    public CarrierCapabilities carrier(@PathVariable String code) {
        return registry.describe(code).orElseThrow(() -> new NotFoundException("Carrier", code));
    }

    // Manual trigger for the scheduled sweep
    @PostMapping("/sync")
    @PreAuthorize("hasAuthority('ROLE_ADMIN')")
    public SweepReport sweep() {
        return sweeper.sweep();
    }
}
