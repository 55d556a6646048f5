package com.guardianintel.claims.features.claims.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import com.guardianintel.claims.exception.CarrierException;
import com.guardianintel.claims.exception.CarrierTimeoutException;
import com.guardianintel.claims.exception.InvalidTransitionException;
import com.guardianintel.claims.exception.UnsupportedCarrierOperationException;
import com.guardianintel.claims.exception.ValidationException;
import com.guardianintel.claims.features.claims.lifecycle.ClaimStateMachine;
import com.guardianintel.claims.features.claims.lifecycle.FinancialReconciler;
import com.guardianintel.claims.features.claims.model.ClaimStatus;
import com.guardianintel.claims.features.claims.model.ClaimType;
import com.guardianintel.claims.features.claims.model.InsuranceClaim;
import com.guardianintel.claims.features.claims.model.StatusHistoryEntry;
import com.guardianintel.claims.features.customers.CustomerDirectory;
import com.guardianintel.claims.features.customers.Photo;
import com.guardianintel.claims.features.customers.PhotoDirectory;
import com.guardianintel.claims.integration.carrier.AdjusterInfo;
import com.guardianintel.claims.integration.carrier.CarrierCapabilityRegistry;
import com.guardianintel.claims.integration.carrier.CarrierClaimStatus;
import com.guardianintel.claims.integration.carrier.CarrierProperties;
import com.guardianintel.claims.integration.carrier.CauseOfLoss;
import com.guardianintel.claims.integration.carrier.DamageArea;
import com.guardianintel.claims.integration.carrier.DamageSeverity;
import com.guardianintel.claims.integration.carrier.FilingResult;

public class ClaimFilingServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    @Mock
    private CustomerDirectory customers;

    @Mock
    private PhotoDirectory photos;

    private ExecutorService executor;
    private InMemoryClaimStore store;
    private ClaimStateMachine stateMachine;
    private RecordingCarrierAdapter stateFarm;
    private RecordingCarrierAdapter allstate;
    private ClaimFilingService service;

    @BeforeEach
    public void setup() {
        MockitoAnnotations.openMocks(this);
        when(customers.findById(7L)).thenReturn(Optional.of(ClaimServiceTest.CUSTOMER));
        when(photos.findByIds(any())).thenReturn(List.of());

        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        stateMachine = new ClaimStateMachine(new FinancialReconciler(), clock);
        store = new InMemoryClaimStore();
        executor = Executors.newCachedThreadPool();

        stateFarm = new RecordingCarrierAdapter("state-farm");
        stateFarm.onFile = request -> new FilingResult("SF-" + stateFarm.fileCalls.get(),
                "SF2025-00000" + stateFarm.fileCalls.get(), CarrierClaimStatus.RECEIVED, "Received",
                new AdjusterInfo("Bob Smith", "555-0100", null, "State Farm", null),
                LocalDate.of(2025, 3, 4), List.of(), null);
        allstate = new RecordingCarrierAdapter("allstate");

        CarrierProperties properties = new CarrierProperties();
        properties.getCarriers().put("state-farm", definition("State Farm", true));
        properties.getCarriers().put("allstate", definition("Allstate", false));
        CarrierCapabilityRegistry registry = new CarrierCapabilityRegistry(properties, List.of(stateFarm, allstate));

        service = new ClaimFilingService(store, new ClaimLockManager(Duration.ofSeconds(1)), stateMachine, registry,
                new CarrierCallRunner(executor, Duration.ofMillis(300)), customers, photos);
    }

    @AfterEach
    public void tearDown() {
        executor.shutdownNow();
    }

    private static CarrierProperties.CarrierDefinition definition(String name, boolean capable) {
        CarrierProperties.CarrierDefinition def = new CarrierProperties.CarrierDefinition();
        def.setDisplayName(name);
        def.setDirectFiling(capable);
        def.setStatusSync(capable);
        return def;
    }

    private Long pendingClaim(String carrier) {
        InsuranceClaim claim = InsuranceClaim.open(7L, carrier, ClaimType.ROOF, LocalDate.of(2025, 2, 20), NOW, "dashboard");
        claim.setInitialEstimate(new BigDecimal("12500.00"));
        return store.save(claim).getId();
    }

    private static FileClaimCommand hailCommand() {
        return new FileClaimCommand(null, CauseOfLoss.HAIL, "Hail storm damaged the north slope",
                List.of(new DamageArea("roof", DamageSeverity.SEVERE, null)), false, null, List.of());
    }

    @Test
    public void testFile_pendingClaimBecomesFiled() {
        Long id = pendingClaim("state-farm");

        FilingOutcome outcome = service.file(id, hailCommand(), "dashboard");

        InsuranceClaim claim = outcome.claim();
        assertEquals(ClaimStatus.FILED, claim.getStatus());
        assertTrue(claim.isFiledWithCarrier());
        assertEquals("SF-1", claim.getCarrierClaimId());
        assertEquals("SF2025-000001", claim.getClaimNumber());
        assertEquals("received", claim.getCarrierStatus());
        assertEquals("Bob Smith", claim.getAdjuster().name());
        assertFalse(outcome.refiled());

        List<StatusHistoryEntry> history = store.stored(id).getStatusHistory();
        assertEquals(2, history.size());
        assertEquals(ClaimStatus.FILED, history.get(1).status());
        assertEquals("Filed with State Farm. Claim #SF2025-000001. Expected response by 2025-03-04. Adjuster: Bob Smith",
                history.get(1).note());
    }

    @Test
    public void testFile_requestTakesPolicyAndAddressFromCustomer() {
        Long id = pendingClaim("state-farm");

        service.file(id, hailCommand(), "dashboard");

        assertEquals("HO-123", stateFarm.lastRequest.policyNumber());
        assertEquals("Jane Homeowner", stateFarm.lastRequest.policyholderName());
        assertEquals("12 Elm St, Dallas, TX 75201", stateFarm.lastRequest.propertyAddress());
        assertEquals(0, new BigDecimal("12500.00").compareTo(stateFarm.lastRequest.initialEstimate()));
    }

    @Test
    public void testFile_unsupportedCarrierNeverReachesAdapter() {
        Long id = pendingClaim("allstate");

        assertThrows(UnsupportedCarrierOperationException.class, () -> service.file(id, hailCommand(), "dashboard"));

        assertEquals(0, allstate.fileCalls.get());
        assertEquals(ClaimStatus.PENDING, store.stored(id).getStatus());
    }

    @Test
    public void testFile_carrierRejectionLeavesClaimUntouched() {
        Long id = pendingClaim("state-farm");
        long version = store.stored(id).getVersion();
        stateFarm.onFile = request -> {
            throw new CarrierException("state-farm", "INVALID_POLICY", "Policy not found", false);
        };

        CarrierException ex = assertThrows(CarrierException.class, () -> service.file(id, hailCommand(), "dashboard"));

        assertEquals("INVALID_POLICY", ex.getCarrierErrorCode());
        InsuranceClaim stored = store.stored(id);
        assertEquals(ClaimStatus.PENDING, stored.getStatus());
        assertFalse(stored.isFiledWithCarrier());
        assertNull(stored.getCarrierClaimId());
        assertEquals(1, stored.getStatusHistory().size());
        assertEquals(version, stored.getVersion());
    }

    @Test
    public void testFile_twiceKeepsLatestIdsAndBothEntries() {
        Long id = pendingClaim("state-farm");

        service.file(id, hailCommand(), "dashboard");
        FilingOutcome second = service.file(id, hailCommand(), "dashboard");

        assertTrue(second.refiled());
        InsuranceClaim stored = store.stored(id);
        assertEquals(ClaimStatus.FILED, stored.getStatus());
        assertEquals("SF-2", stored.getCarrierClaimId());
        assertEquals(3, stored.getStatusHistory().size());
        assertTrue(stored.getStatusHistory().get(2).note().startsWith("Re-filed with State Farm"));
    }

    @Test
    public void testFile_afterCarrierProgressIsRejected() {
        Long id = pendingClaim("state-farm");
        service.file(id, hailCommand(), "dashboard");
        store.save(stateMachine.transition(store.load(id), ClaimStatus.ADJUSTER_ASSIGNED, "dashboard", null));

        assertThrows(InvalidTransitionException.class, () -> service.file(id, hailCommand(), "dashboard"));
        assertEquals(1, stateFarm.fileCalls.get());
    }

    @Test
    public void testFile_collectsValidationProblems() {
        Long id = pendingClaim("state-farm");
        when(photos.findByIds(any())).thenReturn(List.of(new Photo(31L, 8L, "https://cdn/p/31.jpg", "roof", null)));
        FileClaimCommand bad = new FileClaimCommand(null, null, " ", List.of(), false,
                new BigDecimal("-5"), List.of(30L, 31L));

        ValidationException ex = assertThrows(ValidationException.class, () -> service.file(id, bad, "dashboard"));

        assertTrue(ex.getMessage().contains("causeOfLoss is required"));
        assertTrue(ex.getMessage().contains("lossDescription is required"));
        assertTrue(ex.getMessage().contains("at least one damage area"));
        assertTrue(ex.getMessage().contains("emergencyRepairCost"));
        assertTrue(ex.getMessage().contains("photo 30 does not exist"));
        assertTrue(ex.getMessage().contains("photo 31 belongs to another customer"));
        assertEquals(0, stateFarm.fileCalls.get());
    }

    @Test
    public void testFile_nullEntriesAreValidationProblems() {
        Long id = pendingClaim("state-farm");
        FileClaimCommand bad = new FileClaimCommand(null, CauseOfLoss.HAIL, "Hail storm damaged the north slope",
                Arrays.asList(new DamageArea("roof", DamageSeverity.SEVERE, null), null), false, null,
                Arrays.asList((Long) null));

        ValidationException ex = assertThrows(ValidationException.class, () -> service.file(id, bad, "dashboard"));

        assertTrue(ex.getMessage().contains("damageAreas[1] needs a damageType and a severity"));
        assertTrue(ex.getMessage().contains("photoIds must not contain null"));
        assertEquals(0, stateFarm.fileCalls.get());
    }

    @Test
    public void testFile_timeoutLeavesClaimPending() {
        Long id = pendingClaim("state-farm");
        stateFarm.onFile = request -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        };

        assertThrows(CarrierTimeoutException.class, () -> service.file(id, hailCommand(), "dashboard"));
        assertEquals(ClaimStatus.PENDING, store.stored(id).getStatus());
    }

    @Test
    public void testFile_missingIdentifiersIsInvalidResponse() {
        Long id = pendingClaim("state-farm");
        stateFarm.onFile = request -> new FilingResult(null, null, null, null, null, null, null, null);

        CarrierException ex = assertThrows(CarrierException.class, () -> service.file(id, hailCommand(), "dashboard"));

        assertEquals("INVALID_RESPONSE", ex.getCarrierErrorCode());
        assertFalse(store.stored(id).isFiledWithCarrier());
    }
}
