package com.guardianintel.claims.features.claims.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.ObjectMapper;

import com.guardianintel.claims.exception.CarrierException;
import com.guardianintel.claims.exception.InvalidTransitionException;
import com.guardianintel.claims.exception.InvariantViolationException;
import com.guardianintel.claims.exception.UnsupportedCarrierOperationException;
import com.guardianintel.claims.features.claims.lifecycle.ClaimStateMachine;
import com.guardianintel.claims.features.claims.lifecycle.FinancialReconciler;
import com.guardianintel.claims.features.claims.model.ClaimStatus;
import com.guardianintel.claims.features.claims.model.ClaimType;
import com.guardianintel.claims.features.claims.model.InsuranceClaim;
import com.guardianintel.claims.integration.carrier.AdjusterInfo;
import com.guardianintel.claims.integration.carrier.CarrierCapabilityRegistry;
import com.guardianintel.claims.integration.carrier.CarrierClaimStatus;
import com.guardianintel.claims.integration.carrier.CarrierProperties;
import com.guardianintel.claims.integration.carrier.CarrierStatusSnapshot;
import com.guardianintel.claims.integration.carrier.CarrierTestSupport;
import com.guardianintel.claims.integration.carrier.statefarm.StateFarmAdapter;

public class ClaimSyncServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    private ExecutorService executor;
    private InMemoryClaimStore store;
    private ClaimStateMachine stateMachine;
    private RecordingCarrierAdapter carrier;
    private RecordingCarrierAdapter farmers;
    private Clock clock;
    private CarrierCapabilityRegistry registry;
    private ClaimSyncService service;

    @BeforeEach
    public void setup() {
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
        stateMachine = new ClaimStateMachine(new FinancialReconciler(), clock);
        store = new InMemoryClaimStore();
        executor = Executors.newCachedThreadPool();
        carrier = new RecordingCarrierAdapter("state-farm");
        farmers = new RecordingCarrierAdapter("farmers");

        CarrierProperties.CarrierDefinition def = new CarrierProperties.CarrierDefinition();
        def.setDisplayName("State Farm");
        def.setDirectFiling(true);
        def.setStatusSync(true);
        CarrierProperties properties = new CarrierProperties();
        properties.getCarriers().put("state-farm", def);
        properties.getCarriers().put("farmers", CarrierTestSupport.definition("Farmers", true, false));

        registry = new CarrierCapabilityRegistry(properties, List.of(carrier, farmers));
        service = syncServiceFor(registry);
    }

    private ClaimSyncService syncServiceFor(CarrierCapabilityRegistry registry) {
        return new ClaimSyncService(store, new ClaimLockManager(Duration.ofSeconds(1)), stateMachine,
                new FinancialReconciler(), registry, new CarrierCallRunner(executor, Duration.ofMillis(300)), clock);
    }

    @AfterEach
    public void tearDown() {
        executor.shutdownNow();
    }

    private Long filedClaim() {
        return filedClaim("state-farm");
    }

    private Long filedClaim(String carrierCode) {
        InsuranceClaim claim = InsuranceClaim.open(7L, carrierCode, ClaimType.ROOF, LocalDate.of(2025, 2, 20), NOW, "dashboard");
        return store.save(stateMachine.recordFiling(claim, "SF-77", "SF2025-000077", "dashboard", "Filed with State Farm")).getId();
    }

    private static CarrierStatusSnapshot snapshot(String raw, CarrierClaimStatus status,
                                                  String rcv, String acv, String paid) {
        return new CarrierStatusSnapshot("SF-77", "SF2025-000077", raw, status, null,
                rcv != null ? new BigDecimal(rcv) : null,
                acv != null ? new BigDecimal(acv) : null,
                paid != null ? new BigDecimal(paid) : null,
                null, null, NOW);
    }

    @Test
    public void testSync_approvedAdvancesAndDerivesDepreciation() {
        Long id = filedClaim();
        carrier.onFetch = cid -> snapshot("APPROVED", CarrierClaimStatus.APPROVED, "18000", "16000", null);

        SyncOutcome outcome = service.sync(id, "dashboard");

        InsuranceClaim claim = outcome.claim();
        assertTrue(outcome.statusChanged());
        assertEquals(ClaimStatus.FILED, outcome.previousStatus());
        assertEquals(ClaimStatus.APPROVED, claim.getStatus());
        assertEquals(0, new BigDecimal("2000").compareTo(claim.getDepreciation()));
        assertEquals(3, claim.getStatusHistory().size());
        assertEquals("Carrier status: APPROVED", claim.getStatusHistory().get(2).note());
        assertEquals("APPROVED", claim.getCarrierStatus());
        assertEquals(NOW, claim.getCarrierLastSync());
    }

    @Test
    public void testSync_backwardsStatusIsAConflict() {
        Long id = filedClaim();
        carrier.onFetch = cid -> snapshot("APPROVED", CarrierClaimStatus.APPROVED, "18000", "16000", null);
        service.sync(id, "dashboard");
        carrier.onFetch = cid -> snapshot("RECEIVED", CarrierClaimStatus.RECEIVED, null, null, null);

        SyncOutcome outcome = service.sync(id, "dashboard");

        assertTrue(outcome.hasConflict());
        assertFalse(outcome.statusChanged());
        assertEquals(ClaimStatus.APPROVED, outcome.conflict().localStatus());
        assertEquals(ClaimStatus.FILED, outcome.conflict().carrierStatus());
        InsuranceClaim stored = store.stored(id);
        assertEquals(ClaimStatus.APPROVED, stored.getStatus());
        assertEquals(4, stored.getStatusHistory().size());
        assertTrue(stored.getStatusHistory().get(3).note().startsWith("Sync conflict"));
    }

    @Test
    public void testSync_unknownLabelRefreshesMoneyOnly() {
        Long id = filedClaim();
        carrier.onFetch = cid -> new CarrierStatusSnapshot("SF-77", null, "ESCALATED", null, null,
                new BigDecimal("9000"), null, null,
                new AdjusterInfo("Bob Smith", null, null, "State Farm", null), LocalDate.of(2025, 3, 9), NOW);

        SyncOutcome outcome = service.sync(id, "dashboard");

        assertEquals(ClaimStatus.FILED, outcome.claim().getStatus());
        assertEquals(2, outcome.claim().getStatusHistory().size());
        assertEquals(0, new BigDecimal("9000").compareTo(outcome.claim().getApprovedValue()));
        assertEquals("Bob Smith", outcome.claim().getAdjuster().name());
        assertEquals(LocalDate.of(2025, 3, 9), outcome.claim().getInspectionDate());
        assertEquals("ESCALATED", outcome.claim().getCarrierStatus());
    }

    @Test
    public void testSync_carrierErrorIsRecorded() {
        Long id = filedClaim();
        carrier.onFetch = cid -> {
            throw new CarrierException("state-farm", "HTTP_503", "Service unavailable", true);
        };

        assertThrows(CarrierException.class, () -> service.sync(id, "dashboard"));

        InsuranceClaim stored = store.stored(id);
        assertEquals(ClaimStatus.FILED, stored.getStatus());
        assertEquals("HTTP_503: Service unavailable", stored.getLastSyncError());
        assertEquals(NOW, stored.getCarrierLastSync());
    }

    @Test
    public void testSync_unexpectedAdapterFailureIsRecorded() {
        Long id = filedClaim();
        carrier.onFetch = cid -> {
            throw new IllegalStateException("socket closed");
        };

        CarrierException ex = assertThrows(CarrierException.class, () -> service.sync(id, "dashboard"));

        assertEquals("ADAPTER_FAILURE", ex.getCarrierErrorCode());
        InsuranceClaim stored = store.stored(id);
        assertEquals(NOW, stored.getCarrierLastSync());
        assertTrue(stored.getLastSyncError().startsWith("ADAPTER_FAILURE: "));
    }

    @Test
    public void testSync_unreadableStateFarmResponseIsRecorded() {
        RestClient.Builder builder = RestClient.builder().baseUrl("https://sf.test/v1/claims");
        MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
        server.expect(requestTo("https://sf.test/v1/claims/claims/SF-77/status"))
                .andRespond(withSuccess("<html><body>Down for maintenance</body></html>", MediaType.TEXT_HTML));
        StateFarmAdapter stateFarm = new StateFarmAdapter(builder.build(), new ObjectMapper(),
                CarrierTestSupport.properties("state-farm", "State Farm", true, true));
        CarrierProperties properties = CarrierTestSupport.properties("state-farm", "State Farm", true, true);
        ClaimSyncService realService = syncServiceFor(new CarrierCapabilityRegistry(properties, List.of(stateFarm)));
        Long id = filedClaim();

        CarrierException ex = assertThrows(CarrierException.class, () -> realService.sync(id, "dashboard"));

        assertEquals("INVALID_RESPONSE", ex.getCarrierErrorCode());
        InsuranceClaim stored = store.stored(id);
        assertEquals(NOW, stored.getCarrierLastSync());
        assertTrue(stored.getLastSyncError().startsWith("INVALID_RESPONSE: "));
        assertEquals(ClaimStatus.FILED, stored.getStatus());
        server.verify();
    }

    @Test
    public void testSync_carrierErrorSurvivesAFailedBookkeepingSave() {
        AtomicBoolean rejectSaves = new AtomicBoolean();
        store = new InMemoryClaimStore() {
            @Override
            public InsuranceClaim save(InsuranceClaim claim) {
                if (rejectSaves.get()) {
                    throw new DataIntegrityViolationException("value too long for last_sync_error");
                }
                return super.save(claim);
            }
        };
        ClaimSyncService rejecting = syncServiceFor(registry);
        Long id = filedClaim();
        rejectSaves.set(true);
        carrier.onFetch = cid -> {
            throw new CarrierException("state-farm", "HTTP_502", "x".repeat(4000), true);
        };

        CarrierException ex = assertThrows(CarrierException.class, () -> rejecting.sync(id, "dashboard"));

        assertEquals("HTTP_502", ex.getCarrierErrorCode());
        assertEquals(1, ex.getSuppressed().length);
        assertTrue(ex.getSuppressed()[0] instanceof DataIntegrityViolationException);
    }

    @Test
    public void testSync_unsupportedCarrierNeverReachesAdapter() {
        Long id = filedClaim("farmers");
        long version = store.stored(id).getVersion();

        assertThrows(UnsupportedCarrierOperationException.class, () -> service.sync(id, "dashboard"));

        assertEquals(0, farmers.fetchCalls.get());
        assertEquals(version, store.stored(id).getVersion());
        assertNull(store.stored(id).getCarrierLastSync());
    }

    @Test
    public void testSync_successClearsPreviousError() {
        Long id = filedClaim();
        carrier.onFetch = cid -> {
            throw new CarrierException("state-farm", "HTTP_503", "Service unavailable", true);
        };
        assertThrows(CarrierException.class, () -> service.sync(id, "dashboard"));
        carrier.onFetch = cid -> snapshot("RECEIVED", CarrierClaimStatus.RECEIVED, null, null, null);

        service.sync(id, "dashboard");

        assertNull(store.stored(id).getLastSyncError());
    }

    @Test
    public void testSync_timeoutOnlyTouchesLastSync() {
        Long id = filedClaim();
        carrier.onFetch = cid -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        };

        SyncOutcome outcome = service.sync(id, "dashboard");

        assertTrue(outcome.timedOut());
        assertNull(outcome.snapshot());
        InsuranceClaim stored = store.stored(id);
        assertEquals(ClaimStatus.FILED, stored.getStatus());
        assertNotNull(stored.getCarrierLastSync());
        assertNull(stored.getLastSyncError());
    }

    @Test
    public void testSync_brokenCarrierFiguresAreRejected() {
        Long id = filedClaim();
        carrier.onFetch = cid -> snapshot("APPROVED", CarrierClaimStatus.APPROVED, "10000", "12000", null);

        assertThrows(InvariantViolationException.class, () -> service.sync(id, "dashboard"));

        InsuranceClaim stored = store.stored(id);
        assertEquals(ClaimStatus.FILED, stored.getStatus());
        assertNull(stored.getApprovedValue());
        assertTrue(stored.getLastSyncError().startsWith("INVARIANT_VIOLATION"));
    }

    @Test
    public void testSync_neverFiledClaimIsRejected() {
        InsuranceClaim claim = InsuranceClaim.open(7L, "state-farm", ClaimType.ROOF, LocalDate.of(2025, 2, 20), NOW, "dashboard");
        Long id = store.save(claim).getId();

        assertThrows(InvalidTransitionException.class, () -> service.sync(id, "dashboard"));
        assertEquals(0, carrier.fetchCalls.get());
    }
}
