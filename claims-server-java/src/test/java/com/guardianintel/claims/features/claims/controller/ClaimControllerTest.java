package com.guardianintel.claims.features.claims.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.guardianintel.claims.exception.CarrierException;
import com.guardianintel.claims.exception.ConcurrencyConflictException;
import com.guardianintel.claims.exception.GlobalExceptionHandler;
import com.guardianintel.claims.exception.InvalidTransitionException;
import com.guardianintel.claims.exception.InvariantViolationException;
import com.guardianintel.claims.exception.NotFoundException;
import com.guardianintel.claims.exception.UnsupportedCarrierOperationException;
import com.guardianintel.claims.features.claims.lifecycle.ClaimStateMachine;
import com.guardianintel.claims.features.claims.lifecycle.FinancialReconciler;
import com.guardianintel.claims.features.claims.model.ClaimStatus;
import com.guardianintel.claims.features.claims.model.ClaimType;
import com.guardianintel.claims.features.claims.model.InsuranceClaim;
import com.guardianintel.claims.features.claims.service.ClaimFilingService;
import com.guardianintel.claims.features.claims.service.ClaimService;
import com.guardianintel.claims.features.claims.service.ClaimStatsService;
import com.guardianintel.claims.features.claims.service.ClaimSyncService;
import com.guardianintel.claims.integration.carrier.CarrierCapabilityRegistry;
import com.guardianintel.claims.integration.carrier.CarrierProperties;

public class ClaimControllerTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    @Mock
    private ClaimService claimService;

    @Mock
    private ClaimFilingService filingService;

    @Mock
    private ClaimSyncService syncService;

    @Mock
    private ClaimStatsService statsService;

    private MockMvc mockMvc;

    @BeforeEach
    public void setup() {
        MockitoAnnotations.openMocks(this);
        CarrierCapabilityRegistry registry = new CarrierCapabilityRegistry(new CarrierProperties(), List.of());
        ClaimController controller = new ClaimController(claimService, filingService, syncService, statsService,
                new ClaimViewMapper(new FinancialReconciler(), registry));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static InsuranceClaim claimIn(ClaimStatus status) {
        ClaimStateMachine machine = new ClaimStateMachine(new FinancialReconciler(), Clock.fixed(NOW, ZoneOffset.UTC));
        InsuranceClaim claim = InsuranceClaim.open(7L, "usaa", ClaimType.ROOF, LocalDate.of(2025, 2, 20), NOW, "dashboard");
        claim.setId(42L);
        claim.setApprovedValue(new BigDecimal("18000"));
        claim.setAcv(new BigDecimal("16000"));
        return machine.advance(claim, status, "dashboard", null);
    }

    @Test
    public void testGet() throws Exception {
        when(claimService.get(42L)).thenReturn(claimIn(ClaimStatus.APPROVED));

        mockMvc.perform(get("/api/claims/42"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("approved"))
                .andExpect(jsonPath("$.financials.depreciation").value(2000))
                .andExpect(jsonPath("$.canFileWithCarrier").value(false))
                .andExpect(jsonPath("$.statusHistory.length()").value(2));
    }

    @Test
    public void testListByStatusCode() throws Exception {
        when(claimService.list(ClaimStatus.ADJUSTER_ASSIGNED, null)).thenReturn(List.of(claimIn(ClaimStatus.ADJUSTER_ASSIGNED)));

        mockMvc.perform(get("/api/claims").param("status", "adjuster-assigned"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].status").value("adjuster-assigned"));
    }

    @Test
    public void testCreateReturnsLocation() throws Exception {
        when(claimService.create(any(), eq("anonymous"))).thenReturn(claimIn(ClaimStatus.PENDING));

        mockMvc.perform(post("/api/claims")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"customerId\":7,\"claimType\":\"roof\",\"dateOfLoss\":\"2025-02-20\"}"))
                .andExpect(status().isCreated())
                .andExpect(header().string("Location", "/api/claims/42"));
    }

    @Test
    public void testInvalidTransitionIs409() throws Exception {
        when(claimService.transition(eq(42L), eq(ClaimStatus.PAID), any(), any()))
                .thenThrow(new InvalidTransitionException(ClaimStatus.FILED, ClaimStatus.PAID));

        mockMvc.perform(post("/api/claims/42/transitions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"paid\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error_code").value("INVALID_TRANSITION"));
    }

    @Test
    public void testErrorMapping() throws Exception {
        when(claimService.get(1L)).thenThrow(new NotFoundException("Claim", 1L));
        when(claimService.get(2L)).thenThrow(new InvariantViolationException("totalPaid exceeds"));
        when(claimService.get(3L)).thenThrow(new ConcurrencyConflictException(3L, "busy"));

        mockMvc.perform(get("/api/claims/1")).andExpect(status().isNotFound());
        mockMvc.perform(get("/api/claims/2")).andExpect(status().isUnprocessableEntity());
        mockMvc.perform(get("/api/claims/3"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.retryable").value(true));
        mockMvc.perform(get("/api/claims/abc")).andExpect(status().isBadRequest());
    }

    @Test
    public void testFilingErrors() throws Exception {
        when(filingService.file(eq(5L), any(), any()))
                .thenThrow(new UnsupportedCarrierOperationException("usaa", "direct filing"));
        when(filingService.file(eq(6L), any(), any()))
                .thenThrow(new CarrierException("state-farm", "INVALID_POLICY", "Policy not found", false));
        String body = "{\"causeOfLoss\":\"hail\",\"lossDescription\":\"hail\",\"damageAreas\":[{\"damageType\":\"roof\",\"severity\":\"severe\"}]}";

        mockMvc.perform(post("/api/claims/5/filing").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isUnprocessableEntity());
        mockMvc.perform(post("/api/claims/6/filing").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.carrier_error_code").value("INVALID_POLICY"))
                .andExpect(jsonPath("$.retryable").value(false));
    }

    @Test
    public void testDelete() throws Exception {
        mockMvc.perform(delete("/api/claims/42")).andExpect(status().isNoContent());

        verify(claimService).delete(42L, "anonymous");
    }
}
