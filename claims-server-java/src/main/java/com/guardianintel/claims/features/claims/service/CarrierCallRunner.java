package com.guardianintel.claims.features.claims.service;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.guardianintel.claims.config.RequestIdFilter;
import com.guardianintel.claims.exception.CarrierException;
import com.guardianintel.claims.exception.CarrierTimeoutException;
import com.guardianintel.claims.exception.ClaimsException;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs one adapter call on the carrier executor and waits at most
 * {@code claims.carrier-call-timeout} for it. A call that does not finish in time,
 * or whose caller is interrupted, is cancelled and its worker interrupted.
 * Anything an adapter throws outside the {@link ClaimsException} family comes
 * back as a {@link CarrierException} with code {@code ADAPTER_FAILURE}.
 */
@Component
@Slf4j
public class CarrierCallRunner {

    private final ExecutorService executor;
    private final Duration timeout;

    public CarrierCallRunner(@Qualifier("carrierCallExecutor") ExecutorService executor,
                             @Value("${claims.carrier-call-timeout:20s}") Duration timeout) {
        this.executor = executor;
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }

    public <T> T call(String carrierCode, String operation, Supplier<T> call) {
        String traceId = MDC.get(RequestIdFilter.TRACE_ID);
        Future<T> future = executor.submit(() -> {
            if (traceId != null) {
                MDC.put(RequestIdFilter.TRACE_ID, traceId);
            }
            try {
                return call.get();
            } finally {
                MDC.remove(RequestIdFilter.TRACE_ID);
            }
        });

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[{}] {} timed out after {}ms", carrierCode, operation, timeout.toMillis());
            throw new CarrierTimeoutException(carrierCode, operation, timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CarrierException(carrierCode, "CANCELLED", operation + " was cancelled", true, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ClaimsException claimsException) {
                throw claimsException;
            }
            log.error("[{}] {} failed unexpectedly", carrierCode, operation, cause);
            throw new CarrierException(carrierCode, "ADAPTER_FAILURE", String.valueOf(cause), false, cause);
        }
    }
}
