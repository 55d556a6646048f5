package com.guardianintel.claims.aspect;

import java.time.Duration;
import java.time.Instant;

import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import com.guardianintel.claims.exception.ClaimsException;

import lombok.extern.slf4j.Slf4j;

@Aspect
@Component
@Slf4j
public class ClaimAuditAspect {

    // Claim mutations in the service layer
    @Around("@annotation(audited)")
    public Object auditClaimOperation(ProceedingJoinPoint joinPoint, AuditedClaimOperation audited) throws Throwable {
        return audit(joinPoint, audited.value());
    }

    // Assistant-facing tools
    @Around("@annotation(org.springaicommunity.mcp.annotation.McpTool)")
    public Object auditToolCall(ProceedingJoinPoint joinPoint) throws Throwable {
        return audit(joinPoint, "tool:" + joinPoint.getSignature().getName());
    }

    private Object audit(ProceedingJoinPoint joinPoint, String action) throws Throwable {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        String user = (auth != null) ? auth.getName() : "system";
        Object claimId = claimId(joinPoint.getArgs());

        log.info("[AUDIT START] User='{}' Action='{}' Claim={}", user, action, claimId);

        Instant start = Instant.now();
        try {
            Object result = joinPoint.proceed();
            log.info("[AUDIT SUCCESS] User='{}' Action='{}' Claim={} Time={}ms",
                    user, action, claimId, Duration.between(start, Instant.now()).toMillis());
            return result;
        } catch (Throwable ex) {
            String code = ex instanceof ClaimsException ce ? ce.getErrorCode() : ex.getClass().getSimpleName();
            log.error("[AUDIT FAILURE] User='{}' Action='{}' Claim={} Code={} Error='{}' Time={}ms",
                    user, action, claimId, code, ex.getMessage(), Duration.between(start, Instant.now()).toMillis());
            throw ex;
        }
    }

    private static Object claimId(Object[] args) {
        for (Object arg : args) {
            if (arg instanceof Long) {
                return arg;
            }
        }
        return "-";
    }
}
