package com.guardianintel.claims.aspect;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a claim mutation for the audit log. The first {@code Long} argument, if
 * any, is logged as the claim id.
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface AuditedClaimOperation {

    /** Action name written to the audit log, e.g. "transition". */
    String value();
}
