package com.acme.dispatch.domain.exception;

import com.acme.dispatch.core.ErrorCodes;

/** An entity invariant would be broken, typically an illegal status transition. */
public class BusinessRuleViolationException extends DomainException {
    private final String rule;

    public BusinessRuleViolationException(String rule, String details) {
        super(ErrorCodes.BUSINESS_RULE_VIOLATION, "Business rule violation: " + rule + " - " + details);
        this.rule = rule;
    }

    public String getRule() {
        return rule;
    }
}
