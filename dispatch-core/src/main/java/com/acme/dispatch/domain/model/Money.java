package com.acme.dispatch.domain.model;

import com.acme.dispatch.domain.exception.ValidationException;
import java.math.BigDecimal;
import java.util.regex.Pattern;

/** Value object representing a positive amount of money in one ISO-4217 currency */
public record Money(BigDecimal amount, String currency) {
    private static final Pattern CURRENCY = Pattern.compile("^[A-Z]{3}$");

    public Money {
        if (amount == null) {
            throw new ValidationException("Amount cannot be null", "amount");
        }
        if (amount.signum() <= 0) {
            throw new ValidationException("Amount must be positive", "amount");
        }
        if (currency == null || !CURRENCY.matcher(currency).matches()) {
            throw new ValidationException(
                    "Currency must be a 3-letter uppercase code: " + currency, "currency");
        }
    }

    public static Money of(BigDecimal amount, String currency) {
        return new Money(amount, currency);
    }

    public static Money of(String amount, String currency) {
        return new Money(new BigDecimal(amount), currency);
    }

    public Money add(Money other) {
        if (!this.currency.equals(other.currency)) {
            throw new ValidationException(
                    "Cannot add money with different currencies: "
                            + this.currency
                            + " vs "
                            + other.currency,
                    "currency");
        }
        return new Money(this.amount.add(other.amount), this.currency);
    }
}
