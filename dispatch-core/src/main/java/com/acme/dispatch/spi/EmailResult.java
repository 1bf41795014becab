package com.acme.dispatch.spi;

/** Outcome of an email send: a provider message id on success, an error text otherwise. */
public record EmailResult(boolean success, String messageId, String error) {

    public static EmailResult sent(String messageId) {
        return new EmailResult(true, messageId, null);
    }

    public static EmailResult failed(String error) {
        return new EmailResult(false, null, error);
    }
}
