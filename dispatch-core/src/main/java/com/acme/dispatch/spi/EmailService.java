package com.acme.dispatch.spi;

import java.util.Map;

public interface EmailService {
    /**
     * Send one email.
     *
     * @param templateId optional provider template, may be null
     * @param variables optional template variables, may be null
     */
    EmailResult send(
            String recipient,
            String subject,
            String body,
            String templateId,
            Map<String, Object> variables);
}
