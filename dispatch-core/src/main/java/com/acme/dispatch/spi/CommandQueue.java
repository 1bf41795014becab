package com.acme.dispatch.spi;

import java.util.Map;

/**
 * Point-to-point sender used to return command results to a reply queue
 */
public interface CommandQueue {

    /**
     * Send a text message. A {@code correlationId} header becomes the message correlation id; the
     * remaining headers are set as string properties.
     */
    void send(String queue, String body, Map<String, String> headers);
}
