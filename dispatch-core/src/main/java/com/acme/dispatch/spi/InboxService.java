package com.acme.dispatch.spi;

/**
 * Remembers which queue and stream commands were already accepted. The dispatcher asks before
 * running a handler, with {@code operation:correlation_id} as the key.
 */
public interface InboxService {

  /**
   * @return true the first time a key is seen for the transport, false for every redelivery
   */
  boolean markIfAbsent(String commandKey, String transport);
}
