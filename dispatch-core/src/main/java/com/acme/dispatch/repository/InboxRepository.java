package com.acme.dispatch.repository;

import java.time.Instant;
import java.util.Optional;

/**
 * Keys of commands accepted over a transport that may redeliver. An entry is identified by the
 * command key together with the transport name, so the same key arriving over the queue and over
 * the stream counts twice.
 */
public interface InboxRepository {

  /**
   * Stores the entry unless it is already there. Of two concurrent calls for the same entry exactly
   * one returns {@code true}.
   */
  boolean recordIfAbsent(String commandKey, String transport, Instant receivedAt);

  Optional<Instant> receivedAt(String commandKey, String transport);
}
