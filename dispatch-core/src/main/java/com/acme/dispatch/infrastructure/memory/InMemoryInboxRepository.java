package com.acme.dispatch.infrastructure.memory;

import com.acme.dispatch.repository.InboxRepository;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryInboxRepository implements InboxRepository {
  private final Map<Entry, Instant> entries = new ConcurrentHashMap<>();

  @Override
  public boolean recordIfAbsent(String commandKey, String transport, Instant receivedAt) {
    return entries.putIfAbsent(new Entry(commandKey, transport), receivedAt) == null;
  }

  @Override
  public Optional<Instant> receivedAt(String commandKey, String transport) {
    return Optional.ofNullable(entries.get(new Entry(commandKey, transport)));
  }

  private record Entry(String commandKey, String transport) {}
}
