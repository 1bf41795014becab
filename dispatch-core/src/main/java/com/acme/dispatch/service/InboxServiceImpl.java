package com.acme.dispatch.service;

import com.acme.dispatch.repository.InboxRepository;
import com.acme.dispatch.spi.InboxService;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class InboxServiceImpl implements InboxService {
  private static final Logger log = LoggerFactory.getLogger(InboxServiceImpl.class);

  private final InboxRepository repository;
  private final Clock clock;

  public InboxServiceImpl(InboxRepository repository) {
    this(repository, Clock.systemUTC());
  }

  public InboxServiceImpl(InboxRepository repository, Clock clock) {
    this.repository = repository;
    this.clock = clock;
  }

  @Override
  public boolean markIfAbsent(String commandKey, String transport) {
    if (repository.recordIfAbsent(commandKey, transport, clock.instant())) {
      return true;
    }
    log.info(
        "Redelivered command {} over {} (first received at {})",
        commandKey,
        transport,
        repository.receivedAt(commandKey, transport).map(Object::toString).orElse("unknown"));
    return false;
  }
}
