package com.acme.dispatch.command;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry for command handlers - maps (operation, transport) pairs to handler factories. Pure POJO
 * - no framework dependencies.
 *
 * <p>Every {@link #resolve} call builds a new handler from its factory. Registration may happen at
 * any time; the map is guarded by a read-write lock.
 */
public class HandlerRegistry {
  private static final Logger log = LoggerFactory.getLogger(HandlerRegistry.class);

  private final Map<String, Map<Transport, Supplier<? extends CommandHandler>>> handlers =
      new HashMap<>();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  /** Register a handler factory. A prior registration for the same pair is replaced. */
  public void register(
      String operation, Transport transport, Supplier<? extends CommandHandler> factory) {
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(transport, "transport");
    Objects.requireNonNull(factory, "factory");

    lock.writeLock().lock();
    try {
      Supplier<? extends CommandHandler> previous =
          handlers
              .computeIfAbsent(operation, op -> new EnumMap<>(Transport.class))
              .put(transport, factory);
      if (previous != null) {
        log.info("Replacing handler for operation: {} transport: {}", operation, transport);
      } else {
        log.info("Registering handler for operation: {} transport: {}", operation, transport);
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Build a fresh handler for the pair.
   *
   * @throws HandlerNotFoundException if nothing is registered for the operation
   * @throws TransportNotSupportedException if the operation is registered, but not for the transport
   */
  public CommandHandler resolve(String operation, Transport transport) {
    Supplier<? extends CommandHandler> factory;
    lock.readLock().lock();
    try {
      Map<Transport, Supplier<? extends CommandHandler>> byTransport = handlers.get(operation);
      if (byTransport == null || byTransport.isEmpty()) {
        throw new HandlerNotFoundException(operation);
      }
      factory = byTransport.get(transport);
      if (factory == null) {
        throw new TransportNotSupportedException(
            operation, transport, EnumSet.copyOf(byTransport.keySet()));
      }
    } finally {
      lock.readLock().unlock();
    }
    return factory.get();
  }

  public boolean isRegistered(String operation, Transport transport) {
    lock.readLock().lock();
    try {
      Map<Transport, Supplier<? extends CommandHandler>> byTransport = handlers.get(operation);
      return byTransport != null && byTransport.containsKey(transport);
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Registered operation names, sorted. */
  public Set<String> operations() {
    lock.readLock().lock();
    try {
      return Collections.unmodifiableSet(new TreeSet<>(handlers.keySet()));
    } finally {
      lock.readLock().unlock();
    }
  }

  public Set<Transport> transports(String operation) {
    lock.readLock().lock();
    try {
      Map<Transport, Supplier<? extends CommandHandler>> byTransport = handlers.get(operation);
      return byTransport == null || byTransport.isEmpty()
          ? Collections.emptySet()
          : Collections.unmodifiableSet(EnumSet.copyOf(byTransport.keySet()));
    } finally {
      lock.readLock().unlock();
    }
  }
}
