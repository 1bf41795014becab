package com.acme.dispatch.config;

import com.acme.dispatch.bootstrap.DispatchApplication;
import com.acme.dispatch.command.CommandDispatcher;
import com.acme.dispatch.domain.repository.NotificationRepository;
import com.acme.dispatch.domain.repository.PaymentRepository;
import com.acme.dispatch.domain.repository.UserRepository;
import com.acme.dispatch.infrastructure.external.MockEmailService;
import com.acme.dispatch.infrastructure.external.MockPaymentGateway;
import com.acme.dispatch.kafka.KafkaSettings;
import com.acme.dispatch.mq.JmsSettings;
import com.acme.dispatch.repository.InboxRepository;
import com.acme.dispatch.spi.EmailService;
import com.acme.dispatch.spi.EventPublisher;
import com.acme.dispatch.spi.PaymentGateway;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import io.micronaut.core.annotation.Nullable;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

/**
 * Binds the framework-free core to Micronaut. The core builds its own object graph through {@link
 * DispatchApplication}; this factory only decides which adapters get plugged in.
 *
 * <p>JDBC repositories exist as beans only when {@code db.dialect} is set, and the Kafka publisher
 * only when {@code dispatch.kafka.enabled=true}. Missing ports fall back to the in-memory defaults.
 */
@Slf4j
@Factory
public class CoreBeansFactory {

  /** Creates KafkaSettings bean populated from application.yml dispatch.kafka.* properties */
  @Singleton
  @ConfigurationProperties("dispatch.kafka")
  public KafkaSettings kafkaSettings() {
    return new KafkaSettings();
  }

  /** Creates JmsSettings bean populated from application.yml dispatch.jms.* properties */
  @Singleton
  @ConfigurationProperties("dispatch.jms")
  public JmsSettings jmsSettings() {
    return new JmsSettings();
  }

  @Singleton
  public DispatchApplication dispatchApplication(
      DispatchProperties properties,
      @Nullable UserRepository userRepository,
      @Nullable PaymentRepository paymentRepository,
      @Nullable NotificationRepository notificationRepository,
      @Nullable InboxRepository inboxRepository,
      @Nullable EventPublisher eventPublisher) {
    DispatchApplication.Builder builder = DispatchApplication.builder();

    if (properties.getPersistence().isJdbc()) {
      if (userRepository == null
          || paymentRepository == null
          || notificationRepository == null
          || inboxRepository == null) {
        throw new IllegalStateException(
            "dispatch.persistence.mode=jdbc requires db.dialect (H2 or PostgreSQL) and a datasource");
      }
      builder
          .userRepository(userRepository)
          .paymentRepository(paymentRepository)
          .notificationRepository(notificationRepository)
          .inboxRepository(inboxRepository);
      log.info("Using JDBC repositories: {}", userRepository.getClass().getSimpleName());
    } else {
      log.info("Using in-memory repositories");
    }

    if (eventPublisher != null) {
      builder.eventPublisher(eventPublisher);
    }

    return builder
        .emailService(emailService(properties.getEmail()))
        .paymentGateway(paymentGateway(properties.getPaymentGateway()))
        .build();
  }

  /** The dispatcher shared by the HTTP controllers and the queue and stream consumers */
  @Singleton
  public CommandDispatcher commandDispatcher(DispatchApplication application) {
    return application.dispatcher();
  }

  static EmailService emailService(DispatchProperties.Email email) {
    if (!MockPaymentGateway.MOCK_API_KEY.equals(email.getApiKey())) {
      log.warn("No email provider integration available, using mock email service");
    }
    return email.getOutageRate() > 0
        ? new MockEmailService(email.getOutageRate(), Math::random)
        : new MockEmailService();
  }

  static PaymentGateway paymentGateway(DispatchProperties.PaymentGateway gateway) {
    if (!MockPaymentGateway.MOCK_API_KEY.equals(gateway.getApiKey())) {
      log.warn(
          "No payment gateway integration available for {}, using mock gateway", gateway.getUrl());
    }
    return gateway.getDeclineRate() > 0
        ? new MockPaymentGateway(gateway.getDeclineRate(), Math::random)
        : new MockPaymentGateway();
  }
}
