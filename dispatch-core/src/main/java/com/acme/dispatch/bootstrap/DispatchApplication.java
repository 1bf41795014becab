package com.acme.dispatch.bootstrap;

import com.acme.dispatch.application.usecase.CreateUserUseCase;
import com.acme.dispatch.application.usecase.DeleteUserUseCase;
import com.acme.dispatch.application.usecase.ProcessPaymentUseCase;
import com.acme.dispatch.application.usecase.RefundPaymentUseCase;
import com.acme.dispatch.application.usecase.SendNotificationUseCase;
import com.acme.dispatch.application.usecase.UpdateUserUseCase;
import com.acme.dispatch.command.CommandDispatcher;
import com.acme.dispatch.command.HandlerRegistry;
import com.acme.dispatch.command.Operations;
import com.acme.dispatch.command.Transport;
import com.acme.dispatch.domain.repository.NotificationRepository;
import com.acme.dispatch.domain.repository.PaymentRepository;
import com.acme.dispatch.domain.repository.UserRepository;
import com.acme.dispatch.domain.service.UserDomainService;
import com.acme.dispatch.handler.http.HttpNotificationHandler;
import com.acme.dispatch.handler.http.HttpPaymentHandler;
import com.acme.dispatch.handler.http.HttpRefundPaymentHandler;
import com.acme.dispatch.handler.http.HttpUserHandler;
import com.acme.dispatch.handler.queue.QueuePaymentHandler;
import com.acme.dispatch.handler.queue.QueueUserHandler;
import com.acme.dispatch.handler.stream.StreamPaymentHandler;
import com.acme.dispatch.handler.stream.StreamUserHandler;
import com.acme.dispatch.infrastructure.external.LoggingEventPublisher;
import com.acme.dispatch.infrastructure.external.MockEmailService;
import com.acme.dispatch.infrastructure.external.MockPaymentGateway;
import com.acme.dispatch.infrastructure.memory.InMemoryInboxRepository;
import com.acme.dispatch.infrastructure.memory.InMemoryNotificationRepository;
import com.acme.dispatch.infrastructure.memory.InMemoryPaymentRepository;
import com.acme.dispatch.infrastructure.memory.InMemoryUserRepository;
import com.acme.dispatch.repository.InboxRepository;
import com.acme.dispatch.service.InboxServiceImpl;
import com.acme.dispatch.spi.EmailService;
import com.acme.dispatch.spi.EventPublisher;
import com.acme.dispatch.spi.InboxService;
import com.acme.dispatch.spi.PaymentGateway;

/**
 * Composition root. Owns the handler registry, the dispatcher and every bound port; transports
 * receive an instance of this record instead of reaching for global state.
 *
 * <p>Ports left unset on the {@link Builder} fall back to in-memory repositories, mock external
 * services and a logging event publisher.
 */
public record DispatchApplication(
    HandlerRegistry registry,
    CommandDispatcher dispatcher,
    UserRepository userRepository,
    PaymentRepository paymentRepository,
    NotificationRepository notificationRepository,
    InboxService inboxService,
    EventPublisher eventPublisher,
    EmailService emailService,
    PaymentGateway paymentGateway) {

  public static Builder builder() {
    return new Builder();
  }

  /** Application with every port at its default. */
  public static DispatchApplication inMemory() {
    return builder().build();
  }

  /**
   * The registration table: one factory per (operation, transport). Each factory closes over the
   * use cases it needs and builds a new handler per call.
   */
  static void registerHandlers(
      HandlerRegistry registry,
      CreateUserUseCase createUser,
      UpdateUserUseCase updateUser,
      DeleteUserUseCase deleteUser,
      ProcessPaymentUseCase processPayment,
      RefundPaymentUseCase refundPayment,
      SendNotificationUseCase sendNotification) {
    registry.register(
        Operations.CREATE_USER,
        Transport.HTTP,
        () -> new HttpUserHandler(Operations.CREATE_USER, createUser, updateUser, deleteUser));
    registry.register(
        Operations.UPDATE_USER,
        Transport.HTTP,
        () -> new HttpUserHandler(Operations.UPDATE_USER, createUser, updateUser, deleteUser));
    registry.register(
        Operations.DELETE_USER,
        Transport.HTTP,
        () -> new HttpUserHandler(Operations.DELETE_USER, createUser, updateUser, deleteUser));
    registry.register(Operations.CREATE_USER, Transport.QUEUE, () -> new QueueUserHandler(createUser));
    registry.register(
        Operations.CREATE_USER, Transport.STREAM, () -> new StreamUserHandler(createUser));

    registry.register(
        Operations.PROCESS_PAYMENT, Transport.HTTP, () -> new HttpPaymentHandler(processPayment));
    registry.register(
        Operations.PROCESS_PAYMENT, Transport.QUEUE, () -> new QueuePaymentHandler(processPayment));
    registry.register(
        Operations.PROCESS_PAYMENT,
        Transport.STREAM,
        () -> new StreamPaymentHandler(processPayment));
    registry.register(
        Operations.REFUND_PAYMENT,
        Transport.HTTP,
        () -> new HttpRefundPaymentHandler(refundPayment));

    registry.register(
        Operations.SEND_NOTIFICATION,
        Transport.HTTP,
        () -> new HttpNotificationHandler(sendNotification));
  }

  public static final class Builder {
    private UserRepository userRepository;
    private PaymentRepository paymentRepository;
    private NotificationRepository notificationRepository;
    private InboxRepository inboxRepository;
    private EventPublisher eventPublisher;
    private EmailService emailService;
    private PaymentGateway paymentGateway;

    private Builder() {}

    public Builder userRepository(UserRepository userRepository) {
      this.userRepository = userRepository;
      return this;
    }

    public Builder paymentRepository(PaymentRepository paymentRepository) {
      this.paymentRepository = paymentRepository;
      return this;
    }

    public Builder notificationRepository(NotificationRepository notificationRepository) {
      this.notificationRepository = notificationRepository;
      return this;
    }

    public Builder inboxRepository(InboxRepository inboxRepository) {
      this.inboxRepository = inboxRepository;
      return this;
    }

    public Builder eventPublisher(EventPublisher eventPublisher) {
      this.eventPublisher = eventPublisher;
      return this;
    }

    public Builder emailService(EmailService emailService) {
      this.emailService = emailService;
      return this;
    }

    public Builder paymentGateway(PaymentGateway paymentGateway) {
      this.paymentGateway = paymentGateway;
      return this;
    }

    public DispatchApplication build() {
      UserRepository users = userRepository != null ? userRepository : new InMemoryUserRepository();
      PaymentRepository payments =
          paymentRepository != null ? paymentRepository : new InMemoryPaymentRepository();
      NotificationRepository notifications =
          notificationRepository != null
              ? notificationRepository
              : new InMemoryNotificationRepository();
      InboxService inbox =
          new InboxServiceImpl(
              inboxRepository != null ? inboxRepository : new InMemoryInboxRepository());
      EventPublisher publisher =
          eventPublisher != null ? eventPublisher : new LoggingEventPublisher();
      EmailService email = emailService != null ? emailService : new MockEmailService();
      PaymentGateway gateway = paymentGateway != null ? paymentGateway : new MockPaymentGateway();

      HandlerRegistry registry = new HandlerRegistry();
      registerHandlers(
          registry,
          new CreateUserUseCase(users, notifications, new UserDomainService(users), publisher),
          new UpdateUserUseCase(users, publisher),
          new DeleteUserUseCase(users, publisher),
          new ProcessPaymentUseCase(users, payments, gateway, publisher),
          new RefundPaymentUseCase(payments, publisher),
          new SendNotificationUseCase(notifications, email, publisher));

      return new DispatchApplication(
          registry,
          new CommandDispatcher(registry, inbox),
          users,
          payments,
          notifications,
          inbox,
          publisher,
          email,
          gateway);
    }
  }
}
