package com.acme.dispatch.config;

import com.acme.dispatch.bootstrap.DispatchApplication;
import com.acme.dispatch.command.HandlerRegistry;
import com.acme.dispatch.command.Transport;
import com.acme.dispatch.kafka.KafkaSettings;
import com.acme.dispatch.mq.JmsSettings;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.annotation.Value;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.runtime.server.event.ServerStartupEvent;
import jakarta.inject.Singleton;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs effective configuration and the handler registration table on startup. Disabled in test
 * environment.
 */
@Singleton
@Requires(notEnv = "test")
public class ConfigurationLogger implements ApplicationEventListener<ServerStartupEvent> {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLogger.class);

    private final DispatchProperties properties;
    private final KafkaSettings kafkaSettings;
    private final JmsSettings jmsSettings;
    private final DispatchApplication application;

    @Value("${micronaut.server.port:8080}")
    private int serverPort;

    @Value("${datasources.default.url:none}")
    private String datasourceUrl;

    @Value("${db.dialect:none}")
    private String dialect;

    public ConfigurationLogger(
            DispatchProperties properties,
            KafkaSettings kafkaSettings,
            JmsSettings jmsSettings,
            DispatchApplication application) {
        this.properties = properties;
        this.kafkaSettings = kafkaSettings;
        this.jmsSettings = jmsSettings;
        this.application = application;
    }

    @Override
    public void onApplicationEvent(ServerStartupEvent event) {
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
        LOG.info("                         EFFECTIVE CONFIGURATION                                ");
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
        LOG.info("");

        LOG.info("━━━ Server Configuration ━━━");
        LOG.info("  Environment:        {}", properties.getEnvironment());
        LOG.info("  Port:               {} (HTTP endpoint listening port)", serverPort);
        LOG.info("");

        LOG.info("━━━ Persistence Configuration ━━━");
        LOG.info("  Mode:               {}", properties.getPersistence().getMode());
        if (properties.getPersistence().isJdbc()) {
            LOG.info("  Dialect:            {}", dialect);
            LOG.info("  JDBC URL:           {}", datasourceUrl);
        }
        LOG.info("");

        LOG.info("━━━ Stream Transport (Kafka) ━━━");
        LOG.info("  Enabled:            {}", kafkaSettings.isEnabled());
        if (kafkaSettings.isEnabled()) {
            LOG.info("  Bootstrap Servers:  {}", kafkaSettings.getBootstrapServers());
            LOG.info("  Group Id:           {}", kafkaSettings.getGroupId());
            LOG.info("  Topic Mappings:     {}", kafkaSettings.topicOperations());
        }
        LOG.info("");

        LOG.info("━━━ Queue Transport (IBM MQ) ━━━");
        LOG.info("  Enabled:            {}", jmsSettings.isEnabled());
        if (jmsSettings.isEnabled()) {
            LOG.info("  Queue Manager:      {} at {}:{}",
                    jmsSettings.getQueueManager(), jmsSettings.getHost(), jmsSettings.getPort());
            LOG.info("  Reply Queue:        {}", jmsSettings.getReplyQueue());
        }
        LOG.info("");

        LOG.info("━━━ External Services ━━━");
        LOG.info("  Email Service:      {}", application.emailService().getClass().getSimpleName());
        LOG.info("  Payment Gateway:    {}", application.paymentGateway().getClass().getSimpleName());
        LOG.info("  Event Publisher:    {}", application.eventPublisher().getClass().getSimpleName());
        LOG.info("");

        LOG.info("━━━ Registered Handlers ━━━");
        HandlerRegistry registry = application.registry();
        for (String operation : registry.operations()) {
            Set<Transport> transports = registry.transports(operation);
            LOG.info("  {} {}", String.format("%-19s", operation + ":"), transports.stream()
                    .map(Transport::name)
                    .collect(Collectors.joining(", ")));
        }
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
    }
}
