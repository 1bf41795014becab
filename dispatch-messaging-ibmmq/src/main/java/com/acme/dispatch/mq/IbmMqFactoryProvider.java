package com.acme.dispatch.mq;

import static com.ibm.msg.client.jakarta.jms.JmsConstants.*;
import static com.ibm.msg.client.jakarta.wmq.common.CommonConstants.*;

import com.ibm.mq.jakarta.jms.MQConnectionFactory;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import io.micronaut.jms.annotations.JMSConnectionFactory;
import jakarta.jms.ConnectionFactory;
import jakarta.jms.JMSException;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Factory
@Requires(property = "dispatch.jms.enabled", value = "true")
public class IbmMqFactoryProvider {

  @JMSConnectionFactory("mqConnectionFactory")
  public ConnectionFactory mqConnectionFactory(JmsSettings settings) throws JMSException {
    MQConnectionFactory cf = new MQConnectionFactory();
    cf.setTransportType(WMQ_CM_CLIENT);
    cf.setHostName(settings.getHost());
    cf.setPort(settings.getPort());
    cf.setQueueManager(settings.getQueueManager());
    cf.setChannel(settings.getChannel());
    cf.setAppName(settings.getAppName());
    cf.setBooleanProperty(USER_AUTHENTICATION_MQCSP, true);
    cf.setStringProperty(USERID, settings.getUser());
    cf.setStringProperty(PASSWORD, settings.getPassword());

    cf.setIntProperty(WMQ_CLIENT_RECONNECT_OPTIONS, WMQ_CLIENT_RECONNECT);
    // Lets listener and reply threads share one TCP conversation
    cf.setIntProperty(WMQ_SHARE_CONV_ALLOWED, WMQ_SHARE_CONV_ALLOWED_YES);

    log.info(
        "IBM MQ connection factory: {}({}) qmgr={} channel={}",
        settings.getHost(),
        settings.getPort(),
        settings.getQueueManager(),
        settings.getChannel());
    return cf;
  }
}
