package com.acme.dispatch.mq;

/**
 * IBM MQ connection and queue naming settings. Pure POJO - bound from {@code dispatch.jms.*} by the
 * service module.
 */
public class JmsSettings {

  public static final String CREATE_USER_QUEUE = "DISPATCH.CMD.CREATE_USER.Q";
  public static final String PROCESS_PAYMENT_QUEUE = "DISPATCH.CMD.PROCESS_PAYMENT.Q";

  private boolean enabled = false;
  private String host = "localhost";
  private int port = 1414;
  private String queueManager = "QM1";
  private String channel = "DEV.APP.SVRCONN";
  private String user = "app";
  private String password = "passw0rd";
  private String appName = "dispatch-platform";
  private String replyQueue = "DISPATCH.CMD.REPLY.Q";

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public String getHost() {
    return host;
  }

  public void setHost(String host) {
    this.host = host;
  }

  public int getPort() {
    return port;
  }

  public void setPort(int port) {
    this.port = port;
  }

  public String getQueueManager() {
    return queueManager;
  }

  public void setQueueManager(String queueManager) {
    this.queueManager = queueManager;
  }

  public String getChannel() {
    return channel;
  }

  public void setChannel(String channel) {
    this.channel = channel;
  }

  public String getUser() {
    return user;
  }

  public void setUser(String user) {
    this.user = user;
  }

  public String getPassword() {
    return password;
  }

  public void setPassword(String password) {
    this.password = password;
  }

  public String getAppName() {
    return appName;
  }

  public void setAppName(String appName) {
    this.appName = appName;
  }

  public String getReplyQueue() {
    return replyQueue;
  }

  public void setReplyQueue(String replyQueue) {
    this.replyQueue = replyQueue;
  }
}
