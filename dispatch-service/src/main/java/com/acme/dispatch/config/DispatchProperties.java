package com.acme.dispatch.config;

import io.micronaut.context.annotation.ConfigurationProperties;

/** Settings under {@code dispatch.*} that choose the bound adapters. */
@ConfigurationProperties("dispatch")
public class DispatchProperties {

  public static final String PERSISTENCE_MEMORY = "memory";
  public static final String PERSISTENCE_JDBC = "jdbc";

  private String environment = "development";
  private Persistence persistence = new Persistence();
  private Email email = new Email();
  private PaymentGateway paymentGateway = new PaymentGateway();

  public String getEnvironment() {
    return environment;
  }

  public void setEnvironment(String environment) {
    this.environment = environment;
  }

  public Persistence getPersistence() {
    return persistence;
  }

  public void setPersistence(Persistence persistence) {
    this.persistence = persistence;
  }

  public Email getEmail() {
    return email;
  }

  public void setEmail(Email email) {
    this.email = email;
  }

  public PaymentGateway getPaymentGateway() {
    return paymentGateway;
  }

  public void setPaymentGateway(PaymentGateway paymentGateway) {
    this.paymentGateway = paymentGateway;
  }

  @ConfigurationProperties("persistence")
  public static class Persistence {
    /** {@code memory} or {@code jdbc} */
    private String mode = PERSISTENCE_MEMORY;

    public String getMode() {
      return mode;
    }

    public void setMode(String mode) {
      this.mode = mode;
    }

    public boolean isJdbc() {
      return PERSISTENCE_JDBC.equalsIgnoreCase(mode);
    }
  }

  @ConfigurationProperties("email")
  public static class Email {
    private String apiKey = "mock_key";
    private double outageRate = 0.0;

    public String getApiKey() {
      return apiKey;
    }

    public void setApiKey(String apiKey) {
      this.apiKey = apiKey;
    }

    public double getOutageRate() {
      return outageRate;
    }

    public void setOutageRate(double outageRate) {
      this.outageRate = outageRate;
    }
  }

  @ConfigurationProperties("payment-gateway")
  public static class PaymentGateway {
    private String apiKey = "mock_key";
    private String url;
    private double declineRate = 0.0;

    public String getApiKey() {
      return apiKey;
    }

    public void setApiKey(String apiKey) {
      this.apiKey = apiKey;
    }

    public String getUrl() {
      return url;
    }

    public void setUrl(String url) {
      this.url = url;
    }

    public double getDeclineRate() {
      return declineRate;
    }

    public void setDeclineRate(double declineRate) {
      this.declineRate = declineRate;
    }
  }
}
