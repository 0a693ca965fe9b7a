package com.example.sitemonitor.notification;

public class NotificationDeliveryException extends RuntimeException {

  private final String observer;

  public NotificationDeliveryException(String observer, String message) {
    super(message);
    this.observer = observer;
  }

  public NotificationDeliveryException(String observer, String message, Throwable cause) {
    super(message, cause);
    this.observer = observer;
  }

  public String observer() {
    return observer;
  }
}
