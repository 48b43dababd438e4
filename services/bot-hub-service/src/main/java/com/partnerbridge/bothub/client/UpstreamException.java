package com.partnerbridge.bothub.client;

/** A call to Telegram or to the back-office API failed or timed out. */
public class UpstreamException extends RuntimeException {

  public enum Kind {
    TIMEOUT,
    ERROR
  }

  private final Kind kind;
  private final String operation;

  public UpstreamException(Kind kind, String operation, String message) {
    super(operation + ": " + message);
    this.kind = kind;
    this.operation = operation;
  }

  public UpstreamException(Kind kind, String operation, String message, Throwable cause) {
    super(operation + ": " + message, cause);
    this.kind = kind;
    this.operation = operation;
  }

  public Kind getKind() {
    return kind;
  }

  public String getOperation() {
    return operation;
  }

  public boolean isTimeout() {
    return kind == Kind.TIMEOUT;
  }
}
