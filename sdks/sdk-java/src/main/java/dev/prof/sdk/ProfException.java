package dev.prof.sdk;

import java.util.List;

public class ProfException extends RuntimeException {
  public ProfException(String message) {
    super(message);
  }

  public ProfException(String message, Throwable cause) {
    super(message, cause);
  }

  public static class HttpException extends ProfException {
    public HttpException(String reason) {
      super("HTTP request failed: " + reason);
    }

    public HttpException(Throwable cause) {
      super("HTTP request failed: " + describe(cause), cause);
    }

    private static String describe(Throwable cause) {
      return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
    }
  }

  public static class SerializationException extends ProfException {
    public SerializationException(String message, Throwable cause) {
      super("Serialization error: " + message, cause);
    }
  }

  public static class ServiceException extends ProfException {
    private final String reason;

    public ServiceException(String reason) {
      super("Prof service error: " + reason);
      this.reason = reason;
    }

    public String getReason() {
      return reason;
    }
  }

  public static class AuthException extends ProfException {
    public AuthException(String reason) {
      super("Authentication failed: " + reason);
    }
  }

  public static class NotFoundException extends ProfException {
    private final String reason;

    public NotFoundException(String reason) {
      super("Not found: " + reason);
      this.reason = reason;
    }

    public String getReason() {
      return reason;
    }
  }

  public static class ValidationException extends ProfException {
    private final List<String> errors;

    public ValidationException(List<String> errors) {
      super("Validation failed: " + errors);
      this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
      return errors;
    }
  }
}
