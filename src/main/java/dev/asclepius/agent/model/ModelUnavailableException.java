package dev.asclepius.agent.model;

/** Thrown when the decision model cannot produce a usable decision. */
public class ModelUnavailableException extends RuntimeException {

  public ModelUnavailableException(String message) {
    super(message);
  }

  public ModelUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
