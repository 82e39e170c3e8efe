package dev.asclepius.failure;

/**
 * The persistent store is provisioned but could not be reached, even after the bounded retries
 * configured under {@code asclepius.store.retry.*}.
 */
public class StoreUnavailableException extends RuntimeException {

  private final Capability capability;

  public StoreUnavailableException(Capability capability, String message, Throwable cause) {
    super(message, cause);
    this.capability = capability;
  }

  public Capability getCapability() {
    return capability;
  }
}
