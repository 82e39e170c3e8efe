package dev.asclepius.failure;

/**
 * Signals that a feature's backing data or service is not provisioned or cannot be reached (graph
 * tables never built, embedding service down, call timed out).
 *
 * <p>Callers recover locally: the tool layer reports {@code capability_unavailable} and the agent
 * loop keeps reasoning with whatever else it has. Distinct from {@link StoreUnavailableException},
 * which means the provisioned persistent store itself is down.
 */
public class CapabilityUnavailableException extends RuntimeException {

  private final Capability capability;

  public CapabilityUnavailableException(Capability capability, String message) {
    super(message);
    this.capability = capability;
  }

  public CapabilityUnavailableException(Capability capability, String message, Throwable cause) {
    super(message, cause);
    this.capability = capability;
  }

  public Capability getCapability() {
    return capability;
  }
}
