package com.exo.steel.application.port;

/**
 * Failure reported by a remote collaborator (PIN delivery, verification or profile storage).
 *
 * <p>The orchestrator surfaces every instance as a network error regardless of {@link #operation()}.</p>
 *
 * @since 0.1.0
 */
public class CollaboratorException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String operation;

  /**
   * @param operation collaborator call that failed, e.g. {@code sendPin}
   * @param message failure description
   */
  public CollaboratorException(String operation, String message) {
    super(operation + ": " + message);
    this.operation = operation;
  }

  /**
   * @param operation collaborator call that failed
   * @param message failure description
   * @param cause underlying error
   */
  public CollaboratorException(String operation, String message, Throwable cause) {
    super(operation + ": " + message, cause);
    this.operation = operation;
  }

  /**
   * @return name of the failed collaborator call
   */
  public String operation() {
    return operation;
  }
}
