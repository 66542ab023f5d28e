package io.intellixity.resref.error;

/**
 * Raised when the catalog itself is inconsistent (conflicting registrations, malformed schemas).\n
 *
 * Not expected during normal resolution; indicates a defect in what was registered.\n
 */
public class ResourceConfigurationException extends ResourceException {
  public ResourceConfigurationException(String message) {
    super(message);
  }

  public ResourceConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
