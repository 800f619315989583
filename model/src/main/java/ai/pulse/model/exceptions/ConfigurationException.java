package ai.pulse.model.exceptions;

/**
 * Invalid workflow declaration: unknown dependency, cycle, bad option value.
 * Raised before any remote call is issued and never retried.
 */
public class ConfigurationException extends WorkflowException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
