package tech.mediagateway.auth.store;

/**
 * Thrown when the credential store cannot be reached or does not answer
 * within the configured operation timeout.
 *
 * <p>Transient and permanent failures are not distinguished.
 */
public class CredentialStoreUnavailableException extends RuntimeException {

    private final String operation;

    public CredentialStoreUnavailableException(String operation, Throwable cause) {
        super("Credential store unavailable during " + operation, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
