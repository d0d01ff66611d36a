package at.sv.minihub.error;

/**
 * Exception to signal a protocol or connection failure inside an integration. Isolated to the failing integration.
 */
public final class IntegrationFailure extends MiniHubException {

    public IntegrationFailure(String message) {
        super(message);
    }

    public IntegrationFailure(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.INTEGRATION;
    }
}
