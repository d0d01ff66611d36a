package at.sv.minihub.error;

/**
 * Malformed domain input. Always raised before any state has been changed.
 */
public class ValidationException extends MiniHubException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.VALIDATION;
    }
}
