package at.sv.minihub.error;

/**
 * Base of all failures surfaced by the hub core. The {@link ErrorKind} is what a transport layer reports back
 * to its caller.
 */
public abstract class MiniHubException extends RuntimeException {

    protected MiniHubException(String message) {
        super(message);
    }

    protected MiniHubException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind getKind();
}
