package at.sv.minihub.error;

/**
 * Exception to signal that the storage port could not persist or load data. Never swallowed for writes a caller
 * is waiting on.
 */
public final class StorageFailure extends MiniHubException {

    public StorageFailure(String message) {
        super(message);
    }

    public StorageFailure(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.STORAGE;
    }
}
