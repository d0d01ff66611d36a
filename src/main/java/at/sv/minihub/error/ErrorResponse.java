package at.sv.minihub.error;

/**
 * The structured error a transport layer returns for a failed CRUD call.
 */
public record ErrorResponse(ErrorKind kind, String message) {

    public static ErrorResponse from(Throwable throwable) {
        if (throwable instanceof MiniHubException e) {
            return new ErrorResponse(e.getKind(), e.getMessage());
        }
        return new ErrorResponse(ErrorKind.INTERNAL, throwable.getMessage());
    }
}
