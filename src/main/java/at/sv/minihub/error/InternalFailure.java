package at.sv.minihub.error;

public final class InternalFailure extends MiniHubException {

    public InternalFailure(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.INTERNAL;
    }
}
