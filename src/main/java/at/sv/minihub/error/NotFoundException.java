package at.sv.minihub.error;

public final class NotFoundException extends MiniHubException {

    public NotFoundException(String type, Object id) {
        super(type + " '" + id + "' not found");
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.NOT_FOUND;
    }
}
