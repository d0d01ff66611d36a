package at.sv.minihub.error;

public enum ErrorKind {
    VALIDATION,
    NOT_FOUND,
    STORAGE,
    INTEGRATION,
    INTERNAL
}
