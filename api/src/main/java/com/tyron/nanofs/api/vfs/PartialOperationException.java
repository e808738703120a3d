package com.tyron.nanofs.api.vfs;

/**
 * A recursive structural operation failed after part of the work was done.
 * <p>
 * Nothing is rolled back. {@link #getPathname()} is the first child that failed and
 * {@link #getCause()} the failure it raised.
 */
public class PartialOperationException extends FilesystemException {

    private final String operation;
    private final int completed;

    public PartialOperationException(String operation, Pathname failed, int completed, FilesystemException cause) {
        super(Kind.PARTIAL_OPERATION, failed,
                operation + " only partially completed (" + completed + " entries done), failed at " + failed
                        + ": " + cause.getMessage(),
                cause);
        this.operation = operation;
        this.completed = completed;
    }

    public String getOperation() {
        return operation;
    }

    /**
     * @return number of entries processed before the failure.
     */
    public int getCompleted() {
        return completed;
    }

    @Override
    public synchronized FilesystemException getCause() {
        return (FilesystemException) super.getCause();
    }
}
