package com.tyron.nanofs.api.vfs;

/**
 * A raw path string could not be turned into a {@link Pathname}, or a path operation
 * would ascend above the root.
 */
public class InvalidPathnameException extends FilesystemException {

    private final String input;

    public InvalidPathnameException(String input, String reason) {
        super(Kind.INVALID_PATH, null, "Invalid pathname '" + input + "': " + reason);
        this.input = input;
    }

    /**
     * @return the raw string that was rejected.
     */
    public String getInput() {
        return input;
    }
}
