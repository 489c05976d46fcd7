package utils;

import java.nio.file.Path;

// A source file could not be read or parsed; aborts the whole run
public class SourceParseException extends Exception {

    private final transient Path file;

    public SourceParseException(Path file, String message) {
        super(file + ": " + message);
        this.file = file;
    }

    public SourceParseException(Path file, String message, Throwable cause) {
        super(file + ": " + message, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
