package com.flowmable.labreport;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown when a report file cannot be written. The target is left as it was.
 */
public class ReportWriteException extends IOException {

    private final Path path;

    public ReportWriteException(Path path, IOException cause) {
        super("Failed to write report " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    /** The file that was being written. */
    public Path getPath() {
        return path;
    }
}
