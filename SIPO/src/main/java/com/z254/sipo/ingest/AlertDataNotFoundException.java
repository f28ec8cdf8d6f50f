package com.z254.sipo.ingest;

import java.nio.file.Path;

/**
 * The configured alert data file does not exist yet.
 */
public class AlertDataNotFoundException extends AlertIngestionException {

    private final Path path;

    public AlertDataNotFoundException(Path path) {
        super("Alerts data not found at " + path + ". Please generate alerts first.");
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
