package de.conciso.genereconcile.service;

import java.nio.file.Path;

public class InputMissingException extends ReconciliationException {

    private final Path path;

    public InputMissingException(String message, Path path) {
        super(message + ": " + path);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }

    @Override
    public int getExitCode() {
        return 2;
    }
}
