package de.conciso.genereconcile.service;

public class NoEvidenceFoundException extends ReconciliationException {

    public NoEvidenceFoundException(String message) {
        super(message);
    }

    @Override
    public int getExitCode() {
        return 4;
    }
}
