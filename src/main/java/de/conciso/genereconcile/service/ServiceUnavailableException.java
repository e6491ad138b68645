package de.conciso.genereconcile.service;

/**
 * Der Identifier-Service war gar nicht erreichbar und es entstand nichts Verwertbares.
 */
public class ServiceUnavailableException extends ReconciliationException {

    public ServiceUnavailableException(String message) {
        super(message);
    }

    @Override
    public int getExitCode() {
        return 3;
    }
}
