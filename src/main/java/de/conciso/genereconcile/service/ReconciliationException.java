package de.conciso.genereconcile.service;

import org.springframework.boot.ExitCodeGenerator;

/**
 * Fataler Pipeline-Zustand. Spring Boot übernimmt den Exit-Code, wenn die Exception
 * aus einem Runner herausläuft.
 */
public abstract class ReconciliationException extends RuntimeException implements ExitCodeGenerator {

    protected ReconciliationException(String message) {
        super(message);
    }
}
