package de.conciso.genereconcile.runner;

import de.conciso.genereconcile.service.GeneSetAcquisitionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Aktiv bei {@code genereconciler.mode=acquire}. Lädt die konfigurierten Gen-Set-Bibliotheken
 * und schreibt je Quelle eine Roh-CSV.
 */
@Component
@ConditionalOnProperty(name = "genereconciler.mode", havingValue = "acquire")
public class AcquisitionRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(AcquisitionRunner.class);

    private final GeneSetAcquisitionService acquisitionService;

    public AcquisitionRunner(GeneSetAcquisitionService acquisitionService) {
        this.acquisitionService = acquisitionService;
    }

    @Override
    public void run(String... args) throws Exception {
        Map<String, Integer> written = acquisitionService.acquire();
        if (written.isEmpty()) {
            log.warn("No gene-set source produced any rows");
            return;
        }
        System.out.println();
        System.out.println("=== Gen-Set-Download ===");
        written.forEach((label, n) -> System.out.printf("  %-20s %6d Gene%n", label, n));
        System.out.println();
    }
}
