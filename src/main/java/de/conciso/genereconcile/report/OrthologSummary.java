package de.conciso.genereconcile.report;

import de.conciso.genereconcile.model.MappingDirection;
import de.conciso.genereconcile.model.OrthologPair;
import de.conciso.genereconcile.model.OrthologyIndex;

import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Abdeckung und Kardinalität eines Ortholog-Index gemessen an den Eingabesymbolen.
 */
public record OrthologSummary(
        int totalPairs,
        int duplicatesRemoved,
        Map<MappingDirection, Integer> pairsByDirection,
        int humanInput,
        int humanWithOrthologs,
        int humanInputCovered,
        int mouseInput,
        int mouseWithOrthologs,
        int mouseInputCovered,
        int humanWithMultipleMouse,
        int mouseWithMultipleHuman,
        int maxMousePerHuman,
        int maxHumanPerMouse
) {
    public static OrthologSummary of(OrthologyIndex index, Collection<String> humanSymbols,
                                     Collection<String> mouseSymbols) {
        Map<MappingDirection, Integer> byDirection = new EnumMap<>(MappingDirection.class);
        Map<String, Integer> mousePerHuman = new HashMap<>();
        Map<String, Integer> humanPerMouse = new HashMap<>();
        for (OrthologPair pair : index.pairs()) {
            byDirection.merge(pair.direction(), 1, Integer::sum);
            mousePerHuman.merge(pair.humanSymbol(), 1, Integer::sum);
            humanPerMouse.merge(pair.mouseSymbol(), 1, Integer::sum);
        }

        Set<String> humanUpper = humanSymbols.stream().map(s -> s.toUpperCase(Locale.ROOT)).collect(Collectors.toSet());
        Set<String> mouseInput = new HashSet<>(mouseSymbols);
        int humanCovered = (int) mousePerHuman.keySet().stream().filter(humanUpper::contains).count();
        int mouseCovered = (int) humanPerMouse.keySet().stream().filter(mouseInput::contains).count();

        return new OrthologSummary(
                index.pairs().size(),
                index.duplicatesRemoved(),
                byDirection,
                humanUpper.size(),
                mousePerHuman.size(),
                humanCovered,
                mouseInput.size(),
                humanPerMouse.size(),
                mouseCovered,
                (int) mousePerHuman.values().stream().filter(n -> n > 1).count(),
                (int) humanPerMouse.values().stream().filter(n -> n > 1).count(),
                mousePerHuman.values().stream().mapToInt(Integer::intValue).max().orElse(0),
                humanPerMouse.values().stream().mapToInt(Integer::intValue).max().orElse(0));
    }

    public double humanCoveragePercent() {
        return humanInput == 0 ? 0.0 : 100.0 * humanInputCovered / humanInput;
    }

    public double mouseCoveragePercent() {
        return mouseInput == 0 ? 0.0 : 100.0 * mouseInputCovered / mouseInput;
    }
}
