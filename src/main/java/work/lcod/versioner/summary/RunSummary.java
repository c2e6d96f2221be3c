package work.lcod.versioner.summary;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import work.lcod.versioner.reconcile.UnitState;

/**
 * Aggregated outcome of a run, consumed by the invoking pipeline.
 */
public record RunSummary(
    List<UnitResult> units,
    int counterBefore,
    int counterAfter,
    boolean aborted,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public RunSummary {
        units = List.copyOf(units);
        Objects.requireNonNull(startedAt, "startedAt");
        Objects.requireNonNull(finishedAt, "finishedAt");
    }

    public Map<UnitState, Long> counts() {
        Map<UnitState, Long> counts = new EnumMap<>(UnitState.class);
        counts.put(UnitState.UPDATED, 0L);
        counts.put(UnitState.SKIPPED, 0L);
        counts.put(UnitState.FAILED, 0L);
        counts.putAll(units.stream().collect(Collectors.groupingBy(UnitResult::state, Collectors.counting())));
        return counts;
    }

    public long count(UnitState state) {
        return counts().getOrDefault(state, 0L);
    }

    /**
     * One line per unit followed by the aggregate line.
     */
    public List<String> toLines() {
        List<String> lines = new ArrayList<>();
        for (UnitResult unit : units) {
            lines.add(unit.toLine());
        }
        lines.add(String.format(
            "%s: %d updated, %d skipped, %d failed (counter %d → %d)",
            aborted ? "Aborted" : "Done",
            count(UnitState.UPDATED),
            count(UnitState.SKIPPED),
            count(UnitState.FAILED),
            counterBefore,
            counterAfter
        ));
        return lines;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> totals = new LinkedHashMap<>();
        counts().forEach((state, count) -> totals.put(state.name().toLowerCase(), count));

        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", aborted ? "aborted" : "ok");
        serializable.put("counts", totals);
        serializable.put("counterBefore", counterBefore);
        serializable.put("counterAfter", counterAfter);
        serializable.put("units", units.stream().map(UnitResult::toSerializableMap).collect(Collectors.toList()));
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() throws JsonProcessingException {
        return WRITER.writeValueAsString(toSerializableMap());
    }
}
