package work.lcod.versioner.summary;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.versioner.manifest.UnitVersion;
import work.lcod.versioner.reconcile.UnitState;

/**
 * Terminal outcome of one unit. {@code newVersion} is present only for updated units.
 */
public record UnitResult(
    String id,
    UnitVersion oldVersion,
    Optional<UnitVersion> newVersion,
    UnitState state,
    List<String> notes
) {
    public UnitResult {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(oldVersion, "oldVersion");
        Objects.requireNonNull(newVersion, "newVersion");
        Objects.requireNonNull(state, "state");
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("unit " + id + " has no terminal outcome");
        }
        notes = List.copyOf(notes);
    }

    public static UnitResult skipped(String id, UnitVersion version, String note) {
        return new UnitResult(id, version, Optional.empty(), UnitState.SKIPPED, List.of(note));
    }

    public static UnitResult updated(String id, UnitVersion oldVersion, UnitVersion newVersion, List<String> notes) {
        return new UnitResult(id, oldVersion, Optional.of(newVersion), UnitState.UPDATED, notes);
    }

    public static UnitResult failed(String id, UnitVersion version, String note) {
        return new UnitResult(id, version, Optional.empty(), UnitState.FAILED, List.of(note));
    }

    public String toLine() {
        StringBuilder line = new StringBuilder()
            .append(id)
            .append(": ")
            .append(state.name().toLowerCase())
            .append(' ')
            .append(oldVersion);
        newVersion.ifPresent(version -> line.append(" → ").append(version));
        if (!notes.isEmpty()) {
            line.append(" (").append(String.join("; ", notes)).append(')');
        }
        return line.toString();
    }

    Map<String, Object> toSerializableMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", id);
        map.put("oldVersion", oldVersion.toString());
        map.put("newVersion", newVersion.map(UnitVersion::toString).orElse(null));
        map.put("outcome", state.name().toLowerCase());
        map.put("notes", notes);
        return map;
    }
}
