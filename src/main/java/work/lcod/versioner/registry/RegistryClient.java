package work.lcod.versioner.registry;

import java.util.regex.Pattern;

/**
 * Looks up the version a unit currently has on the marketplace. Never throws: failures are
 * reported as {@link RegistryVersionRecord.Kind#UNKNOWN}.
 */
public interface RegistryClient {
    Pattern IDENTIFIER = Pattern.compile("^[A-Za-z0-9_-]+$");

    RegistryVersionRecord lookup(String publisherId, String unitId);

    static boolean isValidIdentifier(String value) {
        return value != null && IDENTIFIER.matcher(value).matches();
    }
}
