package work.lcod.versioner.registry;

import java.util.Map;

/**
 * Decodes the HTML entities the marketplace CLI sometimes emits in error payloads.
 * Unknown named entities are kept verbatim; malformed numeric references are rejected.
 */
final class HtmlEntities {
    private static final Map<String, String> NAMED = Map.of(
        "quot", "\"",
        "amp", "&",
        "lt", "<",
        "gt", ">",
        "apos", "'",
        "nbsp", " "
    );
    private static final int MAX_ENTITY_LENGTH = 12;

    private HtmlEntities() {}

    static String decode(String text) {
        if (text == null || text.indexOf('&') < 0) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            char ch = text.charAt(i);
            int semicolon = ch == '&' ? text.indexOf(';', i + 1) : -1;
            if (semicolon < 0 || semicolon - i - 1 > MAX_ENTITY_LENGTH) {
                out.append(ch);
                i++;
                continue;
            }
            String entity = text.substring(i + 1, semicolon);
            String replacement = entity.startsWith("#") ? numeric(entity) : NAMED.get(entity);
            if (replacement == null) {
                out.append(ch);
                i++;
                continue;
            }
            out.append(replacement);
            i = semicolon + 1;
        }
        return out.toString();
    }

    private static String numeric(String entity) {
        boolean hex = entity.length() > 1 && (entity.charAt(1) == 'x' || entity.charAt(1) == 'X');
        String digits = entity.substring(hex ? 2 : 1);
        if (digits.isEmpty()) {
            throw new IllegalArgumentException("Empty numeric character reference: &" + entity + ";");
        }
        int codePoint;
        try {
            codePoint = Integer.parseInt(digits, hex ? 16 : 10);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Malformed character reference: &" + entity + ";", ex);
        }
        if (!Character.isValidCodePoint(codePoint)) {
            throw new IllegalArgumentException("Character reference out of range: &" + entity + ";");
        }
        return new String(Character.toChars(codePoint));
    }
}
