package org.javai.accrue;

/**
 * One step on the path from the validation root to the value being validated.
 *
 * @param key The field name or key (e.g. "email", "items[0]"); empty when unnamed
 * @param type The expected type name (e.g. "string", "User"); empty when unknown
 * @param actual The value found at this step (may be null)
 */
public record ContextEntry(String key, String type, Object actual) {

    public ContextEntry {
        key = key == null ? "" : key;
        type = type == null ? "" : type;
    }

    public static ContextEntry of(String key, String type) {
        return new ContextEntry(key, type, null);
    }

    /**
     * The label this entry contributes to a rendered path: the key, or the type name
     * when the entry has no key.
     */
    public String label() {
        return key.isEmpty() ? type : key;
    }
}
