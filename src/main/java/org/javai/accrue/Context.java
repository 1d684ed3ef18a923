package org.javai.accrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The path from the validation root to the value currently being validated.
 *
 * <p>A context is immutable. Validators descending into a nested structure
 * {@link #push(ContextEntry) push} an entry and hand the extended context to the nested
 * validator; the outer context is unaffected. Errors capture the context that was current
 * when they were produced.
 *
 * <pre>{@code
 * Context ctx = Context.empty()
 *     .push("user", "User", user)
 *     .push("address", "Address", user.address())
 *     .push("zipCode", "string", zip);
 * ctx.path(); // "user.address.zipCode"
 * }</pre>
 */
public final class Context {

    private static final Context EMPTY = new Context(List.of());

    private final List<ContextEntry> entries;

    private Context(List<ContextEntry> entries) {
        this.entries = entries;
    }

    public static Context empty() {
        return EMPTY;
    }

    public static Context of(ContextEntry... entries) {
        return of(Arrays.asList(entries));
    }

    public static Context of(List<ContextEntry> entries) {
        Objects.requireNonNull(entries, "entries must not be null");
        if (entries.isEmpty()) {
            return EMPTY;
        }
        return new Context(List.copyOf(entries));
    }

    /**
     * Returns a new context with the entry appended.
     */
    public Context push(ContextEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        List<ContextEntry> extended = new ArrayList<>(entries.size() + 1);
        extended.addAll(entries);
        extended.add(entry);
        return new Context(Collections.unmodifiableList(extended));
    }

    public Context push(String key, String type, Object actual) {
        return push(new ContextEntry(key, type, actual));
    }

    public List<ContextEntry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Renders the context as a dotted path, e.g. {@code user.address.zipCode}.
     * Returns an empty string for the root context.
     */
    public String path() {
        return entries.stream()
                .map(ContextEntry::label)
                .collect(Collectors.joining("."));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Context)) {
            return false;
        }
        return entries.equals(((Context) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "Context[" + path() + "]";
    }
}
