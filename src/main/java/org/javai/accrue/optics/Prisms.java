package org.javai.accrue.optics;

import org.javai.accrue.Option;
import org.javai.accrue.Result;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stock prisms for common parsing and unwrapping tasks.
 *
 * <p>The parsing prisms match strings that parse and render the parsed value back with its
 * canonical string form, so {@code reverseGet} does not restore formatting such as a
 * leading {@code +} or leading zeros.
 */
public final class Prisms {

    private Prisms() {}

    public static Prism<String, Integer> parseInt() {
        return Prism.of(Prisms::tryParseInt, i -> Integer.toString(i), "PrismParseInt");
    }

    public static Prism<String, Long> parseLong() {
        return Prism.of(Prisms::tryParseLong, l -> Long.toString(l), "PrismParseLong");
    }

    /**
     * Matches exactly {@code "true"} and {@code "false"}, ignoring case.
     */
    public static Prism<String, Boolean> parseBoolean() {
        return Prism.of(
                s -> {
                    if ("true".equalsIgnoreCase(s)) {
                        return Option.some(Boolean.TRUE);
                    }
                    if ("false".equalsIgnoreCase(s)) {
                        return Option.some(Boolean.FALSE);
                    }
                    return Option.none();
                },
                b -> Boolean.toString(b),
                "PrismParseBoolean");
    }

    public static Prism<String, String> nonEmptyString() {
        return Prism.of(
                Option.fromPredicate((String s) -> !s.isEmpty()),
                s -> s,
                "PrismNonEmptyString");
    }

    /**
     * Unwraps the value of a present {@link Option}.
     */
    public static <A> Prism<Option<A>, A> some() {
        return Prism.of(o -> o, Option::some, "PrismSome");
    }

    /**
     * Unwraps the value of a successful {@link Result}.
     */
    public static <A> Prism<Result<A>, A> ok() {
        return Prism.of(
                r -> r.fold(e -> Option.<A>none(), Option::ofNullable),
                Result::ok,
                "PrismOk");
    }

    /**
     * Matches strings containing {@code pattern}; the focus is the first match with its
     * surrounding text, so {@code reverseGet} rebuilds the original string.
     */
    public static Prism<String, Match> regexMatcher(Pattern pattern) {
        Objects.requireNonNull(pattern, "pattern must not be null");
        return Prism.of(
                s -> {
                    Matcher matcher = pattern.matcher(s);
                    if (!matcher.find()) {
                        return Option.none();
                    }
                    List<String> groups = new ArrayList<>(matcher.groupCount() + 1);
                    for (int i = 0; i <= matcher.groupCount(); i++) {
                        String group = matcher.group(i);
                        groups.add(group == null ? "" : group);
                    }
                    return Option.some(new Match(
                            s.substring(0, matcher.start()),
                            groups,
                            s.substring(matcher.end())));
                },
                Match::reconstruct,
                "PrismRegex[" + pattern.pattern() + "]");
    }

    /**
     * A regex match within a string.
     *
     * @param before The text before the match
     * @param groups The whole match at index 0, then each capture group; unmatched groups are empty
     * @param after The text after the match
     */
    public record Match(String before, List<String> groups, String after) {

        public Match {
            Objects.requireNonNull(before, "before must not be null");
            Objects.requireNonNull(after, "after must not be null");
            if (groups == null || groups.isEmpty()) {
                throw new IllegalArgumentException("groups must contain at least the whole match");
            }
            groups = Collections.unmodifiableList(new ArrayList<>(groups));
        }

        public String fullMatch() {
            return groups.get(0);
        }

        /**
         * Returns capture group {@code index}, or an empty string when there is no such group.
         */
        public String group(int index) {
            return index >= 0 && index < groups.size() ? groups.get(index) : "";
        }

        public String reconstruct() {
            return before + fullMatch() + after;
        }
    }

    private static Option<Integer> tryParseInt(String s) {
        if (s == null) {
            return Option.none();
        }
        try {
            return Option.some(Integer.parseInt(s));
        } catch (NumberFormatException e) {
            return Option.none();
        }
    }

    private static Option<Long> tryParseLong(String s) {
        if (s == null) {
            return Option.none();
        }
        try {
            return Option.some(Long.parseLong(s));
        } catch (NumberFormatException e) {
            return Option.none();
        }
    }
}
