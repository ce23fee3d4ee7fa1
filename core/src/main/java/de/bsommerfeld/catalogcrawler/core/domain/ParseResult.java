package de.bsommerfeld.catalogcrawler.core.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of parsing a single item: either the parsed value or the reason
 * the item was skipped. Parsers return this instead of throwing so that a
 * broken item never unwinds past its own boundary.
 *
 * @param <T> parsed value type
 */
public final class ParseResult<T> {

    private final T value;
    private final String reason;

    private ParseResult(T value, String reason) {
        this.value = value;
        this.reason = reason;
    }

    public static <T> ParseResult<T> parsed(T value) {
        return new ParseResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> ParseResult<T> skipped(String reason) {
        return new ParseResult<>(null, Objects.requireNonNull(reason, "reason"));
    }

    public boolean isParsed() {
        return value != null;
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    /** Why the item was skipped, empty for parsed results. */
    public Optional<String> reason() {
        return Optional.ofNullable(reason);
    }

    @Override
    public String toString() {
        return isParsed() ? "Parsed[" + value + "]" : "Skipped[" + reason + "]";
    }
}
