package me.internalizable.tatc.api.http;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, insertion-ordered view of the headers of one request.
 *
 * <p>Names are matched case-insensitively but kept exactly as received. Repeated headers are kept
 * as separate entries in arrival order.</p>
 */
public final class RequestHeaders {

    private static final RequestHeaders EMPTY = new RequestHeaders(List.of());

    private final List<Map.Entry<String, String>> entries;

    private RequestHeaders(List<Map.Entry<String, String>> entries) {
        this.entries = entries;
    }

    @Nonnull
    public static RequestHeaders empty() {
        return EMPTY;
    }

    /**
     * Copies the given entries, preserving their order.
     */
    @Nonnull
    public static RequestHeaders of(@Nonnull Iterable<? extends Map.Entry<String, String>> entries) {
        Objects.requireNonNull(entries, "entries");
        List<Map.Entry<String, String>> copy = new ArrayList<>();
        for (Map.Entry<String, String> entry : entries) {
            copy.add(Map.entry(entry.getKey(), entry.getValue()));
        }
        return copy.isEmpty() ? EMPTY : new RequestHeaders(Collections.unmodifiableList(copy));
    }

    @Nonnull
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the first value for {@code name}, or {@code null} if absent
     */
    @Nullable
    public String get(@Nonnull String name) {
        for (Map.Entry<String, String> entry : entries) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }

    /**
     * @return every value for {@code name} in arrival order, never {@code null}
     */
    @Nonnull
    public List<String> getAll(@Nonnull String name) {
        List<String> values = new ArrayList<>(2);
        for (Map.Entry<String, String> entry : entries) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                values.add(entry.getValue());
            }
        }
        return Collections.unmodifiableList(values);
    }

    public boolean contains(@Nonnull String name) {
        return get(name) != null;
    }

    @Nonnull
    public List<Map.Entry<String, String>> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RequestHeaders other)) return false;
        return entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("RequestHeaders{");
        for (int i = 0; i < entries.size(); i++) {
            if (i > 0) sb.append(", ");
            Map.Entry<String, String> entry = entries.get(i);
            sb.append(entry.getKey().toLowerCase(Locale.ROOT)).append('=').append(entry.getValue());
        }
        return sb.append('}').toString();
    }

    public static final class Builder {

        private final List<Map.Entry<String, String>> entries = new ArrayList<>();

        private Builder() {
        }

        @Nonnull
        public Builder add(@Nonnull String name, @Nonnull String value) {
            entries.add(Map.entry(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value")));
            return this;
        }

        @Nonnull
        public RequestHeaders build() {
            return RequestHeaders.of(entries);
        }
    }
}
