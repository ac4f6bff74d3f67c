package kz.qazmarka.orch.backup;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Фильтр источника для инкрементальной копии: строки со штампом {@code Timestamp} строго позже
 * момента последнего успешного прогона.
 */
public final class TimestampFilter {

    private final Instant after;

    public TimestampFilter(Instant after) {
        this.after = Objects.requireNonNull(after, "after");
    }

    public Instant after() {
        return after;
    }

    /** Строковая форма запроса: {@code Timestamp gt datetime'<ISO-8601>'}. */
    public String toQuery() {
        return "Timestamp gt datetime'" + DateTimeFormatter.ISO_INSTANT.format(after) + "'";
    }

    public boolean matches(Instant rowTimestamp) {
        return rowTimestamp != null && rowTimestamp.isAfter(after);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimestampFilter)) return false;
        return after.equals(((TimestampFilter) o).after);
    }

    @Override
    public int hashCode() {
        return after.hashCode();
    }

    @Override
    public String toString() {
        return toQuery();
    }
}
