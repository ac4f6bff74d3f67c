package kz.qazmarka.orch.backup.storage;

import java.time.Duration;
import java.util.Objects;

import kz.qazmarka.orch.backup.TimestampFilter;

/** Параметры одного копирования. */
public final class CopyRequest {

    private final String source;
    private final String targetAccount;
    private final String targetTable;
    private final TimestampFilter filter;
    private final Duration timeout;

    public CopyRequest(String source, String targetAccount, String targetTable, TimestampFilter filter, Duration timeout) {
        this.source = Objects.requireNonNull(source, "source");
        this.targetAccount = Objects.requireNonNull(targetAccount, "targetAccount");
        this.targetTable = Objects.requireNonNull(targetTable, "targetTable");
        this.filter = filter;
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    public String getSource() {
        return source;
    }

    public String getTargetAccount() {
        return targetAccount;
    }

    public String getTargetTable() {
        return targetTable;
    }

    /** {@code null}: полная копия. */
    public TimestampFilter getFilter() {
        return filter;
    }

    /** Текст фильтра источника или {@code null}. */
    public String getFilterQuery() {
        return filter == null ? null : filter.toQuery();
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public String toString() {
        return "CopyRequest{" + source + " -> " + targetAccount + '/' + targetTable
                + (filter == null ? "" : ", filter=" + filter.toQuery())
                + ", timeout=" + timeout + '}';
    }
}
