package kz.qazmarka.orch.backup;

import java.time.Duration;
import java.util.Objects;

/**
 * Иммутабельная настройка бэкапа одной таблицы: источник, расписание, режим и таймаут копирования.
 * Одна настройка порождает по записи журнала на каждый прогон.
 */
public final class TableBackupSetup {

    private final String sourceTable;
    private final BackupSchedule schedule;
    private final BackupMode mode;
    private final Duration timeout;

    public TableBackupSetup(String sourceTable, BackupSchedule schedule, BackupMode mode, Duration timeout) {
        if (sourceTable == null || sourceTable.trim().isEmpty()) {
            throw new IllegalArgumentException("Имя исходной таблицы не может быть пустым");
        }
        this.sourceTable = sourceTable.trim();
        this.schedule = Objects.requireNonNull(schedule, "schedule");
        this.mode = Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Таймаут копирования должен быть положительным: " + timeout);
        }
        this.timeout = timeout;
    }

    /** Имя исходной таблицы; оно же ключ партиции в журнале и имя таблицы в целевом аккаунте. */
    public String getSourceTable() {
        return sourceTable;
    }

    public BackupSchedule getSchedule() {
        return schedule;
    }

    public BackupMode getMode() {
        return mode;
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public String toString() {
        return "TableBackupSetup{source=" + sourceTable + ", mode=" + mode + ", " + schedule
                + ", timeout=" + timeout + '}';
    }
}
