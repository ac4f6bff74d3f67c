package kz.qazmarka.orch.backup;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.UUID;

/**
 * Запись журнала бэкапов об одном прогоне для одной таблицы.
 *
 * Ключ партиции: имя исходной таблицы; ключ строки: момент старта в формате
 * {@code yyyyMMddHHmmssSSS} плюс идентификатор записи, так что лексикографический порядок
 * ключей строк совпадает с хронологическим. Запись создаётся со статусом
 * {@link BackupStatus#IN_PROGRESS} до копирования и заменяется итоговой через
 * {@link #finish(Instant, BackupStatus, String)}.
 */
public final class BackupRecord {

    private static final DateTimeFormatter ROW_KEY_TIME =
            DateTimeFormatter.ofPattern("yyyyMMddHHmmssSSS").withZone(ZoneOffset.UTC);

    private final String id;
    private final String sourceTableName;
    private final String targetStorageAccountName;
    private final String targetTableName;
    private final Instant dateCreated;
    private final Instant backupStartedAt;
    private final Instant backupFinishedAt;
    private final BackupStatus status;
    private final BackupMode mode;
    private final String filter;
    private final String message;

    public BackupRecord(String id,
                        String sourceTableName,
                        String targetStorageAccountName,
                        String targetTableName,
                        Instant dateCreated,
                        Instant backupStartedAt,
                        Instant backupFinishedAt,
                        BackupStatus status,
                        BackupMode mode,
                        String filter,
                        String message) {
        this.id = Objects.requireNonNull(id, "id");
        this.sourceTableName = Objects.requireNonNull(sourceTableName, "sourceTableName");
        this.targetStorageAccountName = Objects.requireNonNull(targetStorageAccountName, "targetStorageAccountName");
        this.targetTableName = Objects.requireNonNull(targetTableName, "targetTableName");
        this.dateCreated = Objects.requireNonNull(dateCreated, "dateCreated");
        this.backupStartedAt = Objects.requireNonNull(backupStartedAt, "backupStartedAt");
        this.backupFinishedAt = backupFinishedAt;
        this.status = Objects.requireNonNull(status, "status");
        this.mode = Objects.requireNonNull(mode, "mode");
        this.filter = filter;
        this.message = message;
    }

    /** Новая запись о начатом прогоне. */
    public static BackupRecord started(String sourceTableName,
                                       String targetStorageAccountName,
                                       String targetTableName,
                                       Instant startedAt,
                                       BackupMode mode,
                                       String filter) {
        return new BackupRecord(UUID.randomUUID().toString(), sourceTableName, targetStorageAccountName,
                targetTableName, startedAt, startedAt, null, BackupStatus.IN_PROGRESS, mode, filter, null);
    }

    /** Копия записи с итогом прогона; идентификатор и ключи сохраняются. */
    public BackupRecord finish(Instant finishedAt, BackupStatus finalStatus, String finalMessage) {
        if (finalStatus == BackupStatus.IN_PROGRESS) {
            throw new IllegalArgumentException("Итоговый статус не может быть IN_PROGRESS");
        }
        return new BackupRecord(id, sourceTableName, targetStorageAccountName, targetTableName, dateCreated,
                backupStartedAt, Objects.requireNonNull(finishedAt, "finishedAt"), finalStatus, mode, filter,
                finalMessage);
    }

    public String partitionKey() {
        return sourceTableName;
    }

    public String rowKey() {
        return ROW_KEY_TIME.format(backupStartedAt) + '-' + id;
    }

    /** {@code true}, если итог прогона ещё не записан. */
    public boolean isUnfinished() {
        return backupFinishedAt == null;
    }

    public String getId() {
        return id;
    }

    public String getSourceTableName() {
        return sourceTableName;
    }

    public String getTargetStorageAccountName() {
        return targetStorageAccountName;
    }

    public String getTargetTableName() {
        return targetTableName;
    }

    public Instant getDateCreated() {
        return dateCreated;
    }

    public Instant getBackupStartedAt() {
        return backupStartedAt;
    }

    /** Момент завершения; {@code null}, пока прогон не завершён. */
    public Instant getBackupFinishedAt() {
        return backupFinishedAt;
    }

    public BackupStatus getStatus() {
        return status;
    }

    public BackupMode getMode() {
        return mode;
    }

    /** Фильтр источника, применённый при копировании; {@code null} для полной копии. */
    public String getFilter() {
        return filter;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BackupRecord)) return false;
        BackupRecord that = (BackupRecord) o;
        return id.equals(that.id)
                && sourceTableName.equals(that.sourceTableName)
                && targetStorageAccountName.equals(that.targetStorageAccountName)
                && targetTableName.equals(that.targetTableName)
                && dateCreated.equals(that.dateCreated)
                && backupStartedAt.equals(that.backupStartedAt)
                && Objects.equals(backupFinishedAt, that.backupFinishedAt)
                && status == that.status
                && mode == that.mode
                && Objects.equals(filter, that.filter)
                && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, sourceTableName, backupStartedAt, status);
    }

    @Override
    public String toString() {
        return "BackupRecord{source=" + sourceTableName
                + ", target=" + targetStorageAccountName + '/' + targetTableName
                + ", startedAt=" + backupStartedAt
                + ", finishedAt=" + backupFinishedAt
                + ", status=" + status
                + ", mode=" + mode + '}';
    }
}
