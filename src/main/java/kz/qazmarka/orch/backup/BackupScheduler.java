package kz.qazmarka.orch.backup;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Чистая функция принятия решения о бэкапе таблицы по истории прогонов.
 *
 * <ol>
 *   <li>Истории нет: полная копия в новый аккаунт с сегодняшней датой ({@link BackupReturnCode#FIRST_BACKUP_DONE}).</li>
 *   <li>Последний прогон не завершён и моложе таймаута: пропуск ({@link BackupReturnCode#IN_PROGRESS});
 *   старше таймаута: считается неуспешным и дальше участвует как обычная запись.</li>
 *   <li>С начала последнего прогона (любого статуса) прошло не больше {@code incrementalFrequency}: пропуск.</li>
 *   <li>Аккаунт последнего прогона старше {@code switchTargetFrequency}: полная копия в новый аккаунт.</li>
 *   <li>Иначе копия в тот же аккаунт; в инкрементальном режиме с фильтром от начала последнего
 *   успешного прогона в этот аккаунт (если такого нет: полная копия).</li>
 * </ol>
 *
 * Состояние между вызовами не хранится: источник истины: журнал.
 */
public final class BackupScheduler {

    private final BackupTargetNaming naming;

    public BackupScheduler(BackupTargetNaming naming) {
        this.naming = Objects.requireNonNull(naming, "naming");
    }

    /**
     * @param setup   настройка таблицы
     * @param history записи журнала по таблице (порядок не важен)
     * @param now     текущий момент
     * @throws UnexpectedTargetNameException если аккаунт последнего прогона назван не по схеме
     */
    public BackupPlan plan(TableBackupSetup setup, List<BackupRecord> history, Instant now) {
        Objects.requireNonNull(setup, "setup");
        Objects.requireNonNull(now, "now");
        BackupRecord last = latest(history);
        if (last == null) {
            return BackupPlan.run(naming.format(now), true, BackupMode.FULL, null,
                    BackupReturnCode.FIRST_BACKUP_DONE, null);
        }

        Duration sinceLast = Duration.between(last.getBackupStartedAt(), now);
        if (last.isUnfinished() && sinceLast.compareTo(setup.getTimeout()) <= 0) {
            return BackupPlan.inProgress(last);
        }

        BackupSchedule schedule = setup.getSchedule();
        if (sinceLast.compareTo(schedule.getIncrementalFrequency()) <= 0) {
            return BackupPlan.notDue(last);
        }

        String lastTarget = last.getTargetStorageAccountName();
        Instant targetCreated = BackupTargetNaming.parseCreatedAt(lastTarget);
        if (Duration.between(targetCreated, now).compareTo(schedule.getSwitchTargetFrequency()) > 0) {
            return BackupPlan.run(naming.format(now), true, BackupMode.FULL, null,
                    BackupReturnCode.BACKUP_TO_NEW_CONTAINER_DONE, last);
        }

        if (setup.getMode() == BackupMode.INCREMENTAL) {
            BackupRecord anchor = lastSuccessInto(history, lastTarget);
            if (anchor != null) {
                return BackupPlan.run(lastTarget, false, BackupMode.INCREMENTAL,
                        new TimestampFilter(anchor.getBackupStartedAt()),
                        BackupReturnCode.BACKUP_TO_EXISTING_CONTAINER_DONE, last);
            }
        }
        return BackupPlan.run(lastTarget, false, BackupMode.FULL, null,
                BackupReturnCode.BACKUP_TO_EXISTING_CONTAINER_DONE, last);
    }

    /** Самая поздняя по {@code backupStartedAt} запись или {@code null}. */
    static BackupRecord latest(List<BackupRecord> history) {
        BackupRecord best = null;
        if (history == null) {
            return null;
        }
        for (BackupRecord r : history) {
            if (best == null || r.getBackupStartedAt().isAfter(best.getBackupStartedAt())) {
                best = r;
            }
        }
        return best;
    }

    private static BackupRecord lastSuccessInto(List<BackupRecord> history, String account) {
        BackupRecord best = null;
        for (BackupRecord r : history) {
            if (r.getStatus() != BackupStatus.SUCCESS || !account.equals(r.getTargetStorageAccountName())) {
                continue;
            }
            if (best == null || r.getBackupStartedAt().isAfter(best.getBackupStartedAt())) {
                best = r;
            }
        }
        return best;
    }
}
