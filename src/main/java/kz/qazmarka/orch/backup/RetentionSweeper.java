package kz.qazmarka.orch.backup;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.orch.backup.log.BackupManagementLog;
import kz.qazmarka.orch.backup.storage.BackupStorage;
import kz.qazmarka.orch.util.ProgressReporter;

/**
 * Удаляет просроченные копии таблиц и опустевшие аккаунты бэкапа.
 *
 * Возраст копии считается по самой свежей записи журнала для пары (аккаунт, таблица).
 * Просроченные таблицы удаляются по одной; аккаунт удаляется, только если все его копии
 * по журналу просрочены и после удаления в хранилище в нём не осталось ни одной таблицы.
 * Копии таблиц, для которых нет настройки, не считаются просроченными.
 */
public final class RetentionSweeper {

    private static final Logger LOG = LoggerFactory.getLogger(RetentionSweeper.class);

    private final BackupManagementLog log;
    private final BackupStorage storage;
    private final Map<String, Duration> retentionBySource;
    private final Clock clock;
    private ProgressReporter reporter = ProgressReporter.silent();

    public RetentionSweeper(BackupManagementLog log,
                            BackupStorage storage,
                            List<TableBackupSetup> setups,
                            Clock clock) {
        this.log = Objects.requireNonNull(log, "log");
        this.storage = Objects.requireNonNull(storage, "storage");
        this.clock = Objects.requireNonNull(clock, "clock");
        Map<String, Duration> m = new HashMap<>();
        for (TableBackupSetup s : setups) {
            m.put(s.getSourceTable(), s.getSchedule().getRetention());
        }
        this.retentionBySource = m;
    }

    /** Задаёт необязательный приёмник сообщений о прогрессе. */
    public void reportOn(Consumer<String> action) {
        this.reporter = ProgressReporter.of(action);
    }

    /**
     * @throws TableDeleteFailedException если удаление таблицы не удалось; уже удалённое не восстанавливается
     */
    public SweepResult sweep() {
        Instant now = clock.instant();
        Map<String, Map<String, BackupRecord>> byAccount = newestPerAccountTable();
        List<String> deletedTables = new ArrayList<>();
        List<String> deletedAccounts = new ArrayList<>();

        for (Map.Entry<String, Map<String, BackupRecord>> acc : byAccount.entrySet()) {
            String account = acc.getKey();
            boolean allExpired = true;
            for (BackupRecord r : acc.getValue().values()) {
                if (!isExpired(r, now)) {
                    allExpired = false;
                    continue;
                }
                String table = r.getTargetTableName();
                if (deleteTable(account, table)) {
                    deletedTables.add(account + '/' + table);
                    reporter.report("Удалена просроченная копия " + account + '/' + table);
                }
            }
            if (allExpired && storage.accountExists(account) && storage.listTables(account).isEmpty()) {
                storage.deleteAccount(account);
                deletedAccounts.add(account);
                reporter.report("Удалён опустевший аккаунт " + account);
            } else if (LOG.isDebugEnabled()) {
                LOG.debug("Аккаунт {} сохранён: allExpired={}", account, allExpired);
            }
        }
        SweepResult result = new SweepResult(deletedTables, deletedAccounts);
        LOG.info("Очистка бэкапов завершена: {}", result);
        return result;
    }

    boolean isExpired(BackupRecord r, Instant now) {
        Duration retention = retentionBySource.get(r.getSourceTableName());
        if (retention == null) {
            return false;
        }
        return Duration.between(r.getBackupStartedAt(), now).compareTo(retention) > 0;
    }

    private boolean deleteTable(String account, String table) {
        try {
            return storage.deleteTableIfExists(account, table);
        } catch (RuntimeException e) {
            throw new TableDeleteFailedException(account, table, e);
        }
    }

    /** Журнал отдаёт записи от новых к старым, поэтому первой встречается самая свежая запись пары. */
    private Map<String, Map<String, BackupRecord>> newestPerAccountTable() {
        Map<String, Map<String, BackupRecord>> out = new TreeMap<>();
        for (BackupRecord r : log.query(rec -> true)) {
            out.computeIfAbsent(r.getTargetStorageAccountName(), k -> new LinkedHashMap<>())
                    .putIfAbsent(r.getTargetTableName(), r);
        }
        return out;
    }
}
