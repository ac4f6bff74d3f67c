package kz.qazmarka.orch.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.hadoop.conf.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.orch.backup.BackupMode;
import kz.qazmarka.orch.backup.BackupSchedule;
import kz.qazmarka.orch.backup.TableBackupSetup;
import kz.qazmarka.orch.util.Parsers;

/**
 * Секция {@code orch.backup.*}: суффикс целевых аккаунтов, список таблиц, значения по умолчанию
 * {@code orch.backup.default.*} и переопределения {@code orch.backup.table.<name>.*}.
 *
 * Длительности: в синтаксисе Hadoop ({@code 30m}, {@code 1h}, {@code 7d}); число без суффикса: миллисекунды.
 */
final class BackupSection {
    private static final Logger LOG = LoggerFactory.getLogger(BackupSection.class);

    final String targetSuffix;
    final List<TableBackupSetup> tables;

    private BackupSection(String targetSuffix, List<TableBackupSetup> tables) {
        this.targetSuffix = targetSuffix;
        this.tables = tables;
    }

    /**
     * @return секция или {@code null}, если таблицы не перечислены
     * @throws IllegalArgumentException если таблицы есть, а суффикс не задан или некорректен
     */
    static BackupSection from(Configuration cfg) {
        List<String> names = Parsers.readCsvList(cfg, OrchConfig.K_BACKUP_TABLES);
        if (names.isEmpty()) {
            return null;
        }
        String suffix = cfg.getTrimmed(OrchConfig.K_BACKUP_TARGET_SUFFIX);
        if (suffix == null || suffix.isEmpty()) {
            throw new IllegalArgumentException("Отсутствует обязательный параметр " + OrchConfig.K_BACKUP_TARGET_SUFFIX
                    + " при заданном " + OrchConfig.K_BACKUP_TABLES);
        }
        Defaults defaults = new Defaults(cfg);
        Set<String> seen = new LinkedHashSet<>();
        List<TableBackupSetup> tables = new ArrayList<>(names.size());
        for (String name : names) {
            if (!seen.add(name)) {
                LOG.warn("Таблица '{}' перечислена в {} повторно, дубликат пропущен", name, OrchConfig.K_BACKUP_TABLES);
                continue;
            }
            tables.add(readTable(cfg, name, defaults));
        }
        return new BackupSection(suffix, tables);
    }

    BackupSettings toSettings() {
        return new BackupSettings(targetSuffix, tables);
    }

    private static TableBackupSetup readTable(Configuration cfg, String name, Defaults d) {
        String prefix = OrchConfig.K_BACKUP_TABLE_PREFIX + name + '.';
        String source = Parsers.readStringOrDefault(cfg, prefix + OrchConfig.P_SOURCE, name);
        BackupMode mode = BackupMode.parse(Parsers.readStringOrDefault(cfg, prefix + OrchConfig.P_MODE, d.mode));
        BackupSchedule schedule = new BackupSchedule(
                duration(cfg, prefix + OrchConfig.P_INCREMENTAL_FREQUENCY, d.incrementalMs),
                duration(cfg, prefix + OrchConfig.P_SWITCH_FREQUENCY, d.switchMs),
                duration(cfg, prefix + OrchConfig.P_RETENTION, d.retentionMs));
        Duration timeout = duration(cfg, prefix + OrchConfig.P_TIMEOUT, d.timeoutMs);
        if (timeout.isZero()) {
            LOG.warn("Некорректное значение {}=0, устанавливаю {} мс", prefix + OrchConfig.P_TIMEOUT,
                    OrchConfig.DEFAULT_BACKUP_TIMEOUT_MS);
            timeout = Duration.ofMillis(OrchConfig.DEFAULT_BACKUP_TIMEOUT_MS);
        }
        return new TableBackupSetup(source, schedule, mode, timeout);
    }

    private static Duration duration(Configuration cfg, String key, long defMs) {
        long ms = Parsers.readDurationMs(cfg, key, defMs);
        if (ms < 0) {
            LOG.warn("Некорректное значение {}={} мс, устанавливаю {} мс", key, ms, defMs);
            ms = defMs;
        }
        return Duration.ofMillis(ms);
    }

    /** Значения {@code orch.backup.default.*}, общие для всех таблиц. */
    private static final class Defaults {
        final String mode;
        final long incrementalMs;
        final long switchMs;
        final long retentionMs;
        final long timeoutMs;

        Defaults(Configuration cfg) {
            String p = OrchConfig.K_BACKUP_DEFAULT_PREFIX;
            this.mode = Parsers.readStringOrDefault(cfg, p + OrchConfig.P_MODE, OrchConfig.DEFAULT_BACKUP_MODE);
            this.incrementalMs = nonNegative(cfg, p + OrchConfig.P_INCREMENTAL_FREQUENCY, OrchConfig.DEFAULT_INCREMENTAL_FREQUENCY_MS);
            this.switchMs = nonNegative(cfg, p + OrchConfig.P_SWITCH_FREQUENCY, OrchConfig.DEFAULT_SWITCH_FREQUENCY_MS);
            this.retentionMs = nonNegative(cfg, p + OrchConfig.P_RETENTION, OrchConfig.DEFAULT_RETENTION_MS);
            long timeout = nonNegative(cfg, p + OrchConfig.P_TIMEOUT, OrchConfig.DEFAULT_BACKUP_TIMEOUT_MS);
            this.timeoutMs = timeout == 0 ? OrchConfig.DEFAULT_BACKUP_TIMEOUT_MS : timeout;
        }

        private static long nonNegative(Configuration cfg, String key, long defMs) {
            return duration(cfg, key, defMs).toMillis();
        }
    }
}
