package kz.qazmarka.orch.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import kz.qazmarka.orch.backup.BackupTargetNaming;
import kz.qazmarka.orch.backup.TableBackupSetup;

/**
 * Настройки бэкапа: суффикс целевых аккаунтов и расписания таблиц в порядке перечисления.
 */
public final class BackupSettings {

    private final String targetSuffix;
    private final List<TableBackupSetup> tables;

    public BackupSettings(String targetSuffix, List<TableBackupSetup> tables) {
        this.targetSuffix = BackupTargetNaming.validateSuffix(targetSuffix);
        this.tables = Collections.unmodifiableList(new ArrayList<>(tables));
    }

    public String getTargetSuffix() {
        return targetSuffix;
    }

    public List<TableBackupSetup> getTables() {
        return tables;
    }

    public BackupTargetNaming naming() {
        return new BackupTargetNaming(targetSuffix);
    }
}
