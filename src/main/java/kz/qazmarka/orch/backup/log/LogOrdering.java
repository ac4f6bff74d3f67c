package kz.qazmarka.orch.backup.log;

import java.util.Comparator;

import kz.qazmarka.orch.backup.BackupRecord;

final class LogOrdering {

    /** По убыванию момента старта; при равенстве: по ключу строки, чтобы порядок был стабильным. */
    static final Comparator<BackupRecord> NEWEST_FIRST = Comparator
            .comparing(BackupRecord::getBackupStartedAt)
            .thenComparing(BackupRecord::rowKey)
            .reversed();

    private LogOrdering() {}

    static String key(BackupRecord r) {
        return r.partitionKey() + '\u0000' + r.rowKey();
    }
}
