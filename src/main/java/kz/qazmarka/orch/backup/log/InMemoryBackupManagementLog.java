package kz.qazmarka.orch.backup.log;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.function.Predicate;

import kz.qazmarka.orch.backup.BackupRecord;

/**
 * Журнал в памяти процесса: для тестов и пробных прогонов без внешнего хранилища.
 */
public final class InMemoryBackupManagementLog implements BackupManagementLog {

    private final ConcurrentNavigableMap<String, BackupRecord> rows = new ConcurrentSkipListMap<>();

    @Override
    public void insert(BackupRecord record) {
        Objects.requireNonNull(record, "record");
        BackupRecord prev = rows.putIfAbsent(LogOrdering.key(record), record);
        if (prev != null) {
            throw new IllegalStateException("Запись уже существует: " + record.partitionKey() + '/' + record.rowKey());
        }
    }

    @Override
    public void upsert(BackupRecord record) {
        Objects.requireNonNull(record, "record");
        rows.put(LogOrdering.key(record), record);
    }

    @Override
    public List<BackupRecord> query(Predicate<BackupRecord> predicate) {
        List<BackupRecord> out = new ArrayList<>();
        for (BackupRecord r : rows.values()) {
            if (predicate.test(r)) {
                out.add(r);
            }
        }
        out.sort(LogOrdering.NEWEST_FIRST);
        return out;
    }

    @Override
    public boolean deleteIfExists() {
        boolean had = !rows.isEmpty();
        rows.clear();
        return had;
    }

    public int size() {
        return rows.size();
    }
}
