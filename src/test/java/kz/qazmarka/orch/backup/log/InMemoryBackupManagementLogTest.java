package kz.qazmarka.orch.backup.log;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import kz.qazmarka.orch.backup.BackupMode;
import kz.qazmarka.orch.backup.BackupRecord;

class InMemoryBackupManagementLogTest {

    @Test
    @DisplayName("history(): только записи таблицы, новые первыми; дубликат вставки отвергается")
    void historyOrderAndDuplicates() {
        InMemoryBackupManagementLog log = new InMemoryBackupManagementLog();
        BackupRecord a = BackupRecord.started("orders", "bkp-2024-03-10", "orders",
                Instant.parse("2024-03-10T06:00:00Z"), BackupMode.FULL, null);
        BackupRecord b = BackupRecord.started("orders", "bkp-2024-03-10", "orders",
                Instant.parse("2024-03-10T09:00:00Z"), BackupMode.INCREMENTAL, "Timestamp gt datetime'2024-03-10T06:00:00Z'");
        BackupRecord other = BackupRecord.started("customers", "bkp-2024-03-10", "customers",
                Instant.parse("2024-03-10T12:00:00Z"), BackupMode.FULL, null);
        log.insert(a);
        log.insert(other);
        log.insert(b);

        List<BackupRecord> h = log.history("orders");

        assertEquals(2, h.size());
        assertEquals(b, h.get(0));
        assertEquals(a, h.get(1));
        assertEquals(b, log.latestFor("orders"));
        assertThrows(IllegalStateException.class, () -> log.insert(a));
        assertEquals(3, log.size());
    }
}
