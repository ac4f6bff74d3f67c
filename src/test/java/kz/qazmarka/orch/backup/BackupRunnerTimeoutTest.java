package kz.qazmarka.orch.backup;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import kz.qazmarka.orch.backup.log.InMemoryBackupManagementLog;
import kz.qazmarka.orch.backup.storage.FileSystemBackupStorage;
import kz.qazmarka.orch.backup.storage.FileSystemTableCopier;

/**
 * Прогон с файловым копировщиком, который не укладывается в таймаут: после записи FAILURE
 * целевая таблица не должна появиться.
 */
class BackupRunnerTimeoutTest {

    @TempDir
    Path tmp;

    @Test
    @DisplayName("Таймаут копирования: FAILURE в журнале, цель не записана и после остановки копировщика")
    void timedOutCopyNeverWritesTarget() throws Exception {
        Path sourceRoot = Files.createDirectories(tmp.resolve("source"));
        writeRows(sourceRoot.resolve("orders.jsonl"), 300_000);
        FileSystemBackupStorage storage = new FileSystemBackupStorage(tmp.resolve("backup"));
        ExecutorService pool = Executors.newSingleThreadExecutor();
        InMemoryBackupManagementLog log = new InMemoryBackupManagementLog();
        BackupRunner runner = new BackupRunner(log, storage, new FileSystemTableCopier(sourceRoot, storage, pool),
                new BackupTargetNaming("bkp"), new MutableClock(Instant.parse("2024-03-10T06:00:00Z")));
        TableBackupSetup setup = new TableBackupSetup("orders",
                new BackupSchedule(Duration.ofHours(1), Duration.ofDays(7), Duration.ofDays(30)),
                BackupMode.FULL, Duration.ofMillis(1));

        try {
            assertThrows(BackupFailedException.class, () -> runner.run(setup));
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));
        }

        assertEquals(BackupStatus.FAILURE, log.latestFor("orders").getStatus());
        assertFalse(Files.exists(storage.tableFile("bkp-2024-03-10", "orders")));
    }

    private static void writeRows(Path file, int count) throws IOException {
        try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (int i = 0; i < count; i++) {
                w.write("{\"PartitionKey\":\"p\",\"RowKey\":\"r" + i + "\",\"Timestamp\":\"2024-03-10T01:00:00Z\"}");
                w.newLine();
            }
        }
    }
}
