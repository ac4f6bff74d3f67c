package kz.qazmarka.orch.backup.log;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Predicate;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import kz.qazmarka.orch.backup.BackupMode;
import kz.qazmarka.orch.backup.BackupRecord;
import kz.qazmarka.orch.backup.BackupStatus;

/**
 * Журнал бэкапов в одном JSON-файле.
 *
 * Формат:
 * <pre>
 * { "records": [
 *   { "partitionKey": "orders", "rowKey": "20261019093000000-…", "id": "…",
 *     "sourceTableName": "orders", "targetStorageAccountName": "bkp-2026-10-19",
 *     "targetTableName": "orders", "dateCreated": "2026-10-19T09:30:00Z",
 *     "backupStartedAt": "2026-10-19T09:30:00Z", "backupFinishedAt": null,
 *     "status": "IN_PROGRESS", "mode": "FULL", "filter": null, "message": null }
 * ] }
 * </pre>
 *
 * Каждая операция перечитывает файл; запись идёт во временный файл рядом и атомарно
 * заменяет исходный. Чтение-изменение-запись выполняется под исключительной блокировкой
 * файла {@code <имя>.lock} рядом с журналом, поэтому несколько экземпляров журнала (в том
 * числе в разных процессах) над одним файлом не теряют записи друг друга. Внутри процесса
 * экземпляры над одним путём дополнительно делят общий монитор: блокировка файла
 * принадлежит процессу и не разделяет потоки.
 */
public final class JsonFileBackupManagementLog implements BackupManagementLog {

    private static final Logger LOG = LoggerFactory.getLogger(JsonFileBackupManagementLog.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String KEY_RECORDS = "records";
    private static final String LOCK_SUFFIX = ".lock";
    private static final ConcurrentMap<Path, Object> MONITORS = new ConcurrentHashMap<>();

    private final Path file;
    private final Path lockFile;
    private final Object monitor;

    public JsonFileBackupManagementLog(Path file) {
        this.file = Objects.requireNonNull(file, "file");
        Path normalized = file.toAbsolutePath().normalize();
        this.lockFile = normalized.resolveSibling(normalized.getFileName() + LOCK_SUFFIX);
        this.monitor = MONITORS.computeIfAbsent(normalized, k -> new Object());
    }

    public Path file() {
        return file;
    }

    @Override
    public void insert(BackupRecord record) {
        Objects.requireNonNull(record, "record");
        locked(() -> {
            Map<String, BackupRecord> rows = load();
            String key = LogOrdering.key(record);
            if (rows.containsKey(key)) {
                throw new IllegalStateException("Запись уже существует: " + record.partitionKey() + '/' + record.rowKey());
            }
            rows.put(key, record);
            store(rows);
            return null;
        });
    }

    @Override
    public void upsert(BackupRecord record) {
        Objects.requireNonNull(record, "record");
        locked(() -> {
            Map<String, BackupRecord> rows = load();
            rows.put(LogOrdering.key(record), record);
            store(rows);
            return null;
        });
    }

    @Override
    public List<BackupRecord> query(Predicate<BackupRecord> predicate) {
        Map<String, BackupRecord> rows = locked(this::load);
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
        return locked(() -> {
            try {
                boolean deleted = Files.deleteIfExists(file);
                if (deleted) {
                    LOG.info("Журнал бэкапов {} удалён", file);
                }
                return deleted;
            } catch (IOException e) {
                throw new UncheckedIOException("Не удалось удалить журнал бэкапов " + file, e);
            }
        });
    }

    /** Выполняет действие под общим монитором пути и исключительной блокировкой lock-файла. */
    private <T> T locked(Supplier<T> action) {
        synchronized (monitor) {
            try {
                Files.createDirectories(lockFile.getParent());
            } catch (IOException e) {
                throw new UncheckedIOException("Не удалось создать каталог журнала бэкапов " + lockFile.getParent(), e);
            }
            try (FileChannel ch = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock lock = ch.lock()) {
                if (LOG.isTraceEnabled()) {
                    LOG.trace("Блокировка журнала бэкапов получена: {}", lock);
                }
                return action.get();
            } catch (IOException e) {
                throw new UncheckedIOException("Не удалось заблокировать журнал бэкапов " + lockFile, e);
            }
        }
    }

    private Map<String, BackupRecord> load() {
        Map<String, BackupRecord> rows = new LinkedHashMap<>();
        if (!Files.exists(file)) {
            return rows;
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(file.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException("Не удалось прочитать журнал бэкапов " + file, e);
        }
        if (root == null || root.isMissingNode()) {
            return rows;
        }
        JsonNode records = root.path(KEY_RECORDS);
        if (!records.isArray()) {
            throw new IllegalStateException("Журнал бэкапов " + file + ": ожидается массив '" + KEY_RECORDS + "'");
        }
        for (JsonNode n : records) {
            BackupRecord r = fromJson(n);
            rows.put(LogOrdering.key(r), r);
        }
        return rows;
    }

    private void store(Map<String, BackupRecord> rows) {
        ObjectNode root = MAPPER.createObjectNode();
        ArrayNode arr = root.putArray(KEY_RECORDS);
        for (BackupRecord r : rows.values()) {
            arr.add(toJson(r));
        }
        Path dir = file.toAbsolutePath().getParent();
        try {
            if (dir != null) {
                Files.createDirectories(dir);
            }
            Path tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            try {
                MAPPER.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), root);
                moveIntoPlace(tmp);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Не удалось записать журнал бэкапов " + file, e);
        }
    }

    private void moveIntoPlace(Path tmp) throws IOException {
        try {
            Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("Атомарная замена {} не поддерживается ФС, заменяю обычным переносом", file);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    static ObjectNode toJson(BackupRecord r) {
        ObjectNode n = MAPPER.createObjectNode();
        n.put("partitionKey", r.partitionKey());
        n.put("rowKey", r.rowKey());
        n.put("id", r.getId());
        n.put("sourceTableName", r.getSourceTableName());
        n.put("targetStorageAccountName", r.getTargetStorageAccountName());
        n.put("targetTableName", r.getTargetTableName());
        n.put("dateCreated", r.getDateCreated().toString());
        n.put("backupStartedAt", r.getBackupStartedAt().toString());
        n.put("backupFinishedAt", r.getBackupFinishedAt() == null ? null : r.getBackupFinishedAt().toString());
        n.put("status", r.getStatus().name());
        n.put("mode", r.getMode().name());
        n.put("filter", r.getFilter());
        n.put("message", r.getMessage());
        return n;
    }

    static BackupRecord fromJson(JsonNode n) {
        return new BackupRecord(
                requiredText(n, "id"),
                requiredText(n, "sourceTableName"),
                requiredText(n, "targetStorageAccountName"),
                requiredText(n, "targetTableName"),
                Instant.parse(requiredText(n, "dateCreated")),
                Instant.parse(requiredText(n, "backupStartedAt")),
                optionalInstant(n, "backupFinishedAt"),
                BackupStatus.valueOf(requiredText(n, "status")),
                BackupMode.valueOf(requiredText(n, "mode")),
                optionalText(n, "filter"),
                optionalText(n, "message"));
    }

    private static String requiredText(JsonNode n, String field) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull()) {
            throw new IllegalStateException("В записи журнала бэкапов нет поля '" + field + "': " + n);
        }
        return v.asText();
    }

    private static String optionalText(JsonNode n, String field) {
        JsonNode v = n.get(field);
        return (v == null || v.isNull()) ? null : v.asText();
    }

    private static Instant optionalInstant(JsonNode n, String field) {
        String v = optionalText(n, field);
        return v == null ? null : Instant.parse(v);
    }
}
