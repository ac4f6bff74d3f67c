package kz.qazmarka.orch.backup.storage;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.FutureTask;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import kz.qazmarka.orch.backup.TimestampFilter;

/**
 * Копирует таблицы-файлы {@code <sourceRoot>/<source>.jsonl} в {@link FileSystemBackupStorage}.
 *
 * Каждая строка источника: JSON-объект с полем {@code Timestamp} (ISO-8601). Фильтр
 * пропускает строки со штампом не позже границы. Строки с {@code PartitionKey}/{@code RowKey}
 * вставляются поверх одноимённых строк цели (upsert), остальные дописываются. Полная копия
 * заменяет содержимое целевой таблицы. Некорректные строки не прерывают копирование,
 * а попадают в список ошибок результата.
 *
 * Копирование укладывается в {@link CopyRequest#getTimeout()}: по истечении срока или при
 * прерывании потока оно прекращается без записи в цель. Отмена future, возвращённого
 * {@link #copy(CopyRequest)}, прерывает поток копирования.
 */
public final class FileSystemTableCopier implements TableCopier {

    private static final Logger LOG = LoggerFactory.getLogger(FileSystemTableCopier.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String FIELD_TIMESTAMP = "Timestamp";
    static final String FIELD_PARTITION_KEY = "PartitionKey";
    static final String FIELD_ROW_KEY = "RowKey";
    private static final Duration MAX_BUDGET = Duration.ofDays(365);

    private final Path sourceRoot;
    private final FileSystemBackupStorage target;
    private final Executor executor;

    public FileSystemTableCopier(Path sourceRoot, FileSystemBackupStorage target) {
        this(sourceRoot, target, ForkJoinPool.commonPool());
    }

    public FileSystemTableCopier(Path sourceRoot, FileSystemBackupStorage target, Executor executor) {
        this.sourceRoot = Objects.requireNonNull(sourceRoot, "sourceRoot");
        this.target = Objects.requireNonNull(target, "target");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public CompletableFuture<CopyResult> copy(CopyRequest request) {
        Objects.requireNonNull(request, "request");
        CopyTask task = new CopyTask(() -> copyNow(request));
        executor.execute(task);
        return task.result;
    }

    CopyResult copyNow(CopyRequest request) {
        long deadline = deadlineAfter(request.getTimeout());
        Path src = sourceRoot.resolve(
                FileSystemBackupStorage.requireSimpleName(request.getSource(), "source") + FileSystemBackupStorage.TABLE_EXT);
        List<String> errors = new ArrayList<>();
        if (!Files.isRegularFile(src)) {
            errors.add("Исходная таблица не найдена: " + src);
            return CopyResult.failure(0L, errors);
        }
        target.createAccountIfNotExists(request.getTargetAccount());
        Path dst = target.tableFile(request.getTargetAccount(), request.getTargetTable());

        Map<String, String> rows = new LinkedHashMap<>();
        try {
            if (request.getFilter() != null && Files.isRegularFile(dst)) {
                List<String> targetErrors = new ArrayList<>();
                readRows(dst, "dst", null, rows, targetErrors, deadline);
                if (!targetErrors.isEmpty()) {
                    LOG.warn("Копирование {}: в цели {} некорректных строк, при перезаписи они будут потеряны: {}",
                            request, targetErrors.size(), targetErrors);
                }
            }
            long before = rows.size();
            long copied = readRows(src, "src", request.getFilter(), rows, errors, deadline);
            writeAtomically(dst, rows.values(), deadline);
            if (LOG.isDebugEnabled()) {
                LOG.debug("Копирование {}: строк скопировано {}, строк в цели было {}, стало {}",
                        request, copied, before, rows.size());
            }
            return errors.isEmpty() ? CopyResult.success(copied) : CopyResult.failure(copied, errors);
        } catch (InterruptedIOException e) {
            LOG.warn("Копирование {} прекращено без записи в цель: {}", request, e.getMessage());
            errors.add("Копирование прекращено: " + e.getMessage());
            return CopyResult.failure(0L, errors);
        } catch (IOException e) {
            errors.add("Ошибка ввода-вывода: " + e.getMessage());
            return CopyResult.failure(0L, errors);
        }
    }

    /** Читает строки файла в {@code rows} (по ключу PartitionKey/RowKey), возвращает число принятых. */
    private static long readRows(Path file, String origin, TimestampFilter filter, Map<String, String> rows,
                                 List<String> errors, long deadline) throws IOException {
        checkNotAborted(deadline);
        long accepted = 0L;
        int lineNo = 0;
        try (BufferedReader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = r.readLine()) != null) {
                lineNo++;
                checkNotAborted(deadline);
                if (line.trim().isEmpty()) {
                    continue;
                }
                JsonNode row;
                try {
                    row = MAPPER.readTree(line);
                } catch (JsonProcessingException e) {
                    errors.add(file.getFileName() + ":" + lineNo + ": некорректный JSON: " + e.getOriginalMessage());
                    continue;
                }
                if (filter != null && !filter.matches(timestamp(row, file, lineNo, errors))) {
                    continue;
                }
                rows.put(rowKey(row, origin, lineNo), MAPPER.writeValueAsString(row));
                accepted++;
            }
        }
        return accepted;
    }

    private static Instant timestamp(JsonNode row, Path file, int lineNo, List<String> errors) {
        JsonNode ts = row.get(FIELD_TIMESTAMP);
        if (ts == null || ts.isNull()) {
            errors.add(file.getFileName() + ":" + lineNo + ": нет поля " + FIELD_TIMESTAMP);
            return null;
        }
        try {
            return Instant.parse(ts.asText());
        } catch (DateTimeParseException e) {
            errors.add(file.getFileName() + ":" + lineNo + ": некорректный " + FIELD_TIMESTAMP + " '" + ts.asText() + "'");
            return null;
        }
    }

    private static String rowKey(JsonNode row, String origin, int lineNo) {
        JsonNode pk = row.get(FIELD_PARTITION_KEY);
        JsonNode rk = row.get(FIELD_ROW_KEY);
        if (pk != null && rk != null) {
            return "k:" + pk.asText() + '\u0000' + rk.asText();
        }
        return "l:" + origin + ':' + lineNo;
    }

    static long deadlineAfter(Duration timeout) {
        long budget = timeout.compareTo(MAX_BUDGET) > 0 ? MAX_BUDGET.toNanos() : Math.max(0L, timeout.toNanos());
        return System.nanoTime() + budget;
    }

    /**
     * @throws InterruptedIOException если поток прерван (флаг прерывания восстанавливается)
     *                                или срок копирования истёк
     */
    static void checkNotAborted(long deadline) throws InterruptedIOException {
        if (Thread.interrupted()) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("поток копирования прерван");
        }
        if (System.nanoTime() - deadline >= 0) {
            throw new InterruptedIOException("истёк срок копирования");
        }
    }

    private static void writeAtomically(Path dst, Iterable<String> lines, long deadline) throws IOException {
        checkNotAborted(deadline);
        Path tmp = Files.createTempFile(dst.getParent(), dst.getFileName().toString(), ".tmp");
        try {
            try (BufferedWriter w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                for (String line : lines) {
                    w.write(line);
                    w.newLine();
                }
            }
            checkNotAborted(deadline);
            Files.move(tmp, dst, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    /**
     * Задача копирования для исполнителя. Результат выдаётся через {@link #result};
     * его отмена отменяет задачу и прерывает поток, в котором она идёт.
     */
    private static final class CopyTask extends FutureTask<CopyResult> {

        final CompletableFuture<CopyResult> result = new CompletableFuture<CopyResult>() {
            @Override
            public boolean cancel(boolean mayInterruptIfRunning) {
                boolean cancelled = super.cancel(mayInterruptIfRunning);
                CopyTask.this.cancel(true);
                return cancelled;
            }
        };

        CopyTask(Callable<CopyResult> body) {
            super(body);
        }

        @Override
        protected void done() {
            if (isCancelled()) {
                result.completeExceptionally(new CancellationException("Копирование отменено"));
                return;
            }
            try {
                result.complete(get());
            } catch (ExecutionException e) {
                result.completeExceptionally(e.getCause() == null ? e : e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                result.completeExceptionally(e);
            }
        }
    }
}
