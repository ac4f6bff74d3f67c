package kz.qazmarka.orch.job;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Исполнитель заданий на локальной машине: пул потоков вместо пула узлов.
 *
 * Для каждой задачи создаётся рабочий каталог {@code <workRoot>/<jobId>/<taskId>}, туда копируются
 * файлы-ресурсы, команда запускается через системную оболочку, stdout/stderr пишутся в
 * {@code stdout.txt}/{@code stderr.txt}. Идентификатор пула используется только в журнале.
 */
public final class LocalJobExecutor implements JobExecutor, JobOperations, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(LocalJobExecutor.class);

    private final Path workRoot;
    private final ExecutorService pool;
    private final Map<String, List<LocalTask>> jobs = new ConcurrentHashMap<>();

    public LocalJobExecutor(Path workRoot, int parallelism) {
        this.workRoot = Objects.requireNonNull(workRoot, "workRoot");
        AtomicInteger seq = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(Math.max(1, parallelism), r -> {
            Thread th = new Thread(r, "orch-job-" + seq.incrementAndGet());
            th.setDaemon(true);
            return th;
        });
    }

    @Override
    public void submit(JobSubmission submission) {
        String jobId = submission.getJobId();
        List<LocalTask> tasks = new ArrayList<>(submission.getTaskCommands().size());
        int n = 0;
        for (String command : submission.getTaskCommands()) {
            tasks.add(new LocalTask("task-" + (++n), command));
        }
        if (jobs.putIfAbsent(jobId, Collections.unmodifiableList(tasks)) != null) {
            throw new IllegalStateException("Задание '" + jobId + "' уже существует");
        }
        LOG.info("Задание {} поставлено в пул {}: задач {}", jobId, submission.getPoolId(), tasks.size());
        for (LocalTask t : tasks) {
            t.future = pool.submit(() -> runTask(jobId, t, submission.getResourceFiles()));
        }
    }

    @Override
    public List<TaskStatus> listTasks(String jobId) {
        List<LocalTask> tasks = jobs.get(jobId);
        if (tasks == null) {
            return Collections.emptyList();
        }
        List<TaskStatus> out = new ArrayList<>(tasks.size());
        for (LocalTask t : tasks) {
            out.add(t.snapshot());
        }
        return out;
    }

    @Override
    public void terminate(String jobId) {
        List<LocalTask> tasks = jobs.get(jobId);
        if (tasks == null) {
            return;
        }
        for (LocalTask t : tasks) {
            t.terminate();
        }
        LOG.info("Задание {} прервано", jobId);
    }

    @Override
    public void close() {
        for (String jobId : jobs.keySet()) {
            terminate(jobId);
        }
        pool.shutdownNow();
    }

    private void runTask(String jobId, LocalTask task, List<String> resourceFiles) {
        if (!task.advance(TaskState.PREPARING)) {
            return;
        }
        Path dir = workRoot.resolve(jobId).resolve(task.id);
        try {
            Files.createDirectories(dir);
            for (String resource : resourceFiles) {
                Path src = Paths.get(resource);
                Files.copy(src, dir.resolve(src.getFileName()), StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            task.fail("Подготовка ресурсов не удалась: " + e);
            return;
        }
        if (!task.advance(TaskState.RUNNING)) {
            return;
        }
        try {
            Process p = new ProcessBuilder(shell(task.command))
                    .directory(dir.toFile())
                    .redirectOutput(dir.resolve("stdout.txt").toFile())
                    .redirectError(dir.resolve("stderr.txt").toFile())
                    .start();
            task.process = p;
            int code = p.waitFor();
            task.complete(code);
            if (LOG.isDebugEnabled()) {
                LOG.debug("Задача {}/{} завершена с кодом {}", jobId, task.id, code);
            }
        } catch (IOException e) {
            task.fail("Запуск команды не удался: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            task.terminate();
        }
    }

    static List<String> shell(String command) {
        boolean windows = System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win");
        return windows
                ? Arrays.asList("cmd", "/c", command)
                : Arrays.asList("/bin/sh", "-c", command);
    }

    /** Изменяемое состояние задачи; переходы под монитором задачи. */
    private static final class LocalTask {
        final String id;
        final String command;
        volatile Future<?> future;
        volatile Process process;
        private TaskState state = TaskState.ACTIVE;
        private Integer exitCode;
        private String failure;

        LocalTask(String id, String command) {
            this.id = id;
            this.command = command;
        }

        synchronized boolean advance(TaskState next) {
            if (state == TaskState.COMPLETED) {
                return false;
            }
            state = next;
            return true;
        }

        synchronized void complete(int code) {
            if (state != TaskState.COMPLETED) {
                state = TaskState.COMPLETED;
                exitCode = code;
            }
        }

        synchronized void fail(String message) {
            if (state != TaskState.COMPLETED) {
                state = TaskState.COMPLETED;
                failure = message;
            }
        }

        void terminate() {
            fail("прервана");
            Process p = process;
            if (p != null) {
                p.destroyForcibly();
            }
            Future<?> f = future;
            if (f != null) {
                f.cancel(true);
            }
        }

        synchronized TaskStatus snapshot() {
            return new TaskStatus(id, state, exitCode, failure);
        }
    }
}
