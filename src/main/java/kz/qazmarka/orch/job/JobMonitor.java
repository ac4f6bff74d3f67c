package kz.qazmarka.orch.job;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.orch.util.ProgressReporter;
import kz.qazmarka.orch.util.Sleeper;

/**
 * Опрашивает задачи задания с фиксированным интервалом до их завершения.
 *
 * Когда минимальное состояние задач продвигается, в канал прогресса уходит сообщение
 * «все задачи достигли состояния X». По истечении таймаута незавершённое задание прерывается
 * через {@link JobOperations#terminate(String)} и бросается {@link JobTimeoutException}.
 */
public final class JobMonitor {

    private static final Logger LOG = LoggerFactory.getLogger(JobMonitor.class);

    /** Интервал опроса по умолчанию. */
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(30);

    private final JobOperations operations;
    private final Duration pollInterval;
    private final Clock clock;
    private final Sleeper sleeper;
    private ProgressReporter reporter = ProgressReporter.silent();

    public JobMonitor(JobOperations operations, Duration pollInterval) {
        this(operations, pollInterval, Clock.systemUTC(), Sleeper.THREAD);
    }

    public JobMonitor(JobOperations operations, Duration pollInterval, Clock clock, Sleeper sleeper) {
        this.operations = Objects.requireNonNull(operations, "operations");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("Интервал опроса должен быть положительным: " + pollInterval);
        }
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /** Задаёт необязательный приёмник сообщений о прогрессе. */
    public void reportOn(Consumer<String> action) {
        this.reporter = ProgressReporter.of(action);
    }

    /**
     * Ждёт завершения всех задач задания.
     *
     * @throws JobTimeoutException   если задание не завершилось за {@code timeout}
     * @throws IllegalStateException если ожидание прервано
     */
    public JobOutcome await(String jobId, Duration timeout) {
        Instant start = clock.instant();
        TaskState reached = null;
        while (true) {
            List<TaskStatus> tasks = operations.listTasks(jobId);
            TaskState min = minState(tasks);
            if (min != null && (reached == null || min.compareTo(reached) > 0)) {
                reached = min;
                reporter.report("Все задачи задания %s достигли состояния %s", jobId, min);
            }
            Duration elapsed = Duration.between(start, clock.instant());
            if (min == TaskState.COMPLETED) {
                JobOutcome outcome = new JobOutcome(jobId, tasks, elapsed);
                LOG.info("Задание {} завершено: {}", jobId, outcome);
                return outcome;
            }
            if (elapsed.compareTo(timeout) >= 0) {
                LOG.warn("Задание {} не завершилось за {}, прерываю: {}", jobId, timeout, summary(tasks));
                operations.terminate(jobId);
                throw new JobTimeoutException(jobId, timeout, tasks);
            }
            if (LOG.isDebugEnabled()) {
                LOG.debug("Задание {}: {}, прошло {}", jobId, summary(tasks), elapsed);
            }
            try {
                sleeper.sleep(pollInterval.toMillis());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Ожидание задания '" + jobId + "' прервано", ie);
            }
        }
    }

    /** Минимальное состояние задач; {@code null}, если задач пока нет. */
    static TaskState minState(List<TaskStatus> tasks) {
        TaskState min = null;
        for (TaskStatus t : tasks) {
            if (min == null || t.getState().compareTo(min) < 0) {
                min = t.getState();
            }
        }
        return min;
    }

    private static Map<TaskState, Integer> summary(List<TaskStatus> tasks) {
        Map<TaskState, Integer> counts = new EnumMap<>(TaskState.class);
        for (TaskStatus t : tasks) {
            counts.merge(t.getState(), 1, Integer::sum);
        }
        return counts;
    }
}
