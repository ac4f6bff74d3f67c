package kz.qazmarka.orch.job;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Тесты {@link JobMonitor} на сценарии опросов: часы сдвигаются на интервал при каждом «сне»,
 * поэтому тест не ждёт реального времени.
 */
class JobMonitorTest {

    private static final Duration POLL = Duration.ofSeconds(30);

    @Test
    @DisplayName("Задание завершается: итог с кодами выхода, прогресс по мере роста минимального состояния")
    void completes() {
        ScriptedOperations ops = new ScriptedOperations(
                Collections.<TaskStatus>emptyList(),
                Arrays.asList(TaskStatus.of("task-1", TaskState.ACTIVE), TaskStatus.of("task-2", TaskState.RUNNING)),
                Arrays.asList(TaskStatus.of("task-1", TaskState.RUNNING), TaskStatus.completed("task-2", 0)),
                Arrays.asList(TaskStatus.completed("task-1", 3), TaskStatus.completed("task-2", 0)));
        TickingClock clock = new TickingClock();
        JobMonitor monitor = new JobMonitor(ops, POLL, clock, clock::sleep);
        List<String> progress = new ArrayList<>();
        monitor.reportOn(progress::add);

        JobOutcome outcome = monitor.await("job-1", Duration.ofHours(1));

        assertEquals(4, ops.polls);
        assertEquals(3, clock.sleeps);
        assertEquals(Duration.ofSeconds(90), outcome.getElapsed());
        assertEquals(Integer.valueOf(3), outcome.exitCodes().get("task-1"));
        assertEquals(Integer.valueOf(0), outcome.exitCodes().get("task-2"));
        assertEquals(1, outcome.failedTasks().size());
        assertFalse(outcome.isSuccess());
        assertEquals(3, progress.size());
        assertTrue(progress.get(2).contains("COMPLETED"));
        assertFalse(ops.terminated);
    }

    @Test
    @DisplayName("Таймаут: задание прерывается, JobTimeoutException с последним состоянием")
    void timesOut() {
        ScriptedOperations ops = new ScriptedOperations(
                Collections.singletonList(TaskStatus.of("task-1", TaskState.RUNNING)));
        TickingClock clock = new TickingClock();
        JobMonitor monitor = new JobMonitor(ops, POLL, clock, clock::sleep);

        JobTimeoutException ex = assertThrows(JobTimeoutException.class,
                () -> monitor.await("job-2", Duration.ofMinutes(2)));

        assertTrue(ops.terminated);
        assertEquals("job-2", ex.getJobId());
        assertEquals(TaskState.RUNNING, ex.getLastSeen().get(0).getState());
        assertEquals(5, ops.polls);
    }

    @Test
    @DisplayName("Прерывание ожидания: IllegalStateException и флаг interrupted")
    void interrupted() {
        ScriptedOperations ops = new ScriptedOperations(
                Collections.singletonList(TaskStatus.of("task-1", TaskState.RUNNING)));
        JobMonitor monitor = new JobMonitor(ops, POLL, new TickingClock(), ms -> {
            throw new InterruptedException("stop");
        });
        try {
            assertThrows(IllegalStateException.class, () -> monitor.await("job-3", Duration.ofHours(1)));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    @DisplayName("Неположительный интервал опроса отвергается")
    void rejectsBadInterval() {
        ScriptedOperations ops = new ScriptedOperations(Collections.<TaskStatus>emptyList());
        assertThrows(IllegalArgumentException.class, () -> new JobMonitor(ops, Duration.ZERO));
    }

    @Test
    @DisplayName("Упавшей считается задача со сбоем или ненулевым кодом")
    void failedTaskRules() {
        assertFalse(TaskStatus.completed("t", 0).isFailed());
        assertTrue(TaskStatus.completed("t", 1).isFailed());
        assertTrue(new TaskStatus("t", TaskState.COMPLETED, null, "не запустилась").isFailed());
        assertFalse(TaskStatus.of("t", TaskState.RUNNING).isFailed());
        assertEquals(TaskState.ACTIVE, JobMonitor.minState(Arrays.asList(
                TaskStatus.completed("a", 0), TaskStatus.of("b", TaskState.ACTIVE))));
    }

    /** Отдаёт снимки по очереди, последний повторяется. */
    private static final class ScriptedOperations implements JobOperations {
        private final List<List<TaskStatus>> script;
        int polls;
        boolean terminated;

        @SafeVarargs
        ScriptedOperations(List<TaskStatus>... snapshots) {
            this.script = Arrays.asList(snapshots);
        }

        @Override
        public List<TaskStatus> listTasks(String jobId) {
            int i = Math.min(polls, script.size() - 1);
            polls++;
            return script.get(i);
        }

        @Override
        public void terminate(String jobId) {
            terminated = true;
        }
    }

    private static final class TickingClock extends Clock {
        private Instant now = Instant.parse("2024-03-10T06:00:00Z");
        int sleeps;

        void sleep(long millis) {
            sleeps++;
            now = now.plusMillis(millis);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
