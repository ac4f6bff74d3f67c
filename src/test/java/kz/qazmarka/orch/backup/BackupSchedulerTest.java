package kz.qazmarka.orch.backup;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Тесты {@link BackupScheduler}: чистой функции решения по истории журнала.
 *
 * Расписание во всех тестах: инкремент раз в час, новый аккаунт раз в 7 дней, таймаут прогона час.
 * Текущий момент: 2024-03-10T12:00Z.
 */
class BackupSchedulerTest {

    static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");
    static final String TODAY = "bkp-2024-03-10";

    private final BackupScheduler scheduler = new BackupScheduler(new BackupTargetNaming("bkp"));

    static TableBackupSetup setup(BackupMode mode) {
        return new TableBackupSetup("orders",
                new BackupSchedule(Duration.ofHours(1), Duration.ofDays(7), Duration.ofDays(30)),
                mode, Duration.ofHours(1));
    }

    static BackupRecord record(String account, Instant started, BackupStatus status) {
        Instant finished = status == BackupStatus.IN_PROGRESS ? null : started.plusSeconds(60);
        return new BackupRecord(UUID.randomUUID().toString(), "orders", account, "orders", started, started,
                finished, status, BackupMode.INCREMENTAL, null, null);
    }

    @Test
    @DisplayName("Истории нет: полная копия в новый аккаунт с сегодняшней датой")
    void firstBackup() {
        BackupPlan plan = scheduler.plan(setup(BackupMode.INCREMENTAL), Collections.<BackupRecord>emptyList(), NOW);

        assertTrue(plan.isRun());
        assertEquals(TODAY, plan.getTargetAccount());
        assertTrue(plan.isNewTarget());
        assertEquals(BackupMode.FULL, plan.getMode());
        assertNull(plan.getFilter());
        assertEquals(BackupReturnCode.FIRST_BACKUP_DONE, plan.getReturnCode());
    }

    @Test
    @DisplayName("Последний прогон моложе частоты инкремента: пропуск без действий")
    void notDue() {
        BackupRecord last = record(TODAY, NOW.minus(Duration.ofMinutes(30)), BackupStatus.SUCCESS);

        BackupPlan plan = scheduler.plan(setup(BackupMode.INCREMENTAL), Collections.singletonList(last), NOW);

        assertFalse(plan.isRun());
        assertEquals(BackupPlan.Action.SKIP_NOT_DUE, plan.getAction());
        assertEquals(BackupReturnCode.NOP, plan.getReturnCode());
        assertSame(last, plan.getLastRecord());
    }

    @Test
    @DisplayName("Неуспешный прогон тоже сдвигает время следующего запуска")
    void failedRunAlsoGatesSchedule() {
        BackupRecord failed = record(TODAY, NOW.minus(Duration.ofMinutes(10)), BackupStatus.FAILURE);
        BackupPlan plan = scheduler.plan(setup(BackupMode.INCREMENTAL), Collections.singletonList(failed), NOW);
        assertEquals(BackupPlan.Action.SKIP_NOT_DUE, plan.getAction());
    }

    @Test
    @DisplayName("Незавершённый прогон моложе таймаута: пропуск со статусом IN_PROGRESS")
    void inProgress() {
        BackupRecord running = record(TODAY, NOW.minus(Duration.ofMinutes(20)), BackupStatus.IN_PROGRESS);

        BackupPlan plan = scheduler.plan(setup(BackupMode.INCREMENTAL), Collections.singletonList(running), NOW);

        assertEquals(BackupPlan.Action.SKIP_IN_PROGRESS, plan.getAction());
        assertEquals(BackupReturnCode.IN_PROGRESS, plan.getReturnCode());
    }

    @Test
    @DisplayName("Незавершённый прогон старше таймаута считается неуспешным: якорь: прошлый успех")
    void staleInProgressIsTreatedAsFailed() {
        BackupRecord success = record(TODAY, Instant.parse("2024-03-10T08:00:00Z"), BackupStatus.SUCCESS);
        BackupRecord stale = record(TODAY, Instant.parse("2024-03-10T10:00:00Z"), BackupStatus.IN_PROGRESS);

        BackupPlan plan = scheduler.plan(setup(BackupMode.INCREMENTAL), Arrays.asList(stale, success), NOW);

        assertTrue(plan.isRun());
        assertEquals(BackupMode.INCREMENTAL, plan.getMode());
        assertEquals(success.getBackupStartedAt(), plan.getFilter().after());
        assertSame(stale, plan.getLastRecord());
    }

    @Test
    @DisplayName("Инкремент в тот же аккаунт с фильтром от начала последнего успешного прогона")
    void incrementalIntoExistingAccount() {
        String account = "bkp-2024-03-08";
        BackupRecord older = record(account, Instant.parse("2024-03-09T09:00:00Z"), BackupStatus.SUCCESS);
        BackupRecord anchor = record(account, Instant.parse("2024-03-10T09:00:00Z"), BackupStatus.SUCCESS);
        BackupRecord failed = record(account, Instant.parse("2024-03-10T10:00:00Z"), BackupStatus.FAILURE);
        List<BackupRecord> history = new ArrayList<>(Arrays.asList(older, failed, anchor));

        BackupPlan plan = scheduler.plan(setup(BackupMode.INCREMENTAL), history, NOW);

        assertTrue(plan.isRun());
        assertEquals(account, plan.getTargetAccount());
        assertFalse(plan.isNewTarget());
        assertEquals(BackupMode.INCREMENTAL, plan.getMode());
        assertEquals("Timestamp gt datetime'2024-03-10T09:00:00Z'", plan.getFilter().toQuery());
        assertEquals(BackupReturnCode.BACKUP_TO_EXISTING_CONTAINER_DONE, plan.getReturnCode());
    }

    @Test
    @DisplayName("Успешных прогонов в аккаунт нет: полная копия в тот же аккаунт")
    void noSuccessAnchorFallsBackToFull() {
        BackupRecord failed = record(TODAY, NOW.minus(Duration.ofHours(2)), BackupStatus.FAILURE);

        BackupPlan plan = scheduler.plan(setup(BackupMode.INCREMENTAL), Collections.singletonList(failed), NOW);

        assertEquals(TODAY, plan.getTargetAccount());
        assertEquals(BackupMode.FULL, plan.getMode());
        assertNull(plan.getFilter());
        assertEquals(BackupReturnCode.BACKUP_TO_EXISTING_CONTAINER_DONE, plan.getReturnCode());
    }

    @Test
    @DisplayName("Режим FULL: копия в тот же аккаунт без фильтра")
    void fullModeNeverFilters() {
        BackupRecord success = record(TODAY, NOW.minus(Duration.ofHours(2)), BackupStatus.SUCCESS);
        BackupPlan plan = scheduler.plan(setup(BackupMode.FULL), Collections.singletonList(success), NOW);
        assertEquals(BackupMode.FULL, plan.getMode());
        assertNull(plan.getFilter());
        assertFalse(plan.isNewTarget());
    }

    @Test
    @DisplayName("Аккаунт старше частоты смены: полная копия в новый аккаунт")
    void switchesToNewAccount() {
        BackupRecord success = record("bkp-2024-03-02", NOW.minus(Duration.ofHours(2)), BackupStatus.SUCCESS);

        BackupPlan plan = scheduler.plan(setup(BackupMode.INCREMENTAL), Collections.singletonList(success), NOW);

        assertEquals(TODAY, plan.getTargetAccount());
        assertTrue(plan.isNewTarget());
        assertEquals(BackupMode.FULL, plan.getMode());
        assertEquals(BackupReturnCode.BACKUP_TO_NEW_CONTAINER_DONE, plan.getReturnCode());
    }

    @Test
    @DisplayName("Аккаунт последнего прогона назван не по схеме: ошибка, а не подстановка даты")
    void malformedAccountIsFatal() {
        BackupRecord weird = record("backup2024", NOW.minus(Duration.ofHours(2)), BackupStatus.SUCCESS);
        assertThrows(UnexpectedTargetNameException.class,
                () -> scheduler.plan(setup(BackupMode.INCREMENTAL), Collections.singletonList(weird), NOW));
    }
}
