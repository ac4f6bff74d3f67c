package kz.qazmarka.orch.backup;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.orch.backup.log.BackupManagementLog;
import kz.qazmarka.orch.backup.storage.BackupStorage;
import kz.qazmarka.orch.backup.storage.CopyRequest;
import kz.qazmarka.orch.backup.storage.CopyResult;
import kz.qazmarka.orch.backup.storage.TableCopier;
import kz.qazmarka.orch.util.ProgressReporter;

/**
 * Выполняет цикл бэкапа по таблицам.
 *
 * Для каждой таблицы журнал перечитывается заново, решение принимает {@link BackupScheduler}.
 * До создания аккаунта и копирования в журнал вставляется запись {@link BackupStatus#IN_PROGRESS};
 * после копирования или сбоя хранилища она заменяется итоговой, в том числе при неуспехе,
 * чтобы следующий цикл видел точную историю.
 */
public final class BackupRunner {

    private static final Logger LOG = LoggerFactory.getLogger(BackupRunner.class);

    private final BackupManagementLog log;
    private final BackupStorage storage;
    private final TableCopier copier;
    private final BackupScheduler scheduler;
    private final Clock clock;
    private ProgressReporter reporter = ProgressReporter.silent();

    public BackupRunner(BackupManagementLog log,
                        BackupStorage storage,
                        TableCopier copier,
                        BackupTargetNaming naming,
                        Clock clock) {
        this.log = Objects.requireNonNull(log, "log");
        this.storage = Objects.requireNonNull(storage, "storage");
        this.copier = Objects.requireNonNull(copier, "copier");
        this.scheduler = new BackupScheduler(naming);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Задаёт необязательный приёмник сообщений о прогрессе. */
    public void reportOn(Consumer<String> action) {
        this.reporter = ProgressReporter.of(action);
    }

    /**
     * Обрабатывает все таблицы; ошибка одной таблицы не останавливает остальные.
     *
     * @return по результату на каждую настройку, в исходном порядке
     */
    public List<BackupResult> runAll(List<TableBackupSetup> setups) {
        List<BackupResult> out = new ArrayList<>(setups.size());
        for (TableBackupSetup setup : setups) {
            try {
                out.add(run(setup));
            } catch (BackupFailedException e) {
                out.add(BackupResult.error(setup, e.getErrors()));
            } catch (RuntimeException e) {
                LOG.warn("Бэкап таблицы '{}' прерван ошибкой: {}", setup.getSourceTable(), e.toString());
                if (LOG.isDebugEnabled()) {
                    LOG.debug("Трассировка ошибки бэкапа таблицы '{}'", setup.getSourceTable(), e);
                }
                out.add(BackupResult.error(setup, Collections.singletonList(String.valueOf(e.getMessage()))));
            }
        }
        return out;
    }

    /**
     * Обрабатывает одну таблицу.
     *
     * @throws BackupFailedException если копирование неуспешно или не уложилось в таймаут
     * @throws UnexpectedTargetNameException если в журнале аккаунт с именем не по схеме
     */
    public BackupResult run(TableBackupSetup setup) {
        String source = setup.getSourceTable();
        Instant now = clock.instant();
        BackupPlan plan = scheduler.plan(setup, log.history(source), now);
        if (!plan.isRun()) {
            LOG.info("Бэкап таблицы '{}' пропущен: {} (последний прогон: {})", source, plan.getAction(), plan.getLastRecord());
            return BackupResult.skipped(setup, plan);
        }

        String account = plan.getTargetAccount();
        TimestampFilter filter = plan.getFilter();
        BackupRecord started = BackupRecord.started(source, account, source, now, plan.getMode(),
                filter == null ? null : filter.toQuery());
        log.insert(started);
        try {
            if (storage.createAccountIfNotExists(account)) {
                reporter.report("Создан аккаунт бэкапа " + account);
            }
        } catch (RuntimeException e) {
            List<String> errors = Collections.singletonList("Аккаунт " + account + " не создан: " + e.getMessage());
            log.upsert(started.finish(clock.instant(), BackupStatus.FAILURE, errors.get(0)));
            throw new BackupFailedException(source, errors, e);
        }
        reporter.report("Копирую %s в %s/%s (%s)", source, account, source, plan.getMode());

        CopyRequest request = new CopyRequest(source, account, source, filter, setup.getTimeout());
        CopyResult result = awaitCopy(request);

        BackupStatus status = result.isSuccess() ? BackupStatus.SUCCESS : BackupStatus.FAILURE;
        String message = result.isSuccess() ? null : String.join("; ", result.getErrors());
        log.upsert(started.finish(clock.instant(), status, message));

        if (!result.isSuccess()) {
            LOG.warn("Бэкап таблицы '{}' в {} неуспешен: {}", source, account, result.getErrors());
            throw new BackupFailedException(source, result.getErrors());
        }
        LOG.info("Бэкап таблицы '{}' выполнен: {} в {}, строк {}", source, plan.getReturnCode(), account,
                result.getRowsCopied());
        reporter.report("Таблица %s скопирована: строк %d", source, result.getRowsCopied());
        return BackupResult.done(setup, plan, source, result.getRowsCopied());
    }

    private CopyResult awaitCopy(CopyRequest request) {
        CompletableFuture<CopyResult> future;
        try {
            future = copier.copy(request);
        } catch (RuntimeException e) {
            return CopyResult.failure(0L, Collections.singletonList("Копирование не запущено: " + e.getMessage()));
        }
        try {
            CopyResult r = future.get(request.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
            return r != null ? r : CopyResult.failure(0L, Collections.singletonList("Копировщик вернул пустой результат"));
        } catch (TimeoutException e) {
            future.cancel(true);
            return CopyResult.failure(0L, Collections.singletonList(
                    "Копирование не завершилось за " + request.getTimeout()));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return CopyResult.failure(0L, Collections.singletonList("Копирование упало: " + cause));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return CopyResult.failure(0L, Collections.singletonList("Ожидание копирования прервано"));
        }
    }
}
