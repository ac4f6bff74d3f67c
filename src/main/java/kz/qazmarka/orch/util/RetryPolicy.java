package kz.qazmarka.orch.util;

import java.util.concurrent.Callable;
import java.util.function.BooleanSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ограниченный повтор удалённых вызовов: фиксированное число попыток и задержка между ними
 * (опционально с джиттером). Исключение внутри попытки считается неуспешной попыткой.
 *
 * Экземпляр иммутабелен и потокобезопасен: одну политику разделяют параллельные ветки emit.
 */
public final class RetryPolicy {

    private static final Logger LOG = LoggerFactory.getLogger(RetryPolicy.class);

    /** Число попыток по умолчанию для API управления брокером. */
    public static final int DEFAULT_MAX_ATTEMPTS = 5;
    /** Задержка между попытками по умолчанию (мс). */
    public static final long DEFAULT_DELAY_MS = 500L;

    private final int maxAttempts;
    private final long delayMs;
    private final BackoffPolicy backoff;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, long delayMs, int jitterPercent) {
        this(maxAttempts, delayMs, jitterPercent, Sleeper.THREAD);
    }

    RetryPolicy(int maxAttempts, long delayMs, int jitterPercent, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts должен быть >= 1, получено: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.delayMs = Math.max(0L, delayMs);
        this.backoff = new BackoffPolicy(0L, jitterPercent);
        this.sleeper = sleeper;
    }

    /** Политика 5 попыток × 500 мс без джиттера. */
    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_DELAY_MS, 0);
    }

    /** Политика без задержек: для тестов и локальных заглушек. */
    public static RetryPolicy immediate(int maxAttempts) {
        return new RetryPolicy(maxAttempts, 0L, 0);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public long delayMs() {
        return delayMs;
    }

    /**
     * Выполняет попытку до успеха ({@code true}) или исчерпания лимита.
     * После исчерпания пишет WARN и возвращает {@code false}: вызывающий код продолжает работу.
     *
     * @param description краткое описание операции для журнала
     * @param attempt     попытка; {@code false} или исключение означают неуспех
     * @return {@code true}, если одна из попыток завершилась успешно
     */
    public boolean run(String description, BooleanSupplier attempt) {
        RuntimeException last = null;
        for (int i = 1; i <= maxAttempts; i++) {
            try {
                if (attempt.getAsBoolean()) {
                    return true;
                }
            } catch (RuntimeException e) {
                last = e;
                if (LOG.isDebugEnabled()) {
                    LOG.debug("Попытка {}/{} '{}' завершилась ошибкой", i, maxAttempts, description, e);
                }
            }
            if (i < maxAttempts && !pause()) {
                LOG.warn("Повторы '{}' прерваны после {} попыток", description, i);
                return false;
            }
        }
        LOG.warn("Операция '{}' не выполнена за {} попыток, отказываюсь: {}",
                description, maxAttempts, last == null ? "попытка вернула false" : last.getMessage());
        return false;
    }

    /**
     * Вызывает операцию с повторами и возвращает её результат.
     *
     * @throws Exception последняя ошибка операции, если все попытки неуспешны
     */
    public <T> T call(String description, Callable<T> op) throws Exception {
        Exception last = null;
        for (int i = 1; i <= maxAttempts; i++) {
            try {
                return op.call();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw ie;
            } catch (Exception e) {
                last = e;
                if (LOG.isDebugEnabled()) {
                    LOG.debug("Попытка {}/{} '{}' завершилась ошибкой", i, maxAttempts, description, e);
                }
            }
            if (i < maxAttempts && !pause()) {
                throw new InterruptedException("Повторы '" + description + "' прерваны");
            }
        }
        LOG.warn("Операция '{}' не выполнена за {} попыток: {}", description, maxAttempts, last.getMessage());
        throw last;
    }

    /** @return {@code false}, если поток прерван во время ожидания. */
    private boolean pause() {
        long d = backoff.nextDelayMillis(delayMs);
        if (d <= 0L) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            sleeper.sleep(d);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxAttempts=" + maxAttempts + ", delayMs=" + delayMs + '}';
    }
}
