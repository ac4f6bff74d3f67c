package kz.qazmarka.orch.util;

import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Необязательный канал прогресса для вызывающего кода (консоль, UI, журнал задачи).
 * Сбой колбэка никогда не прерывает основной путь: исключение логируется в запасной канал и гасится.
 */
public final class ProgressReporter {

    private static final Logger LOG = LoggerFactory.getLogger(ProgressReporter.class);

    private static final ProgressReporter SILENT = new ProgressReporter(null);

    private final Consumer<String> callback;

    private ProgressReporter(Consumer<String> callback) {
        this.callback = callback;
    }

    /**
     * @param callback приёмник сообщений; {@code null}: отчёты только в DEBUG-журнал
     */
    public static ProgressReporter of(Consumer<String> callback) {
        return callback == null ? SILENT : new ProgressReporter(callback);
    }

    public static ProgressReporter silent() {
        return SILENT;
    }

    public void report(String message) {
        if (callback == null) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("{}", message);
            }
            return;
        }
        try {
            callback.accept(message);
        } catch (RuntimeException e) {
            LOG.warn("Колбэк прогресса завершился ошибкой, сообщение '{}' записано только в журнал: {}",
                    message, e.getMessage());
            if (LOG.isDebugEnabled()) {
                LOG.debug("Трассировка ошибки колбэка прогресса", e);
            }
        }
    }

    public void report(String format, Object... args) {
        report(String.format(format, args));
    }
}
