package kz.qazmarka.orch.backup;

import kz.qazmarka.orch.util.Parsers;

/** Режим копирования таблицы. */
public enum BackupMode {
    /** Полная копия без фильтра по времени. */
    FULL,
    /** Только строки, изменённые после последнего успешного прогона. */
    INCREMENTAL;

    /**
     * Разбирает значение конфигурации ({@code full}/{@code incremental}, регистр не важен).
     *
     * @throws IllegalArgumentException для нераспознанного значения
     */
    public static BackupMode parse(String raw) {
        String v = Parsers.lower(raw);
        if ("full".equals(v)) {
            return FULL;
        }
        if ("incremental".equals(v)) {
            return INCREMENTAL;
        }
        throw new IllegalArgumentException("Неизвестный режим бэкапа: '" + raw + "' (ожидается full|incremental)");
    }
}
