package kz.qazmarka.orch.backup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Копирование таблицы завершилось неуспехом. Содержит все сообщения копировщика; запись
 * журнала со статусом {@link BackupStatus#FAILURE} к моменту броска уже сохранена.
 */
public class BackupFailedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String sourceTable;
    private final List<String> errors;

    public BackupFailedException(String sourceTable, List<String> errors) {
        this(sourceTable, errors, null);
    }

    public BackupFailedException(String sourceTable, List<String> errors, Throwable cause) {
        super("Бэкап таблицы '" + sourceTable + "' не выполнен: " + String.join("; ", errors), cause);
        this.sourceTable = sourceTable;
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public String getSourceTable() {
        return sourceTable;
    }

    public List<String> getErrors() {
        return errors;
    }
}
