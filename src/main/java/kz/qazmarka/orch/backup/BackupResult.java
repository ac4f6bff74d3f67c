package kz.qazmarka.orch.backup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** Результат обработки одной таблицы в цикле бэкапа. */
public final class BackupResult {

    private final TableBackupSetup setup;
    private final BackupReturnCode returnCode;
    private final String targetAccount;
    private final String targetTable;
    private final long rowsCopied;
    private final List<String> errors;

    private BackupResult(TableBackupSetup setup,
                         BackupReturnCode returnCode,
                         String targetAccount,
                         String targetTable,
                         long rowsCopied,
                         List<String> errors) {
        this.setup = Objects.requireNonNull(setup, "setup");
        this.returnCode = Objects.requireNonNull(returnCode, "returnCode");
        this.targetAccount = targetAccount;
        this.targetTable = targetTable;
        this.rowsCopied = rowsCopied;
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    static BackupResult done(TableBackupSetup setup, BackupPlan plan, String targetTable, long rowsCopied) {
        return new BackupResult(setup, plan.getReturnCode(), plan.getTargetAccount(), targetTable, rowsCopied,
                Collections.<String>emptyList());
    }

    static BackupResult skipped(TableBackupSetup setup, BackupPlan plan) {
        return new BackupResult(setup, plan.getReturnCode(), null, null, 0L, Collections.<String>emptyList());
    }

    static BackupResult error(TableBackupSetup setup, List<String> errors) {
        return new BackupResult(setup, BackupReturnCode.ERROR, null, null, 0L, errors);
    }

    public TableBackupSetup getSetup() {
        return setup;
    }

    public BackupReturnCode getReturnCode() {
        return returnCode;
    }

    /** Аккаунт, в который шла копия; {@code null} для пропуска и ошибки. */
    public String getTargetAccount() {
        return targetAccount;
    }

    public String getTargetTable() {
        return targetTable;
    }

    public long getRowsCopied() {
        return rowsCopied;
    }

    public List<String> getErrors() {
        return errors;
    }

    @Override
    public String toString() {
        return "BackupResult{source=" + setup.getSourceTable()
                + ", code=" + returnCode
                + (targetAccount == null ? "" : ", target=" + targetAccount + '/' + targetTable)
                + ", rows=" + rowsCopied
                + (errors.isEmpty() ? "" : ", errors=" + errors) + '}';
    }
}
