package kz.qazmarka.orch.backup;

import java.util.Objects;

/**
 * Решение планировщика для одной таблицы на текущий цикл.
 */
public final class BackupPlan {

    /** Что делать в этом цикле. */
    public enum Action {
        RUN,
        SKIP_NOT_DUE,
        SKIP_IN_PROGRESS
    }

    private final Action action;
    private final String targetAccount;
    private final boolean newTarget;
    private final BackupMode mode;
    private final TimestampFilter filter;
    private final BackupReturnCode returnCode;
    private final BackupRecord lastRecord;

    private BackupPlan(Action action,
                       String targetAccount,
                       boolean newTarget,
                       BackupMode mode,
                       TimestampFilter filter,
                       BackupReturnCode returnCode,
                       BackupRecord lastRecord) {
        this.action = action;
        this.targetAccount = targetAccount;
        this.newTarget = newTarget;
        this.mode = mode;
        this.filter = filter;
        this.returnCode = returnCode;
        this.lastRecord = lastRecord;
    }

    static BackupPlan run(String targetAccount,
                          boolean newTarget,
                          BackupMode mode,
                          TimestampFilter filter,
                          BackupReturnCode returnCode,
                          BackupRecord lastRecord) {
        Objects.requireNonNull(targetAccount, "targetAccount");
        return new BackupPlan(Action.RUN, targetAccount, newTarget, mode, filter, returnCode, lastRecord);
    }

    static BackupPlan notDue(BackupRecord lastRecord) {
        return new BackupPlan(Action.SKIP_NOT_DUE, null, false, null, null, BackupReturnCode.NOP, lastRecord);
    }

    static BackupPlan inProgress(BackupRecord lastRecord) {
        return new BackupPlan(Action.SKIP_IN_PROGRESS, null, false, null, null, BackupReturnCode.IN_PROGRESS, lastRecord);
    }

    public Action getAction() {
        return action;
    }

    public boolean isRun() {
        return action == Action.RUN;
    }

    /** Целевой аккаунт; {@code null} для пропуска. */
    public String getTargetAccount() {
        return targetAccount;
    }

    /** {@code true}, если аккаунт выделяется заново (первый прогон или смена цели). */
    public boolean isNewTarget() {
        return newTarget;
    }

    /** Фактический режим копирования; {@code null} для пропуска. */
    public BackupMode getMode() {
        return mode;
    }

    /** Фильтр источника; {@code null} для полной копии. */
    public TimestampFilter getFilter() {
        return filter;
    }

    public BackupReturnCode getReturnCode() {
        return returnCode;
    }

    /** Самая свежая запись журнала по таблице; {@code null} для первого прогона. */
    public BackupRecord getLastRecord() {
        return lastRecord;
    }

    @Override
    public String toString() {
        return "BackupPlan{action=" + action
                + ", target=" + targetAccount
                + ", newTarget=" + newTarget
                + ", mode=" + mode
                + ", filter=" + filter
                + ", returnCode=" + returnCode + '}';
    }
}
