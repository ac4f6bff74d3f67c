package kz.qazmarka.orch.backup;

/** Статус записи журнала бэкапов. */
public enum BackupStatus {
    SUCCESS,
    FAILURE,
    /** Прогон начат, итог ещё не записан (или процесс упал посередине). */
    IN_PROGRESS
}
