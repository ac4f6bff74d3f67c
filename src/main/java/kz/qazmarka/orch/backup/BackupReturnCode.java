package kz.qazmarka.orch.backup;

/** Итог одного прогона бэкапа для таблицы. */
public enum BackupReturnCode {
    /** Первый в истории прогон: полная копия в новый аккаунт. */
    FIRST_BACKUP_DONE,
    /** Истёк срок смены цели: полная копия в новый аккаунт с сегодняшней датой. */
    BACKUP_TO_NEW_CONTAINER_DONE,
    /** Копия (инкрементальная или полная) в текущий аккаунт. */
    BACKUP_TO_EXISTING_CONTAINER_DONE,
    /** Бэкап ещё не нужен. */
    NOP,
    /** Предыдущий прогон ещё выполняется. */
    IN_PROGRESS,
    ERROR
}
