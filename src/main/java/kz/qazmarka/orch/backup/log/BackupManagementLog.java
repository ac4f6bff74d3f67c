package kz.qazmarka.orch.backup.log;

import java.util.List;
import java.util.function.Predicate;

import kz.qazmarka.orch.backup.BackupRecord;

/**
 * Долговечный журнал прогонов бэкапа: единственный источник истины для планировщика.
 *
 * Записи адресуются парой (ключ партиции = исходная таблица, ключ строки = момент старта + id).
 * Реализации не кэшируют состояние между вызовами: несколько планировщиков могут работать
 * с одним журналом одновременно.
 */
public interface BackupManagementLog {

    /**
     * Добавляет новую запись.
     *
     * @throws IllegalStateException если запись с таким ключом уже есть
     */
    void insert(BackupRecord record);

    /** Вставляет запись или заменяет существующую с тем же ключом. */
    void upsert(BackupRecord record);

    /** Записи, удовлетворяющие предикату, по убыванию {@code backupStartedAt}. */
    List<BackupRecord> query(Predicate<BackupRecord> predicate);

    /** История прогонов по исходной таблице, самые свежие первыми. */
    default List<BackupRecord> history(String sourceTableName) {
        return query(r -> r.getSourceTableName().equals(sourceTableName));
    }

    /** Самая свежая запись по исходной таблице или {@code null}. */
    default BackupRecord latestFor(String sourceTableName) {
        List<BackupRecord> h = history(sourceTableName);
        return h.isEmpty() ? null : h.get(0);
    }

    /**
     * Удаляет журнал целиком.
     *
     * @return {@code true}, если журнал существовал
     */
    boolean deleteIfExists();
}
