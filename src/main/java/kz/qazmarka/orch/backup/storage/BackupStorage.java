package kz.qazmarka.orch.backup.storage;

import java.util.List;

/**
 * Целевое хранилище бэкапов: аккаунты, внутри которых лежат таблицы-копии.
 */
public interface BackupStorage {

    List<String> listAccounts();

    boolean accountExists(String account);

    /** @return {@code true}, если аккаунт был создан этим вызовом */
    boolean createAccountIfNotExists(String account);

    /** Таблицы аккаунта; пустой список для несуществующего аккаунта. */
    List<String> listTables(String account);

    /** @return {@code true}, если таблица существовала и удалена */
    boolean deleteTableIfExists(String account, String table);

    /**
     * Удаляет аккаунт вместе с содержимым.
     *
     * @return {@code true}, если аккаунт существовал
     */
    boolean deleteAccount(String account);
}
