package kz.qazmarka.orch.backup;

/** Не удалось удалить просроченную таблицу-копию. */
public class TableDeleteFailedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String account;
    private final String table;

    public TableDeleteFailedException(String account, String table, Throwable cause) {
        super("Не удалось удалить таблицу '" + table + "' из аккаунта '" + account + "'", cause);
        this.account = account;
        this.table = table;
    }

    public String getAccount() {
        return account;
    }

    public String getTable() {
        return table;
    }
}
