package kz.qazmarka.orch.backup;

/**
 * Имя целевого аккаунта бэкапа не соответствует формату {@code <suffix>-YYYY-MM-DD}.
 */
public class UnexpectedTargetNameException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String accountName;

    public UnexpectedTargetNameException(String accountName) {
        super("Имя аккаунта '" + accountName + "' не соответствует формату <suffix>-YYYY-MM-DD");
        this.accountName = accountName;
    }

    public UnexpectedTargetNameException(String accountName, Throwable cause) {
        this(accountName);
        initCause(cause);
    }

    public String getAccountName() {
        return accountName;
    }
}
