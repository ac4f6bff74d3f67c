package kz.qazmarka.orch.topology.admin;

/**
 * Сбой вызова API управления брокером (таймаут, отказ брокера, сетевая ошибка).
 */
public final class BrokerManagementException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public BrokerManagementException(String message) {
        super(message);
    }

    public BrokerManagementException(String message, Throwable cause) {
        super(message, cause);
    }
}
