package kz.qazmarka.orch.topology.bus;

/**
 * Сбой публикации или пересылки сообщений topology.
 */
public final class TopicBusException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TopicBusException(String message) {
        super(message);
    }

    public TopicBusException(String message, Throwable cause) {
        super(message, cause);
    }
}
