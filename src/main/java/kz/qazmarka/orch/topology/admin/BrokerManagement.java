package kz.qazmarka.orch.topology.admin;

/**
 * Минимальный контракт API управления брокером, которым пользуется topology.
 *
 * Все методы синхронные и могут завершиться {@link BrokerManagementException}; вызывающий код
 * оборачивает их в ограниченный повтор. Операции создания/удаления идемпотентны:
 * создание существующего и удаление отсутствующего объекта ошибкой не считаются.
 */
public interface BrokerManagement extends AutoCloseable {

    boolean topicExists(String topic);

    /** Создаёт топик либо приводит существующий к требуемым параметрам. */
    void createOrUpdateTopic(String topic);

    void deleteTopic(String topic);

    boolean subscriptionExists(String topic, String subscription);

    /**
     * Создаёт на {@code topic} подписку, пересылающую всё опубликованное в {@code forwardTo}.
     * Топик {@code forwardTo} уже должен существовать.
     */
    void createForwardingSubscription(String topic, String subscription, String forwardTo);

    void deleteSubscription(String topic, String subscription);

    /** Строка подключения к пространству имён, которую получают все узлы topology. */
    String namespaceConnectionString();

    @Override
    void close();
}
