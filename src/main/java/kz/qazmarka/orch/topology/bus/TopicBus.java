package kz.qazmarka.orch.topology.bus;

import java.util.concurrent.CompletableFuture;

/**
 * Публикация в топик topology и подписка на него.
 *
 * Отправлять следует в топик, выданный {@link kz.qazmarka.orch.topology.TopicScaler#getTopicToSendOn()},
 * подписываться на слот из {@link kz.qazmarka.orch.topology.TopicScaler#getTopicToSubscribeOn()}.
 */
public interface TopicBus extends AutoCloseable {

    String topicName();

    /** Имя подписки или {@code null}, если шина создана только для отправки. */
    String subscriptionName();

    /**
     * Асинхронно публикует сообщение.
     *
     * @return future, завершающийся после подтверждения брокером
     */
    CompletableFuture<Void> send(String key, byte[] payload);

    /**
     * Начинает доставку сообщений подписки в {@code handler}. Повторный вызов запрещён.
     *
     * @throws IllegalStateException если подписка не задана или уже запущена
     */
    void subscribe(MessageHandler handler);

    @Override
    void close();

    /** Обработчик входящих сообщений. */
    interface MessageHandler {
        void onMessage(TopicMessage message) throws Exception;
    }
}
