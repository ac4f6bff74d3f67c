package kz.qazmarka.orch.topology.admin;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;

/**
 * Минимальный контракт Kafka AdminClient, нужный адаптеру управления брокером.
 *
 * Интерфейс преднамеренно лишён зависимостей от конкретной реализации AdminClient, что упрощает unit-тесты.
 * Все методы блокирующие и ждут результата не дольше {@code timeoutMs}.
 */
public interface KafkaBrokerAdmin {

    Set<String> listTopics(long timeoutMs)
            throws InterruptedException, ExecutionException, TimeoutException;

    /** Создаёт одну тему с ожиданием до {@code timeoutMs}. */
    void createTopic(NewTopic topic, long timeoutMs)
            throws InterruptedException, ExecutionException, TimeoutException;

    void deleteTopic(String topic, long timeoutMs)
            throws InterruptedException, ExecutionException, TimeoutException;

    /** Последние (end) смещения всех партиций темы. */
    Map<TopicPartition, Long> endOffsets(String topic, long timeoutMs)
            throws InterruptedException, ExecutionException, TimeoutException;

    /** Зафиксированные смещения группы; пустая карта для неизвестной группы. */
    Map<TopicPartition, OffsetAndMetadata> groupOffsets(String groupId, long timeoutMs)
            throws InterruptedException, ExecutionException, TimeoutException;

    /** Фиксирует смещения группы; несуществующая группа создаётся. */
    void alterGroupOffsets(String groupId, Map<TopicPartition, OffsetAndMetadata> offsets, long timeoutMs)
            throws InterruptedException, ExecutionException, TimeoutException;

    void deleteConsumerGroup(String groupId, long timeoutMs)
            throws InterruptedException, ExecutionException, TimeoutException;

    void close(Duration timeout);
}
