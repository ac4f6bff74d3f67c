package kz.qazmarka.orch.topology.admin;

import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.GroupIdNotFoundException;
import org.apache.kafka.common.errors.TopicExistsException;
import org.apache.kafka.common.errors.UnknownTopicOrPartitionException;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import kz.qazmarka.orch.config.KafkaAdminSettings;

/**
 * Тесты адаптера {@link KafkaBrokerManagement} поверх фейкового {@link KafkaBrokerAdmin}.
 *
 * Проверяем идемпотентность (гонки «уже существует»/«уже удалено» считаются успехом),
 * заведение подписки-пересылки как consumer group со смещениями на конце партиций
 * и преобразование ошибок AdminClient в {@link BrokerManagementException}.
 */
class KafkaBrokerManagementTest {

    private static final KafkaAdminSettings SETTINGS =
            new KafkaAdminSettings("kafka1:9092", 1000L, "orch-test", 2, (short) 1, null);

    @Test
    @DisplayName("createOrUpdateTopic(): TopicExistsException не считается ошибкой")
    void createTopicIsIdempotent() {
        FakeAdmin admin = new FakeAdmin();
        admin.topics.add("orders");
        KafkaBrokerManagement m = new KafkaBrokerManagement(admin, SETTINGS);

        assertDoesNotThrow(() -> m.createOrUpdateTopic("orders"));
        m.createOrUpdateTopic("orders-1");

        assertEquals(2, admin.createCalls);
        assertEquals(2, admin.lastCreated.numPartitions());
        assertTrue(m.topicExists("orders-1"));
    }

    @Test
    @DisplayName("deleteTopic()/deleteSubscription(): удаление отсутствующего объекта: успех")
    void deletesAreIdempotent() {
        KafkaBrokerManagement m = new KafkaBrokerManagement(new FakeAdmin(), SETTINGS);
        assertDoesNotThrow(() -> m.deleteTopic("missing"));
        assertDoesNotThrow(() -> m.deleteSubscription("orders", "forward-missing"));
    }

    @Test
    @DisplayName("createForwardingSubscription(): группа заводится на конец партиций родителя")
    void forwardingSubscriptionSeedsEndOffsets() {
        FakeAdmin admin = new FakeAdmin();
        admin.topics.add("orders");
        admin.topics.add("orders-1");
        admin.endOffsets.put(new TopicPartition("orders", 0), 15L);
        admin.endOffsets.put(new TopicPartition("orders", 1), 7L);
        KafkaBrokerManagement m = new KafkaBrokerManagement(admin, SETTINGS);

        assertFalse(m.subscriptionExists("orders", "forward-orders-1"));
        m.createForwardingSubscription("orders", "forward-orders-1", "orders-1");

        Map<TopicPartition, OffsetAndMetadata> seeded = admin.groups.get("forward-orders-1");
        assertEquals(2, seeded.size());
        OffsetAndMetadata p0 = seeded.get(new TopicPartition("orders", 0));
        assertEquals(15L, p0.offset());
        assertEquals("forward-to:orders-1", p0.metadata());
        assertTrue(m.subscriptionExists("orders", "forward-orders-1"));
        // группа привязана к другому топику: подписки на этом топике нет
        assertFalse(m.subscriptionExists("payments", "forward-orders-1"));

        m.deleteSubscription("orders", "forward-orders-1");
        assertFalse(m.subscriptionExists("orders", "forward-orders-1"));
    }

    @Test
    @DisplayName("createForwardingSubscription(): отсутствующий целевой топик: ошибка")
    void forwardingRequiresTarget() {
        FakeAdmin admin = new FakeAdmin();
        admin.topics.add("orders");
        KafkaBrokerManagement m = new KafkaBrokerManagement(admin, SETTINGS);

        assertThrows(BrokerManagementException.class,
                () -> m.createForwardingSubscription("orders", "forward-orders-1", "orders-1"));
        assertTrue(admin.groups.isEmpty());
    }

    @Test
    @DisplayName("Ошибки и таймауты AdminClient оборачиваются в BrokerManagementException")
    void failuresAreWrapped() {
        FakeAdmin admin = new FakeAdmin();
        admin.failWith = new ExecutionException(new IllegalStateException("broker down"));
        KafkaBrokerManagement m = new KafkaBrokerManagement(admin, SETTINGS);

        BrokerManagementException ex = assertThrows(BrokerManagementException.class,
                () -> m.createOrUpdateTopic("orders"));
        assertInstanceOf(IllegalStateException.class, ex.getCause());

        admin.failWith = null;
        admin.timeout = true;
        BrokerManagementException te = assertThrows(BrokerManagementException.class, () -> m.topicExists("x"));
        assertInstanceOf(TimeoutException.class, te.getCause());
    }

    @Test
    @DisplayName("Строка подключения: bootstrap; close() закрывает AdminClient")
    void connectionStringAndClose() {
        FakeAdmin admin = new FakeAdmin();
        KafkaBrokerManagement m = new KafkaBrokerManagement(admin, SETTINGS);
        assertEquals("kafka1:9092", m.namespaceConnectionString());
        m.close();
        assertEquals(Duration.ofMillis(1000L), admin.closedWith);
    }

    /** In-memory заглушка AdminClient с семантикой ошибок Kafka. */
    private static final class FakeAdmin implements KafkaBrokerAdmin {
        final Set<String> topics = new HashSet<>();
        final Map<TopicPartition, Long> endOffsets = new HashMap<>();
        final Map<String, Map<TopicPartition, OffsetAndMetadata>> groups = new HashMap<>();
        int createCalls;
        NewTopic lastCreated;
        ExecutionException failWith;
        boolean timeout;
        Duration closedWith;

        private void maybeFail() throws ExecutionException, TimeoutException {
            if (failWith != null) {
                throw failWith;
            }
            if (timeout) {
                throw new TimeoutException("timeout");
            }
        }

        @Override
        public Set<String> listTopics(long timeoutMs) throws ExecutionException, TimeoutException {
            maybeFail();
            return new HashSet<>(topics);
        }

        @Override
        public void createTopic(NewTopic topic, long timeoutMs) throws ExecutionException, TimeoutException {
            maybeFail();
            createCalls++;
            lastCreated = topic;
            if (!topics.add(topic.name())) {
                throw new ExecutionException(new TopicExistsException("exists: " + topic.name()));
            }
        }

        @Override
        public void deleteTopic(String topic, long timeoutMs) throws ExecutionException, TimeoutException {
            maybeFail();
            if (!topics.remove(topic)) {
                throw new ExecutionException(new UnknownTopicOrPartitionException("unknown: " + topic));
            }
        }

        @Override
        public Map<TopicPartition, Long> endOffsets(String topic, long timeoutMs)
                throws ExecutionException, TimeoutException {
            maybeFail();
            Map<TopicPartition, Long> out = new HashMap<>();
            for (Map.Entry<TopicPartition, Long> e : endOffsets.entrySet()) {
                if (e.getKey().topic().equals(topic)) {
                    out.put(e.getKey(), e.getValue());
                }
            }
            return out;
        }

        @Override
        public Map<TopicPartition, OffsetAndMetadata> groupOffsets(String groupId, long timeoutMs)
                throws ExecutionException, TimeoutException {
            maybeFail();
            Map<TopicPartition, OffsetAndMetadata> g = groups.get(groupId);
            if (g == null) {
                throw new ExecutionException(new GroupIdNotFoundException("unknown group " + groupId));
            }
            return g;
        }

        @Override
        public void alterGroupOffsets(String groupId, Map<TopicPartition, OffsetAndMetadata> offsets, long timeoutMs)
                throws ExecutionException, TimeoutException {
            maybeFail();
            groups.computeIfAbsent(groupId, k -> new HashMap<>()).putAll(offsets);
        }

        @Override
        public void deleteConsumerGroup(String groupId, long timeoutMs) throws ExecutionException, TimeoutException {
            maybeFail();
            if (groups.remove(groupId) == null) {
                throw new ExecutionException(new GroupIdNotFoundException("unknown group " + groupId));
            }
        }

        @Override
        public void close(Duration timeout) {
            this.closedWith = timeout;
        }
    }
}
