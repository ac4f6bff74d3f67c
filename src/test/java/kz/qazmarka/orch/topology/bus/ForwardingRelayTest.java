package kz.qazmarka.orch.topology.bus;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Future;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Тесты {@link ForwardingRelay} на {@link MockConsumer}/{@link MockProducer} из kafka-clients.
 *
 * Что проверяем:
 * - запись родительского топика уходит в дочерний с тем же ключом, телом и заголовками;
 * - смещение фиксируется после подтверждения с метаданными {@code forward-to:<child>};
 * - при отказе продьюсера смещение не фиксируется, позиция возвращается к началу пачки;
 * - цикл run() останавливается по close() и закрывает клиентов.
 */
class ForwardingRelayTest {

    private static final TopicPartition PARENT_0 = new TopicPartition("events", 0);

    private final MockConsumer<byte[], byte[]> consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);

    private static MockProducer<byte[], byte[]> producer() {
        return new MockProducer<>(true, new ByteArraySerializer(), new ByteArraySerializer());
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private ForwardingRelay relay(MockProducer<byte[], byte[]> producer, List<Long> sleeps) {
        return new ForwardingRelay("events", "forward-events-1", "events-1", consumer, producer,
                Duration.ZERO, 25L, sleeps::add);
    }

    private void assignParent() {
        consumer.rebalance(Collections.singletonList(PARENT_0));
        consumer.updateBeginningOffsets(Collections.singletonMap(PARENT_0, 0L));
    }

    @Test
    @DisplayName("Пачка пересылается в дочерний топик, смещение фиксируется с forward-to")
    void forwardsAndCommits() {
        MockProducer<byte[], byte[]> producer = producer();
        ForwardingRelay relay = relay(producer, new ArrayList<Long>());
        relay.start();
        assignParent();
        ConsumerRecord<byte[], byte[]> first = new ConsumerRecord<>("events", 0, 0L, bytes("k1"), bytes("v1"));
        first.headers().add("trace", bytes("t-1"));
        consumer.addRecord(first);
        consumer.addRecord(new ConsumerRecord<>("events", 0, 1L, bytes("k2"), bytes("v2")));

        assertEquals(2, relay.relayOnce());

        List<ProducerRecord<byte[], byte[]>> sent = producer.history();
        assertEquals(2, sent.size());
        assertEquals("events-1", sent.get(0).topic());
        assertArrayEquals(bytes("k1"), sent.get(0).key());
        assertArrayEquals(bytes("v1"), sent.get(0).value());
        assertNotNull(sent.get(0).headers().lastHeader("trace"));
        OffsetAndMetadata committed = consumer.committed(Collections.singleton(PARENT_0)).get(PARENT_0);
        assertEquals(2L, committed.offset());
        assertEquals("forward-to:events-1", committed.metadata());
        assertEquals(2L, relay.forwardedCount());
    }

    @Test
    @DisplayName("Пустой опрос: ничего не пересылается")
    void emptyPollIsNop() {
        MockProducer<byte[], byte[]> producer = producer();
        ForwardingRelay relay = relay(producer, new ArrayList<Long>());
        relay.start();
        assignParent();

        assertEquals(0, relay.relayOnce());
        assertTrue(producer.history().isEmpty());
    }

    @Test
    @DisplayName("Отказ продьюсера: смещение не фиксируется, позиция возвращается к началу пачки")
    void producerFailureRewinds() {
        MockProducer<byte[], byte[]> failing = new MockProducer<byte[], byte[]>(true,
                new ByteArraySerializer(), new ByteArraySerializer()) {
            @Override
            public synchronized Future<RecordMetadata> send(ProducerRecord<byte[], byte[]> record) {
                throw new KafkaException("брокер недоступен");
            }
        };
        ForwardingRelay relay = relay(failing, new ArrayList<Long>());
        relay.start();
        assignParent();
        consumer.addRecord(new ConsumerRecord<>("events", 0, 0L, bytes("k1"), bytes("v1")));
        consumer.addRecord(new ConsumerRecord<>("events", 0, 1L, bytes("k2"), bytes("v2")));

        TopicBusException ex = assertThrows(TopicBusException.class, relay::relayOnce);

        assertTrue(ex.getMessage().contains("events-1"));
        assertEquals(0L, consumer.position(PARENT_0));
        Map<TopicPartition, OffsetAndMetadata> committed = consumer.committed(Collections.singleton(PARENT_0));
        assertNull(committed.get(PARENT_0));
        assertEquals(0L, relay.forwardedCount());
    }

    @Test
    @DisplayName("run(): пересылает до close(), затем закрывает консьюмер и продьюсер")
    void runUntilClosed() throws Exception {
        MockProducer<byte[], byte[]> producer = producer();
        ForwardingRelay relay = relay(producer, new ArrayList<Long>());
        consumer.schedulePollTask(() -> {
            assignParent();
            consumer.addRecord(new ConsumerRecord<>("events", 0, 0L, bytes("k"), bytes("v")));
        });

        Thread worker = new Thread(relay, "relay-test");
        worker.start();
        long deadline = System.currentTimeMillis() + 10_000L;
        while (relay.forwardedCount() < 1 && System.currentTimeMillis() < deadline) {
            Thread.sleep(5L);
        }
        relay.close();
        worker.join(10_000L);

        assertFalse(worker.isAlive());
        assertEquals(1, producer.history().size());
        assertTrue(consumer.closed());
        assertTrue(producer.closed());
    }
}
