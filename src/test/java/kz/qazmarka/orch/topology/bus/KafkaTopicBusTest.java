package kz.qazmarka.orch.topology.bus;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Тесты {@link KafkaTopicBus}: отправка в корневой топик и подписка с обработчиком на листовом.
 */
class KafkaTopicBusTest {

    private static final TopicPartition LEAF_0 = new TopicPartition("events-1", 0);

    private static MockProducer<String, byte[]> producer(boolean autoComplete) {
        return new MockProducer<>(autoComplete, new StringSerializer(), new ByteArraySerializer());
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static void assignLeaf(MockConsumer<String, byte[]> consumer) {
        consumer.rebalance(Collections.singletonList(LEAF_0));
        consumer.updateBeginningOffsets(Collections.singletonMap(LEAF_0, 0L));
    }

    @Test
    @DisplayName("send(): запись уходит в топик шины, future завершается после подтверждения")
    void sendPublishes() throws Exception {
        MockProducer<String, byte[]> producer = producer(true);
        KafkaTopicBus bus = new KafkaTopicBus("events", null, producer, null, Duration.ZERO);

        bus.send("order-1", bytes("{}")).get(5, TimeUnit.SECONDS);

        assertEquals(1, producer.history().size());
        assertEquals("events", producer.history().get(0).topic());
        assertEquals("order-1", producer.history().get(0).key());
        assertNull(bus.subscriptionName());
    }

    @Test
    @DisplayName("send(): отказ брокера завершает future ошибкой TopicBusException")
    void sendFailureCompletesExceptionally() {
        MockProducer<String, byte[]> producer = producer(false);
        KafkaTopicBus bus = new KafkaTopicBus("events", null, producer, null, Duration.ZERO);

        CompletableFuture<Void> f = bus.send("order-1", bytes("{}"));
        producer.errorNext(new RuntimeException("нет лидера партиции"));

        ExecutionException ex = assertThrows(ExecutionException.class, () -> f.get(5, TimeUnit.SECONDS));
        assertInstanceOf(TopicBusException.class, ex.getCause());
    }

    @Test
    @DisplayName("Шина без подписки: subscribe() запрещён")
    void subscribeWithoutSubscription() {
        KafkaTopicBus bus = new KafkaTopicBus("events", null, producer(true), null, Duration.ZERO);
        assertThrows(IllegalStateException.class, () -> bus.subscribe(m -> { }));
    }

    @Test
    @DisplayName("Опрос: сообщения передаются обработчику, смещение фиксируется, повторная подписка запрещена")
    void pollDispatchesAndCommits() {
        MockConsumer<String, byte[]> consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        KafkaTopicBus bus = new KafkaTopicBus("events-1", "events-1-3", producer(true), consumer, Duration.ZERO);
        List<TopicMessage> got = new CopyOnWriteArrayList<>();
        bus.attach(got::add);
        assignLeaf(consumer);
        consumer.addRecord(new ConsumerRecord<>("events-1", 0, 0L, "a", bytes("первое")));
        consumer.addRecord(new ConsumerRecord<>("events-1", 0, 1L, "b", bytes("второе")));

        assertEquals(2, bus.pollOnce());

        assertEquals(2, got.size());
        assertEquals("первое", got.get(0).payloadAsString());
        assertEquals("b", got.get(1).getKey());
        assertEquals(2L, consumer.committed(Collections.singleton(LEAF_0)).get(LEAF_0).offset());
        assertThrows(IllegalStateException.class, () -> bus.attach(m -> { }));
    }

    @Test
    @DisplayName("Сбой обработчика учитывается, остальные сообщения пачки доставляются")
    void handlerFailureDoesNotStopBatch() {
        MockConsumer<String, byte[]> consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        KafkaTopicBus bus = new KafkaTopicBus("events-1", "events-1-3", producer(true), consumer, Duration.ZERO);
        List<String> got = new CopyOnWriteArrayList<>();
        bus.attach(m -> {
            if ("bad".equals(m.getKey())) {
                throw new IllegalArgumentException("не разобрать");
            }
            got.add(m.getKey());
        });
        assignLeaf(consumer);
        consumer.addRecord(new ConsumerRecord<>("events-1", 0, 0L, "bad", bytes("x")));
        consumer.addRecord(new ConsumerRecord<>("events-1", 0, 1L, "good", bytes("y")));

        assertEquals(2, bus.pollOnce());

        assertEquals(Collections.singletonList("good"), got);
        assertEquals(1L, bus.handlerFailures());
        assertEquals(2L, consumer.committed(Collections.singleton(LEAF_0)).get(LEAF_0).offset());
    }

    @Test
    @DisplayName("subscribe(): доставка в фоновом потоке, close() останавливает опрос и закрывает клиентов")
    void subscribeRunsInBackground() throws Exception {
        MockConsumer<String, byte[]> consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        MockProducer<String, byte[]> producer = producer(true);
        KafkaTopicBus bus = new KafkaTopicBus("events-1", "events-1-3", producer, consumer, Duration.ZERO);
        consumer.schedulePollTask(() -> {
            assignLeaf(consumer);
            consumer.addRecord(new ConsumerRecord<>("events-1", 0, 0L, "k", bytes("v")));
        });
        CountDownLatch delivered = new CountDownLatch(1);

        bus.subscribe(m -> delivered.countDown());

        assertTrue(delivered.await(10, TimeUnit.SECONDS));
        bus.close();
        assertTrue(consumer.closed());
        assertTrue(producer.closed());
    }
}
