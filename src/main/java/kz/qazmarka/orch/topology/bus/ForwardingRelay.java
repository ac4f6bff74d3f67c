package kz.qazmarka.orch.topology.bus;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.orch.topology.admin.KafkaBrokerManagement;
import kz.qazmarka.orch.util.Sleeper;

/**
 * Пересылка сообщений по одному ребру topology: родительский топик → дочерний.
 *
 * Читает consumer group подписки-пересылки, заведённую
 * {@link KafkaBrokerManagement#createForwardingSubscription(String, String, String)}, и публикует каждую
 * запись в дочерний топик с теми же ключом, телом и заголовками. Смещения фиксируются только после
 * подтверждения всей пачки брокером (доставка at-least-once), в метаданных смещения сохраняется
 * {@code forward-to:<child>}. При сбое отправки позиции партиций возвращаются к началу пачки.
 */
public final class ForwardingRelay implements Runnable, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ForwardingRelay.class);

    static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofMillis(500);
    static final long DEFAULT_RETRY_DELAY_MS = 1_000L;
    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(10);

    private final String fromTopic;
    private final String subscription;
    private final String forwardTo;
    private final Consumer<byte[], byte[]> consumer;
    private final Producer<byte[], byte[]> producer;
    private final Duration pollTimeout;
    private final long retryDelayMs;
    private final Sleeper sleeper;
    private final String commitMetadata;
    private final AtomicLong forwarded = new AtomicLong();

    private volatile boolean running;
    private volatile boolean closed;

    public ForwardingRelay(String fromTopic,
                           String subscription,
                           String forwardTo,
                           Consumer<byte[], byte[]> consumer,
                           Producer<byte[], byte[]> producer) {
        this(fromTopic, subscription, forwardTo, consumer, producer, DEFAULT_POLL_TIMEOUT, DEFAULT_RETRY_DELAY_MS,
                Sleeper.THREAD);
    }

    ForwardingRelay(String fromTopic,
                    String subscription,
                    String forwardTo,
                    Consumer<byte[], byte[]> consumer,
                    Producer<byte[], byte[]> producer,
                    Duration pollTimeout,
                    long retryDelayMs,
                    Sleeper sleeper) {
        this.fromTopic = Objects.requireNonNull(fromTopic, "fromTopic");
        this.subscription = Objects.requireNonNull(subscription, "subscription");
        this.forwardTo = Objects.requireNonNull(forwardTo, "forwardTo");
        this.consumer = Objects.requireNonNull(consumer, "consumer");
        this.producer = Objects.requireNonNull(producer, "producer");
        this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout");
        this.retryDelayMs = retryDelayMs;
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.commitMetadata = KafkaBrokerManagement.FORWARD_METADATA_PREFIX + forwardTo;
    }

    public String fromTopic() {
        return fromTopic;
    }

    public String subscription() {
        return subscription;
    }

    public String forwardTo() {
        return forwardTo;
    }

    /** Сколько записей переслано и зафиксировано. */
    public long forwardedCount() {
        return forwarded.get();
    }

    /** Подписывает консьюмер на родительский топик. */
    void start() {
        consumer.subscribe(Collections.singletonList(fromTopic));
        LOG.info("Ретранслятор {} → {} (группа {}) запущен", fromTopic, forwardTo, subscription);
    }

    /**
     * Один цикл: опрос, пересылка, ожидание подтверждений, фиксация смещений.
     *
     * @return число пересланных записей
     * @throws TopicBusException если брокер не принял хотя бы одну запись пачки
     */
    int relayOnce() {
        ConsumerRecords<byte[], byte[]> records = consumer.poll(pollTimeout);
        if (records.isEmpty()) {
            return 0;
        }
        Map<TopicPartition, Long> firstOffsets = new HashMap<>();
        Map<TopicPartition, OffsetAndMetadata> commit = new HashMap<>();
        List<Future<RecordMetadata>> acks = new ArrayList<>(records.count());
        try {
            for (ConsumerRecord<byte[], byte[]> r : records) {
                TopicPartition tp = new TopicPartition(r.topic(), r.partition());
                firstOffsets.putIfAbsent(tp, r.offset());
                acks.add(producer.send(new ProducerRecord<>(forwardTo, null, r.key(), r.value(), r.headers())));
                commit.put(tp, new OffsetAndMetadata(r.offset() + 1, commitMetadata));
            }
            producer.flush();
            for (Future<RecordMetadata> ack : acks) {
                ack.get();
            }
        } catch (ExecutionException e) {
            rewind(firstOffsets);
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new TopicBusException("Пересылка " + fromTopic + " → " + forwardTo + " не подтверждена", cause);
        } catch (KafkaException e) {
            rewind(firstOffsets);
            throw new TopicBusException("Пересылка " + fromTopic + " → " + forwardTo + " отклонена", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            rewind(firstOffsets);
            throw new TopicBusException("Пересылка " + fromTopic + " → " + forwardTo + " прервана", e);
        }
        consumer.commitSync(commit);
        long total = forwarded.addAndGet(records.count());
        if (LOG.isDebugEnabled()) {
            LOG.debug("Ретранслятор {} → {}: переслано {}, всего {}", fromTopic, forwardTo, records.count(), total);
        }
        return records.count();
    }

    private void rewind(Map<TopicPartition, Long> firstOffsets) {
        for (Map.Entry<TopicPartition, Long> e : firstOffsets.entrySet()) {
            consumer.seek(e.getKey(), e.getValue());
        }
    }

    @Override
    public void run() {
        running = !closed;
        start();
        try {
            while (running) {
                try {
                    relayOnce();
                } catch (TopicBusException e) {
                    if (Thread.currentThread().isInterrupted()) {
                        throw e;
                    }
                    LOG.warn("{}; повтор через {} мс: {}", e.getMessage(), retryDelayMs, String.valueOf(e.getCause()));
                    sleeper.sleep(retryDelayMs);
                }
            }
        } catch (WakeupException e) {
            if (running) {
                throw e;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Ретранслятор {} → {} прерван", fromTopic, forwardTo);
        } finally {
            consumer.close(CLOSE_TIMEOUT);
            producer.close(CLOSE_TIMEOUT);
            LOG.info("Ретранслятор {} → {} остановлен, переслано {}", fromTopic, forwardTo, forwarded.get());
        }
    }

    /** Останавливает цикл {@link #run()}; ресурсы закрывает поток ретранслятора. */
    @Override
    public void close() {
        closed = true;
        running = false;
        consumer.wakeup();
    }
}
