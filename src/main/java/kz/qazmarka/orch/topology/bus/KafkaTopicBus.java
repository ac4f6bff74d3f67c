package kz.qazmarka.orch.topology.bus;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.orch.config.KafkaAdminSettings;
import kz.qazmarka.orch.topology.TopicInfo;
import kz.qazmarka.orch.topology.TopicSubscriptionInfo;

/**
 * {@link TopicBus} поверх Kafka.
 *
 * Подписка: consumer group с именем подписки на топике. Опрос идёт в отдельном потоке,
 * смещения фиксируются после того, как пачка передана обработчику. Исключение обработчика
 * пишется в WARN и учитывается в {@link #handlerFailures()}; сообщение считается доставленным,
 * чтобы одно «ядовитое» сообщение не останавливало подписку.
 */
public final class KafkaTopicBus implements TopicBus {

    private static final Logger LOG = LoggerFactory.getLogger(KafkaTopicBus.class);

    static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofMillis(500);
    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(10);

    private final String topic;
    private final String subscription;
    private final Producer<String, byte[]> producer;
    private final Consumer<String, byte[]> consumer;
    private final Duration pollTimeout;
    private final AtomicLong handlerFailures = new AtomicLong();

    private volatile boolean running;
    private MessageHandler handler;
    private Thread poller;

    KafkaTopicBus(String topic,
                  String subscription,
                  Producer<String, byte[]> producer,
                  Consumer<String, byte[]> consumer,
                  Duration pollTimeout) {
        this.topic = Objects.requireNonNull(topic, "topic");
        this.subscription = subscription;
        this.producer = Objects.requireNonNull(producer, "producer");
        this.consumer = consumer;
        this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout");
        if ((subscription == null) != (consumer == null)) {
            throw new IllegalArgumentException("Подписка и консьюмер задаются вместе: subscription=" + subscription);
        }
    }

    /** Шина только для отправки в корневой топик. */
    public static KafkaTopicBus forPublishing(TopicInfo info, KafkaAdminSettings settings) {
        String bootstrap = bootstrapOf(info, settings);
        LOG.info("Создаю продьюсер шины: топик={}, bootstrap={}", info.getName(), bootstrap);
        return new KafkaTopicBus(info.getName(), null,
                new KafkaProducer<String, byte[]>(KafkaClientProps.busProducer(settings, bootstrap)),
                null, DEFAULT_POLL_TIMEOUT);
    }

    /** Шина для слота подписки на листовом топике. */
    public static KafkaTopicBus forSubscription(TopicSubscriptionInfo info, KafkaAdminSettings settings) {
        String bootstrap = bootstrapOf(info, settings);
        LOG.info("Создаю шину подписки {}/{}, bootstrap={}", info.getName(), info.getSubscriptionName(), bootstrap);
        return new KafkaTopicBus(info.getName(), info.getSubscriptionName(),
                new KafkaProducer<String, byte[]>(KafkaClientProps.busProducer(settings, bootstrap)),
                new KafkaConsumer<String, byte[]>(
                        KafkaClientProps.busConsumer(settings, bootstrap, info.getSubscriptionName())),
                DEFAULT_POLL_TIMEOUT);
    }

    private static String bootstrapOf(TopicInfo info, KafkaAdminSettings settings) {
        String c = info.getConnectionInfo();
        return (c == null || c.trim().isEmpty()) ? settings.getBootstrap() : c.trim();
    }

    @Override
    public String topicName() {
        return topic;
    }

    @Override
    public String subscriptionName() {
        return subscription;
    }

    @Override
    public CompletableFuture<Void> send(String key, byte[] payload) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        try {
            producer.send(new ProducerRecord<>(topic, key, payload), (metadata, exception) -> {
                if (exception != null) {
                    done.completeExceptionally(new TopicBusException("Отправка в топик " + topic + " не удалась", exception));
                } else {
                    done.complete(null);
                }
            });
        } catch (KafkaException e) {
            done.completeExceptionally(new TopicBusException("Отправка в топик " + topic + " отклонена", e));
        }
        return done;
    }

    @Override
    public synchronized void subscribe(MessageHandler handler) {
        attach(handler);
        running = true;
        poller = new Thread(this::pollLoop, "orch-bus-" + topic + '-' + subscription);
        poller.setDaemon(true);
        poller.start();
        LOG.info("Подписка {}/{} запущена", topic, subscription);
    }

    /** Регистрирует обработчик и подписывает консьюмер; опрос выполняет вызывающий. */
    synchronized void attach(MessageHandler handler) {
        Objects.requireNonNull(handler, "handler");
        if (consumer == null) {
            throw new IllegalStateException("Для топика " + topic + " подписка не задана");
        }
        if (this.handler != null) {
            throw new IllegalStateException("Подписка " + topic + '/' + subscription + " уже запущена");
        }
        this.handler = handler;
        consumer.subscribe(Collections.singletonList(topic));
    }

    /**
     * Один опрос: сообщения передаются обработчику, затем смещения фиксируются.
     *
     * @return число полученных сообщений
     */
    int pollOnce() {
        ConsumerRecords<String, byte[]> records = consumer.poll(pollTimeout);
        if (records.isEmpty()) {
            return 0;
        }
        Map<TopicPartition, OffsetAndMetadata> commit = new HashMap<>();
        for (ConsumerRecord<String, byte[]> r : records) {
            dispatch(r);
            commit.put(new TopicPartition(r.topic(), r.partition()), new OffsetAndMetadata(r.offset() + 1));
        }
        consumer.commitSync(commit);
        return records.count();
    }

    private void dispatch(ConsumerRecord<String, byte[]> r) {
        TopicMessage message = new TopicMessage(r.topic(), r.partition(), r.offset(), r.key(), r.value());
        try {
            handler.onMessage(message);
        } catch (Exception e) {
            long n = handlerFailures.incrementAndGet();
            LOG.warn("Обработчик подписки {}/{} упал на {} (всего сбоев {}): {}",
                    topic, subscription, message, n, e.toString());
            if (LOG.isDebugEnabled()) {
                LOG.debug("Трассировка сбоя обработчика подписки {}/{}", topic, subscription, e);
            }
        }
    }

    private void pollLoop() {
        try {
            while (running) {
                pollOnce();
            }
        } catch (WakeupException e) {
            if (running) {
                LOG.warn("Опрос подписки {}/{} прерван неожиданно", topic, subscription, e);
            }
        } catch (KafkaException e) {
            LOG.error("Подписка {}/{} остановлена ошибкой Kafka: {}", topic, subscription, e.toString(), e);
        } finally {
            consumer.close(CLOSE_TIMEOUT);
        }
    }

    /** Число сообщений, на которых обработчик бросил исключение. */
    public long handlerFailures() {
        return handlerFailures.get();
    }

    @Override
    public void close() {
        Thread t;
        synchronized (this) {
            running = false;
            t = poller;
        }
        if (t != null) {
            consumer.wakeup();
            try {
                t.join(CLOSE_TIMEOUT.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Ожидание остановки подписки {}/{} прервано", topic, subscription);
            }
        } else if (consumer != null) {
            consumer.close(CLOSE_TIMEOUT);
        }
        producer.close(CLOSE_TIMEOUT);
        LOG.info("Шина топика {} закрыта", topic);
    }
}
