package kz.qazmarka.orch.topology.admin;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.GroupIdNotFoundException;
import org.apache.kafka.common.errors.TopicExistsException;
import org.apache.kafka.common.errors.UnknownTopicOrPartitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.orch.config.KafkaAdminSettings;

/**
 * {@link BrokerManagement} поверх Kafka.
 *
 * Узел topology: Kafka-топик. Подписка-пересылка: consumer group с именем подписки, смещения
 * которой заведены на конец партиций родительского топика; в метаданных смещения записан целевой
 * топик ({@code forward-to:<child>}). Такую группу читает
 * {@link kz.qazmarka.orch.topology.bus.ForwardingRelay} и публикует прочитанное в целевой топик. Строка подключения: адреса bootstrap.
 *
 * Гонки с другими администраторами трактуются как успех: {@link TopicExistsException} при создании,
 * {@link UnknownTopicOrPartitionException}/{@link GroupIdNotFoundException} при удалении.
 */
public final class KafkaBrokerManagement implements BrokerManagement {

    private static final Logger LOG = LoggerFactory.getLogger(KafkaBrokerManagement.class);

    public static final String FORWARD_METADATA_PREFIX = "forward-to:";

    private final KafkaBrokerAdmin admin;
    private final KafkaAdminSettings settings;

    public KafkaBrokerManagement(KafkaBrokerAdmin admin, KafkaAdminSettings settings) {
        this.admin = Objects.requireNonNull(admin, "admin");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /** Создаёт адаптер с собственным {@link AdminClient}; закрывается через {@link #close()}. */
    public static KafkaBrokerManagement create(KafkaAdminSettings settings) {
        Properties props = new Properties();
        props.putAll(settings.getExtraProps());
        props.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, settings.getBootstrap());
        props.put(AdminClientConfig.CLIENT_ID_CONFIG, settings.getClientId());
        long timeout = settings.getTimeoutMs();
        props.put(AdminClientConfig.REQUEST_TIMEOUT_MS_CONFIG, (int) Math.min(Integer.MAX_VALUE, timeout));
        props.put(AdminClientConfig.DEFAULT_API_TIMEOUT_MS_CONFIG, (int) Math.min(Integer.MAX_VALUE, timeout));
        LOG.info("Создаю Kafka AdminClient: bootstrap={}, client.id={}", settings.getBootstrap(), settings.getClientId());
        return new KafkaBrokerManagement(new KafkaBrokerAdminClient(AdminClient.create(props)), settings);
    }

    @Override
    public boolean topicExists(String topic) {
        return call("проверка топика " + topic, () -> admin.listTopics(settings.getTimeoutMs()).contains(topic));
    }

    @Override
    public void createOrUpdateTopic(String topic) {
        NewTopic nt = new NewTopic(topic, settings.getTopicPartitions(), settings.getTopicReplication());
        call("создание топика " + topic, () -> {
            try {
                admin.createTopic(nt, settings.getTimeoutMs());
                LOG.info("Создан топик {} (partitions={}, replication={})",
                        topic, settings.getTopicPartitions(), settings.getTopicReplication());
            } catch (ExecutionException e) {
                if (!(e.getCause() instanceof TopicExistsException)) {
                    throw e;
                }
                LOG.debug("Топик {} уже существует", topic);
            }
            return null;
        });
    }

    @Override
    public void deleteTopic(String topic) {
        call("удаление топика " + topic, () -> {
            try {
                admin.deleteTopic(topic, settings.getTimeoutMs());
                LOG.info("Удалён топик {}", topic);
            } catch (ExecutionException e) {
                if (!(e.getCause() instanceof UnknownTopicOrPartitionException)) {
                    throw e;
                }
                LOG.debug("Топик {} уже удалён", topic);
            }
            return null;
        });
    }

    @Override
    public boolean subscriptionExists(String topic, String subscription) {
        return call("проверка подписки " + topic + '/' + subscription, () -> {
            Map<TopicPartition, OffsetAndMetadata> offsets;
            try {
                offsets = admin.groupOffsets(subscription, settings.getTimeoutMs());
            } catch (ExecutionException e) {
                if (e.getCause() instanceof GroupIdNotFoundException) {
                    return false;
                }
                throw e;
            }
            for (TopicPartition tp : offsets.keySet()) {
                if (tp.topic().equals(topic)) {
                    return true;
                }
            }
            return false;
        });
    }

    @Override
    public void createForwardingSubscription(String topic, String subscription, String forwardTo) {
        call("подписка " + topic + '/' + subscription + " → " + forwardTo, () -> {
            if (!admin.listTopics(settings.getTimeoutMs()).contains(forwardTo)) {
                throw new BrokerManagementException("Целевой топик пересылки '" + forwardTo + "' не существует");
            }
            Map<TopicPartition, Long> end = admin.endOffsets(topic, settings.getTimeoutMs());
            Map<TopicPartition, OffsetAndMetadata> seed = new HashMap<>(end.size());
            for (Map.Entry<TopicPartition, Long> e : end.entrySet()) {
                seed.put(e.getKey(), new OffsetAndMetadata(e.getValue(), FORWARD_METADATA_PREFIX + forwardTo));
            }
            admin.alterGroupOffsets(subscription, seed, settings.getTimeoutMs());
            LOG.info("Создана подписка-пересылка {}/{} → {} (партиций {})", topic, subscription, forwardTo, seed.size());
            return null;
        });
    }

    @Override
    public void deleteSubscription(String topic, String subscription) {
        call("удаление подписки " + topic + '/' + subscription, () -> {
            try {
                admin.deleteConsumerGroup(subscription, settings.getTimeoutMs());
                LOG.info("Удалена подписка {}/{}", topic, subscription);
            } catch (ExecutionException e) {
                if (!(e.getCause() instanceof GroupIdNotFoundException)) {
                    throw e;
                }
                LOG.debug("Подписка {}/{} уже удалена", topic, subscription);
            }
            return null;
        });
    }

    @Override
    public String namespaceConnectionString() {
        return settings.getBootstrap();
    }

    @Override
    public void close() {
        admin.close(Duration.ofMillis(settings.getTimeoutMs()));
    }

    private <T> T call(String what, AdminCall<T> op) {
        try {
            return op.call();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerManagementException("Прервано: " + what, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new BrokerManagementException("Ошибка Kafka (" + what + "): " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new BrokerManagementException("Таймаут " + settings.getTimeoutMs() + " мс: " + what, e);
        }
    }

    /** Блокирующий вызов AdminClient. */
    private interface AdminCall<T> {
        T call() throws InterruptedException, ExecutionException, TimeoutException;
    }
}
