package kz.qazmarka.orch.topology.bus;

import java.util.Map;
import java.util.Properties;
import java.util.Set;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;

import kz.qazmarka.orch.config.KafkaAdminSettings;

/**
 * Построитель настроек Producer/Consumer для шины и ретранслятора topology.
 *
 *  - bootstrap и client.id из {@link KafkaAdminSettings};
 *  - продьюсер идемпотентный ({@code acks=all}, {@code max.in.flight=5}), порядок внутри партиции сохраняется;
 *  - консьюмер без автокоммита: смещения фиксируются после обработки пачки;
 *  - pass-through: ключи {@code orch.kafka.admin.props.*}, известные клиенту (например {@code security.protocol}),
 *    прокидываются, если не заданы выше.
 */
final class KafkaClientProps {

    private static final String STRING_SERIALIZER = StringSerializer.class.getName();
    private static final String BYTES_SERIALIZER = ByteArraySerializer.class.getName();
    private static final String STRING_DESERIALIZER = StringDeserializer.class.getName();
    private static final String BYTES_DESERIALIZER = ByteArrayDeserializer.class.getName();

    private KafkaClientProps() {
    }

    /** Продьюсер шины: ключ строка, тело байты. */
    static Properties busProducer(KafkaAdminSettings settings, String bootstrap) {
        return producer(settings, bootstrap, STRING_SERIALIZER, settings.getClientId() + "-bus");
    }

    /** Консьюмер подписки: группа равна имени подписки; новая подписка читает только новые сообщения. */
    static Properties busConsumer(KafkaAdminSettings settings, String bootstrap, String subscription) {
        return consumer(settings, bootstrap, subscription, STRING_DESERIALIZER, "latest",
                settings.getClientId() + "-sub-" + subscription);
    }

    /** Продьюсер ретранслятора: ключ и тело пересылаются байтами без разбора. */
    static Properties relayProducer(KafkaAdminSettings settings, String forwardTo) {
        return producer(settings, settings.getBootstrap(), BYTES_SERIALIZER, settings.getClientId() + "-relay-" + forwardTo);
    }

    /**
     * Консьюмер ретранслятора. Смещения группы заведены при создании подписки-пересылки,
     * {@code earliest} срабатывает только для партиций, добавленных позже.
     */
    static Properties relayConsumer(KafkaAdminSettings settings, String subscription) {
        return consumer(settings, settings.getBootstrap(), subscription, BYTES_DESERIALIZER, "earliest",
                settings.getClientId() + "-relay-" + subscription);
    }

    private static Properties producer(KafkaAdminSettings settings, String bootstrap, String keySerializer,
                                       String clientId) {
        Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrap);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, keySerializer);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, BYTES_SERIALIZER);
        props.put(ProducerConfig.CLIENT_ID_CONFIG, clientId);
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "true");
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.RETRIES_CONFIG, String.valueOf(Integer.MAX_VALUE));
        props.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, "5");
        props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, String.valueOf(Math.max(120_000L, settings.getTimeoutMs())));
        passThrough(props, settings.getExtraProps(), ProducerConfig.configNames());
        return props;
    }

    private static Properties consumer(KafkaAdminSettings settings, String bootstrap, String groupId,
                                       String keyDeserializer, String reset, String clientId) {
        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrap);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, keyDeserializer);
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, BYTES_DESERIALIZER);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        props.put(ConsumerConfig.CLIENT_ID_CONFIG, clientId);
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, reset);
        passThrough(props, settings.getExtraProps(), ConsumerConfig.configNames());
        return props;
    }

    private static void passThrough(Properties props, Map<String, String> extra, Set<String> known) {
        for (Map.Entry<String, String> e : extra.entrySet()) {
            if (known.contains(e.getKey())) {
                props.putIfAbsent(e.getKey(), e.getValue());
            }
        }
    }
}
