package kz.qazmarka.orch.config;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Настройки Kafka AdminClient и параметры создаваемых топиков topology.
 */
public final class KafkaAdminSettings {

    private final String bootstrap;
    private final long timeoutMs;
    private final String clientId;
    private final int topicPartitions;
    private final short topicReplication;
    private final Map<String, String> extraProps;

    public KafkaAdminSettings(String bootstrap,
                              long timeoutMs,
                              String clientId,
                              int topicPartitions,
                              short topicReplication,
                              Map<String, String> extraProps) {
        if (bootstrap == null || bootstrap.trim().isEmpty()) {
            throw new IllegalArgumentException("bootstrap.servers не может быть пустым");
        }
        this.bootstrap = bootstrap.trim();
        this.timeoutMs = timeoutMs < 1 ? 1 : timeoutMs;
        this.clientId = Objects.requireNonNull(clientId, "clientId не может быть null");
        this.topicPartitions = topicPartitions < 1 ? 1 : topicPartitions;
        this.topicReplication = topicReplication < 1 ? (short) 1 : topicReplication;
        this.extraProps = extraProps == null
                ? Collections.<String, String>emptyMap()
                : Collections.unmodifiableMap(new HashMap<>(extraProps));
    }

    public String getBootstrap() {
        return bootstrap;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public String getClientId() {
        return clientId;
    }

    public int getTopicPartitions() {
        return topicPartitions;
    }

    public short getTopicReplication() {
        return topicReplication;
    }

    /** Дополнительные свойства AdminClient (ключи без префикса). */
    public Map<String, String> getExtraProps() {
        return extraProps;
    }
}
