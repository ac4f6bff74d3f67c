package kz.qazmarka.orch.topology.bus;

import java.nio.charset.StandardCharsets;

/**
 * Сообщение, полученное подписчиком топика.
 */
public final class TopicMessage {

    private final String topic;
    private final int partition;
    private final long offset;
    private final String key;
    private final byte[] payload;

    public TopicMessage(String topic, int partition, long offset, String key, byte[] payload) {
        this.topic = topic;
        this.partition = partition;
        this.offset = offset;
        this.key = key;
        this.payload = payload;
    }

    public String getTopic() {
        return topic;
    }

    public int getPartition() {
        return partition;
    }

    public long getOffset() {
        return offset;
    }

    /** Ключ сообщения или {@code null}. */
    public String getKey() {
        return key;
    }

    /** Тело сообщения как есть; массив не копируется. */
    public byte[] getPayload() {
        return payload;
    }

    /** Тело в UTF-8; для пустого тела: {@code null}. */
    public String payloadAsString() {
        return payload == null ? null : new String(payload, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "TopicMessage{" + topic + '-' + partition + '@' + offset + ", key=" + key
                + ", bytes=" + (payload == null ? 0 : payload.length) + '}';
    }
}
