package kz.qazmarka.orch.topology.admin;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.ListOffsetsResult.ListOffsetsResultInfo;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.admin.OffsetSpec;
import org.apache.kafka.clients.admin.TopicDescription;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.TopicPartitionInfo;

/**
 * Обёртка над {@link AdminClient}, реализующая {@link KafkaBrokerAdmin} без дополнительной логики.
 */
public final class KafkaBrokerAdminClient implements KafkaBrokerAdmin {

    private final AdminClient delegate;

    public KafkaBrokerAdminClient(AdminClient delegate) {
        this.delegate = delegate;
    }

    @Override
    public Set<String> listTopics(long timeoutMs)
            throws InterruptedException, ExecutionException, TimeoutException {
        return delegate.listTopics().names().get(timeoutMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void createTopic(NewTopic topic, long timeoutMs)
            throws InterruptedException, ExecutionException, TimeoutException {
        delegate.createTopics(Collections.singleton(topic))
                .all()
                .get(timeoutMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void deleteTopic(String topic, long timeoutMs)
            throws InterruptedException, ExecutionException, TimeoutException {
        delegate.deleteTopics(Collections.singleton(topic))
                .all()
                .get(timeoutMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public Map<TopicPartition, Long> endOffsets(String topic, long timeoutMs)
            throws InterruptedException, ExecutionException, TimeoutException {
        TopicDescription description = delegate.describeTopics(Collections.singleton(topic))
                .allTopicNames()
                .get(timeoutMs, TimeUnit.MILLISECONDS)
                .get(topic);
        Map<TopicPartition, OffsetSpec> request = new HashMap<>();
        for (TopicPartitionInfo p : description.partitions()) {
            request.put(new TopicPartition(topic, p.partition()), OffsetSpec.latest());
        }
        Map<TopicPartition, ListOffsetsResultInfo> listed = delegate.listOffsets(request)
                .all()
                .get(timeoutMs, TimeUnit.MILLISECONDS);
        Map<TopicPartition, Long> out = new HashMap<>(listed.size());
        for (Map.Entry<TopicPartition, ListOffsetsResultInfo> e : listed.entrySet()) {
            out.put(e.getKey(), e.getValue().offset());
        }
        return out;
    }

    @Override
    public Map<TopicPartition, OffsetAndMetadata> groupOffsets(String groupId, long timeoutMs)
            throws InterruptedException, ExecutionException, TimeoutException {
        return delegate.listConsumerGroupOffsets(groupId)
                .partitionsToOffsetAndMetadata()
                .get(timeoutMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void alterGroupOffsets(String groupId, Map<TopicPartition, OffsetAndMetadata> offsets, long timeoutMs)
            throws InterruptedException, ExecutionException, TimeoutException {
        delegate.alterConsumerGroupOffsets(groupId, offsets)
                .all()
                .get(timeoutMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void deleteConsumerGroup(String groupId, long timeoutMs)
            throws InterruptedException, ExecutionException, TimeoutException {
        delegate.deleteConsumerGroups(Collections.singleton(groupId))
                .all()
                .get(timeoutMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void close(Duration timeout) {
        delegate.close(timeout);
    }
}
