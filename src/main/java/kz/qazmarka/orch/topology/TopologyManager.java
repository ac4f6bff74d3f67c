package kz.qazmarka.orch.topology;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Раздаёт вызывающему коду слоты подписок на листовых топиках topology.
 *
 * Листья расходуются в фиксированном порядке (первый незаполненный); заполненный лист удаляется
 * из пула. Выдача слотов линеаризована монитором экземпляра: два конкурентных вызова никогда
 * не получат один и тот же последний слот листа.
 */
public final class TopologyManager {

    private static final Logger LOG = LoggerFactory.getLogger(TopologyManager.class);

    private final TopicTopology topology;
    private final List<TopicAssignment> assignments = new ArrayList<>();

    public TopologyManager(TopicTopology topology) {
        this.topology = Objects.requireNonNull(topology, "topology");
        for (TopicNode leaf : topology.getLeafNodes()) {
            assignments.add(new TopicAssignment(leaf, 0, topology.maxSubscribersPerTopic()));
        }
    }

    /** Топик для публикации: корень topology. */
    public TopicInfo getRootTopicInfo() {
        return topology.getRootTopic();
    }

    public synchronized boolean isFull() {
        return assignments.isEmpty();
    }

    /** Суммарное число свободных слотов во всех листьях. */
    public synchronized long remainingCapacity() {
        long total = 0L;
        for (TopicAssignment a : assignments) {
            total += a.remaining();
        }
        return total;
    }

    /**
     * Выдаёт следующий свободный слот подписки.
     *
     * @throws TopologyCapacityException если все листья заполнены: topology недообеспечена
     */
    public synchronized TopicSubscriptionInfo getSubscriptionSlot() {
        if (assignments.isEmpty()) {
            throw new TopologyCapacityException("Все листовые топики topology '" + topology.topicName()
                    + "' заполнены: листьев " + topology.getNumberOfLeafTopics()
                    + " по " + topology.maxSubscribersPerTopic() + " подписок");
        }
        TopicAssignment first = assignments.get(0);
        TopicNode leaf = first.endpoint();
        int slot = first.assign();
        if (first.isFull()) {
            assignments.remove(0);
            if (LOG.isDebugEnabled()) {
                LOG.debug("Листовой топик '{}' заполнен, осталось листьев: {}", leaf.name(), assignments.size());
            }
        }
        return new TopicSubscriptionInfo(leaf.name(), leaf.connectionHandle(), leaf.name() + '-' + slot);
    }

    TopicTopology topology() {
        return topology;
    }
}
