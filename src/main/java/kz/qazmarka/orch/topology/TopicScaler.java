package kz.qazmarka.orch.topology;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.orch.config.TopologySettings;
import kz.qazmarka.orch.topology.admin.BrokerManagement;

/**
 * Выбирает стратегию масштабирования топика и выдаёт точки отправки и подписки.
 *
 * <ul>
 *   <li>{@link ScaleMode#VERTICAL}: одна topology, углублённая под всех подписчиков; все сообщения
 *   проходят через один логический топик.</li>
 *   <li>{@link ScaleMode#HORIZONTAL}: независимые одноуровневые topology, каждая из одного листового
 *   топика ёмкостью {@code maxSubscribersPerTopic}; для отправки выбирается случайный экземпляр, для подписки последний, а новый экземпляр
 *   создаётся лениво, когда последний заполнен.</li>
 * </ul>
 */
public final class TopicScaler {

    private static final Logger LOG = LoggerFactory.getLogger(TopicScaler.class);

    private final String topicName;
    private final BrokerManagement management;
    private final TopologySettings settings;
    private final int subscribersPerInstance;
    private final Random random;

    private TopologyManager verticalManager;
    private final List<TopologyManager> horizontalManagers = new ArrayList<>();

    public TopicScaler(String topicName,
                       BrokerManagement management,
                       TopologySettings settings,
                       int subscribersPerInstance) {
        this(topicName, management, settings, subscribersPerInstance, new Random());
    }

    TopicScaler(String topicName,
                BrokerManagement management,
                TopologySettings settings,
                int subscribersPerInstance,
                Random random) {
        this.topicName = Objects.requireNonNull(topicName, "topicName");
        this.management = Objects.requireNonNull(management, "management");
        this.settings = Objects.requireNonNull(settings, "settings");
        if (settings.getScaleMode() == ScaleMode.HORIZONTAL
                && subscribersPerInstance > settings.getMaxSubscribersPerTopic()) {
            throw new IllegalArgumentException("В горизонтальном режиме subscribersPerInstance ("
                    + subscribersPerInstance + ") должен быть <= maxSubscribersPerTopic ("
                    + settings.getMaxSubscribersPerTopic() + ")");
        }
        if (subscribersPerInstance < 1) {
            throw new IllegalArgumentException("subscribersPerInstance должен быть >= 1, получено: " + subscribersPerInstance);
        }
        this.subscribersPerInstance = subscribersPerInstance;
        this.random = random;
    }

    public ScaleMode scaleMode() {
        return settings.getScaleMode();
    }

    /** Корневой топик для публикации; в горизонтальном режиме: случайный из живых экземпляров. */
    public synchronized TopicInfo getTopicToSendOn() {
        if (scaleMode() == ScaleMode.VERTICAL) {
            return vertical().getRootTopicInfo();
        }
        if (horizontalManagers.isEmpty()) {
            addHorizontalInstance();
        }
        int index = random.nextInt(horizontalManagers.size());
        return horizontalManagers.get(index).getRootTopicInfo();
    }

    /**
     * Слот подписки на листовом топике. В горизонтальном режиме при заполнении последнего
     * экземпляра создаётся новый.
     *
     * @throws TopologyCapacityException если вертикальная topology исчерпана
     */
    public synchronized TopicSubscriptionInfo getTopicToSubscribeOn() {
        if (scaleMode() == ScaleMode.VERTICAL) {
            return vertical().getSubscriptionSlot();
        }
        if (horizontalManagers.isEmpty() || last().isFull()) {
            addHorizontalInstance();
        }
        return last().getSubscriptionSlot();
    }

    /** Корневые топики всех живых экземпляров. */
    public synchronized List<TopicInfo> getAllBroadcastTopics() {
        if (scaleMode() == ScaleMode.VERTICAL) {
            return Collections.singletonList(vertical().getRootTopicInfo());
        }
        List<TopicInfo> out = new ArrayList<>(horizontalManagers.size());
        for (TopologyManager m : horizontalManagers) {
            out.add(m.getRootTopicInfo());
        }
        return Collections.unmodifiableList(out);
    }

    /** Число созданных экземпляров topology. */
    public synchronized int instanceCount() {
        if (scaleMode() == ScaleMode.VERTICAL) {
            return verticalManager == null ? 0 : 1;
        }
        return horizontalManagers.size();
    }

    private TopologyManager vertical() {
        if (verticalManager == null) {
            verticalManager = new TopologyManager(newTopology(topicName));
        }
        return verticalManager;
    }

    private TopologyManager last() {
        return horizontalManagers.get(horizontalManagers.size() - 1);
    }

    private void addHorizontalInstance() {
        int n = horizontalManagers.size() + 1;
        // отдельное имя корня, чтобы независимые деревья не пересекались на брокере
        String name = n == 1 ? topicName : topicName + "-h" + n;
        horizontalManagers.add(new TopologyManager(newTopology(name)));
        LOG.info("Горизонтальное масштабирование '{}': создан экземпляр #{} ('{}')", topicName, n, name);
    }

    private TopicTopology newTopology(String name) {
        TopicTopology topology = new TopicTopology(name, management, settings);
        topology.generate(subscribersPerInstance);
        if (settings.isAutoEmit()) {
            topology.emit();
        }
        return topology;
    }
}
