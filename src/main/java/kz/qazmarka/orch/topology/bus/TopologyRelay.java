package kz.qazmarka.orch.topology.bus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.orch.config.KafkaAdminSettings;
import kz.qazmarka.orch.topology.TopicTopology;
import kz.qazmarka.orch.topology.TopicTree;

/**
 * Ретрансляторы всех рёбер topology: по одному {@link ForwardingRelay} на пару родитель → ребёнок,
 * каждый в своём потоке. Запускается после {@link TopicTopology#emit()}.
 */
public final class TopologyRelay implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(TopologyRelay.class);
    private static final long STOP_TIMEOUT_SEC = 30L;

    /** Создаёт ретранслятор одного ребра. */
    public interface RelayFactory {
        ForwardingRelay create(String fromTopic, String subscription, String forwardTo);
    }

    private final TopicTopology topology;
    private final RelayFactory factory;
    private final List<ForwardingRelay> relays = new ArrayList<>();
    private ExecutorService pool;
    private boolean started;

    public TopologyRelay(TopicTopology topology, RelayFactory factory) {
        this.topology = Objects.requireNonNull(topology, "topology");
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    /** Ретрансляторы на Kafka-клиентах с настройками из {@code orch.kafka.*}. */
    public static TopologyRelay create(TopicTopology topology, KafkaAdminSettings settings) {
        Objects.requireNonNull(settings, "settings");
        return new TopologyRelay(topology, (from, subscription, to) -> new ForwardingRelay(from, subscription, to,
                new KafkaConsumer<byte[], byte[]>(KafkaClientProps.relayConsumer(settings, subscription)),
                new KafkaProducer<byte[], byte[]>(KafkaClientProps.relayProducer(settings, to))));
    }

    /**
     * Создаёт и запускает ретрансляторы всех рёбер. У topology из одного корня рёбер нет.
     *
     * @throws IllegalStateException если topology не сгенерирована или ретрансляторы уже запущены
     */
    public synchronized void start() {
        if (started) {
            throw new IllegalStateException("Ретрансляторы topology '" + topology.topicName() + "' уже запущены");
        }
        TopicTree t = topology.tree();
        if (t == null) {
            throw new IllegalStateException("Topology '" + topology.topicName() + "' не сгенерирована");
        }
        started = true;
        for (int id = 0; id < t.size(); id++) {
            String parent = t.node(id).name();
            for (Integer childId : t.children(id)) {
                String child = t.node(childId).name();
                relays.add(factory.create(parent, TopicTopology.forwardingSubscriptionName(child), child));
            }
        }
        if (relays.isEmpty()) {
            LOG.info("Topology '{}' из одного узла, пересылка не нужна", topology.topicName());
            return;
        }
        AtomicInteger seq = new AtomicInteger();
        pool = Executors.newFixedThreadPool(relays.size(), r -> {
            Thread th = new Thread(r, "orch-relay-" + topology.topicName() + '-' + seq.incrementAndGet());
            th.setDaemon(true);
            return th;
        });
        for (ForwardingRelay relay : relays) {
            pool.execute(relay);
        }
        LOG.info("Запущено ретрансляторов topology '{}': {}", topology.topicName(), relays.size());
    }

    public synchronized List<ForwardingRelay> relays() {
        return Collections.unmodifiableList(new ArrayList<>(relays));
    }

    /** Останавливает ретрансляторы и ждёт завершения их потоков. */
    @Override
    public synchronized void close() {
        for (ForwardingRelay relay : relays) {
            relay.close();
        }
        if (pool == null) {
            return;
        }
        pool.shutdown();
        try {
            if (!pool.awaitTermination(STOP_TIMEOUT_SEC, TimeUnit.SECONDS)) {
                LOG.warn("Ретрансляторы topology '{}' не остановились за {} с", topology.topicName(), STOP_TIMEOUT_SEC);
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }
}
