package kz.qazmarka.orch.topology;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.orch.config.TopologySettings;
import kz.qazmarka.orch.topology.admin.BrokerManagement;
import kz.qazmarka.orch.topology.util.TopicNameValidator;
import kz.qazmarka.orch.util.ProgressReporter;
import kz.qazmarka.orch.util.RetryPolicy;

/**
 * Дерево автопересылающих топиков, позволяющее превысить лимит подписок на один топик брокера.
 *
 * Публикация идёт в корень; каждый внутренний узел пересылает копию сообщения своим детям через
 * подписку {@code forward-<child>}; подписчики подключаются только к листьям. Листья вместе дают
 * не меньше {@code subscriberCount} слотов.
 *
 * Жизненный цикл: {@link #generate(int)} строит дерево в памяти, {@link #emit()} идемпотентно
 * материализует его на брокере, {@link #destroy(boolean)} удаляет. Каждый удалённый вызов обёрнут
 * в ограниченный повтор; после исчерпания попыток операция прекращается с WARN, а emit продолжается:
 * частично построенная topology лечится повторным emit.
 */
public final class TopicTopology {

    private static final Logger LOG = LoggerFactory.getLogger(TopicTopology.class);

    static final String FORWARD_PREFIX = "forward-";

    private final String topicName;
    private final BrokerManagement management;
    private final int maxSubscribersPerTopic;
    private final RetryPolicy retry;
    private final int emitParallelism;
    private ProgressReporter reporter = ProgressReporter.silent();

    private TopicTree tree;

    public TopicTopology(String topicName, BrokerManagement management, TopologySettings settings) {
        this(topicName, management, settings.getMaxSubscribersPerTopic(), settings.retryPolicy(),
                settings.getEmitParallelism());
    }

    public TopicTopology(String topicName,
                         BrokerManagement management,
                         int maxSubscribersPerTopic,
                         RetryPolicy retry,
                         int emitParallelism) {
        if (maxSubscribersPerTopic < 2) {
            throw new IllegalArgumentException("maxSubscribersPerTopic должен быть >= 2, получено: " + maxSubscribersPerTopic);
        }
        this.topicName = Objects.requireNonNull(topicName, "topicName");
        this.management = Objects.requireNonNull(management, "management");
        this.maxSubscribersPerTopic = maxSubscribersPerTopic;
        this.retry = Objects.requireNonNull(retry, "retry");
        this.emitParallelism = Math.max(1, emitParallelism);
    }

    /** Задаёт необязательный приёмник сообщений о прогрессе. */
    public void reportOn(Consumer<String> action) {
        this.reporter = ProgressReporter.of(action);
    }

    public String topicName() {
        return topicName;
    }

    public int maxSubscribersPerTopic() {
        return maxSubscribersPerTopic;
    }

    /**
     * Строит в памяти дерево, листья которого вмещают {@code subscriberCount} подписчиков.
     * Например, при лимите 2000 и 10000 подписчиков получится корень и пять листьев.
     *
     * @throws IllegalArgumentException при {@code subscriberCount < 1} или недопустимом имени топика
     */
    public void generate(int subscriberCount) {
        if (subscriberCount < 1) {
            throw new IllegalArgumentException("subscriberCount должен быть >= 1, получено: " + subscriberCount);
        }
        int levels = requiredLevels(subscriberCount, maxSubscribersPerTopic);
        TopicNameValidator.requireValidRoot(topicName, levels, maxSubscribersPerTopic);
        reporter.report("Создаю topology '" + topicName + "': уровней " + levels);

        TopicTree t = new TopicTree(topicName);
        // плотные уровни с полным fan-out до предпоследнего уровня
        fillWithChildren(t, TopicTree.ROOT, maxSubscribersPerTopic, 1, Math.max(1, levels - 1));

        int requiredLeaves = ceilDiv(subscriberCount, maxSubscribersPerTopic);
        List<TopicNode> leaves = t.leaves();
        // раскрытие листа в k детей добавляет k - 1 листьев, поэтому детей всегда не меньше двух
        int remaining = requiredLeaves - leaves.size();
        int extraPerNode = remaining > 0 ? ceilDiv(remaining, leaves.size()) : 0;

        for (TopicNode leaf : leaves) {
            if (remaining <= 0) {
                break;
            }
            int extra = Math.min(remaining, extraPerNode);
            fillWithChildren(t, leaf.id(), extra + 1, 1, 2);
            remaining -= extra;
        }

        this.tree = t;
        LOG.info("Topology '{}' построена: узлов={}, листьев={}, подписчиков={}, лимит на топик={}",
                topicName, t.size(), getNumberOfLeafTopics(), subscriberCount, maxSubscribersPerTopic);
    }

    /**
     * Идемпотентно материализует topology: сначала все топики (уровень за уровнем, узлы уровня
     * параллельно), затем строка подключения раздаётся всем узлам, затем создаются недостающие
     * подписки-пересылки родитель→ребёнок.
     */
    public EmitReport emit() {
        TopicTree t = requireTree();
        Counters c = new Counters();
        reporter.report("Создаю топики topology '" + topicName + "'");
        ExecutorService pool = newPool("emit");
        try {
            for (List<Integer> level : t.levels()) {
                runLevel(pool, level, id -> emitTopic(t.node(id), c));
            }
            reporter.report("Топики созданы: " + c.topics.get() + " из " + t.size());

            propagateConnectionString(t);

            for (List<Integer> level : t.levels()) {
                runLevel(pool, parentsOnly(t, level), id -> emitChildSubscriptions(t, id, c));
            }
        } finally {
            pool.shutdownNow();
        }
        EmitReport report = c.toReport();
        if (report.isComplete()) {
            LOG.info("Topology '{}' материализована: {}", topicName, report);
        } else {
            LOG.warn("Topology '{}' материализована частично, повторный emit достроит её: {}", topicName, report);
        }
        return report;
    }

    /**
     * Удаляет topology: подписки-пересылки сверху вниз, затем топики начиная с листьев.
     *
     * @param leaveRoot оставить корневой топик: вызывающие уже держат его как точку публикации
     */
    public EmitReport destroy(boolean leaveRoot) {
        TopicTree t = requireTree();
        Counters c = new Counters();
        reporter.report(leaveRoot
                ? "Удаляю topology '" + topicName + "', корневой топик сохраняется"
                : "Удаляю topology '" + topicName + "' вместе с корневым топиком");
        ExecutorService pool = newPool("destroy");
        try {
            List<List<Integer>> levels = t.levels();
            for (List<Integer> level : levels) {
                runLevel(pool, parentsOnly(t, level), id -> destroyChildSubscriptions(t, id, c));
            }
            for (int i = levels.size() - 1; i >= 0; i--) {
                if (i == 0 && leaveRoot) {
                    continue;
                }
                runLevel(pool, levels.get(i), id -> destroyTopic(t.node(id), c));
            }
        } finally {
            pool.shutdownNow();
        }
        EmitReport report = c.toReport();
        LOG.info("Topology '{}' удалена (leaveRoot={}): {}", topicName, leaveRoot, report);
        return report;
    }

    public int getNumberOfLeafTopics() {
        return requireTree().leaves().size();
    }

    public List<TopicNode> getLeafNodes() {
        return Collections.unmodifiableList(requireTree().leaves());
    }

    public TopicInfo getRootTopic() {
        return requireTree().root().toInfo();
    }

    public int totalNumberOfNodes() {
        return requireTree().size();
    }

    /** Дерево только для чтения; {@code null} до вызова {@link #generate(int)}. */
    public TopicTree tree() {
        return tree;
    }

    public static String forwardingSubscriptionName(String childName) {
        return FORWARD_PREFIX + childName;
    }

    /** Наименьшее {@code L >= 1}, при котором {@code max^L >= count}, без плавающей точки. */
    static int requiredLevels(int count, int max) {
        long capacity = max;
        int levels = 1;
        while (capacity < count) {
            capacity *= max;
            levels++;
        }
        return levels;
    }

    private static int ceilDiv(int a, int b) {
        return (a + b - 1) / b;
    }

    private void fillWithChildren(TopicTree t, int nodeId, int numberOfChildren, int currentLevel, int maxLevel) {
        if (currentLevel == maxLevel) {
            return;
        }
        String parentName = t.node(nodeId).name();
        for (int i = 1; i <= numberOfChildren; i++) {
            int child = t.addChild(nodeId, parentName + "-" + i);
            fillWithChildren(t, child, numberOfChildren, currentLevel + 1, maxLevel);
        }
    }

    private void emitTopic(TopicNode node, Counters c) {
        boolean ok = retry.run("создание топика " + node.name(), () -> {
            management.createOrUpdateTopic(node.name());
            return true;
        });
        if (ok) {
            c.topics.incrementAndGet();
        } else {
            c.topicsAbandoned.incrementAndGet();
            reporter.report("Не удалось создать топик " + node.name());
        }
    }

    private void destroyTopic(TopicNode node, Counters c) {
        boolean ok = retry.run("удаление топика " + node.name(), () -> {
            management.deleteTopic(node.name());
            return true;
        });
        if (ok) {
            int n = c.topics.incrementAndGet();
            reporter.report("Удалено топиков: " + n);
        } else {
            c.topicsAbandoned.incrementAndGet();
        }
    }

    private void emitChildSubscriptions(TopicTree t, int parentId, Counters c) {
        String parent = t.node(parentId).name();
        for (Integer childId : t.children(parentId)) {
            String child = t.node(childId).name();
            String subscription = forwardingSubscriptionName(child);
            boolean ok = retry.run("подписка " + parent + " → " + child, () -> {
                if (management.subscriptionExists(parent, subscription)) {
                    c.subscriptionsExisting.incrementAndGet();
                    return true;
                }
                management.createForwardingSubscription(parent, subscription, child);
                c.subscriptions.incrementAndGet();
                return true;
            });
            if (!ok) {
                c.subscriptionsAbandoned.incrementAndGet();
            }
        }
    }

    private void destroyChildSubscriptions(TopicTree t, int parentId, Counters c) {
        String parent = t.node(parentId).name();
        for (Integer childId : t.children(parentId)) {
            String subscription = forwardingSubscriptionName(t.node(childId).name());
            boolean ok = retry.run("удаление подписки " + parent + '/' + subscription, () -> {
                management.deleteSubscription(parent, subscription);
                return true;
            });
            if (ok) {
                c.subscriptions.incrementAndGet();
            } else {
                c.subscriptionsAbandoned.incrementAndGet();
            }
        }
    }

    private void propagateConnectionString(TopicTree t) {
        String connection;
        try {
            connection = retry.call("строка подключения для " + topicName, management::namespaceConnectionString);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Обработка topology '" + topicName + "' прервана", ie);
        } catch (Exception e) {
            LOG.warn("Строка подключения для topology '{}' не получена, узлы сохраняют прежнее значение: {}",
                    topicName, e.getMessage());
            return;
        }
        if (connection == null) {
            LOG.warn("Брокер вернул пустую строку подключения для topology '{}'", topicName);
            return;
        }
        for (int id = 0; id < t.size(); id++) {
            t.node(id).connectionHandle(connection);
        }
    }

    private static List<Integer> parentsOnly(TopicTree t, List<Integer> level) {
        List<Integer> out = new ArrayList<>(level.size());
        for (Integer id : level) {
            if (!t.isLeaf(id)) {
                out.add(id);
            }
        }
        return out;
    }

    /** Выполняет действие для всех узлов уровня параллельно и дожидается завершения уровня. */
    private void runLevel(ExecutorService pool, List<Integer> level, IntConsumer action) {
        if (level.isEmpty()) {
            return;
        }
        if (level.size() == 1) {
            action.accept(level.get(0));
            return;
        }
        List<Callable<Void>> tasks = new ArrayList<>(level.size());
        for (Integer id : level) {
            tasks.add(() -> {
                action.accept(id);
                return null;
            });
        }
        try {
            for (Future<Void> f : pool.invokeAll(tasks)) {
                awaitQuietly(f);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Обработка topology '" + topicName + "' прервана", ie);
        }
    }

    private void awaitQuietly(Future<Void> f) throws InterruptedException {
        try {
            f.get();
        } catch (ExecutionException e) {
            LOG.warn("Topology '{}': узел обработан с ошибкой: {}", topicName, e.getCause().getMessage());
            if (LOG.isDebugEnabled()) {
                LOG.debug("Трассировка ошибки обработки узла topology '{}'", topicName, e.getCause());
            }
        }
    }

    private ExecutorService newPool(String purpose) {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newFixedThreadPool(emitParallelism, r -> {
            Thread th = new Thread(r, "orch-" + purpose + '-' + topicName + '-' + seq.incrementAndGet());
            th.setDaemon(true);
            return th;
        });
    }

    private TopicTree requireTree() {
        if (tree == null) {
            throw new IllegalStateException("Topology '" + topicName + "' ещё не построена: вызовите generate()");
        }
        return tree;
    }

    /** Счётчики одного вызова emit/destroy; ветки уровня обновляют их параллельно. */
    private static final class Counters {
        final AtomicInteger topics = new AtomicInteger();
        final AtomicInteger topicsAbandoned = new AtomicInteger();
        final AtomicInteger subscriptions = new AtomicInteger();
        final AtomicInteger subscriptionsExisting = new AtomicInteger();
        final AtomicInteger subscriptionsAbandoned = new AtomicInteger();

        EmitReport toReport() {
            return new EmitReport(topics.get(), topicsAbandoned.get(), subscriptions.get(),
                    subscriptionsExisting.get(), subscriptionsAbandoned.get());
        }
    }
}
