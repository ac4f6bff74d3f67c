package kz.qazmarka.orch.topology;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Дерево топиков в виде арены: узлы адресуются стабильными целочисленными id,
 * дети хранятся списками id, а родитель необязательным id. Корень всегда имеет id {@code 0}.
 *
 * Дерево строится в одном потоке (генерация topology) и далее только читается,
 * поэтому внутренняя синхронизация не требуется.
 */
public final class TopicTree {

    public static final int ROOT = 0;
    private static final int NO_PARENT = -1;

    private final List<TopicNode> nodes = new ArrayList<>();
    private final List<List<Integer>> children = new ArrayList<>();
    private final List<Integer> parents = new ArrayList<>();
    private final Set<String> names = new HashSet<>();

    public TopicTree(String rootName) {
        append(rootName, NO_PARENT);
    }

    /**
     * Добавляет ребёнка к узлу {@code parentId}.
     *
     * @return id нового узла
     * @throws IllegalArgumentException если имя уже занято или родитель не существует
     */
    public int addChild(int parentId, String name) {
        checkId(parentId);
        int id = append(name, parentId);
        children.get(parentId).add(id);
        return id;
    }

    private int append(String name, int parentId) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Имя топика не может быть пустым");
        }
        if (!names.add(name)) {
            throw new IllegalArgumentException("Имя топика '" + name + "' уже используется в дереве");
        }
        int id = nodes.size();
        nodes.add(new TopicNode(id, name));
        children.add(new ArrayList<Integer>(4));
        parents.add(parentId);
        return id;
    }

    public TopicNode root() {
        return nodes.get(ROOT);
    }

    public TopicNode node(int id) {
        checkId(id);
        return nodes.get(id);
    }

    public List<Integer> children(int id) {
        checkId(id);
        return Collections.unmodifiableList(children.get(id));
    }

    /** @return id родителя либо {@code -1} для корня */
    public int parent(int id) {
        checkId(id);
        return parents.get(id);
    }

    public boolean isLeaf(int id) {
        checkId(id);
        return children.get(id).isEmpty();
    }

    /** Глубина узла, у корня она равна 1. */
    public int depth(int id) {
        int level = 1;
        int p = parent(id);
        while (p != NO_PARENT) {
            level++;
            p = parents.get(p);
        }
        return level;
    }

    public int size() {
        return nodes.size();
    }

    /** Листья в порядке обхода в глубину (порядок выдачи слотов подписок). */
    public List<TopicNode> leaves() {
        List<TopicNode> out = new ArrayList<>();
        collectLeaves(ROOT, out);
        return out;
    }

    private void collectLeaves(int id, List<TopicNode> out) {
        List<Integer> ch = children.get(id);
        if (ch.isEmpty()) {
            out.add(nodes.get(id));
            return;
        }
        for (Integer c : ch) {
            collectLeaves(c, out);
        }
    }

    /** Уровни дерева в ширину; {@code levels().get(0)} содержит только корень. */
    public List<List<Integer>> levels() {
        List<List<Integer>> out = new ArrayList<>();
        List<Integer> current = Collections.singletonList(ROOT);
        while (!current.isEmpty()) {
            out.add(current);
            List<Integer> next = new ArrayList<>();
            for (Integer id : current) {
                next.addAll(children.get(id));
            }
            current = next;
        }
        return out;
    }

    private void checkId(int id) {
        if (id < 0 || id >= nodes.size()) {
            throw new IllegalArgumentException("Нет узла с id " + id);
        }
    }
}
