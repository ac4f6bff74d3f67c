package kz.qazmarka.orch.topology;

/**
 * Узел дерева топиков: имя широковещательного топика и строка подключения,
 * которую узел получает на этапе emit. Структура дерева хранится в {@link TopicTree}.
 */
public final class TopicNode {

    private final int id;
    private final String name;
    private volatile String connectionHandle;

    TopicNode(int id, String name) {
        this.id = id;
        this.name = name;
    }

    public int id() {
        return id;
    }

    public String name() {
        return name;
    }

    /** @return строка подключения к пространству имён или {@code null}, если topology ещё не материализована */
    public String connectionHandle() {
        return connectionHandle;
    }

    void connectionHandle(String handle) {
        this.connectionHandle = handle;
    }

    /** Снимок узла в виде описания топика для вызывающего кода. */
    public TopicInfo toInfo() {
        return new TopicInfo(name, connectionHandle);
    }

    @Override
    public String toString() {
        return "TopicNode{" + id + ':' + name + '}';
    }
}
