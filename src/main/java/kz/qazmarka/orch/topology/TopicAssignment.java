package kz.qazmarka.orch.topology;

/**
 * Остаток ёмкости одного листового топика. Инвариант: {@code 0 <= used <= capacity}.
 * Изменяется только владеющим {@link TopologyManager} под его монитором.
 */
final class TopicAssignment {

    private final TopicNode endpoint;
    private final int capacity;
    private int used;

    TopicAssignment(TopicNode endpoint, int used, int capacity) {
        if (capacity < 1 || used < 0 || used > capacity) {
            throw new IllegalArgumentException("Некорректная ёмкость: used=" + used + ", capacity=" + capacity);
        }
        this.endpoint = endpoint;
        this.used = used;
        this.capacity = capacity;
    }

    TopicNode endpoint() {
        return endpoint;
    }

    /**
     * Занимает очередной слот.
     *
     * @return индекс занятого слота (с нуля)
     */
    int assign() {
        if (isFull()) {
            throw new IllegalStateException("Топик '" + endpoint.name() + "' уже заполнен");
        }
        return used++;
    }

    boolean isFull() {
        return used == capacity;
    }

    int remaining() {
        return capacity - used;
    }
}
