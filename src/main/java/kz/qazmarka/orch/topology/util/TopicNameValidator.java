package kz.qazmarka.orch.topology.util;

/**
 * Проверка имён топиков topology. Дочерние узлы получают имена {@code parent-N},
 * поэтому ограничение длины проверяется с запасом под суффиксы.
 */
public final class TopicNameValidator {

    /** Лимит длины имени, совместимый со старыми версиями брокеров Kafka. */
    public static final int MAX_LENGTH = 249;

    private TopicNameValidator() {
    }

    /**
     * Быстрая проверка имени топика: допускаются латиница/цифры/._-, без "."/".." и не длиннее лимита.
     */
    public static boolean isValid(String topic, int maxLength) {
        if (topic == null) {
            return false;
        }
        int len = topic.length();
        if (len == 0 || len > maxLength) {
            return false;
        }
        if (".".equals(topic) || "..".equals(topic)) {
            return false;
        }
        for (int i = 0; i < len; i++) {
            if (!isAllowedTopicChar(topic.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Проверяет корневое имя с учётом того, что самый глубокий узел получит {@code depth - 1}
     * суффиксов вида {@code -N}, где N не больше {@code maxFanOut}.
     *
     * @throws IllegalArgumentException если имя недопустимо
     */
    public static void requireValidRoot(String topic, int depth, int maxFanOut) {
        int suffixLen = (Math.max(1, depth) - 1) * (1 + Integer.toString(Math.max(1, maxFanOut)).length());
        if (!isValid(topic, MAX_LENGTH - suffixLen)) {
            throw new IllegalArgumentException("Некорректное имя топика '" + topic
                    + "': допускаются [a-zA-Z0-9._-], длина 1.." + (MAX_LENGTH - suffixLen) + ", запрещены '.' и '..'");
        }
    }

    private static boolean isAllowedTopicChar(char ch) {
        return (ch >= 'a' && ch <= 'z')
                || (ch >= 'A' && ch <= 'Z')
                || (ch >= '0' && ch <= '9')
                || ch == '.'
                || ch == '-'
                || ch == '_';
    }
}
