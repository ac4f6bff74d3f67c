package kz.qazmarka.orch.topology;

import java.util.Locale;

/**
 * Стратегия масштабирования топика сверх лимита подписок одного узла.
 */
public enum ScaleMode {
    /** Одно дерево, углубляемое по мере роста числа подписчиков. */
    VERTICAL,
    /** Несколько независимых одноуровневых деревьев, новое создаётся лениво. */
    HORIZONTAL;

    /**
     * Разбирает значение конфигурации ({@code vertical}/{@code horizontal}, регистр не важен).
     *
     * @throws IllegalArgumentException при неизвестном значении
     */
    public static ScaleMode parse(String raw) {
        String v = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        switch (v) {
            case "vertical":
            case "vertically":
                return VERTICAL;
            case "horizontal":
            case "horizontally":
                return HORIZONTAL;
            default:
                throw new IllegalArgumentException("Неизвестный режим масштабирования: '" + raw + "'");
        }
    }
}
