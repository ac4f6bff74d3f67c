package kz.qazmarka.orch.topology;

/**
 * Все листовые топики заполнены: topology недообеспечена под заявленную нагрузку.
 * Это ошибка конфигурации, повтор вызова её не исправит.
 */
public final class TopologyCapacityException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public TopologyCapacityException(String message) {
        super(message);
    }
}
