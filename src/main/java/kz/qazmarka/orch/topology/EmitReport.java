package kz.qazmarka.orch.topology;

/**
 * Итог одного вызова emit/destroy: сколько топиков и подписок обработано и сколько брошено
 * после исчерпания повторов. Брошенные операции лечатся повторным идемпотентным emit.
 */
public final class EmitReport {

    private final int topicsProcessed;
    private final int topicsAbandoned;
    private final int subscriptionsCreated;
    private final int subscriptionsExisting;
    private final int subscriptionsAbandoned;

    EmitReport(int topicsProcessed,
               int topicsAbandoned,
               int subscriptionsCreated,
               int subscriptionsExisting,
               int subscriptionsAbandoned) {
        this.topicsProcessed = topicsProcessed;
        this.topicsAbandoned = topicsAbandoned;
        this.subscriptionsCreated = subscriptionsCreated;
        this.subscriptionsExisting = subscriptionsExisting;
        this.subscriptionsAbandoned = subscriptionsAbandoned;
    }

    public int topicsProcessed() {
        return topicsProcessed;
    }

    public int topicsAbandoned() {
        return topicsAbandoned;
    }

    /** Для destroy: число удалённых подписок. */
    public int subscriptionsCreated() {
        return subscriptionsCreated;
    }

    public int subscriptionsExisting() {
        return subscriptionsExisting;
    }

    public int subscriptionsAbandoned() {
        return subscriptionsAbandoned;
    }

    /** @return {@code true}, если ни одна операция не была брошена */
    public boolean isComplete() {
        return topicsAbandoned == 0 && subscriptionsAbandoned == 0;
    }

    @Override
    public String toString() {
        return "EmitReport{topics=" + topicsProcessed
                + ", topicsAbandoned=" + topicsAbandoned
                + ", subscriptionsCreated=" + subscriptionsCreated
                + ", subscriptionsExisting=" + subscriptionsExisting
                + ", subscriptionsAbandoned=" + subscriptionsAbandoned + '}';
    }
}
