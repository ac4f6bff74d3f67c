package kz.qazmarka.orch.backup;

import java.time.Duration;
import java.util.Objects;

/**
 * Расписание бэкапа таблицы: как часто копировать, как часто менять целевой аккаунт и сколько хранить копии.
 */
public final class BackupSchedule {

    private final Duration incrementalFrequency;
    private final Duration switchTargetFrequency;
    private final Duration retention;

    public BackupSchedule(Duration incrementalFrequency, Duration switchTargetFrequency, Duration retention) {
        this.incrementalFrequency = requireNonNegative(incrementalFrequency, "incrementalFrequency");
        this.switchTargetFrequency = requireNonNegative(switchTargetFrequency, "switchTargetFrequency");
        this.retention = requireNonNegative(retention, "retention");
    }

    private static Duration requireNonNegative(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative()) {
            throw new IllegalArgumentException(name + " не может быть отрицательным: " + d);
        }
        return d;
    }

    public Duration getIncrementalFrequency() {
        return incrementalFrequency;
    }

    public Duration getSwitchTargetFrequency() {
        return switchTargetFrequency;
    }

    public Duration getRetention() {
        return retention;
    }

    @Override
    public String toString() {
        return "BackupSchedule{incremental=" + incrementalFrequency
                + ", switchTarget=" + switchTargetFrequency
                + ", retention=" + retention + '}';
    }
}
