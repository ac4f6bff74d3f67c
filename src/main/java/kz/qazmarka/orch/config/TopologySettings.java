package kz.qazmarka.orch.config;

import java.util.Objects;

import kz.qazmarka.orch.topology.ScaleMode;
import kz.qazmarka.orch.util.RetryPolicy;

/**
 * DTO с настройками topology: лимит подписок на топик, режим масштабирования, автоматический emit,
 * параллелизм обработки уровня и политика повторов вызовов управления брокером.
 */
public final class TopologySettings {

    private final int maxSubscribersPerTopic;
    private final ScaleMode scaleMode;
    private final boolean autoEmit;
    private final int emitParallelism;
    private final int retryMaxAttempts;
    private final long retryDelayMs;
    private final int retryJitterPercent;

    public TopologySettings(int maxSubscribersPerTopic,
                            ScaleMode scaleMode,
                            boolean autoEmit,
                            int emitParallelism,
                            int retryMaxAttempts,
                            long retryDelayMs,
                            int retryJitterPercent) {
        if (maxSubscribersPerTopic < 2) {
            throw new IllegalArgumentException("maxSubscribersPerTopic должен быть >= 2, получено: " + maxSubscribersPerTopic);
        }
        this.maxSubscribersPerTopic = maxSubscribersPerTopic;
        this.scaleMode = Objects.requireNonNull(scaleMode, "scaleMode");
        this.autoEmit = autoEmit;
        this.emitParallelism = Math.max(1, emitParallelism);
        this.retryMaxAttempts = Math.max(1, retryMaxAttempts);
        this.retryDelayMs = Math.max(0L, retryDelayMs);
        this.retryJitterPercent = Math.min(100, Math.max(0, retryJitterPercent));
    }

    public int getMaxSubscribersPerTopic() {
        return maxSubscribersPerTopic;
    }

    public ScaleMode getScaleMode() {
        return scaleMode;
    }

    public boolean isAutoEmit() {
        return autoEmit;
    }

    public int getEmitParallelism() {
        return emitParallelism;
    }

    public int getRetryMaxAttempts() {
        return retryMaxAttempts;
    }

    public long getRetryDelayMs() {
        return retryDelayMs;
    }

    public int getRetryJitterPercent() {
        return retryJitterPercent;
    }

    /** Новая политика повторов по этим настройкам. */
    public RetryPolicy retryPolicy() {
        return new RetryPolicy(retryMaxAttempts, retryDelayMs, retryJitterPercent);
    }

    @Override
    public String toString() {
        return "TopologySettings{maxSubscribersPerTopic=" + maxSubscribersPerTopic
                + ", scaleMode=" + scaleMode
                + ", autoEmit=" + autoEmit
                + ", emitParallelism=" + emitParallelism
                + ", retry=" + retryMaxAttempts + "x" + retryDelayMs + "ms" + '}';
    }
}
