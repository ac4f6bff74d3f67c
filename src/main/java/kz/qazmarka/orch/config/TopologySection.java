package kz.qazmarka.orch.config;

import org.apache.hadoop.conf.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.orch.topology.ScaleMode;
import kz.qazmarka.orch.util.Parsers;

/**
 * Секция {@code orch.topology.*} и {@code orch.retry.*}. Значения ниже минимума приводятся к минимуму с WARN.
 */
final class TopologySection {
    private static final Logger LOG = LoggerFactory.getLogger(TopologySection.class);
    private static final String ERR_MIN_FMT = "Некорректное значение {}={}, устанавливаю минимум: {}";

    final int maxSubscribersPerTopic;
    final ScaleMode scaleMode;
    final boolean autoEmit;
    final int emitParallelism;
    final int retryMaxAttempts;
    final long retryDelayMs;
    final int retryJitterPercent;

    private TopologySection(Configuration cfg) {
        this.maxSubscribersPerTopic = ConfigMins.ensureMinInt(LOG, ERR_MIN_FMT,
                cfg.getInt(OrchConfig.K_TOPOLOGY_MAX_SUBSCRIBERS, OrchConfig.DEFAULT_MAX_SUBSCRIBERS_PER_TOPIC),
                2, OrchConfig.K_TOPOLOGY_MAX_SUBSCRIBERS);
        this.scaleMode = ScaleMode.parse(Parsers.readStringOrDefault(cfg, OrchConfig.K_TOPOLOGY_SCALE_MODE,
                OrchConfig.DEFAULT_SCALE_MODE));
        this.autoEmit = Parsers.readBoolean(cfg, OrchConfig.K_TOPOLOGY_AUTO_EMIT, OrchConfig.DEFAULT_AUTO_EMIT);
        this.emitParallelism = ConfigMins.ensureMinInt(LOG, ERR_MIN_FMT,
                cfg.getInt(OrchConfig.K_TOPOLOGY_EMIT_PARALLELISM, OrchConfig.DEFAULT_EMIT_PARALLELISM),
                1, OrchConfig.K_TOPOLOGY_EMIT_PARALLELISM);
        this.retryMaxAttempts = ConfigMins.ensureMinInt(LOG, ERR_MIN_FMT,
                cfg.getInt(OrchConfig.K_RETRY_MAX_ATTEMPTS, OrchConfig.DEFAULT_RETRY_MAX_ATTEMPTS),
                1, OrchConfig.K_RETRY_MAX_ATTEMPTS);
        this.retryDelayMs = ConfigMins.ensureMinLong(LOG, ERR_MIN_FMT,
                Parsers.readLong(cfg, OrchConfig.K_RETRY_DELAY_MS, OrchConfig.DEFAULT_RETRY_DELAY_MS),
                0L, OrchConfig.K_RETRY_DELAY_MS);
        this.retryJitterPercent = readJitter(cfg);
    }

    static TopologySection from(Configuration cfg) {
        return new TopologySection(cfg);
    }

    TopologySettings toSettings() {
        return new TopologySettings(maxSubscribersPerTopic, scaleMode, autoEmit, emitParallelism,
                retryMaxAttempts, retryDelayMs, retryJitterPercent);
    }

    private static int readJitter(Configuration cfg) {
        int jitter = cfg.getInt(OrchConfig.K_RETRY_JITTER_PERCENT, OrchConfig.DEFAULT_RETRY_JITTER_PERCENT);
        if (jitter < 0 || jitter > 100) {
            int fixed = jitter < 0 ? 0 : 100;
            LOG.warn("Некорректное значение {}={}, допустимо 0..100, устанавливаю {}",
                    OrchConfig.K_RETRY_JITTER_PERCENT, jitter, fixed);
            return fixed;
        }
        return jitter;
    }
}
