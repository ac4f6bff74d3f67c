package kz.qazmarka.orch.config;

import org.apache.hadoop.conf.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Загружает {@link OrchConfig} из Hadoop {@link Configuration}, собирая секции {@code orch.*}.
 */
final class OrchConfigLoader {
    private static final Logger LOG = LoggerFactory.getLogger(OrchConfigLoader.class);

    OrchConfig load(Configuration cfg) {
        if (cfg == null) {
            throw new IllegalArgumentException("Конфигурация не может быть null");
        }
        TopologySettings topology = TopologySection.from(cfg).toSettings();
        KafkaSection kafka = KafkaSection.from(cfg);
        BackupSection backup = BackupSection.from(cfg);
        OrchConfig config = new OrchConfig(
                topology,
                kafka == null ? null : kafka.toSettings(),
                backup == null ? null : backup.toSettings());
        if (LOG.isDebugEnabled()) {
            LOG.debug("Конфигурация orch загружена: topology={}, kafka={}, таблиц в бэкапе={}",
                    topology,
                    kafka == null ? "нет" : kafka.bootstrap,
                    backup == null ? 0 : backup.tables.size());
        }
        return config;
    }
}
