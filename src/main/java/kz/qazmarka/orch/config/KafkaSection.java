package kz.qazmarka.orch.config;

import java.util.Map;

import org.apache.hadoop.conf.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.orch.util.Parsers;

/**
 * Секция {@code orch.kafka.*}: адреса брокеров, таймаут и client.id AdminClient, параметры создаваемых топиков.
 * Без {@code bootstrap.servers} секция считается отсутствующей. Нечисловые параметры топиков
 * заменяются значениями по умолчанию.
 */
final class KafkaSection {
    private static final Logger LOG = LoggerFactory.getLogger(KafkaSection.class);
    private static final String ERR_MIN_FMT = "Некорректное значение {}={}, устанавливаю минимум: {}";

    final String bootstrap;
    final long adminTimeoutMs;
    final String adminClientId;
    final int topicPartitions;
    final short topicReplication;
    final Map<String, String> adminProps;

    private KafkaSection(Configuration cfg, String bootstrap) {
        this.bootstrap = bootstrap;
        this.adminTimeoutMs = ConfigMins.ensureMinLong(LOG, ERR_MIN_FMT,
                Parsers.readLong(cfg, OrchConfig.K_KAFKA_ADMIN_TIMEOUT_MS, OrchConfig.DEFAULT_ADMIN_TIMEOUT_MS),
                1L, OrchConfig.K_KAFKA_ADMIN_TIMEOUT_MS);
        this.adminClientId = Parsers.buildAdminClientId(cfg, OrchConfig.K_KAFKA_ADMIN_CLIENT_ID,
                OrchConfig.DEFAULT_ADMIN_CLIENT_ID);
        this.topicPartitions = ConfigMins.ensureMinInt(LOG, ERR_MIN_FMT,
                Parsers.parseIntSafe(cfg.getTrimmed(OrchConfig.K_KAFKA_TOPIC_PARTITIONS), OrchConfig.DEFAULT_TOPIC_PARTITIONS),
                1, OrchConfig.K_KAFKA_TOPIC_PARTITIONS);
        this.topicReplication = (short) ConfigMins.ensureMinInt(LOG, ERR_MIN_FMT,
                Parsers.parseIntSafe(cfg.getTrimmed(OrchConfig.K_KAFKA_TOPIC_REPLICATION),
                        OrchConfig.DEFAULT_TOPIC_REPLICATION),
                1, OrchConfig.K_KAFKA_TOPIC_REPLICATION);
        this.adminProps = Parsers.readWithPrefix(cfg, OrchConfig.Keys.ADMIN_PROPS_PREFIX);
    }

    /** @return секция или {@code null}, если bootstrap не задан */
    static KafkaSection from(Configuration cfg) {
        String bootstrap = cfg.getTrimmed(OrchConfig.Keys.BOOTSTRAP);
        if (bootstrap == null || bootstrap.isEmpty()) {
            return null;
        }
        return new KafkaSection(cfg, bootstrap);
    }

    KafkaAdminSettings toSettings() {
        return new KafkaAdminSettings(bootstrap, adminTimeoutMs, adminClientId, topicPartitions, topicReplication,
                adminProps);
    }
}
