package kz.qazmarka.orch.config;

import java.util.Objects;

import org.apache.hadoop.conf.Configuration;

/**
 * Иммутабельная конфигурация оркестратора, прочитанная один раз из Hadoop {@link Configuration}.
 *
 * Содержит:
 *  - настройки topology топиков (лимит подписок на топик, режим масштабирования, параллелизм emit, повторы);
 *  - параметры Kafka AdminClient для адаптера управления брокером (если задан bootstrap);
 *  - настройки бэкапа таблиц (суффикс целевых аккаунтов и расписания таблиц), если перечислены таблицы.
 */
public final class OrchConfig {

    // ==== Ключи topology ====
    /** Максимум подписок на один топик (fan-out узла). */
    static final String K_TOPOLOGY_MAX_SUBSCRIBERS = "orch.topology.max.subscribers.per.topic";
    /** Режим масштабирования: vertical | horizontal. */
    static final String K_TOPOLOGY_SCALE_MODE = "orch.topology.scale.mode";
    /** Материализовать ли topology сразу при создании экземпляра масштабировщиком. */
    static final String K_TOPOLOGY_AUTO_EMIT = "orch.topology.auto.emit";
    /** Число потоков, обрабатывающих узлы одного уровня при emit/destroy. */
    static final String K_TOPOLOGY_EMIT_PARALLELISM = "orch.topology.emit.parallelism";

    // ==== Ключи повторов ====
    static final String K_RETRY_MAX_ATTEMPTS = "orch.retry.max.attempts";
    static final String K_RETRY_DELAY_MS = "orch.retry.delay.ms";
    /** Джиттер задержки, проценты (0: фиксированная задержка). */
    static final String K_RETRY_JITTER_PERCENT = "orch.retry.jitter.percent";

    // ==== Ключи Kafka ====
    static final String K_KAFKA_ADMIN_TIMEOUT_MS = "orch.kafka.admin.timeout.ms";
    static final String K_KAFKA_ADMIN_CLIENT_ID = "orch.kafka.admin.client.id";
    static final String K_KAFKA_TOPIC_PARTITIONS = "orch.kafka.topic.partitions";
    static final String K_KAFKA_TOPIC_REPLICATION = "orch.kafka.topic.replication";

    // ==== Ключи бэкапа ====
    static final String K_BACKUP_TARGET_SUFFIX = "orch.backup.target.suffix";
    static final String K_BACKUP_TABLES = "orch.backup.tables";
    static final String K_BACKUP_DEFAULT_PREFIX = "orch.backup.default.";
    static final String K_BACKUP_TABLE_PREFIX = "orch.backup.table.";
    static final String P_SOURCE = "source";
    static final String P_MODE = "mode";
    static final String P_INCREMENTAL_FREQUENCY = "incremental.frequency";
    static final String P_SWITCH_FREQUENCY = "switch.frequency";
    static final String P_RETENTION = "retention";
    static final String P_TIMEOUT = "timeout";

    // ==== Значения по умолчанию ====
    static final int DEFAULT_MAX_SUBSCRIBERS_PER_TOPIC = 2000;
    static final String DEFAULT_SCALE_MODE = "vertical";
    static final boolean DEFAULT_AUTO_EMIT = true;
    static final int DEFAULT_EMIT_PARALLELISM = 4;
    static final int DEFAULT_RETRY_MAX_ATTEMPTS = 5;
    static final long DEFAULT_RETRY_DELAY_MS = 500L;
    static final int DEFAULT_RETRY_JITTER_PERCENT = 0;
    static final long DEFAULT_ADMIN_TIMEOUT_MS = 60000L;
    /** Базовое значение client.id для AdminClient (к нему добавляется hostname, если доступен). */
    public static final String DEFAULT_ADMIN_CLIENT_ID = "orch";
    static final int DEFAULT_TOPIC_PARTITIONS = 1;
    static final short DEFAULT_TOPIC_REPLICATION = 1;
    static final String DEFAULT_BACKUP_MODE = "incremental";
    static final long DEFAULT_INCREMENTAL_FREQUENCY_MS = 60L * 60L * 1000L;
    static final long DEFAULT_SWITCH_FREQUENCY_MS = 7L * 24L * 60L * 60L * 1000L;
    static final long DEFAULT_RETENTION_MS = 30L * 24L * 60L * 60L * 1000L;
    static final long DEFAULT_BACKUP_TIMEOUT_MS = 60L * 60L * 1000L;

    /**
     * Публичные ключи конфигурации orch.* для использования в других пакетах проекта.
     */
    public static final class Keys {
        /** Адреса Kafka bootstrap.servers. Формат: host:port[,host2:port2]. */
        public static final String BOOTSTRAP = "orch.kafka.bootstrap.servers";
        /** Префикс для переопределения любых свойств Kafka AdminClient (например, orch.kafka.admin.props.security.protocol). */
        public static final String ADMIN_PROPS_PREFIX = "orch.kafka.admin.props.";

        private Keys() {}
    }

    private final TopologySettings topology;
    private final KafkaAdminSettings kafka;
    private final BackupSettings backup;

    OrchConfig(TopologySettings topology, KafkaAdminSettings kafka, BackupSettings backup) {
        this.topology = Objects.requireNonNull(topology, "Секция topology не может быть null");
        this.kafka = kafka;
        this.backup = backup;
    }

    /**
     * Строит {@link OrchConfig} из Hadoop {@link Configuration}.
     *
     * @throws IllegalArgumentException при недопустимом режиме масштабирования, режиме бэкапа
     *                                  или отсутствии суффикса при заданных таблицах
     */
    public static OrchConfig from(Configuration cfg) {
        return new OrchConfigLoader().load(cfg);
    }

    public TopologySettings getTopology() {
        return topology;
    }

    public boolean hasKafka() {
        return kafka != null;
    }

    /** @throws IllegalStateException если {@code orch.kafka.bootstrap.servers} не задан */
    public KafkaAdminSettings getKafka() {
        if (kafka == null) {
            throw new IllegalStateException("Отсутствует обязательный параметр " + Keys.BOOTSTRAP);
        }
        return kafka;
    }

    public boolean hasBackup() {
        return backup != null;
    }

    /** @throws IllegalStateException если {@code orch.backup.tables} пуст */
    public BackupSettings getBackup() {
        if (backup == null) {
            throw new IllegalStateException("Бэкап не настроен: " + K_BACKUP_TABLES + " пуст");
        }
        return backup;
    }
}
