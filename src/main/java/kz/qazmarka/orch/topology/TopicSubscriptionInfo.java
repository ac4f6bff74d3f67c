package kz.qazmarka.orch.topology;

import java.util.Objects;

/**
 * Выданный вызывающему коду слот подписки: листовой топик, строка подключения и имя подписки.
 */
public final class TopicSubscriptionInfo extends TopicInfo {

    private final String subscriptionName;

    public TopicSubscriptionInfo(String topicName, String connectionInfo, String subscriptionName) {
        super(topicName, connectionInfo);
        this.subscriptionName = Objects.requireNonNull(subscriptionName, "subscriptionName");
    }

    public String getSubscriptionName() {
        return subscriptionName;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) return false;
        return subscriptionName.equals(((TopicSubscriptionInfo) o).subscriptionName);
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + subscriptionName.hashCode();
    }

    @Override
    public String toString() {
        return "TopicSubscriptionInfo{topic='" + getName() + "', subscription='" + subscriptionName + "'}";
    }
}
