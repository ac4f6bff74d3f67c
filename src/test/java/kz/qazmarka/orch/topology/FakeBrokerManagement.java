package kz.qazmarka.orch.topology;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import kz.qazmarka.orch.topology.admin.BrokerManagement;
import kz.qazmarka.orch.topology.admin.BrokerManagementException;

/**
 * In-memory брокер для тестов topology: хранит топики и подписки-пересылки, считает вызовы
 * и умеет отказывать для выбранных топиков.
 */
public final class FakeBrokerManagement implements BrokerManagement {

    static final String CONNECTION = "Endpoint=sb://fake/";

    final Set<String> topics = ConcurrentHashMap.newKeySet();
    /** topic → (subscription → forwardTo) */
    final Map<String, Map<String, String>> subscriptions = new ConcurrentHashMap<>();
    final List<String> deletedTopics = new CopyOnWriteArrayList<>();
    final AtomicInteger createTopicCalls = new AtomicInteger();
    final AtomicInteger createSubscriptionCalls = new AtomicInteger();
    final Set<String> failingTopics = Collections.synchronizedSet(new HashSet<String>());
    volatile boolean closed;

    @Override
    public boolean topicExists(String topic) {
        return topics.contains(topic);
    }

    @Override
    public void createOrUpdateTopic(String topic) {
        createTopicCalls.incrementAndGet();
        if (failingTopics.contains(topic)) {
            throw new BrokerManagementException("брокер недоступен: " + topic);
        }
        topics.add(topic);
    }

    @Override
    public void deleteTopic(String topic) {
        if (topics.remove(topic)) {
            deletedTopics.add(topic);
        }
        subscriptions.remove(topic);
    }

    @Override
    public boolean subscriptionExists(String topic, String subscription) {
        Map<String, String> subs = subscriptions.get(topic);
        return subs != null && subs.containsKey(subscription);
    }

    @Override
    public void createForwardingSubscription(String topic, String subscription, String forwardTo) {
        createSubscriptionCalls.incrementAndGet();
        if (!topics.contains(topic) || !topics.contains(forwardTo)) {
            throw new BrokerManagementException("нет топика для подписки " + topic + " → " + forwardTo);
        }
        subscriptions.computeIfAbsent(topic, k -> new ConcurrentHashMap<>()).put(subscription, forwardTo);
    }

    @Override
    public void deleteSubscription(String topic, String subscription) {
        Map<String, String> subs = subscriptions.get(topic);
        if (subs != null) {
            subs.remove(subscription);
        }
    }

    @Override
    public String namespaceConnectionString() {
        return CONNECTION;
    }

    @Override
    public void close() {
        closed = true;
    }

    int subscriptionCount() {
        int n = 0;
        for (Map<String, String> subs : subscriptions.values()) {
            n += subs.size();
        }
        return n;
    }
}
