package kz.qazmarka.orch.topology;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import kz.qazmarka.orch.util.RetryPolicy;

/**
 * Тесты {@link TopologyManager}: порядок выдачи слотов, исчерпание пула и линеаризация
 * конкурентных вызовов.
 */
class TopologyManagerTest {

    private static TopologyManager manager(int subscribers, int max) {
        FakeBrokerManagement broker = new FakeBrokerManagement();
        TopicTopology t = new TopicTopology("orders", broker, max, RetryPolicy.immediate(1), 2);
        t.generate(subscribers);
        t.emit();
        return new TopologyManager(t);
    }

    @Test
    @DisplayName("Слоты выдаются с первого листа, заполненный лист уходит из пула")
    void slotsFillLeavesInOrder() {
        TopologyManager m = manager(6, 3);

        TopicSubscriptionInfo first = m.getSubscriptionSlot();
        m.getSubscriptionSlot();
        TopicSubscriptionInfo third = m.getSubscriptionSlot();
        TopicSubscriptionInfo fourth = m.getSubscriptionSlot();

        assertEquals("orders-1", first.getName());
        assertEquals("orders-1-0", first.getSubscriptionName());
        assertEquals("orders-1-2", third.getSubscriptionName());
        assertEquals("orders-2", fourth.getName());
        assertEquals("orders-2-0", fourth.getSubscriptionName());
        assertEquals(FakeBrokerManagement.CONNECTION, fourth.getConnectionInfo());
        assertEquals(2L, m.remainingCapacity());
    }

    @Test
    @DisplayName("После выдачи всех слотов пул пуст, следующий запрос: ошибка ёмкости")
    void exhaustionIsSurfaced() {
        TopologyManager m = manager(5, 2);
        int leaves = m.topology().getNumberOfLeafTopics();
        assertEquals(3, leaves);

        for (int i = 0; i < leaves * 2; i++) {
            assertFalse(m.isFull());
            m.getSubscriptionSlot();
        }

        assertTrue(m.isFull());
        assertEquals(0L, m.remainingCapacity());
        assertThrows(TopologyCapacityException.class, m::getSubscriptionSlot);
    }

    @Test
    @DisplayName("Корневой топик менеджера совпадает с корнем topology")
    void rootTopicInfo() {
        TopologyManager m = manager(10, 4);
        assertEquals("orders", m.getRootTopicInfo().getName());
        assertEquals(FakeBrokerManagement.CONNECTION, m.getRootTopicInfo().getConnectionInfo());
    }

    @Test
    @DisplayName("Конкурентные вызовы никогда не получают один и тот же слот")
    void concurrentCallersGetDistinctSlots() throws Exception {
        final TopologyManager m = manager(400, 20);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<List<String>>> tasks = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                tasks.add(() -> {
                    List<String> got = new ArrayList<>();
                    for (int k = 0; k < 60; k++) {
                        try {
                            TopicSubscriptionInfo s = m.getSubscriptionSlot();
                            got.add(s.getName() + '/' + s.getSubscriptionName());
                        } catch (TopologyCapacityException e) {
                            break;
                        }
                    }
                    return got;
                });
            }
            Set<String> all = new HashSet<>();
            int total = 0;
            for (Future<List<String>> f : pool.invokeAll(tasks)) {
                List<String> got = f.get();
                total += got.size();
                all.addAll(got);
            }
            assertEquals(400, total);
            assertEquals(400, all.size());
            assertTrue(m.isFull());
        } finally {
            pool.shutdownNow();
            pool.awaitTermination(5, TimeUnit.SECONDS);
        }
    }
}
