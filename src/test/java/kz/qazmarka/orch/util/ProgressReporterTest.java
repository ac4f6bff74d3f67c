package kz.qazmarka.orch.util;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ProgressReporterTest {

    @Test
    @DisplayName("Сообщения доходят до колбэка, шаблон форматируется")
    void deliversMessages() {
        List<String> got = new ArrayList<>();
        ProgressReporter r = ProgressReporter.of(got::add);

        r.report("начало");
        r.report("таблица %s: %d строк", "orders", 42);

        assertEquals(2, got.size());
        assertEquals("начало", got.get(0));
        assertEquals("таблица orders: 42 строк", got.get(1));
    }

    @Test
    @DisplayName("Сбой колбэка не выходит наружу")
    void failingCallbackIsContained() {
        ProgressReporter r = ProgressReporter.of(m -> {
            throw new IllegalStateException("UI упал");
        });
        assertDoesNotThrow(() -> r.report("сообщение"));
    }

    @Test
    @DisplayName("of(null) возвращает молчаливый репортёр")
    void nullCallbackIsSilent() {
        assertSame(ProgressReporter.silent(), ProgressReporter.of(null));
        assertDoesNotThrow(() -> ProgressReporter.silent().report("никому"));
    }
}
