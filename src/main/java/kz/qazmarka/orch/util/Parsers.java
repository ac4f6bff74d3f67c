package kz.qazmarka.orch.util;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import org.apache.hadoop.conf.Configuration;

/**
 * Набор утилит для чтения и нормализации конфигурации {@code orch.*}.
 *
 * Класс не хранит состояния: все методы статические и thread‑safe при передаче неизменяемых аргументов.
 */
public final class Parsers {

    /**
     * Значения, которые трактуем как {@code true} при разборе конфигурации.
     */
    private static final Set<String> TRUE_TOKENS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "true", "1", "yes", "on"
    )));
    /**
     * Значения, которые трактуем как {@code false} при разборе конфигурации.
     */
    private static final Set<String> FALSE_TOKENS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "false", "0", "no", "off"
    )));

    private Parsers() {}

    /**
     * Безопасно парсит целое из строки.
     *
     * @param s      исходная строка (может быть {@code null} или содержать пробелы)
     * @param defVal значение по умолчанию, если {@code s} пустая/некорректная
     * @return распарсенное целое либо {@code defVal} при ошибке
     */
    public static int parseIntSafe(String s, int defVal) {
        if (s == null) return defVal;
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException ex) {
            return defVal;
        }
    }

    /**
     * Нормализует токен для сравнения: {@code trim()} и нижний регистр {@link Locale#ROOT ROOT}.
     *
     * @param s исходная строка (может быть {@code null})
     * @return нормализованная строка; для {@code null}: пустая строка
     */
    public static String lower(String s) {
        return (s == null) ? "" : s.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Считывает {@code long} из {@link Configuration} с мягкой деградацией.
     *
     * @param cfg    конфигурация Hadoop
     * @param key    ключ
     * @param defVal значение по умолчанию при {@code null}/некорректном вводе
     * @return валидное {@code long} значение либо {@code defVal}
     */
    public static long readLong(Configuration cfg, String key, long defVal) {
        String v = cfg.get(key);
        if (v == null) return defVal;
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException nfe) {
            return defVal;
        }
    }

    /**
     * Читает булев флаг с поддержкой токенов {@code true/false/1/0/yes/no/on/off}.
     * Нераспознанное значение трактуется как {@code defVal}.
     */
    public static boolean readBoolean(Configuration cfg, String key, boolean defVal) {
        String raw = cfg.getTrimmed(key);
        if (raw == null || raw.isEmpty()) return defVal;
        String v = lower(raw);
        if (TRUE_TOKENS.contains(v)) return true;
        if (FALSE_TOKENS.contains(v)) return false;
        return defVal;
    }

    /**
     * Читает длительность в миллисекундах. Поддерживает суффиксы Hadoop ({@code ms, s, m, h, d});
     * число без суффикса трактуется как миллисекунды.
     *
     * @param cfg    конфигурация Hadoop
     * @param key    ключ
     * @param defMs  значение по умолчанию (мс)
     * @return длительность в миллисекундах либо {@code defMs}, если ключ не задан или значение некорректно
     */
    public static long readDurationMs(Configuration cfg, String key, long defMs) {
        String raw = cfg.getTrimmed(key);
        if (raw == null || raw.isEmpty()) return defMs;
        try {
            return cfg.getTimeDuration(key, defMs, TimeUnit.MILLISECONDS);
        } catch (NumberFormatException nfe) {
            return defMs;
        }
    }

    /**
     * Возвращает строку из {@link Configuration} или значение по умолчанию, если она пустая.
     */
    public static String readStringOrDefault(Configuration cfg, String key, String defVal) {
        String v = cfg.getTrimmed(key);
        return (v == null || v.isEmpty()) ? defVal : v;
    }

    /**
     * Читает CSV-список: значение разбивается по запятым, элементы триммируются, пустые исключаются.
     */
    public static List<String> readCsvList(Configuration cfg, String key) {
        if (key == null) return Collections.emptyList();
        List<String> values = splitCsv(cfg.getTrimmed(key));
        return values.isEmpty() ? Collections.<String>emptyList() : Collections.unmodifiableList(values);
    }

    private static List<String> splitCsv(String raw) {
        if (raw == null || raw.isEmpty()) return Collections.emptyList();
        String[] parts = raw.split(",");
        List<String> out = new ArrayList<>(parts.length);
        for (String part : parts) {
            String trimmed = part == null ? "" : part.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    /**
     * Обобщённое чтение пары ключ/значение по заданному префиксу конфигурации.
     * Возвращает карту без префикса в ключах. Пустые ключи/значения игнорируются.
     *
     * Например, {@code orch.backup.table.orders.retention=30d} при префиксе
     * {@code orch.backup.table.orders.} даёт {@code {"retention" → "30d"}}.
     *
     * @param cfg    конфигурация Hadoop
     * @param prefix строковый префикс ключей
     * @return новая изменяемая {@link HashMap} с нормализованными ключами без префикса
     */
    public static Map<String, String> readWithPrefix(Configuration cfg, String prefix) {
        Map<String, String> out = new HashMap<>();
        for (Map.Entry<String, String> e : cfg) {
            String k = e.getKey();
            if (k == null || !k.startsWith(prefix)) continue;
            String suffix = k.substring(prefix.length()).trim();
            String v = e.getValue() == null ? "" : e.getValue().trim();
            if (!suffix.isEmpty() && !v.isEmpty()) {
                out.put(suffix, v);
            }
        }
        return out;
    }

    /**
     * Формирует {@code client.id} для {@code AdminClient}.
     * Если значение задано явно, возвращает его; иначе пытается использовать имя хоста.
     *
     * @param cfg         конфигурация Hadoop
     * @param explicitKey ключ явного значения client.id
     * @param defaultId   базовый префикс на случай отсутствия явного значения/ошибки определения хоста
     * @return итоговый {@code client.id}
     */
    public static String buildAdminClientId(Configuration cfg, String explicitKey, String defaultId) {
        String adminClientId = cfg.getTrimmed(explicitKey);
        if (adminClientId != null && !adminClientId.isEmpty()) {
            return adminClientId;
        }
        try {
            return defaultId + "-" + InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return defaultId;
        }
    }
}
