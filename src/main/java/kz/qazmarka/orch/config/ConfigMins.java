package kz.qazmarka.orch.config;

import org.slf4j.Logger;

/** Приведение числовых параметров к минимуму с предупреждением в журнал секции. */
final class ConfigMins {

    private ConfigMins() {}

    static int ensureMinInt(Logger log, String fmt, int value, int minimum, String key) {
        if (value < minimum) {
            log.warn(fmt, key, value, minimum);
            return minimum;
        }
        return value;
    }

    static long ensureMinLong(Logger log, String fmt, long value, long minimum, String key) {
        if (value < minimum) {
            log.warn(fmt, key, value, minimum);
            return minimum;
        }
        return value;
    }
}
