package kz.qazmarka.orch.backup;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Схема имён целевых аккаунтов бэкапа: {@code <suffix>-YYYY-MM-DD} (UTC, месяц и день с ведущим нулём).
 *
 * Разбор строгий: ровно четыре токена через '-', год из четырёх цифр, месяц и день из двух,
 * существующая календарная дата. Любое отклонение даёт {@link UnexpectedTargetNameException},
 * дата никогда не подставляется по умолчанию.
 */
public final class BackupTargetNaming {

    static final char DELIMITER = '-';
    private static final int TOKENS = 4;

    private final String suffix;

    /**
     * @param suffix непустой суффикс без символа {@code '-'} (буквы и цифры)
     * @throws IllegalArgumentException если суффикс не проходит проверку
     */
    public BackupTargetNaming(String suffix) {
        this.suffix = validateSuffix(suffix);
    }

    /** Проверяет суффикс; используется и при чтении конфигурации. */
    public static String validateSuffix(String suffix) {
        if (suffix == null || suffix.trim().isEmpty()) {
            throw new IllegalArgumentException("Суффикс целевого аккаунта бэкапа не задан");
        }
        String s = suffix.trim();
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isLetterOrDigit(s.charAt(i))) {
                throw new IllegalArgumentException("Суффикс целевого аккаунта должен состоять из букв и цифр: '" + s + "'");
            }
        }
        return s;
    }

    public String suffix() {
        return suffix;
    }

    /** Имя аккаунта для даты. */
    public String format(LocalDate date) {
        Objects.requireNonNull(date, "date");
        if (date.getYear() < 0 || date.getYear() > 9999) {
            throw new IllegalArgumentException("Год вне диапазона 0000..9999: " + date);
        }
        StringBuilder sb = new StringBuilder(suffix.length() + 11);
        sb.append(suffix).append(DELIMITER);
        pad(sb, date.getYear(), 4).append(DELIMITER);
        pad(sb, date.getMonthValue(), 2).append(DELIMITER);
        pad(sb, date.getDayOfMonth(), 2);
        return sb.toString();
    }

    /** Имя аккаунта для календарного дня момента {@code instant} в UTC. */
    public String format(Instant instant) {
        return format(instant.atZone(ZoneOffset.UTC).toLocalDate());
    }

    /**
     * Извлекает дату создания аккаунта из имени. Суффикс не сверяется с настроенным: журнал может
     * ссылаться на аккаунты, созданные с прежним суффиксом.
     *
     * @throws UnexpectedTargetNameException при нарушении формата
     */
    public static LocalDate parseDate(String accountName) {
        if (accountName == null) {
            throw new UnexpectedTargetNameException("null");
        }
        String[] tokens = accountName.split(String.valueOf(DELIMITER), -1);
        if (tokens.length != TOKENS || tokens[0].isEmpty()) {
            throw new UnexpectedTargetNameException(accountName);
        }
        int year = strictNumber(tokens[1], 4, accountName);
        int month = strictNumber(tokens[2], 2, accountName);
        int day = strictNumber(tokens[3], 2, accountName);
        try {
            return LocalDate.of(year, month, day);
        } catch (DateTimeException e) {
            throw new UnexpectedTargetNameException(accountName, e);
        }
    }

    /** Начало дня создания аккаунта (UTC). */
    public static Instant parseCreatedAt(String accountName) {
        return parseDate(accountName).atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    private static int strictNumber(String token, int width, String accountName) {
        if (token.length() != width) {
            throw new UnexpectedTargetNameException(accountName);
        }
        int v = 0;
        for (int i = 0; i < width; i++) {
            char c = token.charAt(i);
            if (c < '0' || c > '9') {
                throw new UnexpectedTargetNameException(accountName);
            }
            v = v * 10 + (c - '0');
        }
        return v;
    }

    private static StringBuilder pad(StringBuilder sb, int value, int width) {
        String s = Integer.toString(value);
        for (int i = s.length(); i < width; i++) {
            sb.append('0');
        }
        return sb.append(s);
    }
}
