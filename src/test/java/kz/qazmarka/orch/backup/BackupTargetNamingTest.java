package kz.qazmarka.orch.backup;

import java.time.Instant;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BackupTargetNamingTest {

    private final BackupTargetNaming naming = new BackupTargetNaming("bkp");

    @Test
    @DisplayName("format(): месяц и день с ведущим нулём, дата момента берётся в UTC")
    void formatsWithZeroPadding() {
        assertEquals("bkp-2024-03-05", naming.format(LocalDate.of(2024, 3, 5)));
        assertEquals("bkp-2023-12-31", naming.format(Instant.parse("2023-12-31T23:59:59Z")));
    }

    @Test
    @DisplayName("parseDate(): имя, сформированное format(), разбирается обратно в ту же дату")
    void parsesOwnFormat() {
        LocalDate d = LocalDate.of(2024, 2, 29);
        assertEquals(d, BackupTargetNaming.parseDate(naming.format(d)));
        assertEquals(Instant.parse("2024-02-29T00:00:00Z"), BackupTargetNaming.parseCreatedAt("old1-2024-02-29"));
    }

    @Test
    @DisplayName("parseDate(): любое отклонение от схемы: UnexpectedTargetNameException")
    void rejectsMalformedNames() {
        String[] bad = {
                "bkp",
                "bkp-2024-03",
                "bkp-2024-03-05-x",
                "-2024-03-05",
                "bkp-24-03-05",
                "bkp-2024-3-05",
                "bkp-2024-03-5",
                "bkp-2024-0a-05",
                "bkp-2024-02-30",
                "bkp-2024-13-01",
                "bkp-+024-03-05"
        };
        for (String name : bad) {
            UnexpectedTargetNameException ex = assertThrows(UnexpectedTargetNameException.class,
                    () -> BackupTargetNaming.parseDate(name), name);
            assertEquals(name, ex.getAccountName());
        }
    }

    @Test
    @DisplayName("Суффикс из букв и цифр обязателен")
    void suffixValidation() {
        assertThrows(IllegalArgumentException.class, () -> new BackupTargetNaming(""));
        assertThrows(IllegalArgumentException.class, () -> new BackupTargetNaming("my-bkp"));
        assertEquals("bkp2", new BackupTargetNaming(" bkp2 ").suffix());
    }
}
