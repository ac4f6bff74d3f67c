package kz.qazmarka.orch.backup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Что удалено за один проход очистки. */
public final class SweepResult {

    private final List<String> deletedTables;
    private final List<String> deletedAccounts;

    SweepResult(List<String> deletedTables, List<String> deletedAccounts) {
        this.deletedTables = Collections.unmodifiableList(new ArrayList<>(deletedTables));
        this.deletedAccounts = Collections.unmodifiableList(new ArrayList<>(deletedAccounts));
    }

    /** Удалённые таблицы в виде {@code <account>/<table>}. */
    public List<String> getDeletedTables() {
        return deletedTables;
    }

    public List<String> getDeletedAccounts() {
        return deletedAccounts;
    }

    @Override
    public String toString() {
        return "SweepResult{tables=" + deletedTables + ", accounts=" + deletedAccounts + '}';
    }
}
