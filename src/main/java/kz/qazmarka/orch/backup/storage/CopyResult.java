package kz.qazmarka.orch.backup.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Итог копирования: флаг успеха, число строк и сообщения об ошибках. */
public final class CopyResult {

    private final boolean success;
    private final long rowsCopied;
    private final List<String> errors;

    private CopyResult(boolean success, long rowsCopied, List<String> errors) {
        this.success = success;
        this.rowsCopied = rowsCopied;
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public static CopyResult success(long rowsCopied) {
        return new CopyResult(true, rowsCopied, Collections.<String>emptyList());
    }

    public static CopyResult failure(long rowsCopied, List<String> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("Неуспешный результат копирования должен содержать ошибки");
        }
        return new CopyResult(false, rowsCopied, errors);
    }

    public boolean isSuccess() {
        return success;
    }

    public long getRowsCopied() {
        return rowsCopied;
    }

    public List<String> getErrors() {
        return errors;
    }

    @Override
    public String toString() {
        return "CopyResult{success=" + success + ", rows=" + rowsCopied + ", errors=" + errors + '}';
    }
}
