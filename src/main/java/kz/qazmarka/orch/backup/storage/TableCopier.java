package kz.qazmarka.orch.backup.storage;

import java.util.concurrent.CompletableFuture;

/**
 * Копирование исходной таблицы в целевой аккаунт. Операция может быть долгой; вызывающий
 * ждёт результат с жёстким таймаутом из {@link CopyRequest#getTimeout()}.
 */
public interface TableCopier {

    CompletableFuture<CopyResult> copy(CopyRequest request);
}
