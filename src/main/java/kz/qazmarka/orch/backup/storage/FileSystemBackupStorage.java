package kz.qazmarka.orch.backup.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Хранилище бэкапов на файловой системе: аккаунт: подкаталог корня, таблица: файл
 * {@code <table>.jsonl} (по JSON-объекту на строку).
 */
public final class FileSystemBackupStorage implements BackupStorage {

    private static final Logger LOG = LoggerFactory.getLogger(FileSystemBackupStorage.class);
    static final String TABLE_EXT = ".jsonl";

    private final Path root;

    public FileSystemBackupStorage(Path root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    public Path root() {
        return root;
    }

    @Override
    public List<String> listAccounts() {
        if (!Files.isDirectory(root)) {
            return Collections.emptyList();
        }
        List<String> out = new ArrayList<>();
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(root, Files::isDirectory)) {
            for (Path p : ds) {
                out.add(p.getFileName().toString());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Не удалось перечислить аккаунты в " + root, e);
        }
        Collections.sort(out);
        return out;
    }

    @Override
    public boolean accountExists(String account) {
        return Files.isDirectory(accountDir(account));
    }

    @Override
    public boolean createAccountIfNotExists(String account) {
        Path dir = accountDir(account);
        if (Files.isDirectory(dir)) {
            return false;
        }
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Не удалось создать аккаунт " + account, e);
        }
        LOG.info("Создан аккаунт бэкапа {}", account);
        return true;
    }

    @Override
    public List<String> listTables(String account) {
        Path dir = accountDir(account);
        if (!Files.isDirectory(dir)) {
            return Collections.emptyList();
        }
        List<String> out = new ArrayList<>();
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(dir, "*" + TABLE_EXT)) {
            for (Path p : ds) {
                String name = p.getFileName().toString();
                out.add(name.substring(0, name.length() - TABLE_EXT.length()));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Не удалось перечислить таблицы аккаунта " + account, e);
        }
        Collections.sort(out);
        return out;
    }

    @Override
    public boolean deleteTableIfExists(String account, String table) {
        try {
            return Files.deleteIfExists(tableFile(account, table));
        } catch (IOException e) {
            throw new UncheckedIOException("Не удалось удалить таблицу " + account + '/' + table, e);
        }
    }

    @Override
    public boolean deleteAccount(String account) {
        Path dir = accountDir(account);
        if (!Files.isDirectory(dir)) {
            return false;
        }
        try {
            Files.walkFileTree(dir, new SimpleFileVisitor<Path>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    Files.delete(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path d, IOException exc) throws IOException {
                    if (exc != null) {
                        throw exc;
                    }
                    Files.delete(d);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Не удалось удалить аккаунт " + account, e);
        }
        LOG.info("Аккаунт бэкапа {} удалён", account);
        return true;
    }

    /** Файл таблицы внутри аккаунта (может не существовать). */
    public Path tableFile(String account, String table) {
        return accountDir(account).resolve(requireSimpleName(table, "table") + TABLE_EXT);
    }

    private Path accountDir(String account) {
        return root.resolve(requireSimpleName(account, "account"));
    }

    static String requireSimpleName(String name, String what) {
        if (name == null || name.isEmpty() || name.contains("/") || name.contains("\\")
                || ".".equals(name) || "..".equals(name)) {
            throw new IllegalArgumentException("Недопустимое имя (" + what + "): '" + name + "'");
        }
        return name;
    }
}
