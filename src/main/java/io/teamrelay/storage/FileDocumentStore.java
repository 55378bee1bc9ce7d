package io.teamrelay.storage;

import io.teamrelay.util.Jsons;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * JSON documents on the local filesystem.
 *
 * <p>Writes go to a temporary file in the target directory, are forced to disk, and become visible
 * only through a rename over the target, so readers see either the previous or the new content.
 * The directory is forced after the rename so the new entry survives a crash.
 */
public final class FileDocumentStore extends AbstractDocumentStore {
    static final boolean DIRECTORY_SYNC_SUPPORTED =
            !System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");

    public FileDocumentStore() {
        this(new FileLockManager());
    }

    public FileDocumentStore(LockManager lockManager) {
        super(lockManager);
    }

    @Override
    public <T> Optional<T> read(Path path, Class<T> type) {
        try {
            byte[] raw = Files.readAllBytes(path);
            return Optional.of(Jsons.mapper().readValue(raw, type));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw StoreException.io("Failed to read document " + path, e);
        }
    }

    @Override
    public void writeAtomic(Path path, Object document) {
        Path parent = path.toAbsolutePath().getParent();
        Path temp = parent.resolve("." + path.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            Files.createDirectories(parent);
            byte[] bytes = Jsons.mapper().writeValueAsBytes(document);
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            try {
                Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException unsupported) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
            forceDirectory(parent);
        } catch (IOException e) {
            StoreException failure = StoreException.io("Failed to write document " + path, e);
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                failure.addSuppressed(cleanup);
            }
            throw failure;
        }
    }

    /**
     * Makes the rename itself durable. Windows cannot open a directory as a channel, so there the
     * rename is left to the filesystem.
     */
    static void forceDirectory(Path dir) throws IOException {
        if (!DIRECTORY_SYNC_SUPPORTED) {
            return;
        }
        try (FileChannel channel = FileChannel.open(dir, StandardOpenOption.READ)) {
            channel.force(true);
        }
    }

    @Override
    public boolean exists(Path path) {
        return Files.isRegularFile(path);
    }

    @Override
    public List<Path> list(Path dir, String suffix) {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path path : stream) {
                String name = path.getFileName().toString();
                if (!name.startsWith(".") && name.endsWith(suffix) && Files.isRegularFile(path)) {
                    files.add(path);
                }
            }
        } catch (NoSuchFileException e) {
            return files;
        } catch (IOException e) {
            throw StoreException.io("Failed to list " + dir, e);
        }
        files.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return files;
    }

    @Override
    public boolean delete(Path path) {
        try {
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            throw StoreException.io("Failed to delete " + path, e);
        }
    }

    @Override
    public void deleteTree(Path dir) {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            throw StoreException.io("Failed to delete directory " + dir, e);
        }
    }
}
