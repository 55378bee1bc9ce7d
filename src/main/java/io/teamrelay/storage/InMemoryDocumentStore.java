package io.teamrelay.storage;

import io.teamrelay.util.Jsons;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Documents kept as serialized JSON in memory. Each read deserializes a fresh copy, so callers cannot
 * mutate committed state behind the store's back, the same as with files.
 */
public final class InMemoryDocumentStore extends AbstractDocumentStore {
    private final ConcurrentMap<Path, byte[]> documents = new ConcurrentHashMap<>();

    public InMemoryDocumentStore() {
        super(new LocalLockManager());
    }

    @Override
    public <T> Optional<T> read(Path path, Class<T> type) {
        byte[] raw = documents.get(key(path));
        if (raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Jsons.mapper().readValue(raw, type));
        } catch (IOException e) {
            throw StoreException.io("Failed to decode document " + path, e);
        }
    }

    @Override
    public void writeAtomic(Path path, Object document) {
        try {
            documents.put(key(path), Jsons.mapper().writeValueAsBytes(document));
        } catch (IOException e) {
            throw StoreException.io("Failed to encode document " + path, e);
        }
    }

    @Override
    public boolean exists(Path path) {
        return documents.containsKey(key(path));
    }

    @Override
    public List<Path> list(Path dir, String suffix) {
        Path parent = key(dir);
        List<Path> out = new ArrayList<>();
        for (Path path : documents.keySet()) {
            String name = path.getFileName().toString();
            if (parent.equals(path.getParent()) && !name.startsWith(".") && name.endsWith(suffix)) {
                out.add(path);
            }
        }
        out.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return out;
    }

    @Override
    public boolean delete(Path path) {
        return documents.remove(key(path)) != null;
    }

    @Override
    public void deleteTree(Path dir) {
        Path root = key(dir);
        documents.keySet().removeIf(path -> path.startsWith(root));
    }

    private static Path key(Path path) {
        return LocalLockManager.normalize(path);
    }
}
