package com.ragkit.store.local;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ragkit.store.VectorRecord;

/**
 * In-process vector engine holding named collections of (id, text, metadata, embedding). With a
 * directory every collection is written to {@code <directory>/<name>.json} after each change and
 * read back when the engine is opened. All operations are serialized on the engine.
 */
public class LocalVectorEngine {
    private static final Logger log = LoggerFactory.getLogger(LocalVectorEngine.class);

    private final Path directory;
    private final Map<String, StoredCollection> collections = new LinkedHashMap<>();
    private final ObjectMapper objectMapper = new ObjectMapper();

    private LocalVectorEngine(Path directory) {
        this.directory = directory;
    }

    public static LocalVectorEngine inMemory() {
        return new LocalVectorEngine(null);
    }

    public static LocalVectorEngine open(Path directory) throws IOException {
        LocalVectorEngine engine = new LocalVectorEngine(directory);
        Files.createDirectories(directory);
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*.json")) {
            for (Path file : files) {
                CollectionSnapshot snapshot = engine.objectMapper.readValue(file.toFile(), CollectionSnapshot.class);
                StoredCollection collection = new StoredCollection(snapshot.name(), snapshot.dimension(), DistanceMetric.parse(snapshot.metric()));
                for (StoredRecord record : snapshot.records()) {
                    collection.records.put(record.id(), record);
                }
                engine.collections.put(collection.name, collection);
            }
        }
        log.info("local.engine.opened directory={} collections={}", directory, engine.collections.keySet());
        return engine;
    }

    public synchronized void getOrCreateCollection(String name, int dimension, DistanceMetric metric) {
        StoredCollection existing = collections.get(name);
        if (existing != null) {
            if (existing.dimension != dimension) {
                throw new InvalidDimensionException(name, existing.dimension, dimension);
            }
            return;
        }
        StoredCollection created = new StoredCollection(name, dimension, metric);
        collections.put(name, created);
        persist(created);
        log.debug("local.collection.created name={} dimension={} metric={}", name, dimension, metric);
    }

    public synchronized void deleteCollection(String name) {
        collections.remove(name);
        if (directory != null) {
            try {
                Files.deleteIfExists(fileOf(name));
            } catch (IOException e) {
                throw new UncheckedIOException("Could not delete collection file for " + name, e);
            }
        }
    }

    public synchronized Set<String> collectionNames() {
        return new TreeSet<>(collections.keySet());
    }

    public synchronized List<String> get(String name, List<String> ids, Map<String, Object> where) {
        StoredCollection collection = require(name);
        List<String> found = new ArrayList<>();
        for (String id : ids) {
            StoredRecord record = collection.records.get(id);
            if (record != null && WhereClause.matches(where, record.metadata())) {
                found.add(id);
            }
        }
        return found;
    }

    /**
     * Adds records; ids already in the collection are ignored. The whole call is rejected before
     * any write when one vector has the wrong dimension.
     */
    public synchronized int add(String name, List<VectorRecord> records) {
        StoredCollection collection = require(name);
        for (VectorRecord record : records) {
            if (record.embedding().length != collection.dimension) {
                throw new InvalidDimensionException(name, collection.dimension, record.embedding().length);
            }
        }
        int added = 0;
        for (VectorRecord record : records) {
            if (collection.records.containsKey(record.id())) {
                log.debug("local.add.exists collection={} id={}", name, record.id());
                continue;
            }
            collection.records.put(record.id(), new StoredRecord(record.id(), record.text(), new LinkedHashMap<>(record.metadata()), record.embedding().clone()));
            added++;
        }
        if (added > 0) {
            persist(collection);
        }
        return added;
    }

    public synchronized List<Hit> query(String name, float[] vector, int nResults, Map<String, Object> where) {
        StoredCollection collection = require(name);
        if (vector.length != collection.dimension) {
            throw new InvalidDimensionException(name, collection.dimension, vector.length);
        }
        return collection.records.values().stream()
                .filter(record -> WhereClause.matches(where, record.metadata()))
                .map(record -> new Hit(record.id(), record.text(), detached(record.metadata()), collection.metric.distance(vector, record.embedding())))
                .sorted(Comparator.comparingDouble(Hit::distance))
                .limit(nResults)
                .toList();
    }

    public synchronized int count(String name) {
        return require(name).records.size();
    }

    public synchronized int delete(String name, Map<String, Object> where) {
        StoredCollection collection = require(name);
        List<String> doomed = collection.records.values().stream()
                .filter(record -> WhereClause.matches(where, record.metadata()))
                .map(StoredRecord::id)
                .toList();
        doomed.forEach(collection.records::remove);
        if (!doomed.isEmpty()) {
            persist(collection);
        }
        return doomed.size();
    }

    private StoredCollection require(String name) {
        StoredCollection collection = collections.get(name);
        if (collection == null) {
            throw new UnknownCollectionException(name);
        }
        return collection;
    }

    // hits leave the engine; stored metadata must not be reachable through them
    private static Map<String, Object> detached(Map<String, Object> metadata) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    private void persist(StoredCollection collection) {
        if (directory == null) {
            return;
        }
        CollectionSnapshot snapshot = new CollectionSnapshot(
                collection.name,
                collection.dimension,
                collection.metric.name().toLowerCase(Locale.ROOT),
                new ArrayList<>(collection.records.values()));
        try {
            objectMapper.writeValue(fileOf(collection.name).toFile(), snapshot);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not persist collection " + collection.name, e);
        }
    }

    private Path fileOf(String name) {
        return directory.resolve(name + ".json");
    }

    public record Hit(String id, String text, Map<String, Object> metadata, double distance) {
    }

    public record StoredRecord(String id, String text, Map<String, Object> metadata, float[] embedding) {
    }

    public record CollectionSnapshot(String name, int dimension, String metric, List<StoredRecord> records) {
    }

    private static final class StoredCollection {
        private final String name;
        private final int dimension;
        private final DistanceMetric metric;
        private final Map<String, StoredRecord> records = new LinkedHashMap<>();

        private StoredCollection(String name, int dimension, DistanceMetric metric) {
            this.name = name;
            this.dimension = dimension;
            this.metric = metric;
        }
    }
}
