package com.ragkit.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Local record of which sources each pipeline has ingested, keyed by {@code (pipelineId,
 * contentHash)}. Every change is written back to the JSON file when the ledger has one.
 */
public class SourceLedger {
    private static final Logger log = LoggerFactory.getLogger(SourceLedger.class);

    private final ObjectMapper mapper = new ObjectMapper();
    private final Path path;
    private final List<LedgerEntry> entries = new ArrayList<>();

    private SourceLedger(Path path) {
        this.path = path;
    }

    public static SourceLedger inMemory() {
        return new SourceLedger(null);
    }

    public static SourceLedger open(Path path) throws IOException {
        SourceLedger ledger = new SourceLedger(path);
        if (Files.exists(path)) {
            ledger.entries.addAll(ledger.mapper.readValue(path.toFile(), new TypeReference<List<LedgerEntry>>() {
            }));
            log.info("ledger.loaded path={} entries={}", path, ledger.entries.size());
        }
        return ledger;
    }

    public synchronized void record(LedgerEntry entry) throws IOException {
        boolean replaced = entries.removeIf(existing -> existing.sameKey(entry.pipelineId(), entry.contentHash()));
        if (replaced) {
            log.warn("ledger.record.replaced pipeline={} hash={}", entry.pipelineId(), entry.contentHash());
        }
        entries.add(entry);
        save();
    }

    public synchronized List<LedgerEntry> sources(String pipelineId) {
        return entries.stream().filter(entry -> entry.pipelineId().equals(pipelineId)).toList();
    }

    public synchronized List<LedgerEntry> pending(String pipelineId) {
        return entries.stream()
                .filter(entry -> entry.pipelineId().equals(pipelineId))
                .filter(entry -> !entry.uploaded())
                .toList();
    }

    public synchronized Optional<LedgerEntry> find(String pipelineId, String contentHash) {
        return entries.stream().filter(entry -> entry.sameKey(pipelineId, contentHash)).findFirst();
    }

    public synchronized boolean markUploaded(String pipelineId, String contentHash) throws IOException {
        for (int i = 0; i < entries.size(); i++) {
            LedgerEntry entry = entries.get(i);
            if (entry.sameKey(pipelineId, contentHash)) {
                entries.set(i, entry.withUploaded(true));
                save();
                return true;
            }
        }
        return false;
    }

    public synchronized boolean remove(String pipelineId, String contentHash) throws IOException {
        boolean removed = entries.removeIf(entry -> entry.sameKey(pipelineId, contentHash));
        if (removed) {
            save();
        }
        return removed;
    }

    private void save() throws IOException {
        if (path == null) {
            return;
        }
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), entries);
    }
}
