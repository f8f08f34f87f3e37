package com.ragkit;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ragkit.ingest.IngestionReport;
import com.ragkit.ingest.LedgerEntry;
import com.ragkit.ingest.Source;
import com.ragkit.ingest.SourceOutcome;
import com.ragkit.runtime.AppConfig;
import com.ragkit.runtime.RagComponents;
import com.ragkit.store.Citation;
import com.ragkit.store.ResetDisabledException;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
        name = "ragkit",
        mixinStandardHelpOptions = true,
        version = "ragkit 0.1.0",
        description = "Ingest sources into a vector store and retrieve context from it.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);
    private static final Pattern INTEGER = Pattern.compile("-?(0|[1-9]\\d{0,17})");

    @Spec
    CommandSpec spec;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "query")
    Mode mode;

    @Option(names = "--text", description = "Text to ingest (add) or delete (delete); repeatable")
    List<String> texts = new ArrayList<>();

    @Option(names = "--file", description = "File to ingest or delete; repeatable")
    List<Path> files = new ArrayList<>();

    @Option(names = "--url", description = "Web page to ingest or delete; repeatable")
    List<String> urls = new ArrayList<>();

    @Option(names = "--query", description = "Query text used in query mode")
    String query;

    @Option(names = "--top-k", description = "Number of contexts to return; defaults to query.defaultResults")
    Integer topK;

    @Option(names = "--citations", description = "Print source and document id next to every context", defaultValue = "false")
    boolean citations;

    @Option(names = "--where", description = "Metadata filter key=value; repeat to AND several conditions. "
            + "Integer values such as chunk_index=0 match numeric metadata")
    Map<String, String> where = new LinkedHashMap<>();

    private final OkHttpClient httpClient = new OkHttpClient();

    enum Mode {
        add,
        query,
        count,
        sources,
        delete,
        reset
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = AppConfig.load(Path.of(configPath));
        log.info("Starting ragkit in {} mode", mode);
        log.info("Using config file: {} provider={} collection={}", configPath,
                config.getStore().getProvider(), config.getStore().getCollectionName());

        try (RagComponents components = RagComponents.fromConfig(config, httpClient)) {
            return switch (mode) {
                case add -> runAdd(components);
                case query -> runQuery(components);
                case count -> {
                    out().println(components.store().count());
                    yield 0;
                }
                case sources -> runSources(components);
                case delete -> runDelete(components);
                case reset -> runReset(components);
            };
        }
    }

    private int runAdd(RagComponents components) {
        List<Source> sources = sources();
        if (sources.isEmpty()) {
            log.error("--text, --file or --url is required in add mode");
            return 2;
        }
        IngestionReport report = components.ingestion().ingest(sources);
        for (SourceOutcome outcome : report.outcomes()) {
            out().printf("%s %s chunks=%d added=%d%s%n",
                    outcome.status(),
                    outcome.source().value(),
                    outcome.chunks(),
                    outcome.added(),
                    outcome.error() == null ? "" : " error=" + outcome.error());
        }
        log.info("Ingested sources={} added={} skipped={} failed={}",
                report.outcomes().size(), report.addedRecords(), report.skippedRecords(), report.failedSources());
        return report.hasFailures() ? 1 : 0;
    }

    private int runQuery(RagComponents components) {
        if (query == null || query.isBlank()) {
            log.error("--query is required in query mode");
            return 2;
        }
        int n = topK == null ? components.query().defaultResults() : topK;
        if (citations) {
            List<Citation> results = components.query().retrieveWithCitations(query, n, whereFilter());
            for (int i = 0; i < results.size(); i++) {
                Citation citation = results.get(i);
                out().printf("[%d] %s%n    source=%s doc_id=%s%n", i + 1, citation.context(), citation.source(), citation.documentId());
            }
        } else {
            List<String> contexts = components.query().retrieve(query, n, whereFilter());
            for (int i = 0; i < contexts.size(); i++) {
                out().printf("[%d] %s%n", i + 1, contexts.get(i));
            }
        }
        return 0;
    }

    private int runSources(RagComponents components) {
        for (LedgerEntry entry : components.ingestion().dataSources()) {
            out().printf("%s %s %s uploaded=%s%n", entry.contentHash(), entry.sourceType(), entry.sourceValue(), entry.uploaded());
        }
        return 0;
    }

    private int runDelete(RagComponents components) throws Exception {
        List<Source> sources = sources();
        if (sources.isEmpty() && where.isEmpty()) {
            log.error("--text, --file, --url or --where is required in delete mode");
            return 2;
        }
        if (!where.isEmpty()) {
            components.store().deleteWhere(whereFilter());
            out().println("Deleted records matching " + where);
        }
        for (Source source : sources) {
            boolean known = components.ingestion().delete(source);
            out().printf("Deleted %s%s%n", source.value(), known ? "" : " (not in ledger)");
        }
        return 0;
    }

    private int runReset(RagComponents components) {
        try {
            components.store().reset();
        } catch (ResetDisabledException e) {
            log.error(e.getMessage());
            return 1;
        }
        out().println("Reset " + components.store().physicalCollectionName());
        return 0;
    }

    Map<String, Object> whereFilter() {
        Map<String, Object> filter = new LinkedHashMap<>();
        where.forEach((key, value) -> filter.put(key, INTEGER.matcher(value).matches() ? Long.valueOf(value) : value));
        return filter;
    }

    private List<Source> sources() {
        List<Source> sources = new ArrayList<>();
        texts.forEach(text -> sources.add(Source.text(text)));
        files.forEach(file -> sources.add(Source.file(file.toString())));
        urls.forEach(url -> sources.add(Source.webPage(url)));
        return sources;
    }

    private PrintWriter out() {
        return spec.commandLine().getOut();
    }
}
