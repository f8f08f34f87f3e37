package com.ragkit.query;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.ragkit.store.Citation;
import com.ragkit.store.QueryMatch;
import com.ragkit.store.QueryRequest;
import com.ragkit.store.VectorStore;

/**
 * Retrieval on top of a {@link VectorStore}, plus assembly of the prompt handed to a language
 * model.
 */
public class QueryPipeline {
    public static final String DEFAULT_PROMPT_TEMPLATE = "Use the following pieces of context to answer the query at the end.\n"
            + "If you don't know the answer, just say that you don't know, don't try to make up an answer.\n"
            + "\n"
            + "$context\n"
            + "\n"
            + "Query: $query\n"
            + "\n"
            + "Helpful Answer:";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$(context|query)\\b");

    private final VectorStore store;
    private final int defaultResults;
    private final String promptTemplate;

    public QueryPipeline(VectorStore store, int defaultResults) {
        this(store, defaultResults, DEFAULT_PROMPT_TEMPLATE);
    }

    public QueryPipeline(VectorStore store, int defaultResults, String promptTemplate) {
        if (defaultResults <= 0) {
            throw new IllegalArgumentException("defaultResults must be > 0, was " + defaultResults);
        }
        if (promptTemplate == null || !promptTemplate.contains("$context") || !promptTemplate.contains("$query")) {
            throw new IllegalArgumentException("Prompt template must contain both $context and $query");
        }
        this.store = store;
        this.defaultResults = defaultResults;
        this.promptTemplate = promptTemplate;
    }

    public List<String> retrieve(String query) {
        return retrieve(query, defaultResults, Map.of());
    }

    public List<String> retrieve(String query, int nResults, Map<String, ?> where) {
        return store.query(QueryRequest.ofText(query, nResults).where(where));
    }

    public List<String> retrieve(float[] queryVector, int nResults, Map<String, ?> where) {
        return store.query(QueryRequest.ofVector(queryVector, nResults).where(where));
    }

    public List<Citation> retrieveWithCitations(String query) {
        return retrieveWithCitations(query, defaultResults, Map.of());
    }

    public List<Citation> retrieveWithCitations(String query, int nResults, Map<String, ?> where) {
        return store.queryWithCitations(QueryRequest.ofText(query, nResults).where(where));
    }

    public List<Citation> retrieveWithCitations(float[] queryVector, int nResults, Map<String, ?> where) {
        return store.queryWithCitations(QueryRequest.ofVector(queryVector, nResults).where(where));
    }

    public List<QueryMatch> search(String query) {
        return search(query, defaultResults);
    }

    public List<QueryMatch> search(String query, int nResults) {
        return store.search(QueryRequest.ofText(query, nResults));
    }

    public List<QueryMatch> search(float[] queryVector, int nResults) {
        return store.search(QueryRequest.ofVector(queryVector, nResults));
    }

    /**
     * Fills the template with the contexts joined by {@code " | "} and the query. Placeholders
     * that appear inside the substituted text are left alone.
     */
    public String buildPrompt(String query, List<String> contexts) {
        String context = String.join(" | ", contexts);
        Matcher matcher = PLACEHOLDER.matcher(promptTemplate);
        StringBuilder prompt = new StringBuilder();
        while (matcher.find()) {
            String value = matcher.group(1).equals("context") ? context : query;
            matcher.appendReplacement(prompt, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(prompt);
        return prompt.toString();
    }

    public int defaultResults() {
        return defaultResults;
    }
}
