package com.ragkit.ingest;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

/**
 * Fetches a page and keeps its visible text. Non-content elements such as the head and scripts are
 * removed before the remaining tags are stripped.
 */
public class WebPageLoader implements Loader {
    private static final Pattern TITLE = Pattern.compile("(?is)<title[^>]*>(.*?)</title>");
    private static final Pattern NOISE = Pattern.compile("(?is)<(script|style|nav|header|footer|noscript|head)[^>]*>.*?</\\1>");
    private static final Pattern TAG = Pattern.compile("(?s)<[^>]+>");

    private final OkHttpClient httpClient;

    public WebPageLoader(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public boolean supports(SourceType type) {
        return type == SourceType.WEB_PAGE;
    }

    @Override
    public LoadedDocument load(Source source) throws IOException {
        Request request = new Request.Builder().url(source.value()).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                throw new IOException("GET " + source.value() + " failed: " + response.code());
            }
            return fromHtml(response.body().string());
        }
    }

    static LoadedDocument fromHtml(String html) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        Matcher title = TITLE.matcher(html);
        if (title.find()) {
            metadata.put("title", unescape(title.group(1)).strip());
        }
        String withoutNoise = NOISE.matcher(html).replaceAll(" ");
        String text = unescape(TAG.matcher(withoutNoise).replaceAll(" "));
        return new LoadedDocument(text.replaceAll("\\s+", " ").strip(), metadata);
    }

    private static String unescape(String value) {
        return value.replace("&nbsp;", " ")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&#39;", "'")
                .replace("&amp;", "&");
    }
}
