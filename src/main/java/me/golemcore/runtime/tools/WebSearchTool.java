package me.golemcore.runtime.tools;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import me.golemcore.runtime.domain.component.ToolComponent;
import me.golemcore.runtime.domain.model.ToolDefinition;
import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.infrastructure.http.FeignClientFactory;
import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Web search through the Brave Search API. Disabled when no API key is
 * configured ({@code runtime.tools.web-search.api-key}). HTTP 429 responses
 * are retried with exponential backoff.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebSearchTool implements ToolComponent {

    private static final String PARAM_QUERY = "query";
    private static final String PARAM_COUNT = "count";
    private static final int MAX_COUNT = 10;
    private static final int MAX_RETRIES = 3;
    private static final long INITIAL_BACKOFF_MS = 1000;
    private static final int HTTP_TOO_MANY_REQUESTS = 429;

    private final FeignClientFactory feignClientFactory;
    private final RuntimeProperties properties;

    private BraveSearchApi searchApi;
    private boolean enabled;
    private String apiKey;
    private int defaultCount;
    private Duration budget;

    @PostConstruct
    public void init() {
        RuntimeProperties.WebSearchToolProperties config = properties.getTools().getWebSearch();
        this.apiKey = config.getApiKey();
        this.defaultCount = Math.max(1, Math.min(MAX_COUNT, config.getDefaultCount()));
        this.enabled = config.isEnabled() && apiKey != null && !apiKey.isBlank();
        this.budget = Duration.ofSeconds(properties.getTools().innerTimeoutSeconds());
        if (config.isEnabled() && !enabled) {
            log.warn("[WebSearch] No API key configured, web_search disabled");
        }
        if (enabled) {
            this.searchApi = feignClientFactory.create(BraveSearchApi.class, config.getBaseUrl(), budget);
        }
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("web_search")
                .description("Search the web. Returns titles, URLs and snippets.")
                .inputSchema(ToolSchemas.object(Map.of(
                        PARAM_QUERY, ToolSchemas.string("Search query"),
                        PARAM_COUNT, ToolSchemas.integer("Results (1-" + MAX_COUNT + ")")),
                        List.of(PARAM_QUERY)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        String query = (String) parameters.get(PARAM_QUERY);
        Integer requested = ToolSchemas.optionalInt(parameters, PARAM_COUNT);
        int count = requested != null ? Math.max(1, Math.min(MAX_COUNT, requested)) : defaultCount;
        return CompletableFuture.supplyAsync(() -> search(query, count));
    }

    private ToolResult search(String query, int count) {
        long deadline = System.nanoTime() + budget.toNanos();
        for (int attempt = 0;; attempt++) {
            try {
                log.debug("[WebSearch] query='{}' count={} attempt={}", query, count, attempt);
                return toResult(query, searchApi.search(apiKey, query, count));
            } catch (FeignException e) {
                if (e.status() != HTTP_TOO_MANY_REQUESTS) {
                    log.warn("[WebSearch] API error (status {}) for '{}'", e.status(), query);
                    return ToolResult.failure("Search failed with HTTP " + e.status());
                }
                long backoffMs = INITIAL_BACKOFF_MS << attempt;
                boolean pastBudget = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(backoffMs) >= deadline;
                if (attempt >= MAX_RETRIES || pastBudget) {
                    return ToolResult.failure("Search rate limit exceeded, try again later");
                }
                log.warn("[WebSearch] Rate limited, retrying in {}ms", backoffMs);
                try {
                    Thread.sleep(backoffMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return ToolResult.failure("Search interrupted");
                }
            }
        }
    }

    private ToolResult toResult(String query, SearchResponse response) {
        List<SearchHit> hits = response != null && response.getWeb() != null && response.getWeb().getResults() != null
                ? response.getWeb().getResults()
                : List.of();
        if (hits.isEmpty()) {
            return ToolResult.success("No results for: " + query, Map.of(PARAM_QUERY, query, "results", List.of()));
        }

        StringBuilder sb = new StringBuilder("Results for: ").append(query).append('\n');
        List<Map<String, String>> data = new ArrayList<>();
        int index = 1;
        for (SearchHit hit : hits) {
            sb.append('\n').append(index++).append(". ").append(nullToEmpty(hit.getTitle()))
                    .append("\n   ").append(nullToEmpty(hit.getUrl()));
            if (hit.getDescription() != null && !hit.getDescription().isBlank()) {
                sb.append("\n   ").append(hit.getDescription());
            }
            Map<String, String> item = new LinkedHashMap<>();
            item.put("title", nullToEmpty(hit.getTitle()));
            item.put("url", nullToEmpty(hit.getUrl()));
            item.put("description", nullToEmpty(hit.getDescription()));
            data.add(item);
        }
        return ToolResult.success(sb.toString(), Map.of(PARAM_QUERY, query, "results", data));
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    interface BraveSearchApi {
        @RequestLine("GET /res/v1/web/search?q={query}&count={count}")
        @Headers({ "Accept: application/json", "X-Subscription-Token: {apiKey}" })
        SearchResponse search(@Param("apiKey") String apiKey, @Param("query") String query,
                @Param("count") int count);
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SearchResponse {
        private WebSection web;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WebSection {
        private List<SearchHit> results;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SearchHit {
        private String title;
        private String url;
        private String description;
    }
}
