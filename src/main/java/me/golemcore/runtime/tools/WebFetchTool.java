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

import me.golemcore.runtime.domain.component.ToolComponent;
import me.golemcore.runtime.domain.model.OperationException;
import me.golemcore.runtime.domain.model.ToolDefinition;
import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Fetches a web page over HTTP(S) and returns its readable text.
 */
@Component
@Slf4j
public class WebFetchTool implements ToolComponent {

    private static final String PARAM_URL = "url";
    private static final String PARAM_MAX_CHARS = "max_chars";
    private static final String USER_AGENT = "Mozilla/5.0 (compatible; GolemCoreRuntime/1.0)";

    private final OkHttpClient httpClient;
    private final RuntimeProperties.WebFetchToolProperties config;

    public WebFetchTool(OkHttpClient httpClient, RuntimeProperties properties) {
        this.httpClient = httpClient.newBuilder()
                .callTimeout(properties.getTools().innerTimeoutSeconds(), TimeUnit.SECONDS)
                .build();
        this.config = properties.getTools().getWebFetch();
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("web_fetch")
                .description("Fetch a URL and extract its readable text content.")
                .inputSchema(ToolSchemas.object(Map.of(
                        PARAM_URL, ToolSchemas.string("http or https URL"),
                        PARAM_MAX_CHARS, ToolSchemas.integer("Maximum characters to return")),
                        List.of(PARAM_URL)))
                .build();
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        String url = (String) parameters.get(PARAM_URL);
        HttpUrl httpUrl = HttpUrl.parse(url.trim());
        if (httpUrl == null) {
            throw OperationException.validation(PARAM_URL, "Only http and https URLs are supported: " + url);
        }
        Integer requested = ToolSchemas.optionalInt(parameters, PARAM_MAX_CHARS);
        int maxChars = requested != null && requested > 0 ? Math.min(requested, config.getMaxChars())
                : config.getMaxChars();
        return CompletableFuture.supplyAsync(() -> fetch(httpUrl, maxChars));
    }

    private ToolResult fetch(HttpUrl url, int maxChars) {
        Request request = new Request.Builder().url(url).header("User-Agent", USER_AGENT).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String raw = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                log.warn("[WebFetch] {} returned HTTP {}", url, response.code());
                return ToolResult.failure("HTTP " + response.code() + " fetching " + url);
            }

            String contentType = response.header("Content-Type", "");
            boolean html = contentType.toLowerCase(Locale.ROOT).contains("html")
                    || raw.stripLeading().toLowerCase(Locale.ROOT).startsWith("<!doctype")
                    || raw.stripLeading().toLowerCase(Locale.ROOT).startsWith("<html");
            String title = html ? HtmlText.title(raw) : null;
            String text = html ? HtmlText.toText(raw) : raw;
            boolean truncated = text.length() > maxChars;
            if (truncated) {
                text = text.substring(0, maxChars);
            }

            StringBuilder output = new StringBuilder();
            output.append("URL: ").append(response.request().url()).append('\n');
            if (title != null && !title.isBlank()) {
                output.append("Title: ").append(title).append('\n');
            }
            output.append('\n').append(text);
            if (truncated) {
                output.append("\n\n[Content truncated at ").append(maxChars).append(" chars]");
            }

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("url", response.request().url().toString());
            data.put("status", response.code());
            data.put("truncated", truncated);
            data.put("length", text.length());
            return ToolResult.success(output.toString(), data);
        } catch (IOException e) {
            log.warn("[WebFetch] Failed to fetch {}: {}", url, e.getMessage());
            return ToolResult.failure("Failed to fetch " + url + ": " + e.getMessage());
        }
    }
}
