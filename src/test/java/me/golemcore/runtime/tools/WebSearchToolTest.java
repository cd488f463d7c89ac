package me.golemcore.runtime.tools;

import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.infrastructure.config.RuntimeConfiguration;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.infrastructure.http.FeignClientFactory;
import me.golemcore.runtime.testsupport.http.OkHttpMockEngine;
import okhttp3.Request;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WebSearchToolTest {

    private static final String BRAVE_RESPONSE = """
            {
              "type": "search",
              "web": {
                "results": [
                  {"title": "Berlin weather", "url": "https://weather.example/berlin",
                   "description": "Rain expected", "age": "1 day"},
                  {"title": "Forecast", "url": "https://forecast.example"}
                ]
              }
            }
            """;

    private OkHttpMockEngine engine;
    private RuntimeProperties properties;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        properties = new RuntimeProperties();
        properties.getTools().getWebSearch().setBaseUrl("https://search.test");
        properties.getTools().getWebSearch().setApiKey("brave-key");
    }

    private WebSearchTool newTool() {
        WebSearchTool tool = new WebSearchTool(
                new FeignClientFactory(engine.client(), RuntimeConfiguration.objectMapper()), properties);
        tool.init();
        return tool;
    }

    @Test
    void disabledWithoutApiKey() {
        properties.getTools().getWebSearch().setApiKey(" ");

        assertFalse(newTool().isEnabled());
        assertEquals(0, engine.getRequestCount());
    }

    @Test
    void formatsResultsAndSendsSubscriptionToken() throws Exception {
        engine.enqueueJson(200, BRAVE_RESPONSE);
        WebSearchTool tool = newTool();

        ToolResult result = tool.execute(Map.of("query", "rain berlin", "count", 50)).get();

        assertTrue(tool.isEnabled());
        assertTrue(result.isSuccess());
        assertEquals("""
                Results for: rain berlin

                1. Berlin weather
                   https://weather.example/berlin
                   Rain expected
                2. Forecast
                   https://forecast.example""", result.getOutput());
        List<?> results = (List<?>) ((Map<?, ?>) result.getData()).get("results");
        assertEquals(2, results.size());

        Request request = engine.takeRequest();
        assertEquals("brave-key", request.header("X-Subscription-Token"));
        assertEquals("rain berlin", request.url().queryParameter("q"));
        assertEquals("10", request.url().queryParameter("count"));
    }

    @Test
    void usesDefaultCountAndReportsEmptyResults() throws Exception {
        properties.getTools().getWebSearch().setDefaultCount(3);
        engine.enqueueJson(200, "{\"web\": {\"results\": []}}");

        ToolResult result = newTool().execute(Map.of("query", "nothing")).get();

        assertEquals("No results for: nothing", result.getOutput());
        assertEquals("3", engine.takeRequest().url().queryParameter("count"));
    }

    @Test
    void httpErrorBecomesFailedResult() throws Exception {
        engine.enqueueJson(401, "{\"error\": \"bad key\"}");

        ToolResult result = newTool().execute(Map.of("query", "x")).get();

        assertFalse(result.isSuccess());
        assertEquals("Search failed with HTTP 401", result.getError());
    }

    @Test
    void retriesAfterRateLimit() throws Exception {
        engine.enqueueJson(429, "{}");
        engine.enqueueJson(200, BRAVE_RESPONSE);

        ToolResult result = newTool().execute(Map.of("query", "retry")).get();

        assertTrue(result.isSuccess());
        assertEquals(2, engine.getRequestCount());
    }

    @Test
    void httpCallEndsBeforeDispatcherCeiling() throws Exception {
        properties.getTools().setTimeoutSeconds(20);
        engine.enqueueJson(200, BRAVE_RESPONSE);

        newTool().execute(Map.of("query", "bounded")).get();

        assertEquals(19_000, engine.getLastCallTimeoutMillis());
    }

    @Test
    void stopsRetryingWhenBackoffWouldPassCeiling() throws Exception {
        properties.getTools().setTimeoutSeconds(2);
        engine.enqueueJson(429, "{}");
        engine.enqueueJson(200, BRAVE_RESPONSE);

        ToolResult result = newTool().execute(Map.of("query", "busy")).get();

        assertFalse(result.isSuccess());
        assertEquals("Search rate limit exceeded, try again later", result.getError());
        assertEquals(1, engine.getRequestCount());
    }
}
