package me.golemcore.runtime.infrastructure.http;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import feign.Feign;
import feign.jackson.JacksonDecoder;
import feign.jackson.JacksonEncoder;
import feign.okhttp.OkHttpClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Builds declarative REST clients over the shared OkHttp transport with the
 * runtime's {@link ObjectMapper}.
 *
 * <pre>{@code
 * BraveSearchApi api = factory.create(BraveSearchApi.class, "https://api.search.brave.com");
 * }</pre>
 */
@Component
@RequiredArgsConstructor
public class FeignClientFactory {

    private final okhttp3.OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;

    public <T> T create(Class<T> apiType, String baseUrl) {
        return build(apiType, baseUrl, okHttpClient);
    }

    /**
     * Same as {@link #create(Class, String)} with every call, including
     * retries inside OkHttp, bounded by {@code callTimeout}.
     */
    public <T> T create(Class<T> apiType, String baseUrl, Duration callTimeout) {
        return build(apiType, baseUrl, okHttpClient.newBuilder().callTimeout(callTimeout).build());
    }

    private <T> T build(Class<T> apiType, String baseUrl, okhttp3.OkHttpClient transport) {
        return Feign.builder()
                .client(new OkHttpClient(transport))
                .encoder(new JacksonEncoder(objectMapper))
                .decoder(new JacksonDecoder(objectMapper))
                .target(apiType, baseUrl);
    }
}
