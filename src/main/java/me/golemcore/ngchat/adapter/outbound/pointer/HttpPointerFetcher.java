package me.golemcore.ngchat.adapter.outbound.pointer;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.ngchat.port.outbound.PointerFetcher;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Set;

/**
 * Fetches pointer documents over plain HTTP(S). Any non-2xx status is an
 * error.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HttpPointerFetcher implements PointerFetcher {

    private final OkHttpClient httpClient;

    @Override
    public String fetch(String url) throws IOException {
        Request request;
        try {
            request = new Request.Builder().url(url).get().build();
        } catch (IllegalArgumentException e) {
            throw new IOException("Malformed URL: " + url, e);
        }
        log.debug("[Pointer] GET {}", url);
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful()) {
                throw new IOException("HTTP " + response.code() + " from " + url);
            }
            return body != null ? body.string() : "";
        }
    }

    @Override
    public Set<String> getSchemes() {
        return Set.of("http", "https");
    }
}
