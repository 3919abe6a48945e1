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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.ngchat.infrastructure.config.NgChatProperties;
import me.golemcore.ngchat.port.outbound.PointerFetcher;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Locale;
import java.util.Set;

/**
 * Fetches {@code s3://bucket/key} and {@code gs://bucket/key} pointers through
 * the buckets' public HTTPS endpoints.
 */
@Component
@Slf4j
public class ObjectStoragePointerFetcher implements PointerFetcher {

    private static final String S3 = "s3";
    private static final String GS = "gs";

    private final HttpPointerFetcher httpFetcher;
    private final NgChatProperties properties;

    public ObjectStoragePointerFetcher(HttpPointerFetcher httpFetcher, NgChatProperties properties) {
        this.httpFetcher = httpFetcher;
        this.properties = properties;
    }

    @Override
    public String fetch(String url) throws IOException {
        return httpFetcher.fetch(toHttpsUrl(url));
    }

    @Override
    public Set<String> getSchemes() {
        return Set.of(S3, GS);
    }

    /**
     * Rewrites an object-storage URL to its public HTTPS form.
     *
     * @throws IOException
     *             if the URL has no bucket or key
     */
    String toHttpsUrl(String url) throws IOException {
        int schemeEnd = url.indexOf("://");
        if (schemeEnd <= 0) {
            throw new IOException("Not an object-storage URL: " + url);
        }
        String scheme = url.substring(0, schemeEnd).toLowerCase(Locale.ROOT);
        String rest = url.substring(schemeEnd + 3);
        int slash = rest.indexOf('/');
        if (slash <= 0 || slash == rest.length() - 1) {
            throw new IOException("Object-storage URL needs bucket and key: " + url);
        }
        String bucket = rest.substring(0, slash);
        String key = rest.substring(slash + 1);
        NgChatProperties.PointerProperties pointer = properties.getPointer();
        String https = switch (scheme) {
        case S3 -> String.format(pointer.getS3Endpoint(), bucket, key);
        case GS -> String.format(pointer.getGsEndpoint(), bucket, key);
        default -> throw new IOException("Unsupported object-storage scheme: " + scheme);
        };
        log.debug("[Pointer] {} -> {}", url, https);
        return https;
    }
}
