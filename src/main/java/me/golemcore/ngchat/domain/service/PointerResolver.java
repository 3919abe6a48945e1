package me.golemcore.ngchat.domain.service;

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

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.ngchat.domain.exception.PointerResolutionException;
import me.golemcore.ngchat.domain.exception.SerializationException;
import me.golemcore.ngchat.domain.model.CanonicalState;
import me.golemcore.ngchat.domain.model.ResolvedState;
import me.golemcore.ngchat.domain.model.ViewerState;
import me.golemcore.ngchat.infrastructure.config.NgChatProperties;
import me.golemcore.ngchat.port.outbound.PointerFetcher;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns viewer URLs whose fragment is a pointer (a URL to a JSON document)
 * into URLs carrying the state inline.
 *
 * <p>
 * Fragments that already hold a JSON object are parsed directly. Pointers are
 * fetched through the {@link PointerFetcher} registered for their scheme
 * unless the caller supplies one.
 */
@Service
@Slf4j
public class PointerResolver {

    private static final String LEGACY_LINK_KEY = "ng_link";

    private final ViewerStateCodec codec;
    private final NgChatProperties properties;
    private final Map<String, PointerFetcher> fetchersByScheme = new LinkedHashMap<>();

    public PointerResolver(ViewerStateCodec codec, NgChatProperties properties, List<PointerFetcher> fetchers) {
        this.codec = codec;
        this.properties = properties;
        for (PointerFetcher fetcher : fetchers) {
            for (String scheme : fetcher.getSchemes()) {
                fetchersByScheme.putIfAbsent(scheme.toLowerCase(Locale.ROOT), fetcher);
            }
        }
    }

    /**
     * True iff the percent-decoded fragment is not a JSON object.
     */
    public boolean isPointer(String fragment) {
        String decoded = decodeFragment(fragment);
        try {
            return !codec.readTree(decoded).isObject();
        } catch (SerializationException e) {
            return true;
        }
    }

    /**
     * True iff the URL has a {@code #!} fragment and that fragment is a
     * pointer.
     */
    public boolean isPointerUrl(String url) {
        if (url == null) {
            return false;
        }
        int marker = url.indexOf(ViewerStateCodec.FRAGMENT_MARKER);
        return marker >= 0 && isPointer(url.substring(marker + ViewerStateCodec.FRAGMENT_MARKER.length()));
    }

    public ResolvedState resolve(String fragment) {
        return resolve(fragment, null);
    }

    /**
     * Parses an inline-JSON fragment, or fetches and parses the document a
     * pointer fragment names.
     *
     * @param fetcher
     *            fetcher to use for pointers; {@code null} selects the default
     *            fetcher for the URL's scheme
     * @throws PointerResolutionException
     *             if the pointer cannot be fetched or does not hold a JSON
     *             object
     */
    public ResolvedState resolve(String fragment, PointerFetcher fetcher) {
        String decoded = decodeFragment(fragment);
        if (looksLikeJsonObject(decoded)) {
            try {
                return new ResolvedState(codec.fromJson(decoded), false, null);
            } catch (SerializationException e) {
                throw new PointerResolutionException(decoded, "Fragment looked like JSON but failed to parse: "
                        + e.getMessage(), e);
            }
        }
        if (decoded.isEmpty()) {
            throw new PointerResolutionException(decoded, "Fragment is empty");
        }

        PointerFetcher effective = fetcher != null ? fetcher : fetcherFor(decoded);
        String text;
        try {
            text = effective.fetch(decoded);
        } catch (IOException | RuntimeException e) {
            throw new PointerResolutionException(decoded,
                    "Failed to fetch content from pointer '" + decoded + "': " + e.getMessage(), e);
        }

        JsonNode document;
        try {
            document = codec.readTree(text);
        } catch (SerializationException e) {
            throw new PointerResolutionException(decoded,
                    "Fetched text is not valid JSON from pointer '" + decoded + "'", e);
        }
        if (!document.isObject()) {
            throw new PointerResolutionException(decoded,
                    "Pointer '" + decoded + "' does not contain a JSON object");
        }
        try {
            log.debug("[Pointer] Resolved {}", decoded);
            return new ResolvedState(codec.decode(document), true, decoded);
        } catch (SerializationException e) {
            throw new PointerResolutionException(decoded,
                    "Pointer '" + decoded + "' is not a viewer state: " + e.getMessage(), e);
        }
    }

    public CanonicalState expandToCanonical(String fullUrl) {
        return expandToCanonical(fullUrl, null);
    }

    /**
     * Rewrites a viewer URL so the state is inline. The base part of the URL is
     * kept; a URL without one gets the configured viewer base.
     */
    public CanonicalState expandToCanonical(String fullUrl, PointerFetcher fetcher) {
        if (fullUrl == null || fullUrl.isBlank()) {
            throw new PointerResolutionException(fullUrl, "Viewer URL is empty");
        }
        String text = fullUrl.strip();
        String base;
        String fragment;
        int marker = text.indexOf(ViewerStateCodec.FRAGMENT_MARKER);
        if (marker >= 0) {
            base = text.substring(0, marker);
            fragment = text.substring(marker + ViewerStateCodec.FRAGMENT_MARKER.length());
        } else if (text.startsWith("{")) {
            base = "";
            fragment = text;
        } else if (text.indexOf('#') >= 0) {
            base = text.substring(0, text.indexOf('#'));
            fragment = text.substring(text.indexOf('#') + 1);
        } else {
            base = "";
            fragment = text;
        }

        ResolvedState resolved = resolve(fragment, fetcher);
        ViewerState state = resolved.state();
        state.removeExtra(LEGACY_LINK_KEY);
        String effectiveBase = base.isBlank() ? properties.getViewer().getBaseUrl() : base;
        return new CanonicalState(codec.encode(state, effectiveBase), state, resolved.wasPointer());
    }

    private PointerFetcher fetcherFor(String url) {
        int schemeEnd = url.indexOf("://");
        String scheme = schemeEnd > 0 ? url.substring(0, schemeEnd).toLowerCase(Locale.ROOT) : "";
        PointerFetcher fetcher = fetchersByScheme.get(scheme);
        if (fetcher == null) {
            throw new PointerResolutionException(url, "Unsupported pointer scheme for URL fetch: " + url);
        }
        return fetcher;
    }

    private static String decodeFragment(String fragment) {
        String text = fragment != null ? fragment.strip() : "";
        while (text.startsWith("#") || text.startsWith("!")) {
            text = text.substring(1);
        }
        return ViewerStateCodec.percentDecode(text).strip();
    }

    private static boolean looksLikeJsonObject(String text) {
        return text.startsWith("{") && text.endsWith("}");
    }
}
