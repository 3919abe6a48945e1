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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.ngchat.domain.exception.SerializationException;
import me.golemcore.ngchat.domain.model.ViewerState;
import me.golemcore.ngchat.infrastructure.config.NgChatProperties;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Converts viewer states to and from shareable viewer URLs.
 *
 * <p>
 * A URL is {@code <base>#!<percent-encoded minified JSON>}. Keys are written in
 * the order the state holds them, never sorted, so
 * {@code encode(decode(encode(s)))} equals {@code encode(s)}.
 */
@Component
@Slf4j
public class ViewerStateCodec {

    public static final String FRAGMENT_MARKER = "#!";

    private final ObjectMapper objectMapper;
    private final NgChatProperties properties;

    public ViewerStateCodec(ObjectMapper objectMapper, NgChatProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public String encode(ViewerState state) {
        return encode(state, properties.getViewer().getBaseUrl());
    }

    public String encode(ViewerState state, String baseUrl) {
        String base = baseUrl != null ? baseUrl : properties.getViewer().getBaseUrl();
        return base + FRAGMENT_MARKER + UriUtils.encode(toJson(state), StandardCharsets.UTF_8);
    }

    /**
     * Minified JSON form of the state.
     */
    public String toJson(ViewerState state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to serialize viewer state: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parses a full viewer URL, a fragment with or without {@code #!}, or raw
     * JSON; percent-encoded or not.
     *
     * @throws SerializationException
     *             if no viewer-state JSON object can be read
     */
    public ViewerState decode(String urlOrFragment) {
        if (urlOrFragment == null || urlOrFragment.isBlank()) {
            throw new SerializationException("Viewer URL or fragment is empty");
        }
        String fragment = extractFragment(urlOrFragment);
        String decoded = percentDecode(fragment);
        try {
            return fromJson(decoded);
        } catch (SerializationException e) {
            if (decoded.equals(fragment)) {
                throw e;
            }
            log.debug("[Codec] Decoded fragment did not parse, retrying raw text: {}", e.getMessage());
            return fromJson(fragment);
        }
    }

    public ViewerState decode(Map<String, ?> document) {
        try {
            return objectMapper.convertValue(document, ViewerState.class);
        } catch (IllegalArgumentException e) {
            throw new SerializationException("Not a viewer state: " + e.getMessage(), e);
        }
    }

    public ViewerState decode(JsonNode document) {
        if (document == null || !document.isObject()) {
            throw new SerializationException("Viewer state must be a JSON object");
        }
        try {
            return objectMapper.treeToValue(document, ViewerState.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new SerializationException("Not a viewer state: " + e.getMessage(), e);
        }
    }

    /**
     * Parses a JSON object into a viewer state.
     */
    public ViewerState fromJson(String json) {
        return decode(readTree(json));
    }

    /**
     * Parses arbitrary JSON text.
     *
     * @throws SerializationException
     *             if the text is not JSON
     */
    public JsonNode readTree(String text) {
        try {
            JsonNode node = objectMapper.readTree(text);
            if (node == null || node.isMissingNode()) {
                throw new SerializationException("Empty JSON document");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new SerializationException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Strips everything up to the fragment marker. Text that already starts as
     * a JSON object is returned as is, since it may contain {@code #} itself.
     */
    public static String extractFragment(String urlOrFragment) {
        String text = urlOrFragment.strip();
        if (text.startsWith("{")) {
            return text;
        }
        int marker = text.indexOf(FRAGMENT_MARKER);
        if (marker >= 0) {
            return text.substring(marker + FRAGMENT_MARKER.length());
        }
        int hash = text.indexOf('#');
        if (hash >= 0) {
            text = text.substring(hash + 1);
        }
        return text.startsWith("!") ? text.substring(1) : text;
    }

    public static String percentDecode(String text) {
        try {
            return UriUtils.decode(text, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return text;
        }
    }
}
