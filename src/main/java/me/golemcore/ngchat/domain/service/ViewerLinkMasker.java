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

import me.golemcore.ngchat.infrastructure.config.NgChatProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces raw viewer URLs in chat text with short markdown links.
 *
 * <p>
 * Distinct URLs are labelled in first-seen order ({@code label},
 * {@code label (2)}, ...); repeats reuse their label. URLs already written as
 * {@code [text](url)}, in the link target or as the link text, are left alone,
 * so masking is idempotent. Text carrying a
 * views table ({@code | [view](...) |} rows) is returned unchanged.
 */
@Component
public class ViewerLinkMasker {

    private static final Pattern VIEWS_TABLE_ROW = Pattern.compile("\\|\\s*\\[view]\\(https?://[^)]+\\)\\s*\\|");
    private static final Pattern CANDIDATE = Pattern.compile(
            "https?://[^\\s()\\[\\]]+|(?<!\\S)[^\\s()\\[\\]]*#!%7B[^\\s()\\[\\]]*");
    private static final String TRAILING_PUNCTUATION = ".,;:";
    private static final String INLINE_STATE_MARKER = "#!%7B";
    private static final String MARKDOWN_LINK_OPENER = "](";

    private final NgChatProperties properties;

    public ViewerLinkMasker(NgChatProperties properties) {
        this.properties = properties;
    }

    public String mask(String text) {
        if (text == null || text.isEmpty() || VIEWS_TABLE_ROW.matcher(text).find()) {
            return text;
        }
        Map<String, String> labels = new LinkedHashMap<>();
        StringBuilder result = new StringBuilder(text.length());
        Matcher matcher = CANDIDATE.matcher(text);
        int cursor = 0;
        while (matcher.find()) {
            String url = trimTrailingPunctuation(matcher.group());
            if (!isViewerUrl(url) || isMarkdownLinkText(text, matcher.start(), url)) {
                continue;
            }
            String label = labels.computeIfAbsent(url, key -> labelFor(labels.size() + 1));
            if (isInsideMarkdownLink(text, matcher.start())) {
                continue;
            }
            result.append(text, cursor, matcher.start());
            result.append('[').append(label).append("](").append(url).append(')');
            cursor = matcher.start() + url.length();
        }
        result.append(text, cursor, text.length());
        return result.toString();
    }

    /**
     * Masked markdown for a single URL. URLs without a host marker are linked
     * with the base label as well.
     */
    public String maskedLink(String url) {
        String masked = mask(url);
        if (masked == null || masked.equals(url)) {
            return "[" + properties.getMasking().getLabel() + "](" + url + ")";
        }
        return masked;
    }

    /**
     * Compact link used in views-table rows.
     */
    public String rowLink(String url) {
        return "[link](" + url + ")";
    }

    private boolean isViewerUrl(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        List<String> markers = properties.getMasking().getHostMarkers();
        boolean marked = markers.stream().anyMatch(marker -> lower.contains(marker.toLowerCase(Locale.ROOT)));
        if (!marked) {
            return false;
        }
        return lower.startsWith("http://") || lower.startsWith("https://") || url.contains(INLINE_STATE_MARKER);
    }

    private String labelFor(int ordinal) {
        String label = properties.getMasking().getLabel();
        return ordinal == 1 ? label : label + " (" + ordinal + ")";
    }

    private static boolean isInsideMarkdownLink(String text, int start) {
        return start >= MARKDOWN_LINK_OPENER.length()
                && text.startsWith(MARKDOWN_LINK_OPENER, start - MARKDOWN_LINK_OPENER.length());
    }

    /**
     * A URL written as the visible text of a link, as in {@code [url](url)}.
     */
    private static boolean isMarkdownLinkText(String text, int start, String url) {
        return start > 0 && text.charAt(start - 1) == '['
                && text.startsWith(MARKDOWN_LINK_OPENER, start + url.length());
    }

    private static String trimTrailingPunctuation(String url) {
        int end = url.length();
        while (end > 0 && TRAILING_PUNCTUATION.indexOf(url.charAt(end - 1)) >= 0) {
            end--;
        }
        return url.substring(0, end);
    }
}
