package me.golemcore.ngchat.domain.exception;

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

/**
 * Raised when a pointer fragment cannot be fetched or its content is not a
 * viewer-state JSON object. Carries the pointer URL that failed.
 */
public class PointerResolutionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String url;

    public PointerResolutionException(String url, String message) {
        super(message);
        this.url = url;
    }

    public PointerResolutionException(String url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
