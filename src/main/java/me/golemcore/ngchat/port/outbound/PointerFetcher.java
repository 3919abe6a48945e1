package me.golemcore.ngchat.port.outbound;

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

import java.io.IOException;
import java.util.Set;

/**
 * Fetches the text a viewer-state pointer URL points to.
 */
@FunctionalInterface
public interface PointerFetcher {

    /**
     * Returns the body of the document at {@code url}.
     *
     * @throws IOException
     *             if the document cannot be read
     */
    String fetch(String url) throws IOException;

    /**
     * URL schemes this fetcher serves when registered as a default fetcher.
     */
    default Set<String> getSchemes() {
        return Set.of();
    }
}
