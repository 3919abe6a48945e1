package me.golemcore.ngchat.domain.model;

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
 * A viewer state obtained from a URL fragment.
 *
 * @param state
 *            the parsed state
 * @param wasPointer
 *            whether the fragment was a pointer that had to be fetched
 * @param sourceUrl
 *            the pointer URL when {@code wasPointer}, otherwise {@code null}
 */
public record ResolvedState(ViewerState state, boolean wasPointer, String sourceUrl) {
}
