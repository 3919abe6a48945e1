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

import lombok.Getter;

import java.time.Instant;
import java.util.Objects;

/**
 * A chat session's viewer. Tools edit {@link #getState()} in place or swap it
 * wholesale with {@link #replaceState(ViewerState)} (state load, views table).
 *
 * <p>
 * Not thread-safe: one request at a time per session.
 */
@Getter
public class ViewerSession {

    private final String id;
    private final Instant createdAt;
    private ViewerState state;

    public ViewerSession(String id, ViewerState state, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.state = Objects.requireNonNull(state, "state");
        this.createdAt = createdAt;
    }

    public void replaceState(ViewerState newState) {
        this.state = Objects.requireNonNull(newState, "state");
    }

    public void resetState() {
        this.state = ViewerState.createDefault();
    }
}
