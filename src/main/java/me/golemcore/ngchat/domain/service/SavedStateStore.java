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

import me.golemcore.ngchat.domain.exception.NotFoundException;
import me.golemcore.ngchat.domain.model.ViewerState;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named snapshots of viewer states, kept in memory. Stored and returned states
 * are copies, so later edits never leak into a snapshot.
 */
@Service
public class SavedStateStore {

    private final Map<String, ViewerState> snapshots = new ConcurrentHashMap<>();

    /**
     * Stores a copy of the state and returns its id.
     */
    public String save(ViewerState state) {
        String sid = UUID.randomUUID().toString();
        snapshots.put(sid, state.copy());
        return sid;
    }

    /**
     * @throws NotFoundException
     *             if nothing was saved under {@code sid}
     */
    public ViewerState load(String sid) {
        ViewerState state = sid != null ? snapshots.get(sid) : null;
        if (state == null) {
            throw new NotFoundException("No saved state with id '" + sid + "'");
        }
        return state.copy();
    }
}
