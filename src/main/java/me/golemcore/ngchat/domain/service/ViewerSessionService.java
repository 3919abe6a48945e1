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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.ngchat.domain.model.ViewerSession;
import me.golemcore.ngchat.domain.model.ViewerState;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory registry of viewer sessions. A session is created with the default
 * viewer state on first use and lives for the process lifetime.
 */
@Service
@Slf4j
public class ViewerSessionService {

    public static final String DEFAULT_SESSION_ID = "default";

    private final Map<String, ViewerSession> sessions = new ConcurrentHashMap<>();
    private final Clock clock;

    public ViewerSessionService(Clock clock) {
        this.clock = clock;
    }

    public ViewerSession getOrCreate(String sessionId) {
        String id = normalize(sessionId);
        return sessions.computeIfAbsent(id, key -> {
            log.debug("[Session] Creating viewer session '{}'", key);
            return new ViewerSession(key, ViewerState.createDefault(), clock.instant());
        });
    }

    /**
     * Puts the session back to the default viewer state.
     */
    public ViewerSession reset(String sessionId) {
        ViewerSession session = getOrCreate(sessionId);
        session.resetState();
        log.info("[Session] Viewer state reset for '{}'", session.getId());
        return session;
    }

    private static String normalize(String sessionId) {
        return sessionId == null || sessionId.isBlank() ? DEFAULT_SESSION_ID : sessionId.trim();
    }
}
