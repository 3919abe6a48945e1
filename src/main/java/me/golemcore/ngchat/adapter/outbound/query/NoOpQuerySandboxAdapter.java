package me.golemcore.ngchat.adapter.outbound.query;

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
import me.golemcore.ngchat.domain.model.QueryRequest;
import me.golemcore.ngchat.domain.model.QueryResult;
import me.golemcore.ngchat.port.outbound.QuerySandboxPort;
import org.springframework.stereotype.Component;

/**
 * Placeholder sandbox used when no query engine is wired in. The data_query
 * tool stays hidden from the model while this adapter is active.
 */
@Component
@Slf4j
public class NoOpQuerySandboxAdapter implements QuerySandboxPort {

    @Override
    public QueryResult execute(QueryRequest request) {
        log.debug("[Query] Sandbox not configured, rejecting query");
        return QueryResult.failure("Query sandbox is not configured");
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
