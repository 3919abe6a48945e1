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

import me.golemcore.ngchat.domain.model.QueryRequest;
import me.golemcore.ngchat.domain.model.QueryResult;

/**
 * Port for the external read-only query evaluator over uploaded tables.
 */
public interface QuerySandboxPort {

    /**
     * Evaluates the query. Failures are reported in the result, not thrown.
     */
    QueryResult execute(QueryRequest request);

    boolean isAvailable();
}
