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

import java.util.List;

/**
 * Outcome of one buffered chat turn.
 *
 * @param finalMessage
 *            assistant answer with viewer links masked
 * @param conversation
 *            full conversation including system context and tool messages
 * @param mutated
 *            whether a state-mutating tool was dispatched
 * @param stateLink
 *            current viewer link when {@code mutated}, otherwise {@code null}
 * @param llmCalls
 *            number of model calls made
 * @param toolExecutions
 *            number of tool calls dispatched
 * @param toolTrace
 *            per-call trace in dispatch order
 * @param stopReason
 *            why the loop stopped
 */
public record ChatTurnResult(Message finalMessage, List<Message> conversation, boolean mutated,
        StateLink stateLink, int llmCalls, int toolExecutions, List<ToolTraceEntry> toolTrace,
        String stopReason) {
}
