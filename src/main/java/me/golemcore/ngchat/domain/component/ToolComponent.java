package me.golemcore.ngchat.domain.component;

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

import me.golemcore.ngchat.domain.model.ToolDefinition;
import me.golemcore.ngchat.domain.model.ToolResult;
import me.golemcore.ngchat.domain.model.ViewerSession;

import java.util.Map;

/**
 * Component representing an executable tool that can be invoked by the LLM.
 * Tools expose their JSON Schema definition to the LLM via function calling,
 * and operate on the viewer session of the current chat turn.
 */
public interface ToolComponent extends Component {

    @Override
    default String getComponentType() {
        return "tool";
    }

    /**
     * Returns the tool definition with JSON Schema for function calling.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool. Parameters have already been validated and coerced
     * against the definition's schema. Implementations may throw the domain
     * exceptions; the dispatcher turns them into failed results.
     *
     * @param session
     *            the viewer session the call applies to
     * @param parameters
     *            the execution parameters as a map
     * @return the tool execution result
     */
    ToolResult execute(ViewerSession session, Map<String, Object> parameters);

    /**
     * Whether a call may change the session's viewer state. A chat answer
     * that followed such a call carries a fresh viewer link.
     */
    default boolean isStateMutating() {
        return false;
    }

    /**
     * Returns the unique name of this tool.
     *
     * @return the tool name
     */
    default String getToolName() {
        return getDefinition().getName();
    }
}
