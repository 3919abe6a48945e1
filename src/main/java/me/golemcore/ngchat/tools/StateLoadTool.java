package me.golemcore.ngchat.tools;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.ngchat.domain.component.ToolComponent;
import me.golemcore.ngchat.domain.exception.ValidationException;
import me.golemcore.ngchat.domain.model.CanonicalState;
import me.golemcore.ngchat.domain.model.ToolDefinition;
import me.golemcore.ngchat.domain.model.ToolResult;
import me.golemcore.ngchat.domain.model.ViewerSession;
import me.golemcore.ngchat.domain.model.ViewerState;
import me.golemcore.ngchat.domain.service.PointerResolver;
import me.golemcore.ngchat.domain.service.SavedStateStore;
import me.golemcore.ngchat.domain.service.ViewerStateCodec;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Replaces the session's viewer state with one loaded from a viewer link
 * (pointer links are expanded) or from a saved snapshot id.
 */
@Component
@RequiredArgsConstructor
public class StateLoadTool implements ToolComponent {

    private final PointerResolver pointerResolver;
    private final SavedStateStore savedStateStore;
    private final ViewerStateCodec codec;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("state_load")
                .description("Load a viewer state from a Neuroglancer link (inline JSON or pointer to a JSON "
                        + "file on http(s), s3 or gs) or from a saved state id.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "link", Map.of("type", "string", "description", "Neuroglancer URL"),
                                "sid", Map.of("type", "string", "description", "Saved state id from state_save")),
                        "required", List.of()))
                .build();
    }

    @Override
    public ToolResult execute(ViewerSession session, Map<String, Object> parameters) {
        String link = ToolArguments.string(parameters, "link");
        String sid = ToolArguments.string(parameters, "sid");
        if (link != null && !link.isBlank()) {
            CanonicalState canonical = pointerResolver.expandToCanonical(link);
            session.replaceState(canonical.state());
            return ToolResult.success("Viewer state loaded", Map.of(
                    "ok", true,
                    "was_pointer", canonical.wasPointer(),
                    "url", canonical.url(),
                    "layers", canonical.state().getLayerNames()));
        }
        if (sid != null && !sid.isBlank()) {
            ViewerState state = savedStateStore.load(sid);
            session.replaceState(state);
            return ToolResult.success("Saved state " + sid + " loaded", Map.of(
                    "ok", true,
                    "sid", sid,
                    "url", codec.encode(state),
                    "layers", state.getLayerNames()));
        }
        throw new ValidationException("Either link or sid is required");
    }

    @Override
    public boolean isStateMutating() {
        return true;
    }
}
