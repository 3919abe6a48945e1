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
import me.golemcore.ngchat.domain.model.ToolDefinition;
import me.golemcore.ngchat.domain.model.ToolResult;
import me.golemcore.ngchat.domain.model.ViewerSession;
import me.golemcore.ngchat.domain.service.SavedStateStore;
import me.golemcore.ngchat.domain.service.ViewerLinkMasker;
import me.golemcore.ngchat.domain.service.ViewerStateCodec;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
@RequiredArgsConstructor
public class StateSaveTool implements ToolComponent {

    private final SavedStateStore savedStateStore;
    private final ViewerStateCodec codec;
    private final ViewerLinkMasker masker;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.simple("state_save",
                "Save a snapshot of the current viewer state. Returns an id usable with state_load.");
    }

    @Override
    public ToolResult execute(ViewerSession session, Map<String, Object> parameters) {
        String sid = savedStateStore.save(session.getState());
        String url = codec.encode(session.getState());
        return ToolResult.success("Saved state " + sid, Map.of(
                "ok", true,
                "sid", sid,
                "url", url,
                "masked_markdown", masker.maskedLink(url)));
    }
}
