package me.golemcore.ngchat.tools;

import me.golemcore.ngchat.domain.model.ToolResult;
import me.golemcore.ngchat.domain.model.ViewerSession;
import me.golemcore.ngchat.domain.model.ViewerState;
import me.golemcore.ngchat.domain.service.ViewerLinkMasker;
import me.golemcore.ngchat.domain.service.ViewerStateCodec;
import me.golemcore.ngchat.infrastructure.config.AutoConfiguration;
import me.golemcore.ngchat.infrastructure.config.NgChatProperties;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NgStateLinkToolTest {

    @Test
    void shouldReturnEncodedLinkWithoutMutating() {
        NgChatProperties properties = new NgChatProperties();
        ViewerStateCodec codec = new ViewerStateCodec(AutoConfiguration.objectMapper(), properties);
        NgStateLinkTool tool = new NgStateLinkTool(codec, new ViewerLinkMasker(properties));
        ViewerSession session = new ViewerSession("s",
                ViewerState.createDefault().setView(List.of(5.0, 6.0, 7.0), null, null), Instant.EPOCH);

        ToolResult result = tool.execute(session, Map.of());

        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) result.getData();
        String url = (String) data.get("url");
        assertTrue(url.startsWith("https://neuroglancer-demo.appspot.com#!"));
        assertEquals(List.of(5.0, 6.0, 7.0), codec.decode(url).getPosition());
        assertEquals("[Updated Neuroglancer view](" + url + ")", data.get("masked_markdown"));
        assertFalse(tool.isStateMutating());
    }
}
