package me.golemcore.ngchat.tools;

import me.golemcore.ngchat.domain.model.ToolResult;
import me.golemcore.ngchat.domain.model.ViewerSession;
import me.golemcore.ngchat.domain.model.ViewerState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NgSetLayerVisibilityToolTest {

    private NgSetLayerVisibilityTool tool;
    private ViewerSession session;

    @BeforeEach
    void setUp() {
        tool = new NgSetLayerVisibilityTool();
        session = new ViewerSession("s", ViewerState.createDefault().addLayer("em", "image", null, null),
                Instant.EPOCH);
    }

    @Test
    void shouldHideAndShowLayer() {
        tool.execute(session, Map.of("name", "em", "visible", false));
        assertFalse(session.getState().findLayer("em").get().isShown());

        tool.execute(session, Map.of("name", "em"));
        assertTrue(session.getState().findLayer("em").get().isShown());
    }

    @Test
    void shouldReportMissingLayer() {
        ToolResult result = tool.execute(session, Map.of("name", "ghost", "visible", false));

        assertTrue(result.isSuccess());
        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) result.getData();
        assertEquals(false, data.get("found"));
        assertEquals("No layer named 'ghost'; nothing changed", result.getOutput());
    }
}
