package me.golemcore.ngchat.tools;

import me.golemcore.ngchat.domain.exception.ValidationException;
import me.golemcore.ngchat.domain.model.ImageLayer;
import me.golemcore.ngchat.domain.model.ToolResult;
import me.golemcore.ngchat.domain.model.ViewerSession;
import me.golemcore.ngchat.domain.model.ViewerState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class NgSetLutToolTest {

    private NgSetLutTool tool;
    private ViewerSession session;

    @BeforeEach
    void setUp() {
        tool = new NgSetLutTool();
        session = new ViewerSession("s", ViewerState.createDefault()
                .addLayer("em", "image", null, null)
                .addLayer("marks", "annotation", null, null), Instant.EPOCH);
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldSetRangeOnImageLayer() {
        ToolResult result = tool.execute(session, Map.of("layer", "em", "vmin", 0.0, "vmax", 255.0));

        assertEquals(true, ((Map<String, Object>) result.getData()).get("applied"));
        assertEquals(List.of(0.0, 255.0), ((ImageLayer) session.getState().findLayer("em").get())
                .getNormalizedRange());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldLeaveStateAloneForAnnotationOrMissingLayer() {
        ViewerState before = session.getState().copy();

        ToolResult annotation = tool.execute(session, Map.of("layer", "marks", "vmin", 0.0, "vmax", 1.0));
        ToolResult missing = tool.execute(session, Map.of("layer", "nope", "vmin", 0.0, "vmax", 1.0));

        assertEquals(false, ((Map<String, Object>) annotation.getData()).get("applied"));
        assertEquals(false, ((Map<String, Object>) missing.getData()).get("applied"));
        assertEquals(before, session.getState());
    }

    @Test
    void shouldRejectInvertedRange() {
        assertThrows(ValidationException.class,
                () -> tool.execute(session, Map.of("layer", "em", "vmin", 10.0, "vmax", 1.0)));
    }
}
