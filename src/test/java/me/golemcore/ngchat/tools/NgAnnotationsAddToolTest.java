package me.golemcore.ngchat.tools;

import me.golemcore.ngchat.domain.exception.ValidationException;
import me.golemcore.ngchat.domain.model.AnnotationLayer;
import me.golemcore.ngchat.domain.model.BoxAnnotation;
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
import static org.junit.jupiter.api.Assertions.assertTrue;

class NgAnnotationsAddToolTest {

    private static final Map<String, Object> ORIGIN = Map.of("x", 0.0, "y", 0.0, "z", 0.0);

    private NgAnnotationsAddTool tool;
    private ViewerSession session;

    @BeforeEach
    void setUp() {
        tool = new NgAnnotationsAddTool();
        session = new ViewerSession("s", ViewerState.createDefault(), Instant.EPOCH);
    }

    @Test
    void shouldCreateLayerAndAddTypedItems() {
        ToolResult result = tool.execute(session, Map.of("layer", "marks", "items", List.of(
                Map.of("type", "point", "id", "p1", "center", Map.of("x", 1.0, "y", 2.0, "z", 3.0)),
                Map.of("type", "box", "center", ORIGIN, "size", Map.of("x", 2.0, "y", 4.0, "z", 6.0)),
                Map.of("type", "ellipsoid", "center", ORIGIN, "size", Map.of("x", 2.0, "y", 2.0, "z", 2.0)))));

        assertEquals(Map.of("ok", true, "layer", "marks", "added", 3), result.getData());
        AnnotationLayer layer = (AnnotationLayer) session.getState().findLayer("marks").get();
        assertEquals(3, layer.getAnnotationCount());
        BoxAnnotation box = (BoxAnnotation) layer.getAnnotations().get(1);
        assertEquals(List.of(-1.0, -2.0, -3.0), box.getPointA());
        assertEquals(List.of(1.0, 2.0, 3.0), box.getPointB());
    }

    @Test
    void shouldRequireSizeForBoxAndEllipsoid() {
        ValidationException error = assertThrows(ValidationException.class, () -> tool.execute(session,
                Map.of("layer", "marks", "items", List.of(Map.of("type", "box", "center", ORIGIN)))));

        assertTrue(error.getMessage().contains("size is required for box"));
        assertTrue(session.getState().getLayers().isEmpty());
    }

    @Test
    void shouldRejectEmptyItemsAndUnknownTypes() {
        assertThrows(ValidationException.class,
                () -> tool.execute(session, Map.of("layer", "marks", "items", List.of())));
        assertThrows(ValidationException.class, () -> tool.execute(session,
                Map.of("layer", "marks", "items", List.of(Map.of("type", "line", "center", ORIGIN)))));
    }

    @Test
    void shouldRefuseNonAnnotationLayer() {
        session.getState().addLayer("em", "image", null, null);

        assertThrows(ValidationException.class, () -> tool.execute(session,
                Map.of("layer", "em", "items", List.of(Map.of("type", "point", "center", ORIGIN)))));
    }
}
