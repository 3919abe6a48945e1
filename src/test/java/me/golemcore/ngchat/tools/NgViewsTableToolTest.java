package me.golemcore.ngchat.tools;

import me.golemcore.ngchat.domain.exception.ValidationException;
import me.golemcore.ngchat.domain.model.AnnotationLayer;
import me.golemcore.ngchat.domain.model.ImageLayer;
import me.golemcore.ngchat.domain.model.ToolResult;
import me.golemcore.ngchat.domain.model.ViewerSession;
import me.golemcore.ngchat.domain.model.ViewerState;
import me.golemcore.ngchat.domain.service.ViewerLinkMasker;
import me.golemcore.ngchat.domain.service.ViewerStateCodec;
import me.golemcore.ngchat.infrastructure.config.AutoConfiguration;
import me.golemcore.ngchat.infrastructure.config.NgChatProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NgViewsTableToolTest {

    private ViewerStateCodec codec;
    private NgViewsTableTool tool;
    private ViewerSession session;

    @BeforeEach
    void setUp() {
        NgChatProperties properties = new NgChatProperties();
        codec = new ViewerStateCodec(AutoConfiguration.objectMapper(), properties);
        tool = new NgViewsTableTool(codec, new ViewerLinkMasker(properties));
        session = new ViewerSession("s", ViewerState.createDefault().addLayer("em", "image", null, null),
                Instant.EPOCH);
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldBuildOneLinkPerRowAndMakeFirstRowCurrent() {
        ToolResult result = tool.execute(session, Map.of("rows", List.of(
                Map.of("id", "a", "x", 10.0, "y", 20.0, "z", 30.0, "label", "soma"),
                Map.of("id", "b", "x", 40.0, "y", 50.0, "z", 60.0))));

        assertTrue(result.isSuccess());
        Map<String, Object> data = (Map<String, Object>) result.getData();
        assertEquals(2, data.get("n"));
        List<Map<String, Object>> rows = (List<Map<String, Object>>) data.get("rows");
        assertEquals("a", rows.get(0).get("id"));
        assertEquals("soma", rows.get(0).get("label"));
        assertFalse(rows.get(1).containsKey("label"));
        String firstUrl = (String) rows.get(0).get("url");
        assertEquals(firstUrl, data.get("first_link"));
        assertEquals("[link](" + firstUrl + ")", rows.get(0).get("link"));
        assertNotEquals(firstUrl, rows.get(1).get("url"));
        assertFalse(data.containsKey("warnings"));

        assertEquals(List.of(10.0, 20.0, 30.0), codec.decode(firstUrl).getPosition());
        assertEquals(List.of(40.0, 50.0, 60.0), codec.decode((String) rows.get(1).get("url")).getPosition());
        assertEquals(List.of(10.0, 20.0, 30.0), session.getState().getPosition());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldApplyLutAndAnnotationsToEveryRow() {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("rows", List.of(Map.of("id", "r1", "x", 1.0, "y", 2.0, "z", 3.0),
                Map.of("id", "r2", "x", 4.0, "y", 5.0, "z", 6.0)));
        args.put("lut", Map.of("layer", "em", "min", 10.0, "max", 90.0));
        args.put("annotations", true);
        args.put("annotation_layer", "hits");

        ToolResult result = tool.execute(session, args);

        List<Map<String, Object>> rows = (List<Map<String, Object>>) ((Map<String, Object>) result.getData())
                .get("rows");
        ViewerState second = codec.decode((String) rows.get(1).get("url"));
        assertEquals(List.of(10.0, 90.0), ((ImageLayer) second.findLayer("em").get()).getNormalizedRange());
        AnnotationLayer hits = (AnnotationLayer) second.findLayer("hits").get();
        assertEquals(1, hits.getAnnotationCount());
        assertEquals("r2", hits.getAnnotations().get(0).getId());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldCapRowsAndWarnAboutSkippedOnes() {
        List<Map<String, Object>> rows = new ArrayList<>();
        rows.add(Map.of("id", "bad", "x", 1.0, "y", 2.0));
        for (int i = 0; i < 4; i++) {
            rows.add(Map.of("x", (double) i, "y", 0.0, "z", 0.0));
        }

        ToolResult result = tool.execute(session, Map.of("rows", rows, "top_n", 3));

        Map<String, Object> data = (Map<String, Object>) result.getData();
        assertEquals(2, data.get("n"));
        List<String> warnings = (List<String>) data.get("warnings");
        assertTrue(warnings.get(0).startsWith("row bad:"));
        assertEquals("only the first 3 of 5 rows were used", warnings.get(1));
        assertEquals("2", ((List<Map<String, Object>>) data.get("rows")).get(0).get("id"));
    }

    @Test
    void shouldFailWhenNoRowIsUsable() {
        ViewerState before = session.getState();

        assertThrows(ValidationException.class, () -> tool.execute(session, Map.of("rows", List.of())));
        assertThrows(ValidationException.class,
                () -> tool.execute(session, Map.of("rows", List.of(Map.of("x", 1.0)))));
        assertEquals(before, session.getState());
    }
}
