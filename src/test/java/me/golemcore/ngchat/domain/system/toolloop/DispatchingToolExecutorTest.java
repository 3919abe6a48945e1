package me.golemcore.ngchat.domain.system.toolloop;

import me.golemcore.ngchat.domain.model.Message;
import me.golemcore.ngchat.domain.model.ToolFailureKind;
import me.golemcore.ngchat.domain.model.ViewerSession;
import me.golemcore.ngchat.domain.model.ViewerState;
import me.golemcore.ngchat.domain.service.ToolArgumentValidator;
import me.golemcore.ngchat.domain.service.ToolDispatcher;
import me.golemcore.ngchat.infrastructure.config.AutoConfiguration;
import me.golemcore.ngchat.tools.NgSetViewTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DispatchingToolExecutorTest {

    private DispatchingToolExecutor executor;
    private ViewerSession session;

    @BeforeEach
    void setUp() {
        ToolDispatcher dispatcher = new ToolDispatcher(List.of(new NgSetViewTool()), new ToolArgumentValidator(),
                AutoConfiguration.objectMapper());
        executor = new DispatchingToolExecutor(dispatcher);
        session = new ViewerSession("s", ViewerState.createDefault(), Instant.EPOCH);
    }

    @Test
    void shouldExecuteThroughDispatcherAndFlagMutation() {
        Message.ToolCall call = Message.ToolCall.builder()
                .id("tc-1")
                .name("ng_set_view")
                .arguments(Map.of("center", Map.of("x", "4", "y", 5, "z", 6), "zoom", 3))
                .build();

        ToolExecutionOutcome outcome = executor.execute(session, call, 4000);

        assertEquals("tc-1", outcome.toolCallId());
        assertTrue(outcome.toolResult().isSuccess());
        assertTrue(outcome.mutating());
        assertFalse(outcome.synthetic());
        assertTrue(outcome.messageContent().startsWith("{\"ok\":true,\"position\":[4.0,5.0,6.0]"));
        assertEquals(List.of(4.0, 5.0, 6.0), session.getState().getPosition());
        assertEquals(3.0, session.getState().getCrossSectionScale());
    }

    @Test
    void shouldReturnErrorContentForUnknownTool() {
        Message.ToolCall call = Message.ToolCall.builder().id("tc-2").name("teleport").arguments(Map.of()).build();

        ToolExecutionOutcome outcome = executor.execute(session, call, 4000);

        assertEquals(ToolFailureKind.UNKNOWN_TOOL, outcome.toolResult().getFailureKind());
        assertTrue(outcome.messageContent().startsWith("{\"error\":\"Unknown tool: teleport"));
        assertFalse(outcome.mutating());
    }
}
