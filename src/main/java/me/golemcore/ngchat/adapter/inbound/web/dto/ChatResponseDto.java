package me.golemcore.ngchat.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.ngchat.domain.model.ChatTurnResult;
import me.golemcore.ngchat.domain.model.StateLink;
import me.golemcore.ngchat.domain.model.ToolTraceEntry;

import java.util.List;

/**
 * Buffered chat answer. The intermediate tool messages are not returned; the
 * trace lists the dispatched calls instead.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatResponseDto {
    private String sessionId;
    private ChatMessageDto message;
    private boolean mutated;
    private StateLink stateLink;
    private List<ToolTraceEntry> toolTrace;
    private int llmCalls;
    private int toolExecutions;
    private String stopReason;

    public static ChatResponseDto from(String sessionId, ChatTurnResult result) {
        return ChatResponseDto.builder()
                .sessionId(sessionId)
                .message(ChatMessageDto.builder()
                        .role(result.finalMessage().getRole())
                        .content(result.finalMessage().getContent())
                        .build())
                .mutated(result.mutated())
                .stateLink(result.stateLink())
                .toolTrace(result.toolTrace())
                .llmCalls(result.llmCalls())
                .toolExecutions(result.toolExecutions())
                .stopReason(result.stopReason())
                .build();
    }
}
