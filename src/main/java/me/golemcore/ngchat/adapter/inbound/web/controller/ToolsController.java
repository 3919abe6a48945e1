package me.golemcore.ngchat.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.ngchat.adapter.inbound.web.dto.ToolInvocationResponse;
import me.golemcore.ngchat.domain.model.StateLink;
import me.golemcore.ngchat.domain.model.ToolDefinition;
import me.golemcore.ngchat.domain.model.ToolResult;
import me.golemcore.ngchat.domain.model.ViewerSession;
import me.golemcore.ngchat.domain.service.ToolDispatcher;
import me.golemcore.ngchat.domain.service.ViewerSessionService;
import me.golemcore.ngchat.domain.system.toolloop.StateLinkFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

/**
 * Tool catalog and direct tool invocation, bypassing the model.
 */
@RestController
@RequestMapping("/api/tools")
@RequiredArgsConstructor
@Slf4j
public class ToolsController {

    private final ToolDispatcher toolDispatcher;
    private final ViewerSessionService sessionService;
    private final StateLinkFactory stateLinkFactory;

    @GetMapping
    public Mono<ResponseEntity<List<ToolDefinition>>> listTools() {
        return Mono.just(ResponseEntity.ok(toolDispatcher.getDefinitions()));
    }

    @PostMapping("/{name}")
    public Mono<ResponseEntity<ToolInvocationResponse>> invoke(@PathVariable String name,
            @RequestParam(defaultValue = ViewerSessionService.DEFAULT_SESSION_ID) String sessionId,
            @RequestBody(required = false) Map<String, Object> args) {
        ViewerSession session = sessionService.getOrCreate(sessionId);
        return Mono.fromCallable(() -> {
            ToolResult result = toolDispatcher.dispatch(session, name, args != null ? args : Map.of());
            StateLink link = result.isSuccess() && toolDispatcher.isMutating(name)
                    ? stateLinkFactory.create(session)
                    : null;
            log.debug("[API] Direct tool call {} -> success={}", name, result.isSuccess());
            return ResponseEntity.ok(ToolInvocationResponse.builder()
                    .tool(name)
                    .success(result.isSuccess())
                    .output(result.getOutput())
                    .data(result.getData())
                    .error(result.getError())
                    .failureKind(result.getFailureKind())
                    .stateLink(link)
                    .build());
        }).subscribeOn(Schedulers.boundedElastic());
    }
}
