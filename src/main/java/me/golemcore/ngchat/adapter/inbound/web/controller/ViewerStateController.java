package me.golemcore.ngchat.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.ngchat.adapter.inbound.web.dto.StateExpandRequest;
import me.golemcore.ngchat.adapter.inbound.web.dto.StateLoadRequest;
import me.golemcore.ngchat.domain.exception.ValidationException;
import me.golemcore.ngchat.domain.model.CanonicalState;
import me.golemcore.ngchat.domain.model.StateLink;
import me.golemcore.ngchat.domain.model.SummaryDetail;
import me.golemcore.ngchat.domain.model.ViewerSession;
import me.golemcore.ngchat.domain.service.PointerResolver;
import me.golemcore.ngchat.domain.service.ViewerLinkMasker;
import me.golemcore.ngchat.domain.service.ViewerSessionService;
import me.golemcore.ngchat.domain.service.ViewerStateCodec;
import me.golemcore.ngchat.domain.service.ViewerStateSummarizer;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Viewer state endpoints: current link, summary, loading a shared link and
 * expanding pointer links.
 */
@RestController
@RequestMapping("/api/state")
@RequiredArgsConstructor
@Slf4j
public class ViewerStateController {

    private final ViewerSessionService sessionService;
    private final ViewerStateCodec codec;
    private final ViewerLinkMasker masker;
    private final PointerResolver pointerResolver;
    private final ViewerStateSummarizer summarizer;

    @GetMapping("/link")
    public Mono<ResponseEntity<StateLink>> getLink(
            @RequestParam(defaultValue = ViewerSessionService.DEFAULT_SESSION_ID) String sessionId) {
        ViewerSession session = sessionService.getOrCreate(sessionId);
        String url = codec.encode(session.getState());
        return Mono.just(ResponseEntity.ok(new StateLink(url, masker.maskedLink(url))));
    }

    @GetMapping("/summary")
    public Mono<ResponseEntity<Map<String, Object>>> getSummary(
            @RequestParam(defaultValue = ViewerSessionService.DEFAULT_SESSION_ID) String sessionId,
            @RequestParam(required = false) String detail) {
        ViewerSession session = sessionService.getOrCreate(sessionId);
        return Mono.just(ResponseEntity.ok(summarizer.summarize(session.getState(), SummaryDetail.parse(detail))));
    }

    @PostMapping("/load")
    public Mono<ResponseEntity<Map<String, Object>>> load(
            @RequestParam(defaultValue = ViewerSessionService.DEFAULT_SESSION_ID) String sessionId,
            @RequestBody StateLoadRequest request) {
        String link = requireText(request != null ? request.getLink() : null, "link");
        ViewerSession session = sessionService.getOrCreate(sessionId);
        return Mono.fromCallable(() -> {
            CanonicalState canonical = pointerResolver.expandToCanonical(link);
            session.replaceState(canonical.state());
            log.info("[API] Loaded state into session '{}' (pointer: {})", session.getId(), canonical.wasPointer());
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("ok", true);
            body.put("url", canonical.url());
            body.put("masked_markdown", masker.maskedLink(canonical.url()));
            body.put("was_pointer", canonical.wasPointer());
            body.put("layers", canonical.state().getLayerNames());
            return ResponseEntity.ok(body);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/expand")
    public Mono<ResponseEntity<Map<String, Object>>> expand(@RequestBody StateExpandRequest request) {
        String url = requireText(request != null ? request.getUrl() : null, "url");
        return Mono.fromCallable(() -> {
            CanonicalState canonical = pointerResolver.expandToCanonical(url);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("url", canonical.url());
            body.put("was_pointer", canonical.wasPointer());
            return ResponseEntity.ok(body);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/reset")
    public Mono<ResponseEntity<Map<String, Object>>> reset(
            @RequestParam(defaultValue = ViewerSessionService.DEFAULT_SESSION_ID) String sessionId) {
        ViewerSession session = sessionService.reset(sessionId);
        return Mono.just(ResponseEntity.ok(Map.of("ok", true, "sessionId", session.getId())));
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
        return value.trim();
    }
}
