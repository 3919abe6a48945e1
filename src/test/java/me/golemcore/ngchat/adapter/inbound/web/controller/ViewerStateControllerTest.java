package me.golemcore.ngchat.adapter.inbound.web.controller;

import me.golemcore.ngchat.adapter.inbound.web.dto.StateExpandRequest;
import me.golemcore.ngchat.adapter.inbound.web.dto.StateLoadRequest;
import me.golemcore.ngchat.domain.exception.ValidationException;
import me.golemcore.ngchat.domain.model.ViewerState;
import me.golemcore.ngchat.domain.service.PointerResolver;
import me.golemcore.ngchat.domain.service.ViewerLinkMasker;
import me.golemcore.ngchat.domain.service.ViewerSessionService;
import me.golemcore.ngchat.domain.service.ViewerStateCodec;
import me.golemcore.ngchat.domain.service.ViewerStateSummarizer;
import me.golemcore.ngchat.infrastructure.config.AutoConfiguration;
import me.golemcore.ngchat.infrastructure.config.NgChatProperties;
import me.golemcore.ngchat.port.outbound.PointerFetcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ViewerStateControllerTest {

    private static final String BASE_URL = "https://neuroglancer.example.org/";
    private static final String POINTER_URL = BASE_URL + "#!https://files.example.org/state.json";
    private static final String STORED_STATE = "{\"position\":[3,4,5],\"layers\":[{\"type\":\"segmentation\","
            + "\"name\":\"cells\",\"source\":\"precomputed://gs://b/seg\"}],\"ng_link\":\"stale\"}";

    private ViewerSessionService sessionService;
    private ViewerStateCodec codec;
    private ViewerStateController controller;

    @BeforeEach
    void setUp() {
        NgChatProperties properties = new NgChatProperties();
        properties.getViewer().setBaseUrl(BASE_URL);
        codec = new ViewerStateCodec(AutoConfiguration.objectMapper(), properties);
        PointerFetcher fetcher = new PointerFetcher() {
            @Override
            public String fetch(String url) {
                return STORED_STATE;
            }

            @Override
            public Set<String> getSchemes() {
                return Set.of("https");
            }
        };
        sessionService = new ViewerSessionService(Clock.systemUTC());
        controller = new ViewerStateController(sessionService, codec, new ViewerLinkMasker(properties),
                new PointerResolver(codec, properties, List.of(fetcher)), new ViewerStateSummarizer());
    }

    @Test
    void shouldReturnCurrentLinkOfSession() {
        sessionService.getOrCreate("s1").getState().setView(List.of(7.0, 8.0, 9.0), null, null);

        StepVerifier.create(controller.getLink("s1"))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    String url = response.getBody().url();
                    assertTrue(url.startsWith(BASE_URL + "#!%7B"));
                    assertEquals(List.of(7.0, 8.0, 9.0), codec.decode(url).getPosition());
                    assertEquals("[Updated Neuroglancer view](" + url + ")", response.getBody().maskedMarkdown());
                })
                .verifyComplete();
    }

    @Test
    void shouldSummarizeWithRequestedDetail() {
        StepVerifier.create(controller.getSummary("s1", "minimal"))
                .assertNext(response -> {
                    assertEquals("minimal", response.getBody().get("detail"));
                    assertEquals(List.of(), response.getBody().get("layers"));
                })
                .verifyComplete();
        assertThrows(ValidationException.class, () -> controller.getSummary("s1", "verbose"));
    }

    @Test
    void shouldLoadPointerLinkIntoSession() {
        StepVerifier.create(controller.load("s2", new StateLoadRequest(POINTER_URL)))
                .assertNext(response -> {
                    assertEquals(true, response.getBody().get("was_pointer"));
                    assertEquals(List.of("cells"), response.getBody().get("layers"));
                    assertTrue(((String) response.getBody().get("url")).startsWith(BASE_URL + "#!%7B"));
                })
                .verifyComplete();

        ViewerState loaded = sessionService.getOrCreate("s2").getState();
        assertEquals(List.of(3.0, 4.0, 5.0), loaded.getPosition());
        assertTrue(loaded.getExtras().isEmpty());
    }

    @Test
    void shouldExpandWithoutTouchingSessions() {
        StepVerifier.create(controller.expand(new StateExpandRequest(POINTER_URL)))
                .assertNext(response -> {
                    assertEquals(true, response.getBody().get("was_pointer"));
                    assertTrue(!((String) response.getBody().get("url")).contains("ng_link"));
                })
                .verifyComplete();

        assertEquals(List.of(0.0, 0.0, 0.0), sessionService.getOrCreate("default").getState().getPosition());
    }

    @Test
    void shouldRequireLink() {
        ValidationException error = assertThrows(ValidationException.class,
                () -> controller.load("s", new StateLoadRequest(" ")));
        assertEquals("link is required", error.getMessage());
        assertThrows(ValidationException.class, () -> controller.expand(new StateExpandRequest(null)));
    }

    @Test
    void shouldResetSessionToDefaultState() {
        sessionService.getOrCreate("s3").getState().setView(List.of(1.0, 1.0, 1.0), null, null);

        StepVerifier.create(controller.reset("s3"))
                .assertNext(response -> assertEquals("s3", response.getBody().get("sessionId")))
                .verifyComplete();

        assertEquals(ViewerState.createDefault(), sessionService.getOrCreate("s3").getState());
    }
}
