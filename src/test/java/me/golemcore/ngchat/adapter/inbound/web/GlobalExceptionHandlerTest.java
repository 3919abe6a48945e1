package me.golemcore.ngchat.adapter.inbound.web;

import me.golemcore.ngchat.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.ngchat.domain.exception.NotFoundException;
import me.golemcore.ngchat.domain.exception.PointerResolutionException;
import me.golemcore.ngchat.domain.exception.SerializationException;
import me.golemcore.ngchat.domain.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void shouldHandleResponseStatusException() {
        ResponseStatusException ex = new ResponseStatusException(HttpStatus.NOT_FOUND, "Session 'x' not found");

        StepVerifier.create(handler.handleResponseStatus(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(404, body.getStatus());
                    assertEquals("Session 'x' not found", body.getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapValidationFailureToBadRequest() {
        StepVerifier.create(handler.handleBadRequest(new ValidationException("messages must not be empty")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    assertEquals("messages must not be empty", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapMissingSnapshotToNotFound() {
        StepVerifier.create(handler.handleNotFound(new NotFoundException("No saved state with id 'a'")))
                .assertNext(response -> assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldMapStateProblemsToUnprocessableEntity() {
        StepVerifier.create(handler.handleUnprocessable(new SerializationException("Invalid JSON: x")))
                .assertNext(response -> assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, response.getStatusCode()))
                .verifyComplete();
        StepVerifier.create(handler.handleUnprocessable(
                new PointerResolutionException("s3://b/k", "Failed to fetch content from pointer 's3://b/k'")))
                .assertNext(response -> {
                    assertEquals(422, response.getBody().getStatus());
                    assertEquals("Failed to fetch content from pointer 's3://b/k'", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldHideDetailsOfUnexpectedErrors() {
        StepVerifier.create(handler.handleGeneric(new IllegalStateException("secret internals")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    assertEquals("Internal server error", response.getBody().getMessage());
                })
                .verifyComplete();
    }
}
