package me.golemcore.pipeline.adapter.inbound.web;

import me.golemcore.pipeline.adapter.inbound.web.dto.ApiErrorResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import reactor.test.StepVerifier;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void shouldMapMissingTraceToNotFound() {
        ResponseStatusException ex = new ResponseStatusException(HttpStatus.NOT_FOUND,
                "No trace for conversation conv-1");

        StepVerifier.create(handler.handleResponseStatus(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(404, body.getStatus());
                    assertEquals("No trace for conversation conv-1", body.getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapInvalidParameterToBadRequest() {
        IllegalArgumentException ex = new IllegalArgumentException("hours must be between 1 and 168");

        StepVerifier.create(handler.handleIllegalArgument(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(400, body.getStatus());
                    assertEquals("hours must be between 1 and 168", body.getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapIllegalStateToConflict() {
        IllegalStateException ex = new IllegalStateException("Corrupted artifact payload");

        StepVerifier.create(handler.handleIllegalState(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(409, body.getStatus());
                })
                .verifyComplete();
    }

    @Test
    void shouldHideDetailsOfUnexpectedErrors() {
        Exception ex = new RuntimeException("index.db is locked");

        StepVerifier.create(handler.handleGeneric(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(500, body.getStatus());
                    assertEquals("Internal server error", body.getMessage());
                })
                .verifyComplete();
    }
}
