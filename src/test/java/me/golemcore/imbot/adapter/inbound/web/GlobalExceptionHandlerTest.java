package me.golemcore.imbot.adapter.inbound.web;

import me.golemcore.imbot.domain.model.BotException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void shouldKeepResponseStatus() {
        StepVerifier.create(handler.handleResponseStatus(
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
                    assertEquals(404, response.getBody().getStatus());
                    assertEquals("Session not found", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapInvalidTargetToNotFound() {
        StepVerifier.create(handler.handleBotException(BotException.invalidTarget("sess_1")))
                .assertNext(response -> assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldMapOtherBotErrorsToBadGateway() {
        StepVerifier.create(handler.handleBotException(BotException.rateLimited(5)))
                .assertNext(response -> assertEquals(HttpStatus.BAD_GATEWAY, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldMapArgumentAndStateErrors() {
        StepVerifier.create(handler.handleIllegalArgument(new IllegalArgumentException("bad id")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    assertEquals("bad id", response.getBody().getMessage());
                })
                .verifyComplete();
        StepVerifier.create(handler.handleIllegalState(new IllegalStateException("busy")))
                .assertNext(response -> assertEquals(HttpStatus.CONFLICT, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldHideInternalErrorDetails() {
        StepVerifier.create(handler.handleGeneric(new RuntimeException("stack details")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    assertEquals("Internal server error", response.getBody().getMessage());
                })
                .verifyComplete();
    }
}
