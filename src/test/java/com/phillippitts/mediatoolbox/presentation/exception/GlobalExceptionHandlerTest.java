package com.phillippitts.mediatoolbox.presentation.exception;

import com.phillippitts.mediatoolbox.domain.ToolKind;
import com.phillippitts.mediatoolbox.exception.InvalidJobRequestException;
import com.phillippitts.mediatoolbox.exception.SpawnFailureException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void invalidRequestReturns400WithReason() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleInvalidRequest(new InvalidJobRequestException("argument vector must not be empty"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().errorCode()).isEqualTo("InvalidJobRequestException");
        assertThat(response.getBody().details()).isEqualTo("argument vector must not be empty");
    }

    @Test
    void validationFailureJoinsFieldMessages() {
        BeanPropertyBindingResult result = new BeanPropertyBindingResult(new Object(), "jobStartRequest");
        result.addError(new FieldError("jobStartRequest", "tool", "tool is required"));
        result.addError(new FieldError("jobStartRequest", "arguments", "arguments must not be empty"));
        MethodArgumentNotValidException ex = mock(MethodArgumentNotValidException.class);
        when(ex.getBindingResult()).thenReturn(result);

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleValidation(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().errorCode()).isEqualTo("ValidationFailed");
        assertThat(response.getBody().details())
                .isEqualTo("tool is required; arguments must not be empty");
    }

    @Test
    void unreadableBodyReturns400() {
        HttpMessageNotReadableException ex = new HttpMessageNotReadableException(
                "bad enum", new IllegalArgumentException("No enum constant BURNER"), mock(HttpInputMessage.class));

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleUnreadable(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().errorCode()).isEqualTo("UnreadableBody");
    }

    @Test
    void spawnFailureReturns503WithToolName() {
        SpawnFailureException ex = new SpawnFailureException("Failed to spawn Downloader", ToolKind.DOWNLOADER);

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleSpawnFailure(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().message()).isEqualTo("Tool could not be started");
        assertThat(response.getBody().details()).contains("Failed to spawn Downloader").contains("tool: Downloader");
    }

    @Test
    void unexpectedErrorReturns500WithoutInternals() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleUnexpected(new IllegalStateException("secret internals"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString()).doesNotContain("secret internals");
    }

    @Test
    void responsesAreAlwaysJson() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleInvalidRequest(new InvalidJobRequestException("x"));

        assertThat(response.getHeaders().getContentType()).isEqualTo(MediaType.APPLICATION_JSON);
    }

    @Test
    void responsesCarryTimestamp() {
        Instant before = Instant.now().minusSeconds(1);

        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleSpawnFailure(new SpawnFailureException("nope", ToolKind.TRANSCODER));

        assertThat(response.getBody().timestamp()).isAfter(before);
    }
}
