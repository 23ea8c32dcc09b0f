package com.phillippitts.mathscrap.presentation.exception;

import com.phillippitts.mathscrap.domain.BackendTag;
import com.phillippitts.mathscrap.domain.FailureKind;
import com.phillippitts.mathscrap.exception.RecognitionException;
import com.phillippitts.mathscrap.exception.RecognitionExceptionBuilder;
import com.phillippitts.mathscrap.exception.UnreadableImageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.mock.http.MockHttpInputMessage;

import java.nio.file.InvalidPathException;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void unreadableImageReturns400WithReason() {
        UnreadableImageException ex = new UnreadableImageException("/data/a.png", "file is empty");

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleUnreadableImage(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().errorCode()).isEqualTo("UnreadableImageException");
        assertThat(response.getBody().details()).contains("file is empty");
        assertThat(response.getBody().timestamp()).isNotNull();
    }

    @Test
    void malformedBodyReturns400() {
        HttpMessageNotReadableException ex = new HttpMessageNotReadableException("bad json",
                new MockHttpInputMessage(new byte[0]));

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleBadRequest(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().errorCode()).isEqualTo("InvalidRequest");
    }

    @Test
    void invalidPathReturns400() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleBadRequest(new InvalidPathException("a\u0000b", "Nul character not allowed"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().details()).isEqualTo("InvalidPathException");
    }

    @Test
    void serviceFailureReturns503WithoutInternals() {
        RecognitionException ex = RecognitionExceptionBuilder.create("Internal error: token=secret123")
                .backend(BackendTag.PIX2TEX.backendName())
                .kind(FailureKind.RUNTIME_ERROR)
                .build();

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleServiceFailure(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().errorCode()).isEqualTo("RecognitionException");
        assertThat(response.getBody().toString()).doesNotContain("secret123");
        assertThat(response.getBody().details()).contains("retry");
    }

    @Test
    void saturatedPipelineReturns503() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleBusy(new RejectedExecutionException("pool full"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().errorCode()).isEqualTo("ServiceBusy");
        assertThat(response.getBody().toString()).doesNotContain("pool full");
    }

    @Test
    void unexpectedReturns500WithGenericMessage() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleUnexpected(new IllegalStateException("stack trace detail"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().errorCode()).isEqualTo("InternalServerError");
        assertThat(response.getBody().toString()).doesNotContain("stack trace detail");
    }
}
