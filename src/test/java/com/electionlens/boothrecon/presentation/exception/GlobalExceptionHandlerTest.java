package com.electionlens.boothrecon.presentation.exception;

import com.electionlens.boothrecon.exception.BoothReconException;
import com.electionlens.boothrecon.exception.InvalidContestDataException;
import com.electionlens.boothrecon.exception.ReconciliationImpossibleException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;

import java.util.Map;

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
    void invalidContestDataReturns400WithDetail() {
        ResponseEntity<?> response = handler.handleInvalidContestData(
                new InvalidContestDataException("Duplicate candidate 'A' (P1)"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString())
                .contains("InvalidContestDataException")
                .contains("Invalid contest data")
                .contains("Duplicate candidate 'A' (P1)");
    }

    @Test
    void beanValidationFailureListsFields() {
        BeanPropertyBindingResult binding = new BeanPropertyBindingResult(Map.of(), "request");
        binding.addError(new FieldError("request", "contestId", "must not be blank"));
        binding.addError(new FieldError("request", "candidates", "must not be empty"));
        MethodArgumentNotValidException ex = mock(MethodArgumentNotValidException.class);
        when(ex.getBindingResult()).thenReturn(binding);

        ResponseEntity<?> response = handler.handleValidation(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().toString())
                .contains("ValidationFailed")
                .contains("contestId must not be blank; candidates must not be empty");
    }

    @Test
    void domainFailureReturns422() {
        ResponseEntity<?> response = handler.handleDomainFailure(
                new ReconciliationImpossibleException("no booth records"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(response.getBody().toString())
                .contains("ReconciliationImpossibleException")
                .contains("no booth records");
    }

    @Test
    void batchFailureKeepsItsMessage() {
        ResponseEntity<?> response = handler.handleDomainFailure(
                new BoothReconException("Batch processing failed: pool closed"));

        assertThat(response.getBody().toString()).contains("Batch processing failed: pool closed");
    }

    @Test
    void unexpectedErrorHidesInternals() {
        ResponseEntity<?> response = handler.handleUnexpected(new IllegalStateException("secret path /var/x"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString())
                .contains("InternalServerError")
                .doesNotContain("secret path");
    }
}
