package com.shopfront.productservice.exception;

import com.shopfront.common.dto.ErrorResponse;
import com.shopfront.common.exception.DuplicateResourceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GlobalExceptionHandler Unit Tests")
class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;
    private MockHttpServletRequest request;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
        request = new MockHttpServletRequest("POST", "/seller");
    }

    @Test
    @DisplayName("should map a constraint violation to 409 without leaking the database message")
    void shouldMapDataIntegrityViolationToConflict() {
        // Arrange
        DataIntegrityViolationException ex = new DataIntegrityViolationException(
                "could not execute statement",
                new RuntimeException("Unique index or primary key violation: SELLERS(USERNAME)"));

        // Act
        ResponseEntity<ErrorResponse> response = handler.handleDataIntegrityViolationException(ex, request);

        // Assert
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().getStatus()).isEqualTo(409);
        assertThat(response.getBody().getErrorCode()).isEqualTo("DATA_INTEGRITY_VIOLATION");
        assertThat(response.getBody().getPath()).isEqualTo("/seller");
        assertThat(response.getBody().getMessage()).doesNotContain("SELLERS");
        assertThat(response.getBody().getCorrelationId()).isNotBlank();
    }

    @Test
    @DisplayName("should map a duplicate username to 409 with the service message")
    void shouldMapDuplicateResourceToConflict() {
        ResponseEntity<ErrorResponse> response = handler.handleDuplicateResourceException(
                new DuplicateResourceException("Seller with username 'alice' already exists"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().getErrorCode()).isEqualTo("DUPLICATE_RESOURCE");
        assertThat(response.getBody().getMessage()).isEqualTo("Seller with username 'alice' already exists");
    }

    @Test
    @DisplayName("should keep failed logins on 404 with the distinct message")
    void shouldMapInvalidCredentialsToNotFound() {
        ResponseEntity<ErrorResponse> response = handler.handleInvalidCredentialsException(
                new InvalidCredentialsException("Invalid password"), new MockHttpServletRequest("POST", "/login"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().getMessage()).isEqualTo("Invalid password");
    }
}
