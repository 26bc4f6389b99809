package com.taskgateway.api.rest;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import static org.assertj.core.api.Assertions.*;

class ApiExceptionHandlerTest {

    @Test
    void isRetryAllowed_shouldHoldForServerErrorsTimeoutsAndThrottling() {
        assertThat(ApiExceptionHandler.isRetryAllowed(HttpStatus.SERVICE_UNAVAILABLE)).isTrue();
        assertThat(ApiExceptionHandler.isRetryAllowed(HttpStatus.INTERNAL_SERVER_ERROR)).isTrue();
        assertThat(ApiExceptionHandler.isRetryAllowed(HttpStatus.REQUEST_TIMEOUT)).isTrue();
        assertThat(ApiExceptionHandler.isRetryAllowed(HttpStatus.TOO_MANY_REQUESTS)).isTrue();
    }

    @Test
    void isRetryAllowed_shouldNotHoldForClientErrors() {
        assertThat(ApiExceptionHandler.isRetryAllowed(HttpStatus.BAD_REQUEST)).isFalse();
        assertThat(ApiExceptionHandler.isRetryAllowed(HttpStatus.NOT_FOUND)).isFalse();
        assertThat(ApiExceptionHandler.isRetryAllowed(HttpStatus.CONFLICT)).isFalse();
    }
}
