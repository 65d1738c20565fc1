package com.yoursp.botdetection.exception;

import com.yoursp.botdetection.config.CorrelationIdFilter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void returns500WithCorrelationIdAndNoStackTrace() {
        MDC.put(CorrelationIdFilter.CORRELATION_ID_KEY, "req-42");

        ResponseEntity<Map<String, Object>> result =
                handler.handleGenericException(new IllegalStateException("secret internals"));

        assertEquals(500, result.getStatusCode().value());
        Map<String, Object> body = result.getBody();
        assertNotNull(body);
        assertEquals("req-42", body.get("correlationId"));
        assertFalse(body.toString().contains("secret internals"));
    }

    @Test
    void keepsStatusOfMvcErrors() {
        ResponseEntity<Map<String, Object>> result =
                handler.handleFrameworkError(new HttpRequestMethodNotSupportedException("PUT"));

        assertEquals(405, result.getStatusCode().value());
        assertNotNull(result.getBody());
        assertEquals("Method Not Allowed", result.getBody().get("error"));
    }
}
