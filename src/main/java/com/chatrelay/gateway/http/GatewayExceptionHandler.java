package com.chatrelay.gateway.http;

import com.chatrelay.convert.ConversionException;
import com.chatrelay.providers.ProviderException;
import com.chatrelay.relay.UnknownProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class GatewayExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GatewayExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage(), "Invalid request: " + e.getMessage(), "error");
    }

    @ExceptionHandler(UnknownProviderException.class)
    public ResponseEntity<Map<String, Object>> unknownProvider(UnknownProviderException e) {
        log.warn("Direct call to unknown provider {}", e.provider());
        return error(HttpStatus.NOT_FOUND, e.getMessage(),
                "Provider " + e.provider() + " is not registered", "unknown");
    }

    @ExceptionHandler(ProviderException.class)
    public ResponseEntity<Map<String, Object>> providerFailed(ProviderException e) {
        log.error("Direct call to {} failed [{}]: {}", e.provider(), e.kind(), e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, e.getMessage(),
                "Provider call failed: " + e.getMessage(), "error");
    }

    @ExceptionHandler(ConversionException.class)
    public ResponseEntity<Map<String, Object>> conversionFailed(ConversionException e) {
        log.warn("SVG conversion failed: {}", e.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage(), "Conversion failed", "converter");
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String error,
                                                             String response, String provider) {
        var body = new LinkedHashMap<String, Object>();
        body.put("error", error);
        body.put("response", response);
        body.put("provider", provider);
        return ResponseEntity.status(status).body(body);
    }
}
