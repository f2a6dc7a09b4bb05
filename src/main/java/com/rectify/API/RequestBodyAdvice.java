package com.rectify.API;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Bodies that never reach the controller get the same {@code {"error": ...}} shape and a 400.
 */
@Slf4j
@RestControllerAdvice
public class RequestBodyAdvice {

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> unreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest().body(RectifyController.error("Malformed JSON request body"));
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<Map<String, String>> notJson(HttpMediaTypeNotSupportedException e) {
        log.warn("Unsupported content type: {}", e.getContentType());
        return ResponseEntity.badRequest().body(RectifyController.error(
                "Request body must be JSON (Content-Type: application/json), got " + e.getContentType()));
    }
}
