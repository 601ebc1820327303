package com.programmersdiary.cronwarden.web;

import com.programmersdiary.cronwarden.exception.InvalidCronTypeException;
import com.programmersdiary.cronwarden.exception.MalformedEntryException;
import com.programmersdiary.cronwarden.exception.MalformedScheduleException;
import com.programmersdiary.cronwarden.exception.ScheduleNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.io.UncheckedIOException;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({MalformedScheduleException.class, MalformedEntryException.class})
    public ResponseEntity<Map<String, String>> malformed(RuntimeException ex) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, ex);
    }

    @ExceptionHandler(ScheduleNotFoundException.class)
    public ResponseEntity<Map<String, String>> notFound(ScheduleNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, ex);
    }

    @ExceptionHandler(InvalidCronTypeException.class)
    public ResponseEntity<Map<String, String>> invalidType(InvalidCronTypeException ex) {
        return error(HttpStatus.BAD_REQUEST, ex);
    }

    // The table may already hold the change even though it was not stored.
    @ExceptionHandler(UncheckedIOException.class)
    public ResponseEntity<Map<String, String>> storage(UncheckedIOException ex) {
        log.error("Entry store failure: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex);
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, Exception ex) {
        var message = ex.getMessage() != null ? ex.getMessage() : status.getReasonPhrase();
        return ResponseEntity.status(status).body(Map.of("error", message));
    }
}
