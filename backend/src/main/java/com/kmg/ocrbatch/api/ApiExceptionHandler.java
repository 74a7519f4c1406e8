package com.kmg.ocrbatch.api;

import com.kmg.ocrbatch.dto.ErrorResponse;
import com.kmg.ocrbatch.model.ErrorKind;
import com.kmg.ocrbatch.service.DocumentResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.stream.Collectors;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(DocumentResolver.ResolutionException.class)
    public ResponseEntity<ErrorResponse> resolution(DocumentResolver.ResolutionException e) {
        log.error("Invalid input: {}", e.getMessage());
        return badRequest(e.kind(), e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> validation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return badRequest(ErrorKind.INVALID_INPUT, message);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestPartException.class})
    public ResponseEntity<ErrorResponse> unreadable(Exception e) {
        return badRequest(ErrorKind.INVALID_INPUT, e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> illegalArgument(IllegalArgumentException e) {
        return badRequest(ErrorKind.INVALID_INPUT, e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> unexpected(Exception e) {
        log.error("Unexpected error: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("Internal Server Error", null, "Unexpected error: " + e.getMessage()));
    }

    private ResponseEntity<ErrorResponse> badRequest(ErrorKind kind, String message) {
        return ResponseEntity.badRequest().body(new ErrorResponse("Bad Request", kind, message));
    }
}
