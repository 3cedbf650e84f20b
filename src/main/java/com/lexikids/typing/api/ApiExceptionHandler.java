package com.lexikids.typing.api;

import com.lexikids.typing.session.InvalidRequestException;
import com.lexikids.typing.session.NotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiModels.ErrorResponse> notFound(NotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ApiModels.ErrorResponse("not_found", e.getMessage()));
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ApiModels.ErrorResponse> invalid(InvalidRequestException e) {
        return ResponseEntity.badRequest().body(new ApiModels.ErrorResponse("invalid_request", e.getMessage()));
    }

    @ExceptionHandler({MethodArgumentNotValidException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<ApiModels.ErrorResponse> malformed(Exception e) {
        return ResponseEntity.badRequest().body(new ApiModels.ErrorResponse("invalid_request", "Missing required fields"));
    }
}
