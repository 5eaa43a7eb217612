package com.github.salilvnair.formflow.api.controller;

import com.github.salilvnair.formflow.api.dto.ApiErrorResponse;
import com.github.salilvnair.formflow.engine.exception.FormFlowErrorCode;
import com.github.salilvnair.formflow.engine.exception.FormFlowException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps failures that reach the HTTP surface to {@code {success:false, error_code, message, recoverable}}.
 */
@Slf4j
@RestControllerAdvice
public class FormFlowExceptionHandler {

    @ExceptionHandler(FormFlowException.class)
    public ResponseEntity<ApiErrorResponse> handleFormFlowException(FormFlowException ex, HttpServletRequest request) {
        log.warn("HTTP_ERROR path={}, method={}, errorCode={}, errorMessage={}",
                request.getRequestURI(), request.getMethod(), ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.status(ex.httpStatus())
                .body(new ApiErrorResponse(false, ex.getErrorCode(), ex.getMessage(), ex.isRecoverable()));
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ApiErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.warn("HTTP_ERROR path={}, method={}, errorType={}, errorMessage={}",
                request.getRequestURI(), request.getMethod(), ex.getClass().getSimpleName(), truncate(ex.getMessage()));
        FormFlowErrorCode code = FormFlowErrorCode.MALFORMED_REQUEST;
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ApiErrorResponse(false, code.name(), truncate(ex.getMessage()), code.recoverable()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleUnknown(Exception ex, HttpServletRequest request) {
        log.error("HTTP_ERROR path={}, method={}, errorType={}, errorMessage={}",
                request.getRequestURI(), request.getMethod(), ex.getClass().getSimpleName(), truncate(ex.getMessage()), ex);
        FormFlowErrorCode code = FormFlowErrorCode.INTERNAL_ERROR;
        return ResponseEntity.status(code.httpStatus())
                .body(new ApiErrorResponse(false, code.name(), code.defaultMessage(), false));
    }

    private static String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() <= 300 ? message : message.substring(0, 300);
    }
}
