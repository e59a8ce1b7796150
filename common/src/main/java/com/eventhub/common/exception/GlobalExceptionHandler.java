package com.eventhub.common.exception;

import com.eventhub.common.response.ApiResponse;
import com.eventhub.common.response.ErrorCode;
import com.fasterxml.jackson.core.JsonStreamContext;
import com.fasterxml.jackson.core.exc.StreamReadException;
import com.fasterxml.jackson.databind.JsonMappingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ApiResponse<Void>> handleBusinessException(BusinessException e) {
        ErrorCode errorCode = e.getErrorCode();
        log.warn("Business exception: {} - {}", errorCode.getCode(), e.getMessage());
        return ResponseEntity
                .status(errorCode.getStatus())
                .body(ApiResponse.error(errorCode, e.getMessage(), e.getDetails()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadable(HttpMessageNotReadableException e) {
        String field = fieldOf(e.getCause());
        ValidationException validation = field != null
                ? new ValidationException(field, "has an invalid value")
                : new ValidationException("body", "is not a readable JSON document");
        return handleBusinessException(validation);
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ApiResponse<Void>> handleMissingPart(MissingServletRequestPartException e) {
        return handleBusinessException(new ValidationException(e.getRequestPartName(), "is required"));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiResponse<Void>> handleUploadTooLarge(MaxUploadSizeExceededException e) {
        return handleBusinessException(new ValidationException("file", "exceeds the maximum upload size"));
    }

    @ExceptionHandler(MultipartException.class)
    public ResponseEntity<ApiResponse<Void>> handleMultipart(MultipartException e) {
        return handleBusinessException(new ValidationException("file", "must be sent as multipart/form-data"));
    }

    /**
     * Upload endpoints only consume multipart bodies; everything else only JSON.
     */
    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ApiResponse<Void>> handleMediaType(HttpMediaTypeNotSupportedException e) {
        boolean upload = e.getSupportedMediaTypes().stream()
                .anyMatch(MediaType.MULTIPART_FORM_DATA::includes);
        ValidationException validation = upload
                ? new ValidationException("file", "must be sent as multipart/form-data")
                : new ValidationException("body", "must be sent as application/json");
        return handleBusinessException(validation);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiResponse<Void>> handleMethodNotSupported(HttpRequestMethodNotSupportedException e) {
        return handleBusinessException(new BusinessException(ErrorCode.METHOD_NOT_ALLOWED,
                e.getMethod() + " is not supported here"));
    }

    @ExceptionHandler({NoHandlerFoundException.class, NoResourceFoundException.class})
    public ResponseEntity<ApiResponse<Void>> handleNoHandler(Exception e) {
        return handleBusinessException(new BusinessException(ErrorCode.RESOURCE_NOT_FOUND));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ApiResponse<Void>> handleDataAccess(DataAccessException e) {
        log.error("Document store unavailable", e);
        return ResponseEntity
                .status(ErrorCode.SERVICE_UNAVAILABLE.getStatus())
                .body(ApiResponse.error(ErrorCode.SERVICE_UNAVAILABLE));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleException(Exception e) {
        log.error("Unexpected error", e);
        return ResponseEntity
                .internalServerError()
                .body(ApiResponse.error(ErrorCode.INTERNAL_ERROR));
    }

    /**
     * Field path of a body that parsed but did not bind, or null if the body is not JSON at all.
     * Binding errors carry their path; numeric overflow only leaves it in the parser context.
     */
    private static String fieldOf(Throwable cause) {
        if (cause instanceof JsonMappingException mapping && !mapping.getPath().isEmpty()) {
            return mapping.getPath().stream()
                    .map(ref -> ref.getFieldName() != null ? ref.getFieldName() : String.valueOf(ref.getIndex()))
                    .collect(Collectors.joining("."));
        }
        if (cause instanceof StreamReadException read && read.getProcessor() != null) {
            return contextPath(read.getProcessor().getParsingContext());
        }
        return null;
    }

    private static String contextPath(JsonStreamContext context) {
        List<String> segments = new ArrayList<>();
        for (JsonStreamContext c = context; c != null && !c.inRoot(); c = c.getParent()) {
            if (c.inObject() && c.getCurrentName() != null) {
                segments.add(0, c.getCurrentName());
            } else if (c.inArray()) {
                segments.add(0, String.valueOf(c.getCurrentIndex()));
            }
        }
        return segments.isEmpty() ? null : String.join(".", segments);
    }
}
