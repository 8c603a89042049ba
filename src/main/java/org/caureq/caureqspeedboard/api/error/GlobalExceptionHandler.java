package org.caureq.caureqspeedboard.api.error;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.caureq.caureqspeedboard.service.ReportValidationException;
import org.springframework.http.*;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private ApiError build(ErrorCode code, String msg, String cid, Map<String,Object> details) {
        return ApiError.of(code, msg, cid, details);
    }

    private String cid(HttpServletRequest req) {
        return req.getHeader("X-Correlation-Id");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex,
                                                     HttpServletRequest req) {
        var fields = new LinkedHashMap<String, Object>();
        ex.getBindingResult().getFieldErrors()
                .forEach(fe -> fields.putIfAbsent(fe.getField(), fe.getDefaultMessage()));
        log.info("rejected report from {}: {}", req.getRemoteAddr(), fields);
        return ResponseEntity.badRequest().body(
                build(ErrorCode.VALIDATION_FAILED, "Validation error", cid(req),
                        Map.of("fieldErrors", fields))
        );
    }

    @ExceptionHandler(ReportValidationException.class)
    public ResponseEntity<ApiError> handleReport(ReportValidationException ex, HttpServletRequest req) {
        log.info("rejected report from {}: {}", req.getRemoteAddr(), ex.getMessage());
        return ResponseEntity.badRequest().body(
                build(ErrorCode.VALIDATION_FAILED, ex.getMessage(), cid(req), Map.of("field", ex.field()))
        );
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest req) {
        return ResponseEntity.badRequest().body(
                build(ErrorCode.BAD_REQUEST, "Malformed JSON body", cid(req), Map.of())
        );
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArg(IllegalArgumentException ex,
                                                     HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(
                build(ErrorCode.BAD_REQUEST, ex.getMessage(), cid(req), Map.of())
        );
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleAny(Exception ex, HttpServletRequest req) {
        if (ex instanceof ErrorResponse er) {
            // framework errors (unknown route, wrong method...) keep their own status
            var code = er.getStatusCode().value() == 404 ? ErrorCode.NOT_FOUND : ErrorCode.BAD_REQUEST;
            return ResponseEntity.status(er.getStatusCode()).body(
                    build(code, er.getBody().getDetail(), cid(req), Map.of())
            );
        }
        log.error("unhandled error on {} {}", req.getMethod(), req.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
                build(ErrorCode.INTERNAL_ERROR, "Internal error", cid(req), Map.of())
        );
    }
}
