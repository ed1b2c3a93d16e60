package com.barthel.progcost.adapter.in.web;

import com.barthel.progcost.domain.exception.ConfigException;
import com.barthel.progcost.domain.exception.CostingInterruptedException;
import com.barthel.progcost.domain.exception.DataGapException;
import com.barthel.progcost.domain.exception.ReferenceDataException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps costing failures to problem responses.
 */
@RestControllerAdvice
@Slf4j
public class RestExceptionHandler {

    @ExceptionHandler(ConfigException.class)
    public ProblemDetail handleConfig(ConfigException ex, HttpServletRequest request) {
        log.warn("Invalid programme configuration on {}: {}", request.getRequestURI(), ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Invalid configuration", ex.getMessage(), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.warn("Unreadable request on {}: {}", request.getRequestURI(), ex.getMessage());
        String detail = configCause(ex) != null ? configCause(ex).getMessage() : "Malformed programme configuration.";
        return problem(HttpStatus.BAD_REQUEST, "Invalid configuration", detail, request);
    }

    @ExceptionHandler(DataGapException.class)
    public ProblemDetail handleDataGap(DataGapException ex, HttpServletRequest request) {
        log.warn("Missing reference data on {}: {}", request.getRequestURI(), ex.getMessage());
        ProblemDetail detail = problem(HttpStatus.UNPROCESSABLE_ENTITY, "Missing reference data", ex.getMessage(), request);
        detail.setProperty("module", ex.getModule().id());
        detail.setProperty("country", ex.getCountry());
        return detail;
    }

    @ExceptionHandler(ReferenceDataException.class)
    public ProblemDetail handleReferenceData(ReferenceDataException ex, HttpServletRequest request) {
        log.warn("Reference lookup failed on {}: {}", request.getRequestURI(), ex.getMessage());
        return problem(HttpStatus.UNPROCESSABLE_ENTITY, "Missing reference data", ex.getMessage(), request);
    }

    @ExceptionHandler(CostingInterruptedException.class)
    public ProblemDetail handleInterrupted(CostingInterruptedException ex, HttpServletRequest request) {
        log.warn("Costing aborted on {}: {}", request.getRequestURI(), ex.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Costing aborted", ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnhandled(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error on {}", request.getRequestURI(), ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "Unexpected error", request);
    }

    private static ProblemDetail problem(HttpStatus status, String title, String message, HttpServletRequest request) {
        ProblemDetail detail = ProblemDetail.forStatus(status);
        detail.setTitle(title);
        detail.setDetail(message);
        detail.setProperty("path", request.getRequestURI());
        return detail;
    }

    private static ConfigException configCause(Throwable ex) {
        for (Throwable t = ex; t != null; t = t.getCause()) {
            if (t instanceof ConfigException config) {
                return config;
            }
        }
        return null;
    }
}
