package com.jobbergate.api.api;

import com.jobbergate.api.files.FileValidationException;
import com.jobbergate.api.service.JobScriptRenderException;
import com.jobbergate.api.service.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps service-layer exceptions to RFC 7807 problem details.
 *
 *   ResourceNotFoundException       → 404
 *   DataIntegrityViolationException → 409 (duplicate identifier)
 *   FileValidationException         → 422, with "invalid_files"
 *   JobScriptRenderException        → 422
 *   IllegalArgumentException        → 422 (pagination, sort column, missing fields)
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ResourceNotFoundException.class)
    public ProblemDetail notFound(ResourceNotFoundException e) {
        return problem(HttpStatus.NOT_FOUND, "Not found", e.getMessage());
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ProblemDetail conflict(DataIntegrityViolationException e) {
        log.warn("Rejected write: {}", e.getMostSpecificCause().getMessage());
        return problem(HttpStatus.CONFLICT, "Conflict",
                "The request conflicts with an existing resource (is the identifier already in use?)");
    }

    @ExceptionHandler(FileValidationException.class)
    public ProblemDetail invalidFiles(FileValidationException e) {
        ProblemDetail problem = problem(HttpStatus.UNPROCESSABLE_ENTITY, "Invalid upload", e.getMessage());
        if (!e.getInvalidFiles().isEmpty()) {
            problem.setProperty("invalid_files", e.getInvalidFiles());
        }
        return problem;
    }

    @ExceptionHandler(JobScriptRenderException.class)
    public ProblemDetail renderFailed(JobScriptRenderException e) {
        return problem(HttpStatus.UNPROCESSABLE_ENTITY, "Render failed", e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail invalidRequest(IllegalArgumentException e) {
        return problem(HttpStatus.UNPROCESSABLE_ENTITY, "Invalid request", e.getMessage());
    }

    private static ProblemDetail problem(HttpStatus status, String title, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        return problem;
    }
}
