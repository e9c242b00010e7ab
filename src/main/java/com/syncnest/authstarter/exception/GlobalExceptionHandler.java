package com.syncnest.authstarter.exception;

import com.syncnest.authstarter.store.StoreUnavailableException;
import com.syncnest.authstarter.utils.ErrorMessages;
import com.syncnest.authstarter.utils.ErrorResponseWriter;
import com.syncnest.authstarter.utils.LocalizedMessages;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.ConstraintViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;

import java.io.IOException;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final ErrorResponseWriter writer;
    private final LocalizedMessages messages;

    // ---------- Custom domain / API exceptions ----------

    @ExceptionHandler(ApiException.class)
    public void handleApiException(@NonNull HttpServletRequest req,
                                   @NonNull HttpServletResponse resp,
                                   @NonNull ApiException ex) throws IOException {
        if (ex.getStatus().is5xxServerError()) {
            log.warn("ApiException: status={}, type={}, detail={}", ex.getStatus(), ex.getType(), ex.getMessage(), ex.getCause());
        } else {
            log.debug("ApiException: status={}, type={}, detail={}", ex.getStatus(), ex.getType(), ex.getMessage());
        }
        String detail = messages.resolve(ex.getMessageKey(), safeDetail(ex.getMessage()));
        writer.write(req, resp, ex.getStatus(), ex.getType(), ex.getTitle(), detail, ex.code());
    }

    /** Store failures that escaped the service layer untranslated. */
    @ExceptionHandler(StoreUnavailableException.class)
    public void handleStoreUnavailable(@NonNull HttpServletRequest req,
                                       @NonNull HttpServletResponse resp,
                                       @NonNull StoreUnavailableException ex) throws IOException {
        log.error("Token store unavailable: {}", ex.getMessage(), ex);
        writer.write(req, resp, HttpStatus.SERVICE_UNAVAILABLE,
                "https://syncnest.dev/problems/upstream-unavailable",
                "Upstream Unavailable",
                messages.resolve(ErrorMessages.Errors.SERVICE_UNAVAILABLE, "Service temporarily unavailable."));
    }

    // ---------- Validation & request-shape errors ----------

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public void handleMethodArgumentNotValid(@NonNull HttpServletRequest req,
                                             @NonNull HttpServletResponse resp,
                                             @NonNull MethodArgumentNotValidException ex) throws IOException {
        var details = ex.getBindingResult().getFieldErrors().stream()
                .limit(5) // keep payload small
                .map(fe -> fe.getField() + ": " + (fe.getDefaultMessage() != null ? fe.getDefaultMessage() : "invalid"))
                .collect(Collectors.joining("; "));
        writer.write(req, resp, HttpStatus.BAD_REQUEST,
                "https://syncnest.dev/problems/validation-error",
                "Validation Error",
                details.isBlank() ? messages.resolve(ErrorMessages.Errors.VALIDATION, "Request validation failed.") : details);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public void handleConstraintViolation(@NonNull HttpServletRequest req,
                                          @NonNull HttpServletResponse resp,
                                          @NonNull ConstraintViolationException ex) throws IOException {
        var details = ex.getConstraintViolations().stream()
                .limit(5)
                .map(cv -> cv.getPropertyPath() + ": " + cv.getMessage())
                .collect(Collectors.joining("; "));
        writer.write(req, resp, HttpStatus.BAD_REQUEST,
                "https://syncnest.dev/problems/validation-error",
                "Validation Error",
                details.isBlank() ? messages.resolve(ErrorMessages.Errors.VALIDATION, "Request validation failed.") : details);
    }

    @ExceptionHandler({ MissingServletRequestParameterException.class,
            MissingRequestHeaderException.class,
            HttpMessageNotReadableException.class })
    public void handleBadRequest(@NonNull HttpServletRequest req,
                                 @NonNull HttpServletResponse resp,
                                 @NonNull Exception ex) throws IOException {
        writer.write(req, resp, HttpStatus.BAD_REQUEST,
                "https://syncnest.dev/problems/bad-request",
                "Bad Request",
                messages.resolve(ErrorMessages.Errors.BAD_REQUEST, "Malformed or missing request parameters."));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public void handleTypeMismatch(@NonNull HttpServletRequest req,
                                   @NonNull HttpServletResponse resp,
                                   @NonNull MethodArgumentTypeMismatchException ex) throws IOException {
        writer.write(req, resp, HttpStatus.BAD_REQUEST,
                "https://syncnest.dev/problems/type-mismatch",
                "Type Mismatch",
                "Parameter '" + ex.getName() + "' has invalid type.");
    }

    // ---------- Security ----------

    @ExceptionHandler(AccessDeniedException.class)
    public void handleAccessDenied(@NonNull HttpServletRequest req,
                                   @NonNull HttpServletResponse resp,
                                   @NonNull AccessDeniedException ex) throws IOException {
        writer.write(req, resp, HttpStatus.FORBIDDEN,
                "https://syncnest.dev/problems/forbidden",
                "Forbidden",
                messages.resolve(ErrorMessages.Errors.FORBIDDEN, "You do not have permission to access this resource."));
    }

    // ---------- HTTP mapping errors (JSON, not HTML) ----------

    @ExceptionHandler(NoHandlerFoundException.class)
    public void handleNoHandler(@NonNull HttpServletRequest req,
                                @NonNull HttpServletResponse resp,
                                @NonNull NoHandlerFoundException ex) throws IOException {
        writer.write(req, resp, HttpStatus.NOT_FOUND,
                "https://syncnest.dev/problems/not-found",
                "Not Found",
                messages.resolve(ErrorMessages.Errors.NOT_FOUND, "Resource not found."));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public void handleMethodNotAllowed(@NonNull HttpServletRequest req,
                                       @NonNull HttpServletResponse resp,
                                       @NonNull HttpRequestMethodNotSupportedException ex) throws IOException {
        writer.write(req, resp, HttpStatus.METHOD_NOT_ALLOWED,
                "https://syncnest.dev/problems/method-not-allowed",
                "Method Not Allowed",
                "HTTP method not supported for this endpoint.");
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public void handleUnsupportedMediaType(@NonNull HttpServletRequest req,
                                           @NonNull HttpServletResponse resp,
                                           @NonNull HttpMediaTypeNotSupportedException ex) throws IOException {
        writer.write(req, resp, HttpStatus.UNSUPPORTED_MEDIA_TYPE,
                "https://syncnest.dev/problems/unsupported-media-type",
                "Unsupported Media Type",
                "Content type is not supported.");
    }

    // ---------- Data conflicts ----------

    /** Unique-email race lost at the database: same answer as the pre-check. */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public void handleDataIntegrity(@NonNull HttpServletRequest req,
                                    @NonNull HttpServletResponse resp,
                                    @NonNull DataIntegrityViolationException ex) throws IOException {
        log.debug("DataIntegrityViolation: {}", ex.getMostSpecificCause().getMessage());
        handleApiException(req, resp, new UserExceptions.EmailTaken());
    }

    // ---------- Fallback 500 ----------

    @ExceptionHandler(Exception.class)
    public void handleGeneric(@NonNull HttpServletRequest req,
                              @NonNull HttpServletResponse resp,
                              @NonNull Exception ex) throws IOException {
        // Log full for ops; respond generic to the client
        log.error("Unhandled exception", ex);
        writer.write(req, resp, HttpStatus.INTERNAL_SERVER_ERROR,
                "https://syncnest.dev/problems/internal-error",
                "Internal Server Error",
                messages.resolve(ErrorMessages.Errors.INTERNAL, "An unexpected error occurred."));
    }

    // ---------- helpers ----------

    private String safeDetail(String s) {
        return (s == null || s.isBlank()) ? "Request could not be processed." : s;
    }
}
