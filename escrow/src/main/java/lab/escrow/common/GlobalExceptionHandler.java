package lab.escrow.common;

import jakarta.servlet.http.HttpServletRequest;
import lab.escrow.confirmation.NotMonitoredException;
import lab.escrow.submission.SubmissionConflictException;
import lab.escrow.submission.SubmissionMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;
import java.util.regex.Pattern;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // signed transaction bodies; plain 64-char hashes stay readable
    private static final Pattern SENSITIVE_HEX_PATTERN = Pattern.compile("(0x)?[a-fA-F0-9]{128,}");

    @ExceptionHandler({InvalidRequestException.class, MethodArgumentTypeMismatchException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        String message = ex.getMessage();
        if (ex instanceof MethodArgumentTypeMismatchException mismatch) {
            message = "Invalid value '%s' for parameter '%s'".formatted(mismatch.getValue(), mismatch.getName());
        }

        ErrorResponse body = new ErrorResponse(
                HttpStatus.BAD_REQUEST.value(),
                sanitizeMessage(message),
                SubmissionMode.wireNames()
        );
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        String detail = ex.getMostSpecificCause() != null ? ex.getMostSpecificCause().getMessage() : ex.getMessage();
        String message = "Invalid JSON body.";
        if (detail != null && !detail.isBlank()) {
            message += " Detail: " + detail;
        }

        ErrorResponse body = new ErrorResponse(
                HttpStatus.BAD_REQUEST.value(),
                sanitizeMessage(message),
                SubmissionMode.wireNames()
        );
        return ResponseEntity.badRequest()
                .header(HttpHeaders.CONTENT_TYPE, "application/json")
                .body(body);
    }

    @ExceptionHandler(SubmissionConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(SubmissionConflictException ex) {
        ErrorResponse body = new ErrorResponse(HttpStatus.CONFLICT.value(), sanitizeMessage(ex.getMessage()), List.of());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(NotMonitoredException.class)
    public ResponseEntity<ErrorResponse> handleNotMonitored(NotMonitoredException ex) {
        ErrorResponse body = new ErrorResponse(HttpStatus.NOT_FOUND.value(), ex.getMessage(), List.of());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
    }

    @ExceptionHandler({IllegalStateException.class, RuntimeException.class})
    public ResponseEntity<RuntimeErrorResponse> handleRuntimeException(Exception ex, HttpServletRequest request) {
        log.error("event=http.unhandled_error path={} error={}", request.getRequestURI(), ex.getMessage(), ex);
        RuntimeErrorResponse body = new RuntimeErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                sanitizeMessage(ex.getMessage()),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    static String sanitizeMessage(String message) {
        if (message == null || message.isBlank()) {
            return "Unexpected server error";
        }
        return SENSITIVE_HEX_PATTERN.matcher(message).replaceAll("[REDACTED_HEX]");
    }

    public record ErrorResponse(
            int status,
            String message,
            List<String> allowedModes
    ) {}

    public record RuntimeErrorResponse(
            int status,
            String message,
            String path
    ) {}
}
