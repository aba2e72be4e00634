package fun.fengwk.rsh.core.web;

import fun.fengwk.rsh.core.service.lifecycle.GracefulShutdown;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.util.StringUtils;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps exceptions escaping the controllers to json errors.
 *
 * <p>Framework errors keep their own status. Anything else is an unexpected fault and starts a graceful
 * shutdown after answering 500.
 *
 * @author fengwk
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class FaultHandler {

    private final GracefulShutdown gracefulShutdown;

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("request body unreadable, error={}", ex.getMessage());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("statusCode", HttpStatus.BAD_REQUEST.value());
        body.put("error", "Invalid request body");
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleException(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            return ResponseEntity.status(errorResponse.getStatusCode()).body(errorBody(ex));
        }
        log.error("uncaught exception while handling request, error={}", ex.getMessage(), ex);
        gracefulShutdown.initiate("uncaughtException");
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorBody(ex));
    }

    private static Map<String, Object> errorBody(Exception ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", StringUtils.hasText(ex.getMessage()) ? ex.getMessage() : ex.getClass().getSimpleName());
        return body;
    }

}
