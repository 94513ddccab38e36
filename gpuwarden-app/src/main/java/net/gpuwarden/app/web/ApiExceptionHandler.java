package net.gpuwarden.app.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.sql.SQLException;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    /** 알 수 없는 워커, 잘못된 provider/reason 코드 */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(
                Responses.error("bad_request", ex.getMessage() == null ? "invalid_request" : ex.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Responses.error("bad_request", "malformed request body"));
    }

    /** 레지스트리/원장 저장소 장애. 상태는 바뀌지 않았으므로 재시도 가능 */
    @ExceptionHandler(SQLException.class)
    public ResponseEntity<Map<String, Object>> storage(SQLException ex) {
        log.error("Storage failure while handling control plane request (sqlState={})", ex.getSQLState(), ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(
                Responses.error("storage_unavailable", ex.getMessage()));
    }
}
