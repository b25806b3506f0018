/*
 * どこで: Beacon API
 * 何を: 例外を HTTP レスポンスへ変換する
 * なぜ: 報告の不正/対象なし/ディレクトリ障害を呼び出し側が区別できる応答に揃えるため
 */
package com.example.beacon.api;

import com.example.beacon.intake.InvalidReportException;
import com.example.beacon.repository.DirectoryUnavailableException;
import com.example.beacon.service.AlertNotFoundException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(InvalidReportException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidReport(InvalidReportException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.INVALID_REPORT, ex.getMessage()));
  }

  @ExceptionHandler(AlertNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleAlertNotFound(AlertNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse(ApiErrorCode.ALERT_NOT_FOUND, ex.getMessage()));
  }

  @ExceptionHandler(SubscriberNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleSubscriberNotFound(
      SubscriberNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse(ApiErrorCode.SUBSCRIBER_NOT_FOUND, ex.getMessage()));
  }

  @ExceptionHandler(DirectoryUnavailableException.class)
  public ResponseEntity<ApiErrorResponse> handleDirectoryUnavailable(
      DirectoryUnavailableException ex) {
    logger.warn("request failed because subscriber directory is unavailable", ex);
    // バックエンドの内部文言は返さず、再送を促す短文にする。
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(
            new ApiErrorResponse(
                ApiErrorCode.DIRECTORY_UNAVAILABLE,
                "subscriber directory is unavailable; retry later"));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex) {
    return badRequest(ex.getName() + " is invalid");
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex) {
    // フィールド単位のメッセージを優先し、クライアントに最短で伝える。
    final String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(DefaultMessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request body is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    // JSONパーサの内部文言は露出せず、用途に合う短文へ正規化する。
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    if (rawMessage.contains("Required request body is missing")) {
      return badRequest("request body is required");
    }
    return badRequest("request body is invalid");
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.BAD_REQUEST, message));
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
