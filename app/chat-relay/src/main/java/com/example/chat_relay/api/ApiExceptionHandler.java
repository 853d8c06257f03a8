/*
 * どこで: Chat Relay API
 * 何を: 例外を HTTP レスポンスへ変換する
 * なぜ: API 仕様に沿ったエラー応答を統一するため
 */
package com.example.chat_relay.api;

import com.example.chat_relay.service.AuthFailureException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(AuthFailureException.class)
  public ResponseEntity<ApiErrorResponse> handleAuthFailure(AuthFailureException ex) {
    // 失敗理由の詳細はログとメトリクスにだけ残す
    return error(HttpStatus.UNAUTHORIZED, ApiErrorCode.UNAUTHORIZED, "authentication required");
  }

  @ExceptionHandler(InvalidRelationshipRequestException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidRelationship(
      InvalidRelationshipRequestException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(UserNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleUserNotFound(UserNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.USER_NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(NotMatchedException.class)
  public ResponseEntity<ApiErrorResponse> handleNotMatched(NotMatchedException ex) {
    return error(HttpStatus.FORBIDDEN, ApiErrorCode.NOT_MATCHED, ex.getMessage());
  }

  @ExceptionHandler(NotificationNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotificationNotFound(
      NotificationNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.NOTIFICATION_NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex) {
    return badRequest(ex.getName() + " is invalid");
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ApiErrorResponse> handleConstraintViolation(
      ConstraintViolationException ex) {
    final String message =
        ex.getConstraintViolations().stream()
            .map(ConstraintViolation::getMessage)
            .filter(value -> value != null && !value.isBlank())
            .findFirst()
            .orElse("request is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(DataAccessException.class)
  public ResponseEntity<ApiErrorResponse> handleDataAccess(DataAccessException ex) {
    logger.error("data access failed", ex);
    return error(
        HttpStatus.INTERNAL_SERVER_ERROR, ApiErrorCode.INTERNAL_ERROR, "internal error");
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.INVALID_REQUEST, message);
  }

  private ResponseEntity<ApiErrorResponse> error(
      HttpStatus status, ApiErrorCode code, String message) {
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, message));
  }
}
