/*
 * どこで: Registration API
 * 何を: 例外を HTTP レスポンスへ変換する
 * なぜ: 拒否理由ごとに一貫したエラー応答を返すため
 */
package com.eventportal.registration.api;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;

@RestControllerAdvice
public class ApiExceptionHandler {

  @ExceptionHandler(EventNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleEventNotFound(EventNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.EVENT_NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(RegistrationNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleRegistrationNotFound(
      RegistrationNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.REGISTRATION_NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(RegistrationDeadlinePassedException.class)
  public ResponseEntity<ApiErrorResponse> handleDeadlinePassed(
      RegistrationDeadlinePassedException ex) {
    return error(
        HttpStatus.BAD_REQUEST, ApiErrorCode.REGISTRATION_DEADLINE_PASSED, ex.getMessage());
  }

  @ExceptionHandler(DuplicateRegistrationException.class)
  public ResponseEntity<ApiErrorResponse> handleDuplicateRegistration(
      DuplicateRegistrationException ex) {
    return error(HttpStatus.CONFLICT, ApiErrorCode.DUPLICATE_REGISTRATION, ex.getMessage());
  }

  @ExceptionHandler(RegistrationConflictException.class)
  public ResponseEntity<ApiErrorResponse> handleConflict(RegistrationConflictException ex) {
    return error(HttpStatus.CONFLICT, ApiErrorCode.CONCURRENCY_CONFLICT, ex.getMessage());
  }

  @ExceptionHandler(TicketIssuanceException.class)
  public ResponseEntity<ApiErrorResponse> handleTicketIssuance(TicketIssuanceException ex) {
    // 署名処理の内部文言は返さない
    return error(
        HttpStatus.INTERNAL_SERVER_ERROR, ApiErrorCode.SYSTEM_ERROR, "ticket could not be issued");
  }

  @ExceptionHandler(DataAccessException.class)
  public ResponseEntity<ApiErrorResponse> handleDataAccess(DataAccessException ex) {
    // SQL や接続先を含む内部文言は返さない
    return error(
        HttpStatus.INTERNAL_SERVER_ERROR,
        ApiErrorCode.SYSTEM_ERROR,
        "registration store is unavailable");
  }

  @ExceptionHandler(MissingRequestHeaderException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
    return badRequest(ex.getHeaderName() + " is required");
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ApiErrorResponse> handleConstraintViolation(
      ConstraintViolationException ex) {
    // パス/ヘッダなどの検証エラーは最初の1件に絞って返す。
    final String message =
        ex.getConstraintViolations().stream()
            .map(ConstraintViolation::getMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(HandlerMethodValidationException.class)
  public ResponseEntity<ApiErrorResponse> handleHandlerMethodValidation(
      HandlerMethodValidationException ex) {
    final String message =
        ex.getAllErrors().stream()
            .map(MessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request is invalid");
    return badRequest(message);
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.BAD_REQUEST, message);
  }

  private ResponseEntity<ApiErrorResponse> error(
      HttpStatus status, ApiErrorCode code, String message) {
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, message));
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
