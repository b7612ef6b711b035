/*
 * どこで: PVP API
 * 何を: ドメイン例外と入力エラーを HTTP レスポンスへ変換する
 * なぜ: 全エンドポイントでエラー応答の形を統一するため
 */
package com.example.pvp.api;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(NoActiveSeasonException.class)
  public ResponseEntity<ApiErrorResponse> handleNoActiveSeason(NoActiveSeasonException ex) {
    return error(HttpStatus.CONFLICT, ApiErrorCode.PVP_NO_ACTIVE_SEASON, ex.getMessage());
  }

  @ExceptionHandler(MatchNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleMatchNotFound(MatchNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.PVP_MATCH_NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(InvalidMatchStatusException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidStatus(InvalidMatchStatusException ex) {
    return error(HttpStatus.CONFLICT, ApiErrorCode.PVP_INVALID_STATUS, ex.getMessage());
  }

  @ExceptionHandler(InvalidWinnerException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidWinner(InvalidWinnerException ex) {
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.PVP_INVALID_WINNER, ex.getMessage());
  }

  @ExceptionHandler(SpectateNotAllowedException.class)
  public ResponseEntity<ApiErrorResponse> handleSpectateNotAllowed(
      SpectateNotAllowedException ex) {
    return error(HttpStatus.FORBIDDEN, ApiErrorCode.PVP_SPECTATE_NOT_ALLOWED, ex.getMessage());
  }

  @ExceptionHandler(RankingNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleRankingNotFound(RankingNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.PVP_RANKING_NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler({InvalidPvpRequestException.class, IllegalArgumentException.class})
  public ResponseEntity<ApiErrorResponse> handleInvalidRequest(RuntimeException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(MissingRequestHeaderException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
    return badRequest(ex.getHeaderName() + " is required");
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex) {
    return badRequest(ex.getName() + " is invalid");
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex) {
    // フィールド単位のメッセージを優先する。
    final String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(DefaultMessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request body is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(HandlerMethodValidationException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodValidation(
      HandlerMethodValidationException ex) {
    // クエリパラメータ (limit/offset) の検証エラーは最初の1件に絞る。
    final String message =
        ex.getAllErrors().stream()
            .map(MessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ApiErrorResponse> handleConstraintViolation(
      ConstraintViolationException ex) {
    final String message =
        ex.getConstraintViolations().stream()
            .map(ConstraintViolation::getMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    // JSONパーサの内部文言は露出しない。
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    if (rawMessage.contains("Required request body is missing")) {
      return badRequest("request body is required");
    }
    return badRequest("request body is invalid");
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled pvp api error", ex);
    return error(
        HttpStatus.INTERNAL_SERVER_ERROR, ApiErrorCode.PVP_INTERNAL_ERROR, "internal error");
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.PVP_BAD_REQUEST, message);
  }

  private ResponseEntity<ApiErrorResponse> error(
      HttpStatus status, ApiErrorCode code, String message) {
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, message));
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
