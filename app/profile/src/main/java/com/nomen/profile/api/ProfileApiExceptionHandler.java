/*
 * どこで: app/profile/src/main/java/com/nomen/profile/api/ProfileApiExceptionHandler.java
 * 何を: Profile API の例外を標準エラー形式へ変換する
 * なぜ: 失敗時の契約を一定に保ち、呼び出し側の分岐を簡潔にするため
 */
package com.nomen.profile.api;

import com.nomen.profile.config.ProfileInternalApiProperties;
import com.nomen.profile.service.AuthDirectoryIntegrationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ProfileApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ProfileApiExceptionHandler.class);

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.BAD_REQUEST, "request validation failed");
  }

  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    MissingServletRequestParameterException.class
  })
  public ResponseEntity<ApiErrorResponse> handleMalformedRequest(Exception ex) {
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.BAD_REQUEST, "request is malformed");
  }

  /** 呼び出し元 account のヘッダー欠落は未認証、それ以外のヘッダー欠落は入力不備として扱う。 */
  @ExceptionHandler(MissingRequestHeaderException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
    if (ProfileInternalApiProperties.ACCOUNT_ID_HEADER.equalsIgnoreCase(ex.getHeaderName())) {
      return error(
          HttpStatus.UNAUTHORIZED, ApiErrorCode.NOT_AUTHENTICATED, "caller is not authenticated");
    }
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(ProfileAccessDeniedException.class)
  public ResponseEntity<ApiErrorResponse> handleAccessDenied(ProfileAccessDeniedException ex) {
    return error(HttpStatus.FORBIDDEN, ApiErrorCode.UNAUTHORIZED, ex.getMessage());
  }

  @ExceptionHandler(ResourceNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotFound(ResourceNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(MergeTokenExpiredException.class)
  public ResponseEntity<ApiErrorResponse> handleExpired(MergeTokenExpiredException ex) {
    return error(HttpStatus.GONE, ApiErrorCode.EXPIRED, ex.getMessage());
  }

  @ExceptionHandler(SameAccountException.class)
  public ResponseEntity<ApiErrorResponse> handleSameAccount(SameAccountException ex) {
    return error(HttpStatus.CONFLICT, ApiErrorCode.SAME_ACCOUNT, ex.getMessage());
  }

  @ExceptionHandler(IdentityAlreadyOwnedException.class)
  public ResponseEntity<ApiErrorResponse> handleAlreadyOwned(IdentityAlreadyOwnedException ex) {
    return error(HttpStatus.CONFLICT, ApiErrorCode.ALREADY_OWNED, ex.getMessage());
  }

  @ExceptionHandler(MergeRejectedException.class)
  public ResponseEntity<ApiErrorResponse> handleMergeRejected(MergeRejectedException ex) {
    final ApiErrorCode code =
        switch (ex.reason()) {
          case INVALID_MERGE -> ApiErrorCode.INVALID_MERGE;
          case NO_PROFILE -> ApiErrorCode.NO_PROFILE;
          case ALREADY_MERGED -> ApiErrorCode.ALREADY_MERGED;
        };
    return error(HttpStatus.CONFLICT, code, ex.getMessage());
  }

  @ExceptionHandler(DataIntegrityViolationException.class)
  public ResponseEntity<ApiErrorResponse> handleConflict(DataIntegrityViolationException ex) {
    logger.warn("profile write rejected by integrity constraint", ex);
    return error(HttpStatus.CONFLICT, ApiErrorCode.CONFLICT, "conflicting concurrent update");
  }

  // デッドロック検出やロック取得失敗。呼び出し元の再送で解消する。
  @ExceptionHandler(ConcurrencyFailureException.class)
  public ResponseEntity<ApiErrorResponse> handleConcurrencyFailure(
      ConcurrencyFailureException ex) {
    logger.warn("profile write lost a concurrent race", ex);
    return error(HttpStatus.CONFLICT, ApiErrorCode.CONFLICT, "conflicting concurrent update");
  }

  @ExceptionHandler(AuthDirectoryIntegrationException.class)
  public ResponseEntity<ApiErrorResponse> handleAuthDirectory(
      AuthDirectoryIntegrationException ex) {
    if (ex.reason() == AuthDirectoryIntegrationException.Reason.TIMEOUT) {
      return error(HttpStatus.GATEWAY_TIMEOUT, ApiErrorCode.TIMEOUT, ex.getMessage());
    }
    return error(HttpStatus.BAD_GATEWAY, ApiErrorCode.BAD_GATEWAY, ex.getMessage());
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unexpected profile api failure", ex);
    return error(
        HttpStatus.INTERNAL_SERVER_ERROR, ApiErrorCode.INTERNAL_ERROR, "internal server error");
  }

  private ResponseEntity<ApiErrorResponse> error(
      HttpStatus status, ApiErrorCode code, String message) {
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, message));
  }
}
