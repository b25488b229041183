package com.nomen.profile.service;

import com.nomen.profile.config.AuthDirectoryClientProperties;
import java.net.SocketTimeoutException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/**
 * 外部認証基盤の principal を削除する。
 *
 * <p>404 は削除済みとして成功扱いにする。それ以外の失敗は {@link AuthDirectoryIntegrationException}
 * で呼び出し元へ伝え、統合トランザクションをロールバックさせる。
 */
@Service
@RequiredArgsConstructor
public class AuthDirectoryClient {

  private static final Logger logger = LoggerFactory.getLogger(AuthDirectoryClient.class);

  private final RestClient authDirectoryRestClient;
  private final AuthDirectoryClientProperties properties;

  public void deletePrincipal(String principalId) {
    if (principalId == null || principalId.isBlank()) {
      throw new IllegalArgumentException("principal_id is required");
    }
    try {
      authDirectoryRestClient
          .delete()
          .uri(properties.deletePrincipalPath(), principalId)
          .header(properties.internalApiHeaderName(), properties.internalApiToken())
          .retrieve()
          .toBodilessEntity();
      logger.info("auth directory principal deleted principalId={}", principalId);
    } catch (RestClientResponseException ex) {
      final int status = ex.getStatusCode().value();
      if (status == 404) {
        logger.info("auth directory principal already absent principalId={}", principalId);
        return;
      }
      logger.warn(
          "auth directory deletePrincipal failed with http status={} statusText={}",
          status,
          ex.getStatusText());
      throw AuthDirectoryIntegrationException.forHttpStatus(status, ex);
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        logger.warn("auth directory deletePrincipal timed out principalId={}", principalId);
        throw new AuthDirectoryIntegrationException(
            AuthDirectoryIntegrationException.Reason.TIMEOUT, "auth directory request timeout", ex);
      }
      logger.warn("auth directory deletePrincipal connection failed", ex);
      throw new AuthDirectoryIntegrationException(
          AuthDirectoryIntegrationException.Reason.BAD_GATEWAY,
          "auth directory connection failed",
          ex);
    }
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
