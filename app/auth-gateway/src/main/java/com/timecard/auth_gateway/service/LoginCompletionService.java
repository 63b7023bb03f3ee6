package com.timecard.auth_gateway.service;

import com.timecard.auth_gateway.model.Identity;
import com.timecard.auth_gateway.model.LoginCompletion;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * プロバイダでの本人確認が済んだ後の共通処理。
 *
 * <p>許可リストで弾いたあとセッション Cookie を発行する。どのプロバイダ経路もここを通る。
 */
@Service
@RequiredArgsConstructor
public class LoginCompletionService {

  private static final Logger logger = LoggerFactory.getLogger(LoginCompletionService.class);

  private final EmailAllowlistFilter emailAllowlistFilter;
  private final SessionTokenService sessionTokenService;
  private final AuthMetrics authMetrics;

  public LoginCompletion complete(Identity identity) {
    final String provider = identity.provider().claimValue();
    if (!emailAllowlistFilter.isAllowed(identity.email())) {
      logger.warn("login rejected by email allowlist provider={} sub={}", provider, identity.sub());
      authMetrics.recordLogin(provider, "denied");
      throw new EmailNotAllowedException(identity.email());
    }
    final LoginCompletion completion =
        new LoginCompletion(identity, sessionTokenService.mint(identity));
    logger.info("login completed provider={} sub={}", provider, identity.sub());
    authMetrics.recordLogin(provider, "success");
    return completion;
  }
}
