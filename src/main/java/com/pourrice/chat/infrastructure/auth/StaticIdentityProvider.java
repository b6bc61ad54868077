package com.pourrice.chat.infrastructure.auth;

import com.pourrice.chat.application.port.IdentityProvider;
import com.pourrice.chat.domain.chat.UserIdentity;
import java.util.Optional;

/**
 * {@link IdentityProvider} for a fixed identity, or for nobody.
 *
 * @since 0.1.0
 */
public final class StaticIdentityProvider implements IdentityProvider {
  private final Optional<UserIdentity> identity;

  private StaticIdentityProvider(Optional<UserIdentity> identity) {
    this.identity = identity;
  }

  /**
   * Provider for a signed-in user.
   *
   * @param identity user identity
   * @return provider
   */
  public static StaticIdentityProvider of(UserIdentity identity) {
    return new StaticIdentityProvider(Optional.of(identity));
  }

  /**
   * Provider for a signed-out client.
   *
   * @return provider returning empty
   */
  public static StaticIdentityProvider signedOut() {
    return new StaticIdentityProvider(Optional.empty());
  }

  @Override
  public Optional<UserIdentity> currentUser() {
    return identity;
  }
}
