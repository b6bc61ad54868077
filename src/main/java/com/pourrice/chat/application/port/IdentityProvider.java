package com.pourrice.chat.application.port;

import com.pourrice.chat.domain.chat.UserIdentity;
import java.util.Optional;

/**
 * Supplies the locally signed-in user.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface IdentityProvider {
  /**
   * Returns the current user.
   *
   * @return identity, or empty when nobody is signed in
   */
  Optional<UserIdentity> currentUser();
}
