package com.codeheadsystems.delegate.server.model;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Normalization rules for account, key and target identities.
 * <p>
 * Identities are usually hex addresses, which compare case-insensitively, so every identity is
 * trimmed and lower-cased before it is stored or compared.  The zero identity ({@code null}, blank,
 * or all zeros with an optional {@code 0x} prefix) is never a valid account or key.
 */
public final class Identities {

  private static final Pattern ZERO = Pattern.compile("^(0x)?0+$");

  private Identities() {
  }

  /**
   * Normalizes an identity.
   *
   * @param identity raw identity, may be null
   * @return trimmed, lower-cased identity, or null if the input was null
   */
  public static String normalize(String identity) {
    return identity == null ? null : identity.trim().toLowerCase(Locale.ROOT);
  }

  /**
   * Is zero boolean.
   *
   * @param identity the identity
   * @return true if the identity is null, blank, or an all-zero value
   */
  public static boolean isZero(String identity) {
    if (identity == null || identity.isBlank()) {
      return true;
    }
    return ZERO.matcher(normalize(identity)).matches();
  }

  /**
   * Normalizes a collection of target identities into a sorted set.
   *
   * @param targets raw targets
   * @return normalized, sorted, de-duplicated targets
   * @throws IllegalArgumentException if any target is null or blank
   */
  public static Set<String> normalizeTargets(Collection<String> targets) {
    TreeSet<String> normalized = new TreeSet<>();
    for (String target : targets) {
      if (target == null || target.isBlank()) {
        throw new IllegalArgumentException("Allowed targets must not contain blank entries");
      }
      normalized.add(normalize(target));
    }
    return normalized;
  }
}
