package venio.gate.core.domain.model;

import java.util.Locale;

/** Session token kind, carried in the {@code kind} claim. */
public enum TokenKind {
  ACCESS,
  REFRESH;

  public String claimValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parse a claim value.
   *
   * @return the kind, or {@code null} when the value is unknown
   */
  public static TokenKind fromClaim(String value) {
    if (value == null) {
      return null;
    }
    for (TokenKind kind : values()) {
      if (kind.claimValue().equals(value)) {
        return kind;
      }
    }
    return null;
  }
}
