package venio.gate.core.domain.model;

/** Access token plus refresh token, returned by login-style issuance and by refresh. */
public record IssuedTokens(String accessToken, String refreshToken) {}
