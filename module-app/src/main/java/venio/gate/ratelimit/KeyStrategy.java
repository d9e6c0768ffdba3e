package venio.gate.ratelimit;

/** 경로 등급별 한도를 어떤 식별자로 셀지 */
public enum KeyStrategy {
  /** 인증된 principal ID 기준 ({@code p:<id>}) */
  PRINCIPAL,
  /** 클라이언트 주소 기준 ({@code a:<address>}) */
  ADDRESS
}
