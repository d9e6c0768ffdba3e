package venio.gate.infrastructure.executor;

import java.util.Objects;

/**
 * 메트릭 카디널리티 통제를 위한 작업 컨텍스트
 *
 * <pre>
 * "component:operation:dynamicValue"
 *
 * 예시:
 * - TaskContext.of("RateLimit", "Consume", "p:42")      → "RateLimit:Consume:p:42"
 * - TaskContext.of("Permission", "Load")                → "Permission:Load"
 * </pre>
 *
 * <ul>
 *   <li>component, operation: 메트릭 태그로 사용 (고정 값)
 *   <li>dynamicValue: 로그에만 기록 (마스킹된 값만 넣을 것)
 * </ul>
 *
 * @param component 컴포넌트 이름 (예: "RateLimit", "Token", "Store")
 * @param operation 작업 유형 (예: "Consume", "Validate", "Incr")
 * @param dynamicValue 동적 값
 */
public record TaskContext(String component, String operation, String dynamicValue) {
  public TaskContext {
    Objects.requireNonNull(component, "component");
    Objects.requireNonNull(operation, "operation");
    if (dynamicValue == null) {
      dynamicValue = "";
    }
  }

  public static TaskContext of(String component, String operation, String dynamicValue) {
    return new TaskContext(component, operation, dynamicValue);
  }

  public static TaskContext of(String component, String operation) {
    return new TaskContext(component, operation, "");
  }

  public String toTaskName() {
    if (dynamicValue.isEmpty()) {
      return component + ":" + operation;
    }
    return component + ":" + operation + ":" + dynamicValue;
  }
}
