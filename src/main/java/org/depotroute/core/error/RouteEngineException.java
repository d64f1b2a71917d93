package org.depotroute.core.error;

import lombok.Getter;

import java.util.Objects;

/**
 * Unchecked failure raised by the route engine, tagged with a stable reason code.
 *
 * <p>Reason codes are owned by the type that raises them:</p>
 * <ul>
 *   <li>{@link ValidationException}: malformed input such as coordinates, hours, depot
 *   count, duplicate or unknown ids, zones that do not partition the stops, and
 *   configuration values.</li>
 *   <li>{@link InsufficientDataException}: well-formed input with too few locations or
 *   no stops to route.</li>
 *   <li>{@link InvalidRouteException}: a visit sequence that is not a depot-anchored
 *   cycle over every stop exactly once.</li>
 *   <li>this class: failures of the parallel zone solve itself
 *   ({@link #REASON_SOLVE_INTERRUPTED}, {@link #REASON_ZONE_SOLVE_FAILED}).</li>
 * </ul>
 *
 * <p>{@link #getMessage()} reads {@code [REASON_CODE] detail}; {@link #getDetail()}
 * returns the text without the prefix.</p>
 */
@Getter
public class RouteEngineException extends RuntimeException {
    public static final String REASON_SOLVE_INTERRUPTED = "SOLVE_INTERRUPTED";
    public static final String REASON_ZONE_SOLVE_FAILED = "ZONE_SOLVE_FAILED";

    private final String reasonCode;
    private final String detail;

    public RouteEngineException(String reasonCode, String detail) {
        this(reasonCode, detail, null);
    }

    /**
     * @param reasonCode non-blank reason code.
     * @param detail human-readable description, without the code prefix.
     * @param cause underlying failure, may be {@code null}.
     */
    public RouteEngineException(String reasonCode, String detail, Throwable cause) {
        super(prefixed(reasonCode, detail), cause);
        this.reasonCode = reasonCode;
        this.detail = detail;
    }

    private static String prefixed(String reasonCode, String detail) {
        Objects.requireNonNull(reasonCode, "reasonCode");
        Objects.requireNonNull(detail, "detail");
        if (reasonCode.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return "[" + reasonCode + "] " + detail;
    }
}
