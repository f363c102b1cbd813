package org.decentmobility.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Failure of a matching, evaluation or selection call, tagged with a stable reason code.
 *
 * <p>The reason code names the error kind (for example {@code NO_FEASIBLE_ALTERNATIVE});
 * {@link #getDetail()} carries the offending destination, method id or bounds. The
 * message is {@code "[CODE] detail"}.</p>
 */
@Getter
public final class MobilityCoreException extends RuntimeException {
    private final String reasonCode;
    private final String detail;

    public MobilityCoreException(String reasonCode, String detail) {
        this(reasonCode, detail, null);
    }

    /**
     * @param reasonCode one of the {@code MobilityCore.REASON_*} codes.
     * @param detail human-readable description of the failing input.
     * @param cause underlying failure, may be null.
     */
    public MobilityCoreException(String reasonCode, String detail, Throwable cause) {
        super("[" + validCode(reasonCode) + "] " + Objects.requireNonNull(detail, "detail"), cause);
        this.reasonCode = reasonCode;
        this.detail = detail;
    }

    private static String validCode(String reasonCode) {
        if (Objects.requireNonNull(reasonCode, "reasonCode").isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return reasonCode;
    }
}
