package com.t2aassist.engine.plan;

/**
 * A plan was requested around a code that cannot be a principal.
 * No partial plan is produced.
 */
public class InvalidPrincipalException extends RuntimeException {

    public enum Reason {
        NOT_FOUND,
        RETIRED
    }

    private final String code;
    private final Reason reason;

    public InvalidPrincipalException(String code, Reason reason) {
        super(switch (reason) {
            case NOT_FOUND -> "Code " + code + " is not in the catalog";
            case RETIRED -> "Code " + code + " is retired and cannot be billed";
        });
        this.code = code;
        this.reason = reason;
    }

    public String getCode() {
        return code;
    }

    public Reason getReason() {
        return reason;
    }
}
