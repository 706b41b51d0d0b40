package com.influxlog.point;

/** A point violates its own invariants (tag/field key overlap, missing measurement, bad value type). */
public class MalformedPointException extends RuntimeException {
    public MalformedPointException(String message) {
        super(message);
    }
}
