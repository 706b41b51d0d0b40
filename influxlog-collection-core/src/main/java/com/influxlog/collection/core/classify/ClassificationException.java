package com.influxlog.collection.core.classify;

/** A record attribute that cannot become a tag or field; the attribute is skipped. */
public class ClassificationException extends Exception {
    private final String attribute;

    public ClassificationException(String attribute, String reason) {
        super(reason);
        this.attribute = attribute;
    }

    public ClassificationException(String attribute, String reason, Throwable cause) {
        super(reason, cause);
        this.attribute = attribute;
    }

    public String attribute() {
        return attribute;
    }
}
