package io.intellixity.strata.compile;

/** One time-series bucket, as local timestamps in {@code yyyy-MM-dd'T'HH:mm:ss.SSS} form. Both ends inclusive. */
public record TimeBucket(String from, String to) {
}
