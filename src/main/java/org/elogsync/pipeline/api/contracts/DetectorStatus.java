package org.elogsync.pipeline.api.contracts;

import java.util.Objects;

/**
 * Whether a detector took part in a run ({@code Checked}) or not ({@code Unchecked}).
 */
public record DetectorStatus(int runNumber, String detectorName, String status) {

    public static final String CHECKED = "Checked";
    public static final String UNCHECKED = "Unchecked";

    public DetectorStatus {
        Objects.requireNonNull(detectorName, "detectorName must not be null");
        Objects.requireNonNull(status, "status must not be null");
    }
}
