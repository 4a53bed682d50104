package com.kotsin.enrichment.version;

/**
 * Version chosen for one request. {@code experimentId} is set when the choice came
 * from a running experiment; {@code versionId} is null when the kind has no versions.
 */
public record VersionAssignment(String versionId, String experimentId) {

    public boolean inExperiment() {
        return experimentId != null;
    }
}
