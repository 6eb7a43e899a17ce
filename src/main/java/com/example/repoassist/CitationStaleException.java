package com.example.repoassist;

/** A citation refers to evidence gathered against an index epoch that is no longer current. */
public class CitationStaleException extends RuntimeException {

    private final long citedEpoch;
    private final long currentEpoch;

    public CitationStaleException(String evidenceId, long citedEpoch, long currentEpoch) {
        super("Evidence " + evidenceId + " belongs to epoch " + citedEpoch + " but the index is at epoch " + currentEpoch);
        this.citedEpoch = citedEpoch;
        this.currentEpoch = currentEpoch;
    }

    public long getCitedEpoch() {
        return citedEpoch;
    }

    public long getCurrentEpoch() {
        return currentEpoch;
    }
}
