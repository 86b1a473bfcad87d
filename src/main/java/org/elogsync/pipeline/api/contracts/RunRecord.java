package org.elogsync.pipeline.api.contracts;

/**
 * One run of an experiment together with its production counters and file statistics.
 * Counters are {@code null} when the remote source did not report them.
 */
public record RunRecord(
    int runNumber,
    String startTime,
    String endTime,
    Long events,
    Long damaged,
    Long dropped,
    String prodStart,
    String prodEnd,
    Long numberOfFiles,
    Long totalSizeBytes
) {
    public RunRecord withFiles(Long files, Long sizeBytes) {
        return new RunRecord(runNumber, startTime, endTime, events, damaged, dropped, prodStart, prodEnd,
            files, sizeBytes);
    }
}
