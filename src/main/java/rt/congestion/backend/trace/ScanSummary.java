package rt.congestion.backend.trace;

/*
 * ScanSummary
 *
 * Zähler eines Scan-Durchlaufs, nur für Log / Tests.
 */
public final class ScanSummary {

    public final long lines;
    public final long timesteps;
    public final long vehicleLines;
    public final long skippedRecords;
    public final double lastTime;
    public final boolean stoppedEarly;
    public final long elapsedMillis;

    public ScanSummary(long lines, long timesteps, long vehicleLines, long skippedRecords,
            double lastTime, boolean stoppedEarly, long elapsedMillis) {
        this.lines = lines;
        this.timesteps = timesteps;
        this.vehicleLines = vehicleLines;
        this.skippedRecords = skippedRecords;
        this.lastTime = lastTime;
        this.stoppedEarly = stoppedEarly;
        this.elapsedMillis = elapsedMillis;
    }

    @Override
    public String toString() {
        return "lines=" + lines
                + ", timesteps=" + timesteps
                + ", vehicleLines=" + vehicleLines
                + ", skipped=" + skippedRecords
                + ", lastTime=" + lastTime
                + ", stoppedEarly=" + stoppedEarly
                + ", elapsed=" + elapsedMillis + "ms";
    }
}
