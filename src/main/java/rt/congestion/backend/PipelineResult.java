package rt.congestion.backend;

import java.util.List;

import rt.congestion.application.analytics.EdgeCongestionTable;
import rt.congestion.application.geometry.CongestionFeature;
import rt.congestion.application.trajectory.Trajectory;
import rt.congestion.application.validation.ValidationReport;
import rt.congestion.backend.trace.ScanSummary;

/*
 * PipelineResult
 *
 * Alles, was ein Lauf erzeugt hat. Stufen, die der RunMode nicht ausführt, bleiben leer
 * (leere Liste bzw. null für Tabelle und Report).
 */
public final class PipelineResult {

    public final RunMode mode;
    public final ScanSummary scan;
    public final List<Trajectory> trajectories;
    public final EdgeCongestionTable edgeTable;
    public final List<CongestionFeature> features;
    public final ValidationReport validation;

    PipelineResult(RunMode mode, ScanSummary scan, List<Trajectory> trajectories, EdgeCongestionTable edgeTable,
            List<CongestionFeature> features, ValidationReport validation) {
        this.mode = mode;
        this.scan = scan;
        this.trajectories = trajectories;
        this.edgeTable = edgeTable;
        this.features = features;
        this.validation = validation;
    }
}
