// Stau-Tabelle aller aggregierten Kanten
/**EdgeCongestionTable:
 * - Verknüpft die Aggregate mit dem Netz:
 * + Freifluss = max(Lane-Speed * 3.6, Untergrenze)
 * + Speed-Ratio = mittlere Geschwindigkeit / Freifluss
 * + Länge aus der net.xml
 * + Peak-Fluss = Samples / Divisor
 * - Kanten, die das Netz nicht kennt, bekommen Default-Freifluss und Default-Länge
 * - Kennzahlen für das Log
 * - Export als CSV
 *
 * Idee:
 * Auf der Basis von EdgeAggregator berechnen wir hier die fehlenden Werte pro Kante,
 * die Karte und die Validierung lesen dann nur noch diese Tabelle.
 */
package rt.congestion.application.analytics;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rt.congestion.backend.network.RoadNetwork;
import rt.congestion.backend.network.RoadSegment;
import rt.congestion.config.PipelineConfig;

public class EdgeCongestionTable {

	private static final Logger LOG = LoggerFactory.getLogger(EdgeCongestionTable.class);

	// Edge-Id -> Zeile, Reihenfolge wie im Aggregator
	private final Map<String, EdgeCongestion> rows;

	private EdgeCongestionTable(Map<String, EdgeCongestion> rows) {
		this.rows = Collections.unmodifiableMap(rows);
	}

	/**
	 * Join the aggregates with the network
	 *
	 * @param aggregates segmentId -> aggregate
	 * @param network    static network
	 * @param config     freeflow floor, defaults and flow divisor
	 * @return table with one row per aggregated segment
	 */
	public static EdgeCongestionTable build(Map<String, SegmentAggregate> aggregates, RoadNetwork network,
			PipelineConfig config) {
		Map<String, EdgeCongestion> rows = new LinkedHashMap<>();

		for (SegmentAggregate agg : aggregates.values()) {
			if (agg.getSampleCount() == 0) {
				continue;
			}

			double freeflow = config.defaultFreeflowKmh;
			double length = config.defaultLengthM;

			RoadSegment segment = network.getSegment(agg.segmentId);
			if (segment != null) {
				freeflow = Math.max(segment.getFreeflowKmh(), config.minFreeflowKmh);
				if (segment.lengthM > 0.0) {
					length = segment.lengthM;
				}
			}

			double peakFlow = agg.getSampleCount() / config.peakFlowDivisor;
			rows.put(agg.segmentId, new EdgeCongestion(agg.segmentId, agg.getMeanSpeedKmh(), freeflow, length,
					agg.getSampleCount(), peakFlow));
		}

		return new EdgeCongestionTable(rows);
	}

	/**
	 * @param edgeId id of the chosen edge
	 * @return the row or null if the edge had no samples
	 */
	public EdgeCongestion get(String edgeId) {
		return rows.get(edgeId);
	}

	public boolean contains(String edgeId) {
		return rows.containsKey(edgeId);
	}

	public Collection<EdgeCongestion> getRows() {
		return rows.values();
	}

	public int size() {
		return rows.size();
	}

	public boolean isEmpty() {
		return rows.isEmpty();
	}

	/**
	 * @return amount of samples over all edges
	 */
	public long getTotalSamples() {
		long sum = 0;
		for (EdgeCongestion row : rows.values()) {
			sum += row.sampleCount;
		}
		return sum;
	}

	/**
	 * @return mean speed ratio over all edges, 0 if empty
	 */
	public double getMeanSpeedRatio() {
		if (rows.isEmpty()) {
			return 0.0;
		}
		double sum = 0.0;
		for (EdgeCongestion row : rows.values()) {
			sum += row.speedRatio;
		}
		return sum / rows.size();
	}

	/**
	 * @return median of the mean speeds in km/h, 0 if empty
	 */
	public double getMedianSpeedKmh() {
		if (rows.isEmpty()) {
			return 0.0;
		}
		List<Double> speeds = new ArrayList<>(rows.size());
		for (EdgeCongestion row : rows.values()) {
			speeds.add(row.meanSpeedKmh);
		}
		Collections.sort(speeds);

		int mid = speeds.size() / 2;
		if (speeds.size() % 2 == 1) {
			return speeds.get(mid);
		}
		return (speeds.get(mid - 1) + speeds.get(mid)) / 2.0;
	}

	/**
	 * @param ratio upper bound (exclusive)
	 * @return amount of edges with a speed ratio below the bound
	 */
	public int countBelowRatio(double ratio) {
		int count = 0;
		for (EdgeCongestion row : rows.values()) {
			if (row.speedRatio < ratio) {
				count++;
			}
		}
		return count;
	}

	public void logSummary() {
		if (rows.isEmpty()) {
			LOG.info("[EDGES] no aggregated edges (no samples in the peak windows)");
			return;
		}
		LOG.info("[EDGES] {} edges, {} samples", rows.size(), getTotalSamples());
		LOG.info(String.format(Locale.ROOT, "[EDGES] mean speed ratio %.3f | median speed %.1f km/h",
				getMeanSpeedRatio(), getMedianSpeedKmh()));
		LOG.info("[EDGES] ratio < 0.30: {} edges | ratio < 0.50: {} edges", countBelowRatio(0.30),
				countBelowRatio(0.50));
	}

	public void exportToCsv(Path path) throws IOException {
		// Ordner sicherstellen
		if (path.getParent() != null) {
			Files.createDirectories(path.getParent());
		}

		try (PrintWriter writer = new PrintWriter(Files.newBufferedWriter(path))) {
			String sep = ";";

			writer.println("edge_id" + sep + "mean_speed_kmh" + sep + "mean_speed_rel" + sep + "freeflow_kmh" + sep
					+ "length_m" + sep + "sample_count" + sep + "peak_flow");

			for (EdgeCongestion row : rows.values()) {
				writer.printf(Locale.ROOT, "%s%s%.2f%s%.4f%s%.1f%s%.1f%s%d%s%.1f%n",
						row.edgeId, sep,
						row.meanSpeedKmh, sep,
						row.speedRatio, sep,
						row.freeflowKmh, sep,
						row.lengthMeters, sep,
						row.sampleCount, sep,
						row.peakFlow);
			}
		}

		LOG.info("[EDGES] CSV exportiert nach: {}", path.toAbsolutePath());
	}
}
