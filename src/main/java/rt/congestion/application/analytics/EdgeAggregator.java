// Aggregation der Peak-Geschwindigkeiten pro Kante
/**EdgeAggregator:
 * - Faltet jedes Sample aus dem Aggregations-Fenster in (Summe, Anzahl) seiner Kante
 * - Kante = Lane-ID ohne den Lane-Index ("123#0_1" -> "123#0")
 * - Speicher wächst nur mit der Anzahl Kanten, nie mit der Anzahl Samples
 *
 * Idee:
 * Wie die Zählung pro Kante in der Live-Analyse, nur über viele Timesteps hinweg
 * und mit Geschwindigkeit statt Fahrzeuganzahl.
 */
package rt.congestion.application.analytics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class EdgeAggregator {

	// Edge-Id -> laufende Summe
	private final Map<String, SegmentAggregate> aggregates = new LinkedHashMap<>();

	private long foldedSamples = 0;

	/**
	 * Fold one sample into the running aggregate of its segment
	 *
	 * @param laneId               lane id from the trace ("<segment>_<laneIndex>")
	 * @param speedMetersPerSecond speed in m/s, stored as km/h
	 */
	public void add(String laneId, double speedMetersPerSecond) {
		String segmentId = segmentIdOf(laneId);
		aggregates.computeIfAbsent(segmentId, SegmentAggregate::new).add(speedMetersPerSecond * 3.6);
		foldedSamples++;
	}

	/**
	 * @param laneId a lane id like "E0_0" or ":J3_0_1"
	 * @return the segment id, the lane id itself if it has no lane suffix
	 */
	public static String segmentIdOf(String laneId) {
		int idx = laneId.lastIndexOf('_');
		if (idx <= 0) {
			return laneId;
		}
		return laneId.substring(0, idx);
	}

	/**
	 * @return amount of distinct segments seen so far
	 */
	public int distinctSegments() {
		return aggregates.size();
	}

	/**
	 * @return amount of samples folded
	 */
	public long getFoldedSamples() {
		return foldedSamples;
	}

	/**
	 * @param segmentId id of the segment
	 * @return the aggregate or null if the segment never had a sample
	 */
	public SegmentAggregate get(String segmentId) {
		return aggregates.get(segmentId);
	}

	/**
	 * @return unmodifiable view segmentId -> aggregate, in first-seen order
	 */
	public Map<String, SegmentAggregate> getAggregates() {
		return Collections.unmodifiableMap(aggregates);
	}
}
