// Eine Zeile der Stau-Tabelle
/**
 * EdgeCongestion:
 * Eine Kante mit ihren aggregierten Peak-Werten, verknüpft mit dem Netz.
 * Sie hält:
 * - mittlere Geschwindigkeit in km/h
 * - Freifluss-Geschwindigkeit in km/h
 * - Speed-Ratio (mittel / Freifluss)
 * - Länge in Metern
 * - Anzahl Samples und daraus geschätzter Peak-Fluss
 */
package rt.congestion.application.analytics;

public class EdgeCongestion {
	public final String edgeId; // Unique id for each street
	public final double meanSpeedKmh; // mean sampled speed
	public final double freeflowKmh; // allowed speed, at least the configured floor
	public final double speedRatio; // meanSpeedKmh / freeflowKmh
	public final double lengthMeters; // edge length
	public final int sampleCount; // folded samples
	public final double peakFlow; // sampleCount / peakFlowDivisor

	/**
	 *
	 * @param edgeId       unique edge id
	 * @param meanSpeedKmh mean speed of all samples in km/h
	 * @param freeflowKmh  free flow speed in km/h
	 * @param lengthMeters length of the edge in meters
	 * @param sampleCount  amount of samples
	 * @param peakFlow     estimated flow in the peak windows
	 */
	public EdgeCongestion(String edgeId, double meanSpeedKmh, double freeflowKmh, double lengthMeters,
			int sampleCount, double peakFlow) {
		this.edgeId = edgeId;
		this.meanSpeedKmh = meanSpeedKmh;
		this.freeflowKmh = freeflowKmh;
		this.speedRatio = meanSpeedKmh / freeflowKmh;
		this.lengthMeters = lengthMeters;
		this.sampleCount = sampleCount;
		this.peakFlow = peakFlow;
	}
}
