package rt.congestion.application.geometry;

import java.util.Objects;

/*
 * Gruppen-Schlüssel einer logischen Straße: (baseId, laneCount, Richtung).
 */
public final class RoadGroupKey {

    public final String baseId;
    public final int laneCount;
    public final boolean reverse;

    public RoadGroupKey(String baseId, int laneCount, boolean reverse) {
        this.baseId = baseId;
        this.laneCount = laneCount;
        this.reverse = reverse;
    }

    public static RoadGroupKey of(String edgeId, int laneCount) {
        return new RoadGroupKey(RoadKeys.baseId(edgeId), laneCount, RoadKeys.isReverse(edgeId));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RoadGroupKey)) {
            return false;
        }
        RoadGroupKey other = (RoadGroupKey) o;
        return laneCount == other.laneCount && reverse == other.reverse && baseId.equals(other.baseId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseId, laneCount, reverse);
    }

    @Override
    public String toString() {
        return (reverse ? "-" : "") + baseId + "/" + laneCount;
    }
}
