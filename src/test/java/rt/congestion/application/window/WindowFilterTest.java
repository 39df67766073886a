package rt.congestion.application.window;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import rt.congestion.config.WindowSpec;

class WindowFilterTest {

    private final WindowFilter filter = new WindowFilter(
            new WindowSpec("morning", 25200, 32400, 60, 1),
            List.of(new WindowSpec("morning", 25200, 32400, 0, 30),
                    new WindowSpec("evening", 61200, 72000, 0, 30)));

    @ParameterizedTest
    @CsvSource({
            "25139, false",
            "25140, true",
            "28000.5, true",
            "32460, true",
            "32460.5, false" })
    void trajectoryWindowIncludesBuffer(double t, boolean expected) {
        assertEquals(expected, filter.inTrajectoryWindow(t));
    }

    @ParameterizedTest
    @CsvSource({
            "9.0, false",
            "9.5, false",
            "10.0, true",
            "11.5, true",
            "11.7, false" })
    void trajectoryWindowChecksTheWholeSecondToo(double t, boolean expected) {
        WindowFilter fractional = new WindowFilter(new WindowSpec("t", 10, 11, 0.5, 1), List.of());
        assertEquals(expected, fractional.inTrajectoryWindow(t));
    }

    @ParameterizedTest
    @CsvSource({
            "25200, true",
            "25230, true",
            "25215, false",
            "25200.5, false",
            "24000, false",
            "61200, true",
            "72000, true",
            "72030, false" })
    void aggregationNeedsWholeSecondOnStride(double t, boolean expected) {
        assertEquals(expected, filter.inAggregationWindow(t));
    }

    @Test
    void membershipCombinesBothWindows() {
        assertEquals(WindowMembership.BOTH, filter.evaluate(25200));
        assertEquals(WindowMembership.TRAJECTORY, filter.evaluate(25201));
        assertEquals(WindowMembership.AGGREGATION, filter.evaluate(61230));
        assertEquals(WindowMembership.NONE, filter.evaluate(40000));
    }

    @Test
    void horizonIsLatestBufferedEnd() {
        assertEquals(72000.0, filter.horizon(), 0.0);
        assertFalse(filter.isPastHorizon(72000));
        assertTrue(filter.isPastHorizon(72000.1));

        WindowFilter trajectoryOnly = new WindowFilter(new WindowSpec("t", 0, 100, 5, 1), List.of());
        assertEquals(105.0, trajectoryOnly.horizon(), 0.0);
        assertTrue(trajectoryOnly.collectsTrajectories());
        assertFalse(trajectoryOnly.collectsAggregates());
    }

    @Test
    void withoutWindowsNothingIsCollected() {
        WindowFilter none = new WindowFilter(null, null);

        assertEquals(WindowMembership.NONE, none.evaluate(0));
        assertFalse(none.collectsTrajectories());
        assertFalse(none.collectsAggregates());
        assertTrue(none.isPastHorizon(0));
    }
}
