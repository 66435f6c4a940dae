package org.gts3.atlantis.distance.solver;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class AggregationTest {

    @Test
    public void testHarmonicMean() {
        assertThat(Aggregation.HARMONIC_MEAN.aggregate(List.of(2.0, 4.0)), closeTo(8.0 / 3.0, 1e-9));
        assertEquals(3.0, Aggregation.HARMONIC_MEAN.aggregate(List.of(3.0)));
    }

    @Test
    public void testMinimum() {
        assertEquals(2.0, Aggregation.MINIMUM.aggregate(List.of(5.0, 2.0, 4.0)));
    }

    @Test
    public void testArithmeticMean() {
        assertEquals(3.0, Aggregation.ARITHMETIC_MEAN.aggregate(List.of(2.0, 4.0)));
    }

    @Test
    public void testFromName() {
        assertSame(Aggregation.HARMONIC_MEAN, Aggregation.fromName("harmonic"));
        assertSame(Aggregation.MINIMUM, Aggregation.fromName(" Minimum "));
        assertSame(Aggregation.ARITHMETIC_MEAN, Aggregation.fromName("arithmetic"));
        assertThrows(IllegalArgumentException.class, () -> Aggregation.fromName("median"));
    }
}
