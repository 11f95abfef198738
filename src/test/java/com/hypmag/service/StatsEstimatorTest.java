package com.hypmag.service;

import com.hypmag.exception.ConfigurationException;
import com.hypmag.model.FieldStats;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.SortedMap;

import static com.hypmag.service.ZeropointModel.POGSON;
import static org.junit.jupiter.api.Assertions.*;

class StatsEstimatorTest {

    private final StatsEstimator estimator = new StatsEstimator();

    @Test
    void singleFieldWithFixedZeropoint() {
        double[] flux = {100.0, -50.0, 0.0};
        double[] err = {5.0, 5.0, -1.0};
        String[] fields = {"0", "0", "0"};

        SortedMap<String, FieldStats> stats = estimator.estimate("r", flux, err, null, fields, 30.0);

        assertEquals(List.of("0"), List.copyOf(stats.keySet()));
        FieldStats s = stats.get("0");
        assertEquals(30.0, s.zeropoint);
        assertEquals(5.0, s.fluxError);
        assertEquals(ZeropointModel.refFluxFromZp(30.0), s.refFlux);
        assertTrue(s.bRelative > 0.0);
        assertEquals(ZeropointModel.estimateB(30.0, 5.0), s.bRelative);
        assertEquals(s.refFlux * s.bRelative, s.bAbsolute);
        // b in flux units is sqrt(POGSON) times the noise
        assertEquals(Math.sqrt(POGSON) * 5.0, s.bAbsolute, 1e-9);

        // brighter than the zero flux magnitude of this field
        MagnitudeTransformer.Result result = new MagnitudeTransformer()
                .transform("r", flux, err, fields, stats, s.bRelative);
        double zeroFluxMag = -POGSON * Math.log(s.bRelative);
        assertTrue(Float.isFinite(result.magnitude[0]));
        assertTrue(result.magnitude[0] < zeroFluxMag);
        assertTrue(result.magnitude[1] > zeroFluxMag);
        assertEquals(-99.0f, result.magnitude[2]);
        assertEquals(-99.0f, result.magnitudeError[2]);
    }

    @Test
    void zeropointEstimatedFromMagnitudes() {
        // zeropoints 30, 30.2 and 29.9; the bad source and the negative flux are ignored
        double[] flux = {100.0, 100.0, 100.0, -20.0, 100.0};
        double[] mag = {25.0, 25.2, 24.9, 20.0, 10.0};
        double[] err = {1.0, 3.0, 2.0, 4.0, 0.0};
        String[] fields = {"0", "0", "0", "0", "0"};

        FieldStats s = estimator.estimate("g", flux, err, mag, fields, null).get("0");

        assertEquals(30.0, s.zeropoint, 1e-9);
        assertEquals(2.5, s.fluxError, 1e-12);
        assertEquals(ZeropointModel.estimateB(s.zeropoint, 2.5), s.bRelative, 1e-24);
    }

    @Test
    void fixedZeropointOverridesMagnitudes() {
        double[] flux = {100.0};
        double[] mag = {25.0};
        double[] err = {1.0};

        FieldStats s = estimator.estimate("g", flux, err, mag, new String[]{"0"}, 27.0).get("0");

        assertEquals(27.0, s.zeropoint);
    }

    @Test
    void fieldsAreSortedByIdentifier() {
        double[] flux = {1, 1, 1, 1};
        double[] err = {1, 1, 1, 1};
        String[] fields = {"10", "2", "1", "2"};

        SortedMap<String, FieldStats> stats = estimator.estimate("i", flux, err, null, fields, 30.0);

        assertEquals(List.of("1", "2", "10"), List.copyOf(stats.keySet()));
    }

    @Test
    void fieldWithoutGoodSourcesIsAllNaN() {
        double[] flux = {100.0, 100.0, 100.0};
        double[] mag = {25.0, 25.0, 25.0};
        double[] err = {1.0, 0.0, -1.0};
        String[] fields = {"A", "B", "B"};

        SortedMap<String, FieldStats> stats = estimator.estimate("r", flux, err, mag, fields, null);

        assertTrue(stats.get("A").isFinite());
        FieldStats b = stats.get("B");
        assertTrue(Double.isNaN(b.zeropoint));
        assertTrue(Double.isNaN(b.fluxError));
        assertTrue(Double.isNaN(b.refFlux));
        assertTrue(Double.isNaN(b.bRelative));
        assertTrue(Double.isNaN(b.bAbsolute));
    }

    @Test
    void fixedZeropointKeepsZeropointOfEmptyField() {
        FieldStats s = estimator.estimate("r", new double[]{1.0}, new double[]{-1.0}, null,
                new String[]{"0"}, 30.0).get("0");

        assertEquals(30.0, s.zeropoint);
        assertTrue(Double.isNaN(s.fluxError));
        assertFalse(s.isFinite());
    }

    @Test
    void missingZeropointSourceFails() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> estimator.estimate("z",
                new double[]{1.0}, new double[]{1.0}, null, new String[]{"0"}, null));
        assertTrue(e.getMessage().contains("'z'"));
    }

    @Test
    void columnsOfDifferentLengthAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> estimator.estimate("r",
                new double[]{1.0, 2.0}, new double[]{1.0, 2.0}, null, new String[]{"0"}, 30.0));
    }
}
