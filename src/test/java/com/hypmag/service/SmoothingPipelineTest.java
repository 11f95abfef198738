package com.hypmag.service;

import com.hypmag.exception.ColumnNotFoundException;
import com.hypmag.exception.ConfigurationException;
import com.hypmag.model.Catalogue;
import com.hypmag.model.FieldStats;
import com.hypmag.model.FilterColumns;
import com.hypmag.model.HyperbolicConfig;
import com.hypmag.model.StatsTable;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SmoothingPipelineTest {

    private final SmoothingPipeline pipeline = new SmoothingPipeline();

    static Catalogue calibrationCatalogue() {
        return new Catalogue()
                .addColumn("POINTING", new double[]{2.0, 2.0, 1.0, 1.0, 1.0, 3.0})
                .addColumn("FLUX_r", new double[]{100.0, 200.0, 100.0, -50.0, 0.0, 10.0})
                .addColumn("ERR_r", new double[]{5.0, 7.0, 5.0, 5.0, -1.0, -1.0})
                .addColumn("MAG_r", new double[]{25.0, 24.3, 24.0, 99.0, 99.0, 27.5})
                .addColumn("FLUX_g", new double[]{50.0, 60.0, 70.0, 80.0, 90.0, 100.0})
                .addColumn("ERR_g", new double[]{2.0, 2.0, 3.0, 3.0, 3.0, 4.0})
                .addColumn("MAG_g", new double[]{26.0, 25.8, 25.6, 25.4, 25.3, 25.0});
    }

    static HyperbolicConfig calibrationConfig() {
        Map<String, FilterColumns> filters = new LinkedHashMap<>();
        filters.put("r", new FilterColumns("HMAG_r", "FLUX_r", "ERR_r", "MAG_r"));
        filters.put("g", new FilterColumns("mag_g", "FLUX_g", "ERR_g", "MAG_g"));
        return new HyperbolicConfig(filters).withFieldsColumn("POINTING");
    }

    @Test
    void statisticsPerFilterAndField() {
        StatsTable stats = pipeline.run(calibrationCatalogue(), calibrationConfig());

        assertEquals(List.of("r", "g"), stats.filters());
        assertEquals(List.of("1", "2", "3"), List.copyOf(stats.forFilter("r").keySet()));
        assertEquals(6, stats.size());

        FieldStats r1 = stats.forFilter("r").get("1");
        assertEquals(24.0 + ZeropointModel.POGSON * Math.log(100.0), r1.zeropoint, 1e-12);
        assertEquals(5.0, r1.fluxError);
        FieldStats r2 = stats.forFilter("r").get("2");
        assertEquals(6.0, r2.fluxError);
        assertFalse(stats.forFilter("r").get("3").isFinite());
        assertTrue(stats.forFilter("g").get("3").isFinite());
    }

    @Test
    void withoutFieldColumnAllSourcesShareOneField() {
        HyperbolicConfig config = calibrationConfig().withFieldsColumn(null).withZeropoint(30.0);

        StatsTable stats = pipeline.run(calibrationCatalogue(), config);

        assertEquals(List.of("0"), List.copyOf(stats.forFilter("g").keySet()));
        assertEquals(30.0, stats.forFilter("r").get("0").zeropoint);
        assertEquals(5.0, stats.forFilter("r").get("0").fluxError);
    }

    @Test
    void fixedZeropointDoesNotNeedMagnitudeColumns() {
        Map<String, FilterColumns> filters = new LinkedHashMap<>();
        filters.put("r", new FilterColumns("HMAG_r", "FLUX_r", "ERR_r", "MISSING"));
        HyperbolicConfig config = new HyperbolicConfig(filters).withZeropoint(30.0);

        StatsTable stats = pipeline.run(calibrationCatalogue(), config);

        assertEquals(30.0, stats.forFilter("r").get("0").zeropoint);
    }

    @Test
    void missingMagnitudeColumnNameFails() {
        Map<String, FilterColumns> filters = new LinkedHashMap<>();
        filters.put("r", new FilterColumns("HMAG_r", "FLUX_r", "ERR_r", null));

        assertThrows(ConfigurationException.class,
                () -> pipeline.run(calibrationCatalogue(), new HyperbolicConfig(filters)));
    }

    @Test
    void missingColumnsAreReported() {
        Map<String, FilterColumns> filters = new LinkedHashMap<>();
        filters.put("r", new FilterColumns("HMAG_r", "FLUX_x", "ERR_r", "MAG_r"));
        ColumnNotFoundException flux = assertThrows(ColumnNotFoundException.class,
                () -> pipeline.run(calibrationCatalogue(), new HyperbolicConfig(filters)));
        assertEquals("FLUX_x", flux.getColumn());
        assertTrue(flux.getMessage().contains("flux column 'FLUX_x'"));

        ColumnNotFoundException fields = assertThrows(ColumnNotFoundException.class,
                () -> pipeline.run(calibrationCatalogue(), calibrationConfig().withFieldsColumn("TILE")));
        assertEquals("TILE", fields.getColumn());
    }
}
