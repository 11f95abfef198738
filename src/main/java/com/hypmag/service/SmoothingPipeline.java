package com.hypmag.service;

import com.hypmag.model.Catalogue;
import com.hypmag.model.FieldStats;
import com.hypmag.model.FilterColumns;
import com.hypmag.model.HyperbolicConfig;
import com.hypmag.model.StatsTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.SortedMap;

/**
 * First stage: field statistics of a calibration catalogue for every configured filter.
 */
public class SmoothingPipeline {

    private static final Logger log = LoggerFactory.getLogger(SmoothingPipeline.class);

    private final StatsEstimator estimator;
    private final FitsCatalogueService catalogueService;
    private final StatsCsvService csvService;

    public SmoothingPipeline() {
        this(new StatsEstimator(), new FitsCatalogueService(), new StatsCsvService());
    }

    public SmoothingPipeline(StatsEstimator estimator, FitsCatalogueService catalogueService,
                             StatsCsvService csvService) {
        this.estimator = estimator;
        this.catalogueService = catalogueService;
        this.csvService = csvService;
    }

    public StatsTable run(Catalogue data, HyperbolicConfig config) {
        String[] fields = ColumnSelector.fields(data, config);
        StatsTable all = new StatsTable();
        for (String filter : config.getFilters()) {
            log.info("processing filter {}", filter);
            FilterColumns columns = config.getColumns(filter);
            SortedMap<String, FieldStats> stats = estimator.estimate(filter,
                    ColumnSelector.flux(data, columns),
                    ColumnSelector.error(data, columns),
                    ColumnSelector.magnitude(data, filter, columns, config),
                    fields,
                    config.getZeropoint());
            all.putAll(filter, stats);
            if (config.isVerbose()) {
                log.info("statistics of filter {}:\n{}", filter, all.describe(filter));
            }
        }
        return all;
    }

    /** Reads a FITS catalogue and writes its statistics to a CSV file. */
    public StatsTable run(File infile, Path outfile, HyperbolicConfig config) throws IOException {
        Catalogue data = catalogueService.read(infile);
        StatsTable stats = run(data, config);
        csvService.write(stats, outfile);
        return stats;
    }
}
