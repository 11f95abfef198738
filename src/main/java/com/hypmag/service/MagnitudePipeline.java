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
import java.util.Map;
import java.util.SortedMap;

/**
 * Second stage: adds hyperbolic magnitudes and errors of every configured filter to a
 * catalogue, using previously computed field statistics.
 */
public class MagnitudePipeline {

    private static final Logger log = LoggerFactory.getLogger(MagnitudePipeline.class);

    private final StatsRepair repair;
    private final SmoothingDerivation derivation;
    private final MagnitudeTransformer transformer;
    private final FitsCatalogueService catalogueService;
    private final StatsCsvService csvService;

    public MagnitudePipeline() {
        this(new StatsRepair(), new MagnitudeTransformer(), new FitsCatalogueService(), new StatsCsvService());
    }

    public MagnitudePipeline(StatsRepair repair, MagnitudeTransformer transformer,
                             FitsCatalogueService catalogueService, StatsCsvService csvService) {
        this.repair = repair;
        this.derivation = new SmoothingDerivation(repair);
        this.transformer = transformer;
        this.catalogueService = catalogueService;
        this.csvService = csvService;
    }

    /**
     * @param data      catalogue to extend; columns are added in place
     * @param stats     field statistics used for the reference fluxes
     * @param smoothing statistics to derive b from, or null to use {@code stats}
     * @return {@code data}
     */
    public Catalogue run(Catalogue data, StatsTable stats, StatsTable smoothing, HyperbolicConfig config) {
        Map<String, Double> b = derivation.deriveB(smoothing != null ? smoothing : stats,
                config.getFilters(), config.isGlobalB());
        if (config.isVerbose()) {
            log.info("smoothing parameters:\n{}", SmoothingDerivation.describe(b));
        }

        String[] fields = ColumnSelector.fields(data, config);
        for (String filter : config.getFilters()) {
            log.info("processing filter {}", filter);
            FilterColumns columns = config.getColumns(filter);
            SortedMap<String, FieldStats> filterStats = repair.fillMissingStats(filter, stats.forFilter(filter));
            MagnitudeTransformer.Result result = transformer.transform(filter,
                    ColumnSelector.flux(data, columns),
                    ColumnSelector.error(data, columns),
                    fields, filterStats, b.get(filter));
            data.addColumn(columns.outname, result.magnitude);
            data.addColumn(columns.errorOutname(), result.magnitudeError);
        }
        return data;
    }

    /**
     * Reads a FITS catalogue and the statistics files, writes the extended catalogue.
     *
     * @param smoothingFile external statistics for the smoothing parameter, or null
     */
    public Catalogue run(File infile, Path statsFile, Path smoothingFile, File outfile, HyperbolicConfig config)
            throws IOException {
        Catalogue data = catalogueService.read(infile);
        StatsTable stats = csvService.read(statsFile);
        StatsTable smoothing = smoothingFile != null ? csvService.read(smoothingFile) : null;
        run(data, stats, smoothing, config);
        catalogueService.write(data, outfile);
        return data;
    }
}
