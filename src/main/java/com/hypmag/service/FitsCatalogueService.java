package com.hypmag.service;

import com.hypmag.model.Catalogue;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.BinaryTable;
import nom.tam.fits.BinaryTableHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.util.BufferedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Loads source catalogues from, and stores them to, FITS binary tables.
 */
public class FitsCatalogueService {

    private static final Logger log = LoggerFactory.getLogger(FitsCatalogueService.class);

    /**
     * Reads the first binary table extension. Scalar numeric columns are widened to
     * double, character columns kept as text; other column types are skipped.
     */
    public Catalogue read(File file) throws IOException {
        log.info("reading data from {}", file);
        try (Fits fits = new Fits(file)) {
            BinaryTableHDU table = null;
            for (BasicHDU<?> hdu : fits.read()) {
                if (hdu instanceof BinaryTableHDU) {
                    table = (BinaryTableHDU) hdu;
                    break;
                }
            }
            if (table == null) throw new IOException("no binary table found in " + file);

            Catalogue catalogue = new Catalogue();
            for (int c = 0; c < table.getNCols(); c++) {
                String name = table.getColumnName(c);
                Object column = table.getColumn(c);
                if (column instanceof String[]) {
                    catalogue.addColumn(name, (String[]) column);
                    continue;
                }
                double[] values = toDoubleColumn(column);
                if (values == null) {
                    log.debug("skipping column {} of unsupported type {}", name, column.getClass().getSimpleName());
                    continue;
                }
                catalogue.addColumn(name, values);
            }
            log.debug("read {} rows with columns {}", catalogue.size(), catalogue.columnNames());
            return catalogue;
        } catch (FitsException e) {
            throw new IOException("cannot read FITS table " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Writes the catalogue as a single binary table extension. The table is written to a
     * temporary file next to {@code file}, which is replaced only once writing succeeded.
     */
    public void write(Catalogue catalogue, File file) throws IOException {
        log.info("writing table data to {}", file);
        List<String> names = catalogue.columnNames();
        if (names.isEmpty()) throw new IOException("catalogue has no columns, nothing to write to " + file);
        Object[] columns = new Object[names.size()];
        for (int c = 0; c < columns.length; c++) columns[c] = catalogue.getColumn(names.get(c));

        Path target = file.toPath().toAbsolutePath();
        Path tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            try (Fits fits = new Fits(); BufferedFile out = new BufferedFile(tmp.toFile(), "rw")) {
                BinaryTable data = BinaryTableHDU.encapsulate(columns);
                BinaryTableHDU table = new BinaryTableHDU(BinaryTableHDU.manufactureHeader(data), data);
                for (int c = 0; c < columns.length; c++) table.setColumnName(c, names.get(c), null);
                fits.addHDU(BasicHDU.getDummyHDU());
                fits.addHDU(table);
                fits.write(out);
            } catch (FitsException e) {
                throw new IOException("cannot write FITS table " + file + ": " + e.getMessage(), e);
            }
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private static double[] toDoubleColumn(Object k) {
        if (k instanceof double[]) return (double[]) k;
        if (k instanceof float[]) {
            float[] f = (float[]) k;
            double[] d = new double[f.length];
            for (int i = 0; i < f.length; i++) d[i] = f[i];
            return d;
        }
        if (k instanceof long[]) {
            long[] l = (long[]) k;
            double[] d = new double[l.length];
            for (int i = 0; i < l.length; i++) d[i] = l[i];
            return d;
        }
        if (k instanceof int[]) {
            int[] n = (int[]) k;
            double[] d = new double[n.length];
            for (int i = 0; i < n.length; i++) d[i] = n[i];
            return d;
        }
        if (k instanceof short[]) {
            short[] s = (short[]) k;
            double[] d = new double[s.length];
            for (int i = 0; i < s.length; i++) d[i] = s[i];
            return d;
        }
        if (k instanceof byte[]) {
            byte[] b = (byte[]) k;
            double[] d = new double[b.length];
            for (int i = 0; i < b.length; i++) d[i] = b[i] & 0xFF;
            return d;
        }
        if (k instanceof Object[]) {
            // scalar columns declared as one-element vectors
            Object[] rows = (Object[]) k;
            double[] d = new double[rows.length];
            for (int i = 0; i < rows.length; i++) {
                double[] r = toDoubleColumn(rows[i]);
                if (r == null || r.length != 1) return null;
                d[i] = r[0];
            }
            return d;
        }
        return null;
    }
}
