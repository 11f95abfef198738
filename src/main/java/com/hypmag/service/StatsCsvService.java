package com.hypmag.service;

import com.hypmag.exception.ConfigurationException;
import com.hypmag.model.FieldIds;
import com.hypmag.model.FieldStats;
import com.hypmag.model.Keys;
import com.hypmag.model.StatsTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads and writes statistics tables as comma separated text with the filter and field
 * as index columns. NaN is written as an empty cell and infinities as {@code inf}, the
 * way pandas does, so tables can be exchanged with the python tools of the survey.
 */
public class StatsCsvService {

    private static final Logger log = LoggerFactory.getLogger(StatsCsvService.class);
    private static final String SEP = ",";

    public void write(StatsTable table, Path path) throws IOException {
        log.info("writing statistics to {}", path);
        try (BufferedWriter out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(table, out);
        }
    }

    public void write(StatsTable table, Writer out) throws IOException {
        out.write(quote(Keys.FILTER) + SEP + quote(Keys.FIELD));
        for (String col : Keys.VALUE_COLUMNS) out.write(SEP + col);
        out.write('\n');
        for (String filter : table.filters()) {
            for (Map.Entry<String, FieldStats> e : table.forFilter(filter).entrySet()) {
                out.write(quote(filter) + SEP + quote(e.getKey()));
                for (double v : e.getValue().values()) out.write(SEP + formatValue(v));
                out.write('\n');
            }
        }
    }

    public StatsTable read(Path path) throws IOException {
        log.info("reading statistics from {}", path);
        try (BufferedReader in = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(in);
        }
    }

    public StatsTable read(Reader reader) throws IOException {
        BufferedReader in = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        String header = in.readLine();
        if (header == null) throw new ConfigurationException("statistics file is empty");
        int[] index = columnIndex(split(header));

        StatsTable table = new StatsTable();
        String line;
        int lineNo = 1;
        while ((line = in.readLine()) != null) {
            lineNo++;
            if (line.isBlank()) continue;
            List<String> cells = split(line);
            if (cells.size() < 2 + Keys.VALUE_COLUMNS.length) {
                throw new ConfigurationException("statistics line " + lineNo + ": expected "
                        + (2 + Keys.VALUE_COLUMNS.length) + " columns, got " + cells.size());
            }
            double[] values = new double[Keys.VALUE_COLUMNS.length];
            for (int c = 0; c < values.length; c++) {
                values[c] = parseValue(cells.get(index[c + 2]), lineNo);
            }
            table.put(cells.get(index[0]), FieldIds.normalize(cells.get(index[1])), FieldStats.fromValues(values));
        }
        return table;
    }

    // position of filter, field and the value columns in the file
    private static int[] columnIndex(List<String> header) {
        String[] expected = new String[2 + Keys.VALUE_COLUMNS.length];
        expected[0] = Keys.FILTER;
        expected[1] = Keys.FIELD;
        System.arraycopy(Keys.VALUE_COLUMNS, 0, expected, 2, Keys.VALUE_COLUMNS.length);
        int[] index = new int[expected.length];
        for (int i = 0; i < expected.length; i++) {
            index[i] = header.indexOf(expected[i]);
            if (index[i] < 0) {
                throw new ConfigurationException("statistics file lacks column '" + expected[i] + "'");
            }
        }
        return index;
    }

    static String formatValue(double v) {
        if (Double.isNaN(v)) return "";
        if (v == Double.POSITIVE_INFINITY) return "inf";
        if (v == Double.NEGATIVE_INFINITY) return "-inf";
        return Double.toString(v);
    }

    static double parseValue(String cell, int lineNo) {
        String s = cell.trim();
        switch (s.toLowerCase(Locale.ROOT)) {
            case "":
            case "nan":
                return Double.NaN;
            case "inf":
            case "+inf":
            case "infinity":
                return Double.POSITIVE_INFINITY;
            case "-inf":
            case "-infinity":
                return Double.NEGATIVE_INFINITY;
            default:
                try {
                    return Double.parseDouble(s);
                } catch (NumberFormatException e) {
                    throw new ConfigurationException("statistics line " + lineNo + ": not a number: '" + s + "'", e);
                }
        }
    }

    private static String quote(String s) {
        if (s.contains(SEP) || s.contains("\"")) return '"' + s.replace("\"", "\"\"") + '"';
        return s;
    }

    static List<String> split(String line) {
        List<String> cells = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"' && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    cell.append('"');
                    i++;
                } else if (c == '"') {
                    quoted = false;
                } else {
                    cell.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                cells.add(cell.toString());
                cell.setLength(0);
            } else {
                cell.append(c);
            }
        }
        cells.add(cell.toString());
        return cells;
    }
}
