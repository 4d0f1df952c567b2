package com.modelgate.evaluation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;

/**
 * Reads a holdout CSV with a header row. All columns except the label column are numeric features.
 * Non-numeric labels are encoded as the index of the label in the sorted set of distinct labels.
 */
public class HoldoutDatasetLoader {
    private static final Logger log = LoggerFactory.getLogger(HoldoutDatasetLoader.class);

    private final CsvMapper csvMapper;

    public HoldoutDatasetLoader() {
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.csvMapper.enable(CsvParser.Feature.TRIM_SPACES);
        this.csvMapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    public HoldoutDataset load(Path csvPath, String labelColumn) {
        HoldoutDataset dataset = parse(csvPath, labelColumn, true);
        log.info("holdout.loaded path={} rows={} features={} classes={}", csvPath, dataset.rows().size(),
                dataset.featureNames().size(), Arrays.stream(dataset.labels()).distinct().count());
        return dataset;
    }

    /**
     * Feature rows only, for scoring unlabelled records. A label column, if present, is dropped.
     */
    public List<double[]> loadFeatures(Path csvPath, String labelColumn) {
        return parse(csvPath, labelColumn, false).rows();
    }

    private HoldoutDataset parse(Path csvPath, String labelColumn, boolean requireLabels) {
        if (!Files.exists(csvPath)) {
            throw new HoldoutDatasetException(csvPath + " not found. Run the data preparation stage first.");
        }
        List<String[]> records = readRecords(csvPath);
        if (records.isEmpty()) {
            throw new HoldoutDatasetException(csvPath + " has no header row");
        }

        String[] header = records.get(0);
        int labelIndex = Arrays.asList(header).indexOf(labelColumn);
        if (labelIndex < 0 && requireLabels) {
            throw new HoldoutDatasetException(csvPath + " has no label column '" + labelColumn + "'");
        }
        List<String> featureNames = new ArrayList<>();
        for (int i = 0; i < header.length; i++) {
            if (i != labelIndex) {
                featureNames.add(header[i]);
            }
        }

        List<double[]> rows = new ArrayList<>();
        List<String> rawLabels = new ArrayList<>();
        for (int line = 1; line < records.size(); line++) {
            String[] record = records.get(line);
            if (record.length != header.length) {
                throw new HoldoutDatasetException(String.format(
                        "%s line %d has %d columns, expected %d", csvPath, line + 1, record.length, header.length));
            }
            double[] row = new double[featureNames.size()];
            int column = 0;
            for (int i = 0; i < record.length; i++) {
                if (i == labelIndex) {
                    continue;
                }
                try {
                    row[column++] = Double.parseDouble(record[i]);
                } catch (NumberFormatException e) {
                    throw new HoldoutDatasetException(String.format(
                            "%s line %d column '%s' is not numeric: %s", csvPath, line + 1, header[i], record[i]), e);
                }
            }
            rows.add(row);
            if (labelIndex >= 0) {
                rawLabels.add(record[labelIndex]);
            }
        }
        return new HoldoutDataset(featureNames, rows, encodeLabels(rawLabels));
    }

    private List<String[]> readRecords(Path csvPath) {
        try (MappingIterator<String[]> iterator = csvMapper.readerFor(String[].class).readValues(csvPath.toFile())) {
            return iterator.readAll();
        } catch (IOException e) {
            throw new HoldoutDatasetException("Unable to read holdout dataset " + csvPath, e);
        }
    }

    static int[] encodeLabels(List<String> rawLabels) {
        int[] labels = new int[rawLabels.size()];
        for (int i = 0; i < labels.length; i++) {
            Integer numeric = integralValue(rawLabels.get(i));
            if (numeric == null) {
                return categoryCodes(rawLabels);
            }
            labels[i] = numeric;
        }
        return labels;
    }

    /**
     * {@code "2"} and {@code "2.0"} are both class 2; anything fractional or non-numeric is not a class id.
     */
    private static Integer integralValue(String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            try {
                double value = Double.parseDouble(raw);
                if (value == Math.rint(value) && value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
                    return (int) value;
                }
                return null;
            } catch (NumberFormatException notNumeric) {
                return null;
            }
        }
    }

    private static int[] categoryCodes(List<String> rawLabels) {
        Map<String, Integer> codes = new TreeMap<>();
        for (String label : new TreeSet<>(rawLabels)) {
            codes.put(label, codes.size());
        }
        int[] labels = new int[rawLabels.size()];
        for (int i = 0; i < labels.length; i++) {
            labels[i] = codes.get(rawLabels.get(i));
        }
        return labels;
    }
}
