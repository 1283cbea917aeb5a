package tsforecast.io;

import tsforecast.analysis.Series;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads a series from CSV. The first line is a header; each following line is
 * {@code timestamp,value[,...]}. Blank lines, {@code #} comments, lines with fewer than two
 * columns and rows whose value is not a finite number are skipped.
 */
public final class SeriesCsvReader {

    private SeriesCsvReader() {
    }

    public static Series read(Path path) throws IOException {
        try (BufferedReader in = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(in);
        }
    }

    public static Series read(Reader reader) throws IOException {
        BufferedReader in = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        List<String> timestamps = new ArrayList<>();
        List<Double> values = new ArrayList<>();

        String header = in.readLine();
        if (header == null) throw new IllegalArgumentException("Empty file");

        String line;
        while ((line = in.readLine()) != null) {
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            String[] parts = line.split(",");
            if (parts.length < 2) continue;
            try {
                double v = Double.parseDouble(parts[1].trim());
                if (!Double.isFinite(v)) continue;
                timestamps.add(parts[0].trim());
                values.add(v);
            } catch (NumberFormatException e) {
                continue; // non-numeric value
            }
        }
        if (values.isEmpty()) throw new IllegalArgumentException("No numeric observations found");

        double[] arr = values.stream().mapToDouble(Double::doubleValue).toArray();
        return Series.of(timestamps, arr);
    }
}
