package pl.marcinmilkowski.line_search.bench;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Timing of one (algorithm, file, query, reread mode) combination.
 * Times are wall-clock milliseconds per search call.
 */
public record SpeedTestResult(
    String algorithm,
    String file,
    int lines,
    String query,
    int runs,
    boolean rereadOnQuery,
    double avgMs,
    double minMs,
    double maxMs
) {

    static SpeedTestResult of(String algorithm, String file, int lines, String query,
                              boolean rereadOnQuery, List<Long> nanos) {
        long min = Long.MAX_VALUE;
        long max = 0;
        long sum = 0;
        for (long n : nanos) {
            min = Math.min(min, n);
            max = Math.max(max, n);
            sum += n;
        }
        int runs = nanos.size();
        if (runs == 0) {
            return new SpeedTestResult(algorithm, file, lines, query, 0, rereadOnQuery, 0, 0, 0);
        }
        return new SpeedTestResult(algorithm, file, lines, query, runs, rereadOnQuery,
            toMillis(sum / (double) runs), toMillis(min), toMillis(max));
    }

    private static double toMillis(double nanos) {
        return nanos / 1_000_000.0;
    }

    /**
     * Row for the JSON report, keys in a stable order.
     */
    Map<String, Object> toMap() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("algorithm", algorithm);
        row.put("file", file);
        row.put("lines", lines);
        row.put("query", query);
        row.put("runs", runs);
        row.put("rereadOnQuery", rereadOnQuery);
        row.put("avgMs", avgMs);
        row.put("minMs", minMs);
        row.put("maxMs", maxMs);
        return row;
    }
}
