package pl.marcinmilkowski.line_search.bench;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class SpeedTestTest {

    @TempDir
    Path tempDir;

    private final SpeedTest speedTest = new SpeedTest(LoggerFactory.getLogger(SpeedTestTest.class),
        new Random(1), List.of("linear", "set", "boyer_moore"));

    @Test
    @DisplayName("Generated files have the requested number of 'test string N' lines")
    void generatesTestFile() throws Exception {
        SpeedTest.TestFile file = speedTest.generateTestFile(tempDir, 500);

        List<String> lines = Files.readAllLines(file.path(), StandardCharsets.UTF_8);
        assertEquals(500, file.lines());
        assertEquals(500, lines.size());
        assertEquals("test_data_500.txt", file.path().getFileName().toString());
        for (String line : lines) {
            assertTrue(line.matches("test string \\d+"), line);
            int n = Integer.parseInt(line.substring("test string ".length()));
            assertTrue(n >= 0 && n <= 500);
        }
    }

    @Test
    @DisplayName("Every algorithm, file and query combination is measured")
    void collectsAllCombinations() throws Exception {
        List<SpeedTest.TestFile> files = speedTest.generateTestFiles(tempDir, List.of(100, 200));

        List<SpeedTestResult> results = speedTest.collect(files, List.of("test string 5", "missing"), 3, false);

        assertEquals(3 * 2 * 2, results.size());
        for (SpeedTestResult result : results) {
            assertEquals(3, result.runs());
            assertFalse(result.rereadOnQuery());
            assertTrue(result.minMs() <= result.avgMs() && result.avgMs() <= result.maxMs());
        }
        assertEquals("LinearSearch", results.get(0).algorithm());
        assertEquals("test_data_100.txt", results.get(0).file());
        assertEquals(100, results.get(0).lines());
    }

    @Test
    @DisplayName("The JSON report holds one object per result with stable keys")
    void writesJsonReport() throws Exception {
        List<SpeedTest.TestFile> files = speedTest.generateTestFiles(tempDir, List.of(50));
        List<SpeedTestResult> results = speedTest.collect(files, List.of("missing"), 2, true);
        Path report = tempDir.resolve("reports").resolve("speed.json");

        SpeedTest.writeReport(results, report);

        JSONArray rows = JSON.parseArray(Files.readString(report));
        assertEquals(results.size(), rows.size());
        JSONObject first = rows.getJSONObject(0);
        assertEquals(List.of("algorithm", "file", "lines", "query", "runs", "rereadOnQuery", "avgMs", "minMs", "maxMs"),
            List.copyOf(first.keySet()));
        assertEquals("missing", first.getString("query"));
        assertTrue(first.getBooleanValue("rereadOnQuery"));
        assertEquals(50, first.getIntValue("lines"));
    }

    @Test
    void summarisesNanosAsMillis() {
        SpeedTestResult result = SpeedTestResult.of("X", "f", 1, "q", false, List.of(1_000_000L, 3_000_000L));

        assertEquals(2.0, result.avgMs(), 1e-9);
        assertEquals(1.0, result.minMs(), 1e-9);
        assertEquals(3.0, result.maxMs(), 1e-9);
        assertEquals(2, result.runs());
    }
}
