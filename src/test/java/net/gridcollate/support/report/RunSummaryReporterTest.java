package net.gridcollate.support.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import net.gridcollate.config.CollateProperties;
import net.gridcollate.model.summary.RunSummary;
import net.gridcollate.model.summary.SubcategorySummary;
import net.gridcollate.testutil.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class RunSummaryReporterTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private CollateProperties properties;
    private RunSummary summary;

    @BeforeEach
    void setUp() {
        properties = TestProperties.grid(tempDir, 4, 4);
        summary = new RunSummary();
        SubcategorySummary main = summary.addCategory("Sketches").addSubcategory("main");
        main.recordDiscovered(17);
        for (int i = 0; i < 17; i++) {
            main.recordChecked();
        }
        main.recordDuplicate("copy.png");
        main.recordBatch(16);
    }

    @Test
    void should_WriteJsonReport_When_SummaryReportConfigured() throws IOException {
        Path report = tempDir.resolve("reports/summary.json");
        properties.setSummaryReport(report);

        new RunSummaryReporter(objectMapper, properties).report(summary);

        JsonNode json = objectMapper.readTree(Files.readString(report));
        assertThat(json.get("totalChecked").asInt()).isEqualTo(17);
        assertThat(json.get("totalDuplicates").asInt()).isEqualTo(1);
        assertThat(json.get("totalProcessed").asInt()).isEqualTo(16);
        assertThat(json.get("totalStitchedBatches").asInt()).isEqualTo(1);
        assertThat(json.get("ledgerPossiblyIncomplete").asBoolean()).isFalse();
        assertThat(json.has("abortReason")).isFalse();
        JsonNode sub = json.get("categories").get(0).get("subcategories").get(0);
        assertThat(sub.get("subcategory").asText()).isEqualTo("main");
        assertThat(sub.get("duplicateFiles").get(0).asText()).isEqualTo("copy.png");
    }

    @Test
    void should_IncludeAbortReason_When_RunAborted() throws IOException {
        Path report = tempDir.resolve("summary.json");
        properties.setSummaryReport(report);
        summary.abort("ledger append failed", true);

        new RunSummaryReporter(objectMapper, properties).report(summary);

        JsonNode json = objectMapper.readTree(report.toFile());
        assertThat(json.get("abortReason").asText()).isEqualTo("ledger append failed");
        assertThat(json.get("ledgerPossiblyIncomplete").asBoolean()).isTrue();
    }

    @Test
    void should_SkipJson_When_NoReportConfigured() {
        new RunSummaryReporter(objectMapper, properties).report(summary);

        assertThat(tempDir.resolve("summary.json")).doesNotExist();
    }

    @Test
    void should_NotThrow_When_ReportPathUnwritable() throws IOException {
        Path blocked = Files.createDirectories(tempDir.resolve("blocked.json"));

        assertThatCode(() -> new RunSummaryReporter(objectMapper, properties).writeJson(summary, blocked))
            .doesNotThrowAnyException();
    }
}
