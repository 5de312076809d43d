/* (C)2026 */
package com.ammann.dashboard.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.dashboard.dto.DatasetInfoDTO;
import com.ammann.dashboard.dto.DatasetProfileDTO;
import com.ammann.dashboard.support.TestTables;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class NarrativeServiceTest {

    private final NarrativeService service = new NarrativeService();

    @Test
    void describesShapeAndColumnKinds() {
        StatisticsService statistics = new StatisticsService();
        DatasetProfileDTO profile = new DatasetProfilingService(statistics)
                .profile(new DataCleaningService(statistics).clean(TestTables.salesTable()));

        String text = service.describe(profile);

        assertThat(text)
                .contains("Dataset has 4 rows and 3 columns")
                .contains("Numeric columns: 1")
                .contains("Categorical columns: 1")
                .contains("Missing values detected in: none");
    }

    @Test
    void listsColumnsWithMissingValuesInOrder() {
        Map<String, Long> missing = new LinkedHashMap<>();
        missing.put("a", 0L);
        missing.put("b", 2L);
        missing.put("c", 1L);
        DatasetProfileDTO profile = new DatasetProfileDTO(
                new DatasetInfoDTO(10, 3, 0.01), Map.of(), missing, Map.of(), Map.of(), Map.of());

        assertThat(service.describe(profile)).contains("Missing values detected in: b, c");
    }

    @Test
    void separatesLinesWithNewlineOnly() {
        StatisticsService statistics = new StatisticsService();
        DatasetProfileDTO profile = new DatasetProfilingService(statistics)
                .profile(new DataCleaningService(statistics).clean(TestTables.salesTable()));

        String text = service.describe(profile);

        assertThat(text).doesNotContain("\r");
        assertThat(text.split("\n")).containsExactly(
                "Basic analysis of your data:",
                "- Dataset has 4 rows and 3 columns",
                "- Numeric columns: 1",
                "- Categorical columns: 1",
                "- Missing values detected in: none",
                "",
                "Consider exploring the charts for detailed insights.");
    }
}
