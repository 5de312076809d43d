/* (C)2026 */
package com.ammann.dashboard.service;

import com.ammann.dashboard.dto.DatasetProfileDTO;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;
import java.util.Map;

/**
 * Renders a short plain-text summary of a dataset profile.
 */
@ApplicationScoped
public class NarrativeService {

    /**
     * Builds the narrative for a profile: shape, column kind counts and the columns whose
     * profile reports missing cells.
     *
     * @param profile dataset profile
     * @return multi-line summary text
     */
    public String describe(DatasetProfileDTO profile) {
        List<String> missingColumns = profile.missingCounts().entrySet().stream()
                .filter(entry -> entry.getValue() > 0)
                .map(Map.Entry::getKey)
                .toList();

        StringBuilder text = new StringBuilder("Basic analysis of your data:\n");
        text.append(String.format("- Dataset has %d rows and %d columns\n",
                profile.datasetInfo().rowCount(), profile.datasetInfo().columnCount()));
        text.append(String.format("- Numeric columns: %d\n", profile.numericSummary().size()));
        text.append(String.format("- Categorical columns: %d\n", profile.categoricalSummary().size()));
        text.append("- Missing values detected in: ")
                .append(missingColumns.isEmpty() ? "none" : String.join(", ", missingColumns))
                .append('\n');
        text.append("\nConsider exploring the charts for detailed insights.");
        return text.toString();
    }
}
