package com.mondayBi.biAgent.orchestrator.model;

import com.mondayBi.biAgent.cleaning.model.CleanedItem;
import com.mondayBi.biAgent.cleaning.model.QualityReport;
import com.mondayBi.biAgent.query.model.MetricsResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Per-board intermediate results of one turn.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BoardResult {

    private List<CleanedItem> filteredItems;

    private QualityReport qualityReport;

    private MetricsResult metrics;
}
