package com.mondayBi.biAgent.query.service;

import com.mondayBi.biAgent.TestBoards;
import com.mondayBi.biAgent.board.model.BoardTag;
import com.mondayBi.biAgent.cleaning.model.CleanedItem;
import com.mondayBi.biAgent.query.model.BucketSummary;
import com.mondayBi.biAgent.query.model.MetricTag;
import com.mondayBi.biAgent.query.model.MetricsResult;
import com.mondayBi.biAgent.query.model.OverdueItem;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MetricsEngineTest {

    private static final String VALUE = "Masked Deal value";
    private static final String SECTOR = "Sector/service";
    private static final String STAGE = "Deal Stage";
    private static final String STATUS = "Deal Status";
    private static final String CLOSE_DATE = "Tentative Close Date";

    // Today is 2026-03-10.
    private final Clock clock = Clock.fixed(Instant.parse("2026-03-10T09:00:00Z"), ZoneOffset.UTC);
    private final MetricsEngine metricsEngine = new MetricsEngine(TestBoards.boardProperties(), clock);

    @Test
    public void shouldComputeTotalsCountAndAverage() {
        List<CleanedItem> items = List.of(
                item("A", 12_000_000.0, "Energy", "Proposal", "Open", null),
                item("B", 5_000_000.0, "Energy", "Negotiation", "Open", null),
                item("C", null, "Mining", "Proposal", "Open", null));

        MetricsResult result = metricsEngine.compute(items,
                EnumSet.of(MetricTag.TOTAL_VALUE, MetricTag.COUNT, MetricTag.AVERAGE_VALUE), BoardTag.DEALS);

        assertEquals(17_000_000.0, result.getTotalValue(), 1e-6);
        assertEquals("₹1.7Cr", result.getTotalValueFormatted());
        assertEquals(3, result.getCount());
        assertEquals(8_500_000.0, result.getAverageValue(), 1e-6);
        assertEquals("₹85.0L", result.getAverageValueFormatted());
        assertNull(result.getGroups());
        assertNull(result.getOverdueItems());
    }

    @Test
    public void shouldReturnZeroWhenNoValuesAreReadable() {
        MetricsResult result = metricsEngine.compute(List.of(item("A", null, null, null, null, null)),
                List.of(MetricTag.TOTAL_VALUE, MetricTag.AVERAGE_VALUE), BoardTag.DEALS);

        assertEquals(0.0, result.getTotalValue());
        assertEquals(0.0, result.getAverageValue());
        assertEquals("₹0", result.getTotalValueFormatted());
    }

    @Test
    public void shouldAverageToTotalOverCountWhenEveryItemHasValue() {
        List<CleanedItem> items = List.of(
                item("A", 100.0, null, null, null, null),
                item("B", 250.0, null, null, null, null),
                item("C", 650.0, null, null, null, null));

        MetricsResult result = metricsEngine.compute(items,
                List.of(MetricTag.TOTAL_VALUE, MetricTag.COUNT, MetricTag.AVERAGE_VALUE), BoardTag.DEALS);

        assertEquals(result.getTotalValue() / result.getCount(), result.getAverageValue(), 1e-9);
    }

    @Test
    public void shouldBucketBySectorWithUnknownForMissing() {
        List<CleanedItem> items = List.of(
                item("A", 100.0, "Energy", "Proposal", null, null),
                item("B", 200.0, "Energy", "Won", null, null),
                item("C", null, null, "Proposal", null, null));

        MetricsResult result = metricsEngine.compute(items,
                List.of(MetricTag.GROUP_BY, MetricTag.PIPELINE_SUMMARY), BoardTag.DEALS);

        Map<String, BucketSummary> groups = result.getGroups();
        assertEquals(List.of("Energy", "Unknown"), new ArrayList<>(groups.keySet()));
        assertEquals(2, groups.get("Energy").getCount());
        assertEquals(300.0, groups.get("Energy").getTotalValue(), 1e-9);
        assertEquals(1, groups.get("Unknown").getCount());
        assertEquals(items.size(), groups.values().stream().mapToInt(BucketSummary::getCount).sum());

        Map<String, BucketSummary> pipeline = result.getPipeline();
        assertEquals(2, pipeline.get("Proposal").getCount());
        assertEquals(100.0, pipeline.get("Proposal").getTotalValue(), 1e-9);
        assertEquals(1, pipeline.get("Won").getCount());
    }

    @Test
    public void shouldFlagOnlyOpenItemsPastTheirDate() {
        List<CleanedItem> items = List.of(
                item("Late", 150_000.0, null, null, "In Progress", "2026-03-09"),
                item("Done", 150_000.0, null, null, "Completed", "2026-03-09"),
                item("ClosedWon", 150_000.0, null, null, "closed won", "2026-01-01"),
                item("DueToday", 150_000.0, null, null, "Open", "2026-03-10"),
                item("Future", 150_000.0, null, null, "Open", "2026-04-01"),
                item("NoStatus", null, null, null, null, "2026-02-01"),
                item("NoDate", 150_000.0, null, null, "Open", null));

        MetricsResult result = metricsEngine.compute(items, List.of(MetricTag.OVERDUE_CHECK), BoardTag.DEALS);

        assertEquals(2, result.getOverdueCount());
        OverdueItem late = result.getOverdueItems().get(0);
        assertEquals("Late", late.getName());
        assertEquals("2026-03-09", late.getEndDate());
        assertEquals("In Progress", late.getStatus());
        assertEquals("₹1.5L", late.getValue());
        OverdueItem noStatus = result.getOverdueItems().get(1);
        assertEquals("NoStatus", noStatus.getName());
        assertNull(noStatus.getStatus());
        assertEquals("₹0", noStatus.getValue());
    }

    @Test
    public void shouldListAtMostFiftyItemsWithNonNullColumns() {
        List<CleanedItem> items = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            items.add(item("Deal " + i, (double) i, "Energy", null, null, null));
        }

        MetricsResult result = metricsEngine.compute(items, List.of(MetricTag.LIST_ITEMS), BoardTag.DEALS);

        assertEquals(MetricsEngine.MAX_LISTED_ITEMS, result.getItems().size());
        Map<String, Object> first = result.getItems().get(0);
        assertEquals("Deal 0", first.get("name"));
        assertEquals("Energy", first.get(SECTOR));
        assertTrue(!first.containsKey(STAGE));
    }

    private static CleanedItem item(String name, Double value, String sector, String stage, String status,
                                    String closeDate) {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put(VALUE, value);
        columns.put(SECTOR, sector);
        columns.put(STAGE, stage);
        columns.put(STATUS, status);
        columns.put(CLOSE_DATE, closeDate);
        return CleanedItem.builder().name(name).columns(columns).build();
    }
}
