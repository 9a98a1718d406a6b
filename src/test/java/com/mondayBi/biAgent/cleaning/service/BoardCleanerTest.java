package com.mondayBi.biAgent.cleaning.service;

import com.mondayBi.biAgent.TestBoards;
import com.mondayBi.biAgent.board.model.RawItem;
import com.mondayBi.biAgent.cleaning.model.CleanedItem;
import com.mondayBi.biAgent.cleaning.model.CleaningResult;
import com.mondayBi.biAgent.cleaning.model.QualityReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class BoardCleanerTest {

    private BoardCleaner boardCleaner;

    @BeforeEach
    public void setUp() {
        this.boardCleaner = new BoardCleaner(new ColumnClassifier(TestBoards.columnClassification()));
    }

    @Test
    public void shouldNormalizeEveryClassifiedColumn() {
        RawItem item = deal("Solar Farm", columns(
                "Masked Deal value", "1.2Cr",
                "Tentative Close Date", "27th Feb 2026",
                "Deal Status", "wip",
                "Sector/service", "  renewables ",
                "Owner code note", "keep me"));

        CleaningResult result = boardCleaner.clean(List.of(item));

        CleanedItem cleaned = result.items().get(0);
        assertEquals(12_000_000.0, (Double) cleaned.get("Masked Deal value"), 1e-6);
        assertEquals("2026-02-27", cleaned.get("Tentative Close Date"));
        assertEquals("In Progress", cleaned.get("Deal Status"));
        assertEquals("Renewables", cleaned.get("Sector/service"));
        assertEquals("keep me", cleaned.get("Owner code note"));
        assertEquals(item.getColumns().keySet(), cleaned.getColumns().keySet());

        QualityReport report = result.qualityReport();
        assertEquals(1, report.getTotalItems());
        assertEquals(0, report.countIssues());
        assertEquals(1, report.getNormalizedStatuses());
        assertEquals(1, report.getNormalizedText());
    }

    @Test
    public void shouldReportUnparseableValuesAndKeepGoing() {
        List<RawItem> items = List.of(
                deal("Deal A", columns("Masked Deal value", "1.2Cr")),
                deal("Deal B", columns("Masked Deal value", "₹50L")),
                deal("Deal C", columns("Masked Deal value", "bad", "Tentative Close Date", "someday")));

        CleaningResult result = boardCleaner.clean(items);

        assertEquals(12_000_000.0, (Double) result.items().get(0).get("Masked Deal value"), 1e-6);
        assertEquals(5_000_000.0, (Double) result.items().get(1).get("Masked Deal value"), 1e-6);
        assertNull(result.items().get(2).get("Masked Deal value"));
        assertNull(result.items().get(2).get("Tentative Close Date"));

        QualityReport report = result.qualityReport();
        assertEquals(1, report.getUnparseableNumbers());
        assertEquals(1, report.getUnparseableDates());
        assertEquals(List.of(
                "Unparseable number in 'Masked Deal value' for item 'Deal C': 'bad'",
                "Unparseable date in 'Tentative Close Date' for item 'Deal C': 'someday'"), report.getIssues());
        assertEquals("2 data quality issues found across 3 items: 0 missing values, "
                + "1 unparseable dates, 1 unparseable numbers.", report.getSummary());
    }

    @Test
    public void shouldCountBlankCellsAsMissing() {
        Map<String, String> cells = new LinkedHashMap<>();
        cells.put("Masked Deal value", null);
        cells.put("Deal Status", "   ");
        cells.put("Owner code note", "");

        CleaningResult result = boardCleaner.clean(List.of(deal("Empty", cells)));

        assertEquals(3, result.qualityReport().getMissingValues());
        assertEquals(3, result.items().get(0).getColumns().size());
        assertTrue(result.items().get(0).getColumns().values().stream().allMatch(value -> value == null));
        assertTrue(result.qualityReport().getIssues().isEmpty());
    }

    @Test
    public void shouldCapIssuesWithOverflowMarker() {
        List<RawItem> items = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            items.add(deal("Deal " + i, columns("Masked Deal value", "n/a-" + i)));
        }

        QualityReport report = boardCleaner.clean(items).qualityReport();

        assertEquals(25, report.getUnparseableNumbers());
        assertEquals(QualityReport.MAX_ISSUES + 1, report.getIssues().size());
        assertEquals("... and 5 more issues", report.getIssues().get(QualityReport.MAX_ISSUES));
    }

    @Test
    public void shouldKeepIssuesWithinClassifiedCellsWhenEveryColumnIsClassified() {
        List<RawItem> items = List.of(
                deal("A", columns("Masked Deal value", "x", "Tentative Close Date", "y", "Deal Status", "")),
                deal("B", columns("Masked Deal value", "", "Tentative Close Date", "", "Deal Status", "won")));

        QualityReport report = boardCleaner.clean(items).qualityReport();

        assertTrue(report.countIssues() <= items.size() * 3);
        assertEquals(5, report.countIssues());
    }

    @Test
    public void shouldCountBlankUnclassifiedCellsAsMissing() {
        List<RawItem> items = List.of(
                deal("A", columns("Masked Deal value", "1.2Cr", "Owner", "", "Notes", "  ")),
                deal("B", columns("Masked Deal value", "bad", "Owner", null, "Notes", "call back")));

        QualityReport report = boardCleaner.clean(items).qualityReport();

        assertEquals(3, report.getMissingValues());
        assertEquals(1, report.getUnparseableNumbers());
        assertEquals(4, report.countIssues());
        assertTrue(report.countIssues() > items.size());
        assertTrue(report.countIssues() <= items.size() * 3);
    }

    @Test
    public void shouldReportStatusesOutsideTheCanonicalVocabulary() {
        List<RawItem> items = List.of(
                deal("A", columns("Deal Status", "wip")),
                deal("B", columns("Deal Status", "Some Weird Value")),
                deal("C", columns("Deal Status", " awaiting legal ")));

        CleaningResult result = boardCleaner.clean(items);

        assertEquals(Set.of("Some Weird Value", "awaiting legal"), result.unmappedStatuses());
        assertEquals("In Progress", result.items().get(0).get("Deal Status"));
        assertEquals("Awaiting Legal", result.items().get(2).get("Deal Status"));
        assertEquals(2, result.qualityReport().getNormalizedStatuses());
    }

    @Test
    public void shouldHandleEmptyInput() {
        CleaningResult result = boardCleaner.clean(null);

        assertTrue(result.items().isEmpty());
        assertEquals(0, result.qualityReport().getTotalItems());
    }

    private static RawItem deal(String name, Map<String, String> columns) {
        return RawItem.builder()
                .id(name.toLowerCase())
                .name(name)
                .columns(columns)
                .build();
    }

    private static Map<String, String> columns(String... titlesAndValues) {
        Map<String, String> columns = new LinkedHashMap<>();
        for (int i = 0; i < titlesAndValues.length; i += 2) {
            columns.put(titlesAndValues[i], titlesAndValues[i + 1]);
        }
        return columns;
    }
}
