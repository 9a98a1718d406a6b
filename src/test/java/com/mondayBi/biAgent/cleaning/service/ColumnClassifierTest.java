package com.mondayBi.biAgent.cleaning.service;

import com.mondayBi.biAgent.TestBoards;
import com.mondayBi.biAgent.cleaning.model.ColumnType;
import com.mondayBi.biAgent.config.ColumnClassificationProperties;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class ColumnClassifierTest {

    private final ColumnClassifier classifier = new ColumnClassifier(TestBoards.columnClassification());

    @Test
    public void shouldClassifyByTrimmedLowerCaseTitle() {
        assertEquals(ColumnType.DATE, classifier.classify("Tentative Close Date"));
        assertEquals(ColumnType.CURRENCY, classifier.classify("  Masked Deal value "));
        assertEquals(ColumnType.STATUS, classifier.classify("DEAL STATUS"));
        assertEquals(ColumnType.TEXT, classifier.classify("Sector/service"));
    }

    @Test
    public void shouldDefaultUnknownTitlesToUnclassified() {
        assertEquals(ColumnType.UNCLASSIFIED, classifier.classify("Owner"));
        assertEquals(ColumnType.UNCLASSIFIED, classifier.classify(null));
        assertEquals(ColumnType.TEXT, classifier.classify("sector"));
    }

    @Test
    public void shouldKeepFirstClassWhenTitleIsListedTwice() {
        ColumnClassificationProperties properties = new ColumnClassificationProperties();
        properties.setDate(List.of("collection date"));
        properties.setStatus(List.of("Collection Date", "collection status"));

        ColumnClassifier overlapping = new ColumnClassifier(properties);

        assertEquals(ColumnType.DATE, overlapping.classify("collection date"));
        assertEquals(ColumnType.STATUS, overlapping.classify("collection status"));
    }

    @Test
    public void shouldAcceptExplicitMapping() {
        ColumnClassifier explicit = new ColumnClassifier(Map.of("Go Live", ColumnType.DATE));

        assertEquals(ColumnType.DATE, explicit.classify("go live"));
    }
}
