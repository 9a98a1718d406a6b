package com.mondayBi.biAgent.cleaning.service;

import com.mondayBi.biAgent.cleaning.model.ColumnType;
import com.mondayBi.biAgent.config.ColumnClassificationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps a column title to the normalizer that applies to it.
 * <p>
 * The mapping is loaded once from configuration and never changes afterwards,
 * so a single instance is shared by all requests.
 * </p>
 */
@Slf4j
@Component
public class ColumnClassifier {

    private final Map<String, ColumnType> classifications;

    @Autowired
    public ColumnClassifier(ColumnClassificationProperties properties) {
        this(fromProperties(properties));
    }

    public ColumnClassifier(Map<String, ColumnType> classifications) {
        Map<String, ColumnType> keyed = new LinkedHashMap<>();
        classifications.forEach((title, type) -> {
            if (title != null && type != null) {
                keyed.putIfAbsent(key(title), type);
            }
        });
        this.classifications = Collections.unmodifiableMap(keyed);
        log.info("Column classifier initialised - classified columns: {}", this.classifications.size());
    }

    /**
     * Classifies a column by its title. Unknown titles are {@link ColumnType#UNCLASSIFIED}.
     *
     * @param columnTitle Column title as it appears on the board
     * @return Column type, never null
     */
    public ColumnType classify(String columnTitle) {
        if (columnTitle == null) {
            return ColumnType.UNCLASSIFIED;
        }
        return classifications.getOrDefault(key(columnTitle), ColumnType.UNCLASSIFIED);
    }

    private static String key(String columnTitle) {
        return columnTitle.trim().toLowerCase(Locale.ROOT);
    }

    // A title listed under several classes keeps the first one, in date, currency, status, text order.
    private static Map<String, ColumnType> fromProperties(ColumnClassificationProperties properties) {
        Map<String, ColumnType> mapping = new LinkedHashMap<>();
        register(mapping, properties.getDate(), ColumnType.DATE);
        register(mapping, properties.getCurrency(), ColumnType.CURRENCY);
        register(mapping, properties.getStatus(), ColumnType.STATUS);
        register(mapping, properties.getText(), ColumnType.TEXT);
        return mapping;
    }

    private static void register(Map<String, ColumnType> mapping, Collection<String> titles, ColumnType type) {
        if (titles == null) {
            return;
        }
        for (String title : titles) {
            if (title != null && !title.isBlank()) {
                mapping.putIfAbsent(key(title), type);
            }
        }
    }
}
