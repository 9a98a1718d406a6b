package com.mondayBi.biAgent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Column titles per normalization class, bound from {@code bi.cleaning.columns}.
 * <p>
 * Titles are matched after lower-casing and trimming, so the configured values
 * should be written in lower case.
 * </p>
 */
@Data
@ConfigurationProperties(prefix = "bi.cleaning.columns")
public class ColumnClassificationProperties {

    /** Columns holding dates in any of the supported textual formats. */
    private List<String> date = new ArrayList<>();

    /** Columns holding amounts or quantities, possibly with currency glyphs and K/M/Cr/L suffixes. */
    private List<String> currency = new ArrayList<>();

    /** Columns holding a status-like vocabulary (deal, execution, billing, invoice...). */
    private List<String> status = new ArrayList<>();

    /** Free-text columns that are compared case-insensitively, such as sector names. */
    private List<String> text = new ArrayList<>();
}
