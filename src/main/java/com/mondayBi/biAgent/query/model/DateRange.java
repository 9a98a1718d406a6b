package com.mondayBi.biAgent.query.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Inclusive date bounds; either side may be open.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DateRange {

    @JsonProperty("start")
    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate start;

    @JsonProperty("end")
    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate end;

    @JsonIgnore
    public boolean isBounded() {
        return start != null || end != null;
    }

    public boolean contains(LocalDate date) {
        if (start != null && date.isBefore(start)) {
            return false;
        }
        return end == null || !date.isAfter(end);
    }
}
