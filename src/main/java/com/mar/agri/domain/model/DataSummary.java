package com.mar.agri.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDate;

public record DataSummary(
    @JsonProperty("total_records") int totalRecords,
    @JsonProperty("commodities") int commodities,
    @JsonProperty("states") int states,
    @JsonProperty("districts") int districts,
    @JsonProperty("markets") int markets,
    @JsonProperty("avg_modal_price") double avgModalPrice,
    @JsonProperty("max_modal_price") double maxModalPrice,
    @JsonProperty("min_modal_price") double minModalPrice,
    @JsonProperty("date_range") DateRange dateRange
) {
    public record DateRange(LocalDate start, LocalDate end) {}
}
