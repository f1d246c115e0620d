package com.mar.agri.service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import com.mar.agri.domain.model.MarketObservation;

/** Daily synthetic price series starting Monday 2024-01-01. */
public final class Series {

    public static final LocalDate START = LocalDate.of(2024, 1, 1);

    private Series() {}

    public static List<MarketObservation> linear(String commodity, int n, double start, double step) {
        List<MarketObservation> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            out.add(MarketObservation.of(commodity, "Punjab", "Ludhiana", START.plusDays(i), start + i * step));
        }
        return out;
    }

    public static List<MarketObservation> constant(String commodity, int n, double price) {
        return linear(commodity, n, price, 0.0);
    }
}
