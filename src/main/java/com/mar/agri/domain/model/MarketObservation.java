package com.mar.agri.domain.model;

import java.time.LocalDate;

/**
 * One reported price for a commodity on a date at a market.
 *
 * Prices are per quintal. {@code minPrice} and {@code maxPrice} may be null when the source row omits them.
 */
public record MarketObservation(
    String commodity,
    String state,
    String district,
    String market,
    String variety,
    String grade,
    LocalDate arrivalDate,
    Double minPrice,
    Double maxPrice,
    double modalPrice
) {
    public static MarketObservation of(String commodity, String state, String market, LocalDate arrivalDate, double modalPrice) {
        return new MarketObservation(commodity, state, null, market, null, null, arrivalDate, null, null, modalPrice);
    }
}
