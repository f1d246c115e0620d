package com.mar.agri.service;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import com.mar.agri.domain.model.MarketObservation;

/**
 * The in-memory observation table. Loaded once and read-only afterwards, so it is safe to
 * share across concurrent forecasts.
 */
public class ObservationRepository {

    private final List<MarketObservation> observations;

    public ObservationRepository(List<MarketObservation> observations) {
        this.observations = List.copyOf(observations);
    }

    public List<MarketObservation> findAll() {
        return observations;
    }

    /** Observations of one commodity, narrowed to one state when {@code state} is non-blank. */
    public List<MarketObservation> findByCommodity(String commodity, String state) {
        return observations.stream()
            .filter(o -> o.commodity().equals(commodity))
            .filter(o -> isBlank(state) || Objects.equals(o.state(), state))
            .toList();
    }

    public List<MarketObservation> findByState(String state) {
        if (isBlank(state)) return observations;
        return observations.stream().filter(o -> Objects.equals(o.state(), state)).toList();
    }

    public List<String> commodities() {
        return distinct(MarketObservation::commodity);
    }

    public List<String> states() {
        return distinct(MarketObservation::state);
    }

    public int size() {
        return observations.size();
    }

    private List<String> distinct(Function<MarketObservation, String> key) {
        return observations.stream().map(key).filter(Objects::nonNull).distinct().sorted().toList();
    }

    static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
