package com.mar.agri.service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import com.mar.agri.domain.model.MarketObservation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ObservationRepositoryTest {

    private static final LocalDate DAY = LocalDate.of(2024, 5, 2);

    private final List<MarketObservation> source = new ArrayList<>(List.of(
        MarketObservation.of("Onion", "Punjab", "Ludhiana", DAY, 1200),
        MarketObservation.of("Onion", "Gujarat", "Rajkot", DAY, 1100),
        MarketObservation.of("Tomato", "Punjab", "Ludhiana", DAY, 900)));

    private final ObservationRepository repo = new ObservationRepository(source);

    @Test
    void filtersByCommodityAndOptionalState() {
        assertThat(repo.findByCommodity("Onion", null)).hasSize(2);
        assertThat(repo.findByCommodity("Onion", "")).hasSize(2);
        assertThat(repo.findByCommodity("Onion", "Punjab")).singleElement()
            .extracting(MarketObservation::modalPrice).isEqualTo(1200.0);
        assertThat(repo.findByCommodity("Garlic", null)).isEmpty();
        assertThat(repo.findByState("Punjab")).hasSize(2);
        assertThat(repo.findByState(null)).hasSize(3);
    }

    @Test
    void listsSortedDistinctNames() {
        assertThat(repo.commodities()).containsExactly("Onion", "Tomato");
        assertThat(repo.states()).containsExactly("Gujarat", "Punjab");
        assertThat(repo.size()).isEqualTo(3);
    }

    @Test
    void isUnaffectedByLaterChangesToTheSource() {
        source.clear();

        assertThat(repo.size()).isEqualTo(3);
        assertThatThrownBy(() -> repo.findAll().clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}
