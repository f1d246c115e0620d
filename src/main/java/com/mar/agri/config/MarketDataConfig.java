package com.mar.agri.config;

import lombok.extern.slf4j.Slf4j;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import com.mar.agri.domain.model.MarketObservation;
import com.mar.agri.infrastructure.csv.ObservationCsvReader;
import com.mar.agri.service.ObservationRepository;

@Slf4j
@Configuration
public class MarketDataConfig {

    @Bean
    ObservationRepository observationRepository(AppProperties props) {
        Path path = Path.of(props.getData().getCsvPath());
        if (!Files.exists(path)) {
            log.warn("DATA | {} not found, starting with an empty observation table", path.toAbsolutePath());
            return new ObservationRepository(List.of());
        }
        try {
            List<MarketObservation> rows = new ObservationCsvReader(props.getData().getDatePatterns()).read(path);
            log.info("DATA | loaded {} market records from {}", rows.size(), path.toAbsolutePath());
            return new ObservationRepository(rows);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }
}
