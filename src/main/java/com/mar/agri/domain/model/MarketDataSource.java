package com.mar.agri.domain.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class MarketDataSource {
    @NotBlank
    private String csvPath = "data/agmarknet-data.csv";

    // tried in order, first match wins
    @NotEmpty
    private List<String> datePatterns = new ArrayList<>(List.of("dd/MM/yyyy", "yyyy-MM-dd"));
}
