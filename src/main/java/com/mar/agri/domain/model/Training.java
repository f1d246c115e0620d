package com.mar.agri.domain.model;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class Training {
    @Min(1) private int topModels = 5;

    /** Commodities the {@code test} command reloads and forecasts. */
    @NotEmpty
    private List<String> sampleCommodities = new ArrayList<>(List.of("Rice", "Wheat", "Potato", "Onion", "Tomato"));
}
