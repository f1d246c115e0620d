package com.mar.agri.config;

import lombok.Data;
import jakarta.validation.Valid;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;
import com.mar.agri.domain.model.Boosting;
import com.mar.agri.domain.model.Forecast;
import com.mar.agri.domain.model.Forest;
import com.mar.agri.domain.model.MarketDataSource;
import com.mar.agri.domain.model.Models;
import com.mar.agri.domain.model.Training;

@Data
@Validated
@ConfigurationProperties(prefix = "agri")
public class AppProperties {

    @Valid
    @NestedConfigurationProperty
    private Forecast forecast = new Forecast();

    @Valid
    @NestedConfigurationProperty
    private Forest forest = new Forest();

    @Valid
    @NestedConfigurationProperty
    private Boosting boosting = new Boosting();

    @Valid
    @NestedConfigurationProperty
    private MarketDataSource data = new MarketDataSource();

    @Valid
    @NestedConfigurationProperty
    private Models models = new Models();

    @Valid
    @NestedConfigurationProperty
    private Training training = new Training();
}
