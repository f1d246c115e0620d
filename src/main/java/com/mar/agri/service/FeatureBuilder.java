package com.mar.agri.service;

import lombok.RequiredArgsConstructor;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Service;
import com.mar.agri.config.AppProperties;
import com.mar.agri.domain.model.FeatureRow;
import com.mar.agri.domain.model.MarketObservation;
import com.mar.agri.util.Indicators;

/**
 * Turns a price series into date-ascending feature rows: calendar fields, three price lags and
 * trailing rolling mean/std. Rows with any undefined value are dropped.
 */
@Service
@RequiredArgsConstructor
public class FeatureBuilder {

    private final AppProperties props;

    public List<FeatureRow> build(List<MarketObservation> observations) {
        List<MarketObservation> sorted = new ArrayList<>(observations);
        sorted.sort(Comparator.comparing(MarketObservation::arrivalDate));   // List.sort is stable

        double[] price = sorted.stream().mapToDouble(MarketObservation::modalPrice).toArray();
        int window = props.getForecast().getRollingWindow();

        double[] lag1 = Indicators.lag(price, 1);
        double[] lag2 = Indicators.lag(price, 2);
        double[] lag3 = Indicators.lag(price, 3);
        double[] mean = Indicators.rollingMean(price, window);
        double[] std = Indicators.rollingStd(price, window);

        List<FeatureRow> rows = new ArrayList<>();
        for (int i = 0; i < price.length; i++) {
            if (Double.isNaN(lag1[i]) || Double.isNaN(lag2[i]) || Double.isNaN(lag3[i])
                || Double.isNaN(mean[i]) || Double.isNaN(std[i]) || Double.isNaN(price[i])) {
                continue;
            }
            LocalDate d = sorted.get(i).arrivalDate();
            rows.add(new FeatureRow(
                d,
                d.getDayOfWeek().getValue() - 1,   // Monday = 0
                d.getDayOfMonth(),
                d.getMonthValue(),
                (d.getMonthValue() - 1) / 3 + 1,
                lag1[i], lag2[i], lag3[i],
                mean[i], std[i],
                price[i]
            ));
        }
        return rows;
    }
}
