package com.chicu.marginoptimizer.analysis;

import com.chicu.marginoptimizer.metrics.PerformanceWindow;
import lombok.Builder;

/**
 * Одна строка аналитической выгрузки (один arm за один час или за весь период).
 */
@Builder
public record ArmRow(
        String demandName,
        String demandId,
        int hour,

        double impressions,
        double responses,
        double cost,
        double revenue,

        double marginPct,
        double bidRatePct,
        double winRatePct,

        double supplyBidfloor,
        double ourBidfloor,
        double demandEcpm
) {

    public PerformanceWindow toWindow() {
        return PerformanceWindow.builder()
                .margin(marginPct)
                .impressions(impressions)
                .revenue(revenue)
                .cost(cost)
                .bidRate(bidRatePct)
                .responses(responses)
                .build();
    }
}
