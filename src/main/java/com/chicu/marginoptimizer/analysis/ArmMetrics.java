package com.chicu.marginoptimizer.analysis;

import lombok.Builder;

/**
 * KPI одного arm-а A/B теста маржи.
 */
@Builder(toBuilder = true)
public record ArmMetrics(
        String name,
        String demandId,

        double impressions,
        double responses,
        double marginPct,
        double winRatePct,

        double profit,
        double profitPer1k,
        double revenuePer1k,
        double costPer1k,
        double impressionRate,

        double ourBidfloor,
        double supplyBidfloor,
        double demandEcpm,
        double srpm
) {}
