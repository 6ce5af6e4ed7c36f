package com.edgegate.backend.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PerformanceMathTest {

    @Test
    void profitFactorIsCappedWithoutLosses() {
        assertThat(PerformanceMath.profitFactor(500.0, 0.0)).isEqualTo(PerformanceMath.PROFIT_FACTOR_CAP);
        assertThat(PerformanceMath.profitFactor(0.0, 0.0)).isZero();
        assertThat(PerformanceMath.profitFactor(300.0, 200.0)).isEqualTo(1.5);
    }

    @Test
    void sharpeNeedsDispersion() {
        assertThat(PerformanceMath.sharpe(List.of(0.01), 252)).isZero();
        assertThat(PerformanceMath.sharpe(List.of(0.01, 0.01, 0.01), 252)).isZero();
        assertThat(PerformanceMath.sharpe(List.of(0.02, 0.0), 252)).isCloseTo(Math.sqrt(252), within(1e-9));
    }

    @Test
    void drawdownOfPnlPath() {
        assertThat(PerformanceMath.maxDrawdownOfPnl(List.of(100.0, -30.0, -50.0, 200.0, -60.0))).isEqualTo(80.0);
        assertThat(PerformanceMath.maxDrawdownOfPnl(List.of(-20.0, 10.0))).isEqualTo(20.0);
    }

    @Test
    void winRateOfNoTradesIsZero() {
        assertThat(PerformanceMath.winRate(0, 0)).isZero();
        assertThat(PerformanceMath.winRate(3, 4)).isEqualTo(0.75);
    }
}
