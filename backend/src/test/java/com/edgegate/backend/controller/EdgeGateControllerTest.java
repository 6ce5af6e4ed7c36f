package com.edgegate.backend.controller;

import com.edgegate.backend.dto.SignalDecision;
import com.edgegate.backend.dto.SignalEvaluationRequest;
import com.edgegate.backend.exception.InvalidKeyException;
import com.edgegate.backend.model.ConditionDimension;
import com.edgegate.backend.model.Direction;
import com.edgegate.backend.model.MarketRegime;
import com.edgegate.backend.service.risk.BlacklistCheck;
import com.edgegate.backend.service.risk.CombinationKey;
import com.edgegate.backend.service.risk.ConditionContext;
import com.edgegate.backend.service.risk.FailureModeBlacklist;
import com.edgegate.backend.service.risk.TradeQualityScorer;
import com.edgegate.backend.trading.gate.AggregateEdgeStatistics;
import com.edgegate.backend.trading.gate.DecisionResult;
import com.edgegate.backend.trading.gate.EdgeGate;
import com.edgegate.backend.trading.gate.EdgeGateDiagnostics;
import com.edgegate.backend.trading.gate.EdgeStatistics;
import com.edgegate.backend.trading.gate.EdgeStatsKey;
import com.edgegate.backend.trading.gate.EdgeStatsTracker;
import com.edgegate.backend.trading.gate.GateState;
import com.edgegate.backend.trading.gate.SignalAdmissionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(EdgeGateController.class)
class EdgeGateControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SignalAdmissionService signalAdmissionService;

    @MockBean
    private EdgeGateDiagnostics diagnostics;

    @MockBean
    private EdgeStatsTracker edgeStatsTracker;

    @MockBean
    private FailureModeBlacklist failureModeBlacklist;

    @MockBean
    private TradeQualityScorer tradeQualityScorer;

    @Test
    void evaluateReturnsDecision() throws Exception {
        DecisionResult result = DecisionResult.probe(GateState.PROBE_MEDIUM, 0.25, EdgeGate.REASON_PROBE_MEDIUM,
                "percentile=0.800", 0.7);
        when(signalAdmissionService.evaluate(any(SignalEvaluationRequest.class)))
                .thenReturn(SignalDecision.of("BTCUSDT", "LONG", "15m", result, 0.8, false, null, null));

        mockMvc.perform(post("/api/edge-gate/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"symbol":"BTCUSDT","direction":"LONG","timeframe":"15m","netEdge":0.002,"confidence":0.7}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("PROBE_MEDIUM"))
                .andExpect(jsonPath("$.positionMultiplier").value(0.25))
                .andExpect(jsonPath("$.pyramidingAllowed").value(false));
    }

    @Test
    void evaluateRejectsOutOfRangeConfidence() throws Exception {
        mockMvc.perform(post("/api/edge-gate/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"symbol":"BTCUSDT","direction":"LONG","timeframe":"15m","netEdge":0.002,"confidence":1.5}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.details[0].field").value("confidence"));

        verifyNoInteractions(signalAdmissionService);
    }

    @Test
    void evaluateMapsInvalidKeyToBadRequest() throws Exception {
        when(signalAdmissionService.evaluate(any(SignalEvaluationRequest.class)))
                .thenThrow(new InvalidKeyException("invalid symbol: BTC USDT"));

        mockMvc.perform(post("/api/edge-gate/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"symbol":"BTC USDT","direction":"LONG","timeframe":"15m","netEdge":0.002,"confidence":0.7}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("invalid symbol: BTC USDT"));
    }

    @Test
    void statsValidatesKey() throws Exception {
        mockMvc.perform(get("/api/edge-gate/stats/BTCUSDT/LONG/fifteen"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(edgeStatsTracker);
    }

    @Test
    void statsReturnsKeySummary() throws Exception {
        EdgeStatsKey key = new EdgeStatsKey("BTCUSDT", Direction.LONG, "15m");
        when(edgeStatsTracker.getStatistics(key))
                .thenReturn(new EdgeStatistics(key, 120, true, 0.0001, 0.01, 0.003, 0.002, 0.003, 0.004, 0.006));

        mockMvc.perform(get("/api/edge-gate/stats/btcusdt/long/15m"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(120))
                .andExpect(jsonPath("$.sufficient").value(true));
    }

    @Test
    void aggregateStatsListsEveryKey() throws Exception {
        EdgeStatsKey key = new EdgeStatsKey("ETHUSDT", Direction.SHORT, "1h");
        EdgeStatistics stats = new EdgeStatistics(key, 30, false, 0.001, 0.004, 0.002, 0.001, 0.002, 0.003, 0.004);
        when(edgeStatsTracker.getAggregateStatistics())
                .thenReturn(new AggregateEdgeStatistics(1, 30, 0, List.of(stats)));

        mockMvc.perform(get("/api/edge-gate/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalKeys").value(1))
                .andExpect(jsonPath("$.keysWithSufficientData").value(0))
                .andExpect(jsonPath("$.keys[0].count").value(30));
    }

    @Test
    void evaluateRejectsOversizedSignalTypeAndNegativeVolume() throws Exception {
        mockMvc.perform(post("/api/edge-gate/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"symbol":"BTCUSDT","direction":"LONG","timeframe":"15m","netEdge":0.002,"confidence":0.7,
                                 "volumeRatio":-1.0,"signalType":"%s"}
                                """.formatted("x".repeat(51))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.length()").value(2));

        verifyNoInteractions(signalAdmissionService);
    }

    @Test
    void tradeOutcomeIsTalliedAndReturnsCheck() throws Exception {
        when(failureModeBlacklist.check(eq("ema"), any(ConditionContext.class)))
                .thenReturn(new BlacklistCheck(true, "not blacklisted", null));

        mockMvc.perform(post("/api/edge-gate/trade-outcomes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"strategyId":"ema","regime":"RANGING","volatility":0.02,"pnl":-35.5}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.allowed").value(true));

        verify(failureModeBlacklist).recordTradeResult("ema", MarketRegime.RANGING, 0.02, -35.5);
    }

    @Test
    void tradeOutcomeRequiresPnl() throws Exception {
        mockMvc.perform(post("/api/edge-gate/trade-outcomes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"strategyId":"ema","regime":"RANGING"}
                                """))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(failureModeBlacklist);
    }

    @Test
    void removingUnknownCombinationIsNotFound() throws Exception {
        when(failureModeBlacklist.remove(any(CombinationKey.class))).thenReturn(false);

        mockMvc.perform(post("/api/edge-gate/blacklist/remove")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"strategyId":"ema","conditions":{"MARKET_REGIME":"RANGING"}}
                                """))
                .andExpect(status().isNotFound());

        verify(failureModeBlacklist).remove(
                new CombinationKey("ema", Map.of(ConditionDimension.MARKET_REGIME, "RANGING")));
    }

    @Test
    void removingBlacklistedCombinationIsNoContent() throws Exception {
        when(failureModeBlacklist.remove(any(CombinationKey.class))).thenReturn(true);

        mockMvc.perform(post("/api/edge-gate/blacklist/remove")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"strategyId":"ema","conditions":{"TIME_PERIOD":"NIGHT"}}
                                """))
                .andExpect(status().isNoContent());
    }

    @Test
    void blacklistReportAndQualityStatsAreExposed() throws Exception {
        when(failureModeBlacklist.generateReport()).thenReturn("FAILURE MODE BLACKLIST REPORT");
        when(tradeQualityScorer.getStats()).thenReturn(new TradeQualityScorer.QualityStats(10, 7, 3, 71.5));

        mockMvc.perform(get("/api/edge-gate/blacklist/report"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_PLAIN))
                .andExpect(content().string("FAILURE MODE BLACKLIST REPORT"));
        mockMvc.perform(get("/api/edge-gate/quality/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalScored").value(10))
                .andExpect(jsonPath("$.blocked").value(3));
    }

    @Test
    void reportIsPlainText() throws Exception {
        when(diagnostics.generateReport()).thenReturn("EDGE GATE DIAGNOSTIC REPORT");

        mockMvc.perform(get("/api/edge-gate/diagnostics/report"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_PLAIN))
                .andExpect(content().string("EDGE GATE DIAGNOSTIC REPORT"));
    }
}
