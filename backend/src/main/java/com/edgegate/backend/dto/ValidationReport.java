package com.edgegate.backend.dto;

import com.edgegate.backend.model.BacktestResult;
import com.edgegate.backend.model.FailurePattern;
import com.edgegate.backend.model.WalkForwardResult;

import java.util.List;

public record ValidationReport(
        BacktestResult backtest,
        WalkForwardResult walkForward,
        AdmissionDecision admission,
        List<FailurePattern> failurePatterns
) {}
