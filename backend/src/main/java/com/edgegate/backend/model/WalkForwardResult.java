package com.edgegate.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WalkForwardResult {

    public static final String REASON_INSUFFICIENT_DATA = "insufficient data";
    public static final String REASON_LOW_CONSISTENCY = "consistency below minimum";
    public static final String REASON_DEGRADATION = "average degradation above limit";
    public static final String REASON_LOW_TEST_WIN_RATE = "test win rate below minimum";
    public static final String REASON_NON_POSITIVE_TEST_PNL = "non-positive total test pnl";
    public static final String REASON_WINDOW_FAILED = "window simulation failed";

    private String strategyId;
    private String version;

    @Builder.Default
    private List<WalkForwardWindow> windows = new ArrayList<>();

    private int totalWindows;
    private int passedWindows;
    private double consistencyScore;
    private double avgTrainPnl;
    private double avgTestPnl;
    private double avgDegradation;
    private double testWinRate;
    private double totalTestPnl;

    private boolean passed;
    @Builder.Default
    private List<String> failureReasons = new ArrayList<>();

    public String getPrimaryFailureReason() {
        return failureReasons.isEmpty() ? null : failureReasons.get(0);
    }
}
