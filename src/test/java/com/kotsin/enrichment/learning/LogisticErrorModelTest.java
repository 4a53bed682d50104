package com.kotsin.enrichment.learning;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogisticErrorModel - Comprehensive Tests")
class LogisticErrorModelTest {

    @Test
    @DisplayName("Sigmoid should be bounded and symmetric")
    void testSigmoid() {
        assertEquals(0.5, LogisticErrorModel.sigmoid(0), 1e-12);
        assertEquals(1.0 - LogisticErrorModel.sigmoid(2.0), LogisticErrorModel.sigmoid(-2.0), 1e-12);
        assertTrue(LogisticErrorModel.sigmoid(1_000) <= 1.0);
        assertTrue(LogisticErrorModel.sigmoid(-1_000) >= 0.0);
    }

    @Test
    @DisplayName("Should separate a feature that predicts failure")
    void testLearnsSeparatingFeature() {
        int n = 60;
        double[][] x = new double[n][];
        int[] y = new int[n];
        for (int i = 0; i < n; i++) {
            boolean risky = i % 2 == 0;
            x[i] = new double[]{risky ? 1.0 : 0.0, 0.3};
            y[i] = risky ? 1 : 0;
        }

        LogisticErrorModel model = LogisticErrorModel.fit(x, y, 1.0);

        assertTrue(model.probability(new double[]{1.0, 0.3}) > 0.7);
        assertTrue(model.probability(new double[]{0.0, 0.3}) < 0.3);
        assertTrue(model.getWeights()[0] > 0);
        assertEquals(n, model.getTrainingSize());
    }

    @Test
    @DisplayName("Regularisation should keep weights finite on perfectly separable data")
    void testFiniteOnSeparableData() {
        double[][] x = {{1.0}, {1.0}, {0.0}, {0.0}};
        int[] y = {1, 1, 0, 0};

        LogisticErrorModel model = LogisticErrorModel.fit(x, y, 1.0);

        assertTrue(Double.isFinite(model.getWeights()[0]));
        assertTrue(Double.isFinite(model.getIntercept()));
        double p = model.probability(new double[]{1.0});
        assertTrue(p > 0.5 && p < 1.0);
    }

    @Test
    @DisplayName("Balanced labels with no signal should predict near one half")
    void testNoSignal() {
        double[][] x = new double[40][];
        int[] y = new int[40];
        for (int i = 0; i < 40; i++) {
            x[i] = new double[]{0.5};
            y[i] = i % 2;
        }

        LogisticErrorModel model = LogisticErrorModel.fit(x, y, 1.0);

        assertEquals(0.5, model.probability(new double[]{0.5}), 0.05);
    }
}
