package com.kotsin.enrichment.learning;

/**
 * L2-regularised logistic regression over {@link FeatureExtractor} vectors.
 *
 * Fitted with Newton-Raphson. Instances are immutable; retraining produces a new
 * model that replaces the old one atomically.
 */
public final class LogisticErrorModel {

    private static final int MAX_ITERATIONS = 50;
    private static final double CONVERGENCE = 1e-8;
    private static final double MAX_STEP = 5.0;
    // Keeps the Hessian invertible when the intercept is unregularised
    private static final double INTERCEPT_RIDGE = 1e-6;

    private final double[] weights;
    private final double intercept;
    private final int trainingSize;

    private LogisticErrorModel(double[] weights, double intercept, int trainingSize) {
        this.weights = weights;
        this.intercept = intercept;
        this.trainingSize = trainingSize;
    }

    /**
     * @param features n rows of d features
     * @param labels n labels, 1 = error
     * @param l2 ridge penalty on the weights (not the intercept)
     */
    public static LogisticErrorModel fit(double[][] features, int[] labels, double l2) {
        int n = features.length;
        if (n == 0 || labels.length != n) {
            throw new IllegalArgumentException("features and labels must be non-empty and aligned");
        }
        int d = features[0].length;
        int size = d + 1;
        double[] w = new double[size];

        for (int iter = 0; iter < MAX_ITERATIONS; iter++) {
            double[] gradient = new double[size];
            double[][] hessian = new double[size][size];

            for (int i = 0; i < n; i++) {
                double[] x = withIntercept(features[i]);
                double p = sigmoid(dot(w, x));
                double residual = p - labels[i];
                double curvature = p * (1.0 - p);
                for (int a = 0; a < size; a++) {
                    gradient[a] += residual * x[a];
                    double scaled = curvature * x[a];
                    for (int b = a; b < size; b++) {
                        hessian[a][b] += scaled * x[b];
                    }
                }
            }
            for (int a = 0; a < size; a++) {
                for (int b = 0; b < a; b++) {
                    hessian[a][b] = hessian[b][a];
                }
            }
            for (int a = 0; a < d; a++) {
                gradient[a] += l2 * w[a];
                hessian[a][a] += l2;
            }
            hessian[d][d] += INTERCEPT_RIDGE;

            double[] step = solve(hessian, gradient);
            double maxStep = 0.0;
            for (int a = 0; a < size; a++) {
                maxStep = Math.max(maxStep, Math.abs(step[a]));
            }
            double damping = maxStep > MAX_STEP ? MAX_STEP / maxStep : 1.0;
            for (int a = 0; a < size; a++) {
                w[a] -= damping * step[a];
            }
            if (maxStep < CONVERGENCE) {
                break;
            }
        }

        double[] weights = new double[d];
        System.arraycopy(w, 0, weights, 0, d);
        return new LogisticErrorModel(weights, w[d], n);
    }

    public double probability(double[] features) {
        return sigmoid(dot(weights, features) + intercept);
    }

    public double[] getWeights() {
        return weights.clone();
    }

    public double getIntercept() {
        return intercept;
    }

    public int getTrainingSize() {
        return trainingSize;
    }

    private static double[] withIntercept(double[] x) {
        double[] extended = new double[x.length + 1];
        System.arraycopy(x, 0, extended, 0, x.length);
        extended[x.length] = 1.0;
        return extended;
    }

    private static double dot(double[] a, double[] b) {
        double sum = 0.0;
        int len = Math.min(a.length, b.length);
        for (int i = 0; i < len; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    static double sigmoid(double z) {
        if (z >= 0) {
            return 1.0 / (1.0 + Math.exp(-z));
        }
        double e = Math.exp(z);
        return e / (1.0 + e);
    }

    /**
     * Gaussian elimination with partial pivoting. Inputs are not modified.
     */
    private static double[] solve(double[][] matrix, double[] rhs) {
        int n = rhs.length;
        double[][] a = new double[n][];
        for (int i = 0; i < n; i++) {
            a[i] = matrix[i].clone();
        }
        double[] b = rhs.clone();

        for (int col = 0; col < n; col++) {
            int pivot = col;
            for (int row = col + 1; row < n; row++) {
                if (Math.abs(a[row][col]) > Math.abs(a[pivot][col])) {
                    pivot = row;
                }
            }
            if (Math.abs(a[pivot][col]) < 1e-12) {
                throw new IllegalStateException("Singular system while fitting error model");
            }
            double[] tmpRow = a[col];
            a[col] = a[pivot];
            a[pivot] = tmpRow;
            double tmp = b[col];
            b[col] = b[pivot];
            b[pivot] = tmp;

            for (int row = col + 1; row < n; row++) {
                double factor = a[row][col] / a[col][col];
                if (factor == 0.0) {
                    continue;
                }
                for (int k = col; k < n; k++) {
                    a[row][k] -= factor * a[col][k];
                }
                b[row] -= factor * b[col];
            }
        }

        double[] x = new double[n];
        for (int row = n - 1; row >= 0; row--) {
            double sum = b[row];
            for (int k = row + 1; k < n; k++) {
                sum -= a[row][k] * x[k];
            }
            x[row] = sum / a[row][row];
        }
        return x;
    }
}
