/*
 * Copyright (c) 2015 Zhiqiang Yang.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package net.larse.ccd.helper;

import com.google.common.base.Preconditions;
import org.ejml.data.DenseMatrix64F;

/**
 * LASSO fits of the harmonic time series model by cyclic coordinate descent.
 *
 * <p>Minimizes (1 / 2n) * ||y - Xb - b0||^2 + lambda * ||b||_1. Columns are centered but not
 * scaled, so the intercept is never penalized and lambda is in the units of the observations.
 */
public class LassoFitGenerator implements Fitter {
  // Relative size of the largest coefficient update at which iteration stops.
  private static final double TOLERANCE = 1e-4;

  public static final int DEFAULT_MAX_ITERATIONS = 25000;

  private final int maxIterations;
  private final double lambda;

  public LassoFitGenerator(double lambda) {
    this(DEFAULT_MAX_ITERATIONS, lambda);
  }

  public LassoFitGenerator(int maxIterations, double lambda) {
    Preconditions.checkArgument(maxIterations > 0, "maxIterations must be positive");
    Preconditions.checkArgument(lambda >= 0, "lambda must not be negative");
    this.maxIterations = maxIterations;
    this.lambda = lambda;
  }

  public double getLambda() {
    return lambda;
  }

  public int getMaxIterations() {
    return maxIterations;
  }

  @Override
  public FittedModel fit(double[] times, double[] values) throws FitException {
    Preconditions.checkArgument(times.length == values.length,
        "Got %s times but %s values", times.length, values.length);
    if (times.length == 0) {
      throw new FitException("Can't fit an empty window");
    }

    DenseMatrix64F x = HarmonicMatrix.coefficientMatrix(times);
    int n = x.getNumRows();
    int p = x.getNumCols();

    // center the columns and the target
    double[] xMean = new double[p];
    for (int j = 0; j < p; j++) {
      double sum = 0;
      for (int i = 0; i < n; i++) {
        sum += x.unsafe_get(i, j);
      }
      xMean[j] = sum / n;
    }
    double yMean = 0;
    for (double v : values) {
      yMean += v;
    }
    yMean /= n;

    double[] sumSquares = new double[p];
    for (int i = 0; i < n; i++) {
      for (int j = 0; j < p; j++) {
        double v = x.unsafe_get(i, j) - xMean[j];
        x.unsafe_set(i, j, v);
        sumSquares[j] += v * v;
      }
    }

    double[] residual = new double[n];
    for (int i = 0; i < n; i++) {
      residual[i] = values[i] - yMean;
    }

    double[] beta = new double[p];
    for (int iter = 0; iter < maxIterations; iter++) {
      double maxDelta = 0;
      double maxBeta = 0;
      for (int j = 0; j < p; j++) {
        // a constant column carries no information once centered
        if (sumSquares[j] == 0) {
          continue;
        }
        double old = beta[j];
        double rho = sumSquares[j] * old;
        for (int i = 0; i < n; i++) {
          rho += x.unsafe_get(i, j) * residual[i];
        }
        double updated = softThreshold(rho / n, lambda) / (sumSquares[j] / n);
        double delta = updated - old;
        if (delta != 0) {
          for (int i = 0; i < n; i++) {
            residual[i] -= delta * x.unsafe_get(i, j);
          }
          beta[j] = updated;
        }
        maxDelta = Math.max(maxDelta, Math.abs(delta));
        maxBeta = Math.max(maxBeta, Math.abs(updated));
      }
      if (maxBeta == 0 || maxDelta / maxBeta < TOLERANCE) {
        break;
      }
    }

    double intercept = yMean;
    for (int j = 0; j < p; j++) {
      intercept -= beta[j] * xMean[j];
    }

    if (Double.isNaN(intercept) || Double.isInfinite(intercept)) {
      throw new FitException("LASSO solution is not finite");
    }
    return new FittedModel(beta, intercept);
  }

  private static double softThreshold(double z, double gamma) {
    if (z > gamma) {
      return z - gamma;
    } else if (z < -gamma) {
      return z + gamma;
    }
    return 0;
  }
}
