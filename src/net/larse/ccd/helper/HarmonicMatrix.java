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

import org.ejml.data.DenseMatrix64F;

/**
 * Builds the periodic design matrices used to model a time series of observations.
 *
 * <p>The time series model is f(t) = a0 + b0*t + sum_{k=1..3} ak*cos(k*w*t) + bk*sin(k*w*t),
 * with w = 2*pi/365.25. The intercept a0 is not part of the matrix; fitters estimate it
 * separately.
 */
public final class HarmonicMatrix {
  // number of days in a year
  public static final double SIZE_OF_A_YEAR = 365.25;

  // Harmonic scaling term.
  public static final double OMEGA = 2.0 * Math.PI / SIZE_OF_A_YEAR;

  // trend + 3 harmonic pairs
  public static final int NUM_HARMONICS = 3;
  public static final int NUM_COLUMNS = 1 + 2 * NUM_HARMONICS;

  private HarmonicMatrix() {}

  /**
   * Design matrix for the change model: [t, cos(wt), sin(wt), cos(2wt), sin(2wt), cos(3wt),
   * sin(3wt)].
   *
   * @param times ordinal day numbers
   * @return [times.length][NUM_COLUMNS] matrix
   */
  public static DenseMatrix64F coefficientMatrix(double[] times) {
    DenseMatrix64F matrix = new DenseMatrix64F(times.length, NUM_COLUMNS);
    for (int i = 0; i < times.length; i++) {
      double t = times[i];
      matrix.set(i, 0, t);
      int idx = 0;
      for (int k = 1; k <= NUM_HARMONICS; k++) {
        matrix.set(i, ++idx, Math.cos(k * OMEGA * t));
        matrix.set(i, ++idx, Math.sin(k * OMEGA * t));
      }
    }
    return matrix;
  }

  /**
   * Design matrix for the outlier mask: cos/sin of the annual cycle followed by cos/sin of the
   * observation cycle, whose period is the number of (started) years covered by the times.
   *
   * <p>When the times cover at most one year both cycles are the same and only the annual
   * columns are returned.
   *
   * @param times ordinal day numbers, at least one
   * @return [times.length][2 or 4] matrix
   */
  public static DenseMatrix64F tmaskMatrix(double[] times) {
    int years = (int) Math.ceil((times[times.length - 1] - times[0]) / SIZE_OF_A_YEAR);
    boolean observationCycle = years > 1;
    double w2 = OMEGA / years;

    DenseMatrix64F matrix = new DenseMatrix64F(times.length, observationCycle ? 4 : 2);
    for (int i = 0; i < times.length; i++) {
      matrix.set(i, 0, Math.cos(OMEGA * times[i]));
      matrix.set(i, 1, Math.sin(OMEGA * times[i]));
      if (observationCycle) {
        matrix.set(i, 2, Math.cos(w2 * times[i]));
        matrix.set(i, 3, Math.sin(w2 * times[i]));
      }
    }
    return matrix;
  }
}
