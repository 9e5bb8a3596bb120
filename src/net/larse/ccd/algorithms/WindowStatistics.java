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
package net.larse.ccd.algorithms;

import com.google.common.base.Preconditions;
import java.util.List;
import net.larse.ccd.helper.ArrayHelper;
import net.larse.ccd.helper.FittedModel;
import net.larse.ccd.helper.HarmonicMatrix;
import org.ejml.data.DenseMatrix64F;

/**
 * Fit statistics of per-band models over a window of observations.
 *
 * <p>RMSE is normalized by the window length and gates initialization; magnitude is the plain
 * 2-norm of the residuals and gates extension.
 */
public final class WindowStatistics {
  public static final double DEFAULT_STABILITY_THRESHOLD = 2.0;
  public static final double DEFAULT_ACCURACY_THRESHOLD = 0.99;

  private WindowStatistics() {}

  /**
   * RMSE of each band's model over the window.
   *
   * @param models one model per band
   * @param times ordinal days of the window
   * @param observations [BANDS][times.length] observed values
   */
  public static double[] rmse(List<FittedModel> models, double[] times, double[][] observations) {
    double[] errors = magnitudes(models, times, observations);
    double scale = Math.sqrt(times.length);
    for (int b = 0; b < errors.length; b++) {
      errors[b] /= scale;
    }
    return errors;
  }

  /** True if every error is strictly below threshold. */
  public static boolean stable(double[] errors, double threshold) {
    return allBelow(errors, threshold);
  }

  public static boolean stable(double[] errors) {
    return stable(errors, DEFAULT_STABILITY_THRESHOLD);
  }

  /**
   * 2-norm of the difference between predicted and observed values of each band over the whole
   * window.
   */
  public static double[] magnitudes(
      List<FittedModel> models, double[] times, double[][] observations) {
    Preconditions.checkArgument(models.size() == observations.length,
        "Got %s models for %s bands", models.size(), observations.length);

    DenseMatrix64F matrix = HarmonicMatrix.coefficientMatrix(times);
    double[] result = new double[models.size()];
    for (int b = 0; b < result.length; b++) {
      double[] predicted = models.get(b).predict(matrix);
      result[b] = ArrayHelper.distance(predicted, observations[b]);
    }
    return result;
  }

  /** True if every magnitude is strictly below threshold. */
  public static boolean accurate(double[] magnitudes, double threshold) {
    return allBelow(magnitudes, threshold);
  }

  public static boolean accurate(double[] magnitudes) {
    return accurate(magnitudes, DEFAULT_ACCURACY_THRESHOLD);
  }

  private static boolean allBelow(double[] values, double threshold) {
    for (double v : values) {
      // NaN never passes
      if (!(v < threshold)) {
        return false;
      }
    }
    return true;
  }
}
