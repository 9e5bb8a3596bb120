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
import it.unimi.dsi.fastutil.ints.IntArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import net.larse.ccd.helper.ArrayHelper;
import net.larse.ccd.helper.FitException;
import net.larse.ccd.helper.FitGenerator;
import net.larse.ccd.helper.FittedModel;
import net.larse.ccd.helper.HarmonicMatrix;
import org.apache.commons.math.stat.descriptive.DescriptiveStatistics;
import org.ejml.data.DenseMatrix64F;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Multitemporal outlier mask. A simple seasonal model is fit to a few bands and observations
 * that stray too far from it on any of them are removed from all bands.
 */
public final class TMask {
  private static final Logger log = LoggerFactory.getLogger(TMask.class);

  public static final int GREEN_BAND = 1;
  public static final int SWIR1_BAND = 4;

  /** Bands used for outlier detection unless told otherwise: green and SWIR1. */
  public static final List<Integer> DEFAULT_BANDS =
      Collections.unmodifiableList(Arrays.asList(GREEN_BAND, SWIR1_BAND));

  /** Observations needed to fit the seasonal model over more than a year. */
  public static final int MIN_OBSERVATIONS = 5;

  private static final FitGenerator OLS = new FitGenerator();

  private TMask() {}

  /** Observations that survived the mask. */
  public static final class Result {
    private final double[] times;
    private final double[][] observations;
    private final boolean[] outliers;

    private Result(double[] times, double[][] observations, boolean[] outliers) {
      this.times = times;
      this.observations = observations;
      this.outliers = outliers;
    }

    public double[] getTimes() {
      return times.clone();
    }

    /** [BANDS][getTimes().length] */
    public double[][] getObservations() {
      double[][] copy = new double[observations.length][];
      for (int b = 0; b < observations.length; b++) {
        copy[b] = observations[b].clone();
      }
      return copy;
    }

    /** Whether the observation at index i of the input was removed. */
    public boolean isOutlier(int i) {
      return outliers[i];
    }

    public int getOutlierCount() {
      return ArrayHelper.count(true, outliers);
    }
  }

  public static Result mask(double[] times, double[][] observations, double[] adjustedRmse)
      throws FitException {
    return mask(times, observations, adjustedRmse, DEFAULT_BANDS);
  }

  /**
   * Remove outliers from all bands.
   *
   * @param times ordinal days, strictly increasing
   * @param observations [BANDS][times.length] observed values
   * @param adjustedRmse per band residual threshold, indexed by band
   * @param bands the bands to test for outliers
   * @throws FitException if there are too few observations to fit the seasonal model
   */
  public static Result mask(double[] times, double[][] observations, double[] adjustedRmse,
      List<Integer> bands) throws FitException {
    Preconditions.checkArgument(times.length > 0, "No observations to mask");
    Preconditions.checkArgument(adjustedRmse.length == observations.length,
        "Got %s thresholds for %s bands", adjustedRmse.length, observations.length);
    for (int band : bands) {
      Preconditions.checkArgument(band >= 0 && band < observations.length,
          "Band %s out of range; there are %s bands", band, observations.length);
    }

    DenseMatrix64F matrix = HarmonicMatrix.tmaskMatrix(times);
    boolean[] outliers = new boolean[times.length];

    // An observation is an outlier if it's off on any of the bands.
    for (int band : bands) {
      FittedModel model = OLS.fit(matrix, observations[band]);
      double[] predicted = model.predict(matrix);
      for (int i = 0; i < times.length; i++) {
        if (Math.abs(predicted[i] - observations[band][i]) > adjustedRmse[band]) {
          outliers[i] = true;
        }
      }
    }

    IntArrayList kept = new IntArrayList(times.length);
    for (int i = 0; i < times.length; i++) {
      if (!outliers[i]) {
        kept.add(i);
      }
    }
    int[] indices = kept.toIntArray();

    double[][] cleaned = new double[observations.length][];
    for (int b = 0; b < observations.length; b++) {
      cleaned[b] = ArrayHelper.select(observations[b], indices);
    }

    log.debug("Masked {} of {} observations", times.length - indices.length, times.length);
    return new Result(ArrayHelper.select(times, indices), cleaned, outliers);
  }

  /**
   * Noise floor of each band: the median absolute difference between consecutive
   * observations (median variogram at lag 1).
   *
   * @param times ordinal days, strictly increasing, at least two
   * @param observations [BANDS][times.length] observed values
   */
  public static double[] adjustedRmse(double[] times, double[][] observations) {
    Preconditions.checkArgument(times.length > 1,
        "Need at least two observations, got %s", times.length);

    double[] result = new double[observations.length];
    DescriptiveStatistics stat = new DescriptiveStatistics();
    for (int b = 0; b < observations.length; b++) {
      stat.clear();
      for (int i = 1; i < times.length; i++) {
        stat.addValue(Math.abs(observations[b][i] - observations[b][i - 1]));
      }
      result[b] = stat.getPercentile(50);
    }
    return result;
  }
}
