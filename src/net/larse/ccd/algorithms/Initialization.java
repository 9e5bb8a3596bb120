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

import java.util.List;
import java.util.OptionalInt;
import net.larse.ccd.helper.FitException;
import net.larse.ccd.helper.Fitter;
import net.larse.ccd.helper.FittedModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the first stable window: the earliest start at which a window of at least windowSize
 * observations, covering at least minSpanDays, is fit by models whose RMSE is within tolerance.
 */
public final class Initialization {
  private static final Logger log = LoggerFactory.getLogger(Initialization.class);

  public static final double DEFAULT_MIN_SPAN_DAYS = 365;

  private Initialization() {}

  public static WindowResult initialize(double[] times, double[][] observations, Fitter fitter,
      int start, int windowSize) throws FitException {
    return initialize(times, observations, fitter, start, windowSize, DEFAULT_MIN_SPAN_DAYS,
        WindowStatistics.DEFAULT_STABILITY_THRESHOLD);
  }

  /**
   * Search for a stable window starting at start, sliding the start forward one observation
   * each time the models are unstable.
   *
   * @param times ordinal days, strictly increasing
   * @param observations [BANDS][times.length] observed values
   * @param fitter used to fit each band
   * @param start index at which the search begins
   * @param windowSize minimum number of observations in the window
   * @param minSpanDays minimum number of days between the first and last observation
   * @param stabilityThreshold RMSE every band must be strictly below
   * @return the stable window, or InsufficientData with the index where the search stopped
   * @throws FitException if a band can't be fit
   */
  public static WindowResult initialize(double[] times, double[][] observations, Fitter fitter,
      int start, int windowSize, double minSpanDays, double stabilityThreshold)
      throws FitException {
    if (!Window.enoughSamples(times, start, windowSize)
        || !Window.enoughTime(times, start, minSpanDays)) {
      return WindowResult.insufficientData(start);
    }

    while (Window.enoughSamples(times, start, windowSize)) {
      // The end can't simply move in lock-step with the start; the time span between
      // observations varies, so search for it again.
      OptionalInt end = Window.findTimeIndex(times, start, windowSize, minSpanDays);
      if (!end.isPresent()) {
        break;
      }

      Window window = new Window(start, end.getAsInt());
      double[] period = window.times(times);
      double[][] spectra = window.observations(observations);
      List<FittedModel> models = fitter.fitAll(period, spectra);
      double[] errors = WindowStatistics.rmse(models, period, spectra);

      if (WindowStatistics.stable(errors, stabilityThreshold)) {
        log.debug("Stable window {} of {} observations", window, window.size());
        return WindowResult.stable(window, models, errors);
      }

      // A disturbance may be inside the window; move on.
      log.debug("Unstable window {}", window);
      start++;
    }

    log.debug("No stable window; search stopped at index {}", start);
    return WindowResult.insufficientData(start);
  }
}
