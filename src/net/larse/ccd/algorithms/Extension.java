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

import java.util.Collections;
import java.util.List;
import net.larse.ccd.helper.FitException;
import net.larse.ccd.helper.Fitter;
import net.larse.ccd.helper.FittedModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Grows a stable window one observation at a time until the observations peeked beyond its
 * end no longer agree with the current models.
 *
 * <p>Accuracy is always tested with the models of the previous step, over the whole window
 * including the peeked observations. Only an accepted step refits the models, so a disturbance
 * is never absorbed into the curve it is tested against.
 */
public final class Extension {
  private static final Logger log = LoggerFactory.getLogger(Extension.class);

  /** Receives every window the extension evaluates, accepted or not. */
  public interface StepListener {
    /**
     * @param window the window before the step; the magnitudes cover window.peek(peekSize)
     * @param models models in force during the evaluation
     * @param magnitudes per band magnitudes over the peeked window
     */
    void evaluated(Window window, List<FittedModel> models, double[] magnitudes);
  }

  private static final StepListener NO_LISTENER = (window, models, magnitudes) -> { };

  private Extension() {}

  /** Final state of an extension. */
  public static final class Result {
    private final int end;
    private final List<FittedModel> models;
    private final double[] magnitudes;

    Result(int end, List<FittedModel> models, double[] magnitudes) {
      this.end = end;
      this.models = Collections.unmodifiableList(models);
      this.magnitudes = magnitudes == null ? null : magnitudes.clone();
    }

    public int getEnd() {
      return end;
    }

    public List<FittedModel> getModels() {
      return models;
    }

    /** Magnitudes of the last evaluated window, or null if no step was attempted. */
    public double[] getMagnitudes() {
      return magnitudes == null ? null : magnitudes.clone();
    }

    public boolean hasMagnitudes() {
      return magnitudes != null;
    }
  }

  public static Result extend(double[] times, double[][] observations, Fitter fitter,
      Window window, int peekSize, List<FittedModel> models) throws FitException {
    return extend(times, observations, fitter, window, peekSize, models,
        WindowStatistics.DEFAULT_ACCURACY_THRESHOLD, NO_LISTENER);
  }

  /**
   * Extend window until a change is detected or the observations run out.
   *
   * @param times ordinal days, strictly increasing
   * @param observations [BANDS][times.length] observed values
   * @param fitter used to refit each band after an accepted step
   * @param window the stable window found by initialization
   * @param peekSize number of observations looked at beyond the window end
   * @param models the models fit over window
   * @param accuracyThreshold magnitude every band must be strictly below
   * @param listener notified of every evaluated window
   * @throws FitException if a band can't be refit
   */
  public static Result extend(double[] times, double[][] observations, Fitter fitter,
      Window window, int peekSize, List<FittedModel> models, double accuracyThreshold,
      StepListener listener) throws FitException {
    if (!Window.enoughSamples(times, window.getEnd(), peekSize)) {
      return new Result(window.getEnd(), models, null);
    }

    double[] magnitudes = null;
    while (Window.enoughSamples(times, window.getEnd(), peekSize)) {
      Window peeked = window.peek(peekSize);
      double[] period = peeked.times(times);
      double[][] spectra = peeked.observations(observations);

      magnitudes = WindowStatistics.magnitudes(models, period, spectra);
      listener.evaluated(window, models, magnitudes);

      if (!WindowStatistics.accurate(magnitudes, accuracyThreshold)) {
        log.debug("Change detected after {}", window);
        break;
      }

      models = fitter.fitAll(period, spectra);
      window = window.grow();
    }

    return new Result(window.getEnd(), models, magnitudes);
  }
}
