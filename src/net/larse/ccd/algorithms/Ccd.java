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
import java.util.ArrayList;
import java.util.List;
import net.larse.ccd.helper.FitException;
import net.larse.ccd.helper.Fitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Continuous change detection for a single pixel.
 *
 * <p>Detection alternates two steps until the observations run out: initialization finds a
 * stable window, then extension grows it until the observations stop matching the models.
 * Every such window becomes one segment, and the search for the next one starts where the
 * previous one ended.
 *
 * <p>Everything a run needs is passed in; nothing is shared between runs, so pixels may be
 * processed concurrently.
 */
public class Ccd {
  private static final Logger log = LoggerFactory.getLogger(Ccd.class);

  public static class Args {
    /** Minimum number of observations in an initial window. */
    public int windowSize = 16;

    /** Number of observations looked at beyond the window end when testing for change. */
    public int peekSize = 3;

    /** Minimum number of days covered by an initial window. */
    public double minSpanDays = Initialization.DEFAULT_MIN_SPAN_DAYS;

    /** RMSE every band must be strictly below for a window to be stable. */
    public double stabilityThreshold = WindowStatistics.DEFAULT_STABILITY_THRESHOLD;

    /** Change magnitude every band must be strictly below to extend a window. */
    public double accuracyThreshold = WindowStatistics.DEFAULT_ACCURACY_THRESHOLD;

    /**
     * Indexes of the bands used for outlier masking, typically TMask.DEFAULT_BANDS. If null,
     * the outlier mask is not applied.
     */
    public List<Integer> tmaskBands = null;

    /** Outlier threshold, in multiples of each band's adjusted RMSE. */
    public double tmaskScale = 4.89;

    /**
     * Lower bound on the adjusted RMSE used for outlier masking. Bands of integer values often
     * repeat themselves, which makes their median step 0.
     */
    public double tmaskMinRmse = 0;

    public Args copy() {
      Args copy = new Args();
      copy.windowSize = windowSize;
      copy.peekSize = peekSize;
      copy.minSpanDays = minSpanDays;
      copy.stabilityThreshold = stabilityThreshold;
      copy.accuracyThreshold = accuracyThreshold;
      copy.tmaskBands = tmaskBands == null ? null : new ArrayList<>(tmaskBands);
      copy.tmaskScale = tmaskScale;
      copy.tmaskMinRmse = tmaskMinRmse;
      return copy;
    }

    /**
     * @throws IllegalArgumentException if any value is out of range
     */
    public Args validate() {
      // A window of one observation could end where it starts.
      Preconditions.checkArgument(windowSize >= 2, "windowSize must be at least 2: %s",
          windowSize);
      Preconditions.checkArgument(peekSize >= 1, "peekSize must be positive: %s", peekSize);
      Preconditions.checkArgument(minSpanDays >= 0, "minSpanDays must not be negative: %s",
          minSpanDays);
      Preconditions.checkArgument(stabilityThreshold > 0,
          "stabilityThreshold must be positive: %s", stabilityThreshold);
      Preconditions.checkArgument(accuracyThreshold > 0,
          "accuracyThreshold must be positive: %s", accuracyThreshold);
      Preconditions.checkArgument(tmaskScale > 0, "tmaskScale must be positive: %s", tmaskScale);
      Preconditions.checkArgument(tmaskMinRmse >= 0, "tmaskMinRmse must not be negative: %s",
          tmaskMinRmse);
      return this;
    }
  }

  private final Args args;
  private final Fitter fitter;

  public Ccd(Fitter fitter) {
    this(new Args(), fitter);
  }

  public Ccd(Args args, Fitter fitter) {
    this.args = args.copy().validate();
    this.fitter = Preconditions.checkNotNull(fitter);
  }

  /**
   * Run the outlier mask, if configured, and then change detection for a single pixel.
   *
   * @param y [BANDS][NUM_OBSERVATIONS] array of time series of spectral values
   * @param x ordinal days of the observations, strictly increasing
   * @return the segments, in chronological order
   * @throws FitException if a regression can't be solved
   */
  public List<SegmentResult> getResult(double[][] y, double[] x) throws FitException {
    checkInputs(x, y);

    double[] times = x;
    double[][] observations = y;
    if (args.tmaskBands != null
        && x.length >= Math.max(args.windowSize, TMask.MIN_OBSERVATIONS)) {
      TMask.Result masked =
          TMask.mask(x, y, tmaskThresholds(TMask.adjustedRmse(x, y), args), args.tmaskBands);
      double[] kept = masked.getTimes();
      // Too little left to start a segment; detect on the unmasked series instead.
      if (kept.length < args.windowSize || !Window.enoughTime(kept, 0, args.minSpanDays)) {
        log.debug("Outlier mask kept {} of {} observations; not applied", kept.length,
            x.length);
      } else {
        times = kept;
        observations = masked.getObservations();
      }
    }

    List<SegmentResult> results = run(times, observations, fitter, args, false);
    log.debug("Detected {} segments in {} observations", results.size(), times.length);
    return results;
  }

  /** Per band outlier thresholds: tmaskScale times the adjusted RMSE, floored at tmaskMinRmse. */
  static double[] tmaskThresholds(double[] adjustedRmse, Args args) {
    double[] thresholds = new double[adjustedRmse.length];
    for (int b = 0; b < thresholds.length; b++) {
      thresholds[b] = args.tmaskScale * Math.max(adjustedRmse[b], args.tmaskMinRmse);
    }
    return thresholds;
  }

  public static List<SegmentResult> detect(double[] times, double[][] observations,
      Fitter fitter) throws FitException {
    return detect(times, observations, fitter, new Args());
  }

  /**
   * Detect change in observations that have already been cleaned.
   *
   * @param times ordinal days, strictly increasing
   * @param observations [BANDS][times.length] observed values
   * @param fitter used to model each band
   * @param args window sizes and thresholds; tmaskBands is ignored
   * @return one result per segment, in chronological order; empty if there are too few
   *     observations
   * @throws FitException if a regression can't be solved
   */
  public static List<SegmentResult> detect(double[] times, double[][] observations,
      Fitter fitter, Args args) throws FitException {
    checkInputs(times, observations);
    return run(times, observations, fitter, args.copy().validate(), false);
  }

  /**
   * Like detect, but reports every window evaluated while extending instead of one result per
   * segment. A segment that could not be extended at all is reported as its initial window,
   * without magnitudes.
   */
  public static List<SegmentResult> detectWindows(double[] times, double[][] observations,
      Fitter fitter, Args args) throws FitException {
    checkInputs(times, observations);
    return run(times, observations, fitter, args.copy().validate(), true);
  }

  private static List<SegmentResult> run(double[] times, double[][] observations,
      Fitter fitter, Args args, boolean everyWindow) throws FitException {
    List<SegmentResult> results = new ArrayList<>();

    int start = 0;
    while (Window.enoughSamples(times, start, args.windowSize)) {
      // Step 1: find a stable window.
      WindowResult init = Initialization.initialize(times, observations, fitter, start,
          args.windowSize, args.minSpanDays, args.stabilityThreshold);
      if (!init.isFound()) {
        break;
      }
      WindowResult.Found found = init.found();
      double[] errors = found.getErrors();

      // Step 2: extend it until a change is detected.
      List<SegmentResult> steps = new ArrayList<>();
      Extension.StepListener listener = (window, models, magnitudes) -> {
        if (everyWindow) {
          steps.add(new SegmentResult(times[window.getStart()], times[window.getEnd()],
              models, errors, magnitudes));
        }
      };
      Extension.Result extended = Extension.extend(times, observations, fitter,
          found.getWindow(), args.peekSize, found.getModels(), args.accuracyThreshold,
          listener);

      if (steps.isEmpty()) {
        // A single peeked observation lets the window grow past the last index.
        int end = Math.min(extended.getEnd(), times.length - 1);
        SegmentResult segment = new SegmentResult(times[found.getStart()], times[end],
            extended.getModels(), errors, extended.getMagnitudes());
        log.debug("Segment [{}, {}] from window {}", segment.getStartTime(),
            segment.getEndTime(), found.getWindow());
        results.add(segment);
      } else {
        results.addAll(steps);
      }

      // Step 3: the next segment starts where this one ended.
      start = extended.getEnd();
    }

    return results;
  }

  private static void checkInputs(double[] times, double[][] observations) {
    Preconditions.checkArgument(observations.length > 0, "No bands");
    for (int b = 0; b < observations.length; b++) {
      Preconditions.checkArgument(observations[b].length == times.length,
          "Band %s has %s observations, expected %s", b, observations[b].length, times.length);
    }
    for (int i = 1; i < times.length; i++) {
      Preconditions.checkArgument(times[i] > times[i - 1],
          "Times must be strictly increasing; index %s", i);
    }
  }
}
