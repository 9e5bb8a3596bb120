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

import java.util.ArrayList;
import java.util.List;

/**
 * Fits a regression model to the observations of a single band.
 *
 * <p>Implementations must be deterministic and must not keep state between calls, so one
 * instance can be shared by concurrent detections.
 */
public interface Fitter {
  /**
   * @param times ordinal day numbers of the observations
   * @param values observed values, one per time
   * @return the fitted model
   * @throws FitException if the regression cannot be solved
   */
  FittedModel fit(double[] times, double[] values) throws FitException;

  /**
   * Fit each band independently over the same times.
   *
   * @param observations [BANDS][times.length] observed values
   * @return one model per band, in band order
   */
  default List<FittedModel> fitAll(double[] times, double[][] observations) throws FitException {
    List<FittedModel> models = new ArrayList<>(observations.length);
    for (double[] band : observations) {
      models.add(fit(times, band));
    }
    return models;
  }
}
