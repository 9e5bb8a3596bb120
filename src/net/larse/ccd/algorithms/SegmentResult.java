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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import net.larse.ccd.helper.ArrayHelper;
import net.larse.ccd.helper.FittedModel;

/** Parameters for a single segment */
public final class SegmentResult {
  private final double tStart;   // Time of the first observation of the segment.
  private final double tEnd;     // Time of the observation at the segment's end index.
  private final List<FittedModel> models;
  private final double[] rmse;      // RMSE of each band's fit, from initialization
  private final double[] magnitude; // null if the segment was never extended

  public SegmentResult(double tStart, double tEnd, List<FittedModel> models, double[] rmse,
      double[] magnitude) {
    this.tStart = tStart;
    this.tEnd = tEnd;
    this.models = Collections.unmodifiableList(new ArrayList<>(models));
    this.rmse = rmse.clone();
    this.magnitude = magnitude == null ? null : magnitude.clone();
  }

  public double getStartTime() {
    return tStart;
  }

  public double getEndTime() {
    return tEnd;
  }

  public int getNumberOfBands() {
    return models.size();
  }

  /** One model per band. */
  public List<FittedModel> getModels() {
    return models;
  }

  public double[] getRmse() {
    return rmse.clone();
  }

  /** The magnitude of change of each band, or null if no extension was attempted. */
  public double[] getMagnitude() {
    return magnitude == null ? null : magnitude.clone();
  }

  public boolean hasMagnitude() {
    return magnitude != null;
  }

  public Band getBand(int band) {
    return new Band(magnitude == null ? Double.NaN : magnitude[band], rmse[band],
        models.get(band));
  }

  /** The result for one spectral band. */
  public static final class Band {
    private final double magnitude;
    private final double rmse;
    private final FittedModel model;

    Band(double magnitude, double rmse, FittedModel model) {
      this.magnitude = magnitude;
      this.rmse = rmse;
      this.model = model;
    }

    /** NaN if the segment was never extended. */
    public double getMagnitude() {
      return magnitude;
    }

    public double getRmse() {
      return rmse;
    }

    public double[] getCoefficients() {
      return model.getCoefficients();
    }

    public double getIntercept() {
      return model.getIntercept();
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SegmentResult)) {
      return false;
    }
    SegmentResult other = (SegmentResult) o;
    return Double.compare(tStart, other.tStart) == 0
        && Double.compare(tEnd, other.tEnd) == 0
        && models.equals(other.models)
        && Arrays.equals(rmse, other.rmse)
        && Arrays.equals(magnitude, other.magnitude);
  }

  @Override
  public int hashCode() {
    int result = Double.hashCode(tStart);
    result = 31 * result + Double.hashCode(tEnd);
    result = 31 * result + models.hashCode();
    result = 31 * result + Arrays.hashCode(rmse);
    return 31 * result + Arrays.hashCode(magnitude);
  }

  public String toString() {
    StringBuilder buffer = new StringBuilder();
    buffer.append(tStart);
    buffer.append(",");
    buffer.append(tEnd);
    for (FittedModel model : models) {
      buffer.append(",\n");
      buffer.append(model);
    }
    buffer.append(",\n");
    buffer.append(ArrayHelper.join(rmse, ","));
    buffer.append(",\n");
    buffer.append(magnitude == null ? "" : ArrayHelper.join(magnitude, ","));
    return buffer.toString();
  }
}
