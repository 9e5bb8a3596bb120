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
import java.util.Arrays;
import org.ejml.data.DenseMatrix64F;

/**
 * An immutable regression model: an intercept plus one coefficient per design matrix column.
 */
public final class FittedModel {
  private final double[] coefficients;
  private final double intercept;

  public FittedModel(double[] coefficients, double intercept) {
    this.coefficients = coefficients.clone();
    this.intercept = intercept;
  }

  /**
   * Predict one value per row of the design matrix.
   *
   * @param design [n][coefficients.length] design matrix
   */
  public double[] predict(DenseMatrix64F design) {
    Preconditions.checkArgument(design.getNumCols() == coefficients.length,
        "Design matrix has %s columns, model has %s coefficients",
        design.getNumCols(), coefficients.length);

    double[] predicted = new double[design.getNumRows()];
    for (int i = 0; i < predicted.length; i++) {
      double v = intercept;
      for (int j = 0; j < coefficients.length; j++) {
        v += coefficients[j] * design.unsafe_get(i, j);
      }
      predicted[i] = v;
    }
    return predicted;
  }

  public double[] getCoefficients() {
    return coefficients.clone();
  }

  public double getIntercept() {
    return intercept;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FittedModel)) {
      return false;
    }
    FittedModel other = (FittedModel) o;
    return Double.compare(intercept, other.intercept) == 0
        && Arrays.equals(coefficients, other.coefficients);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(coefficients) + Double.hashCode(intercept);
  }

  @Override
  public String toString() {
    return intercept + "," + ArrayHelper.join(coefficients, ",");
  }
}
