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
import org.ejml.factory.LinearSolverFactory;
import org.ejml.interfaces.linsol.LinearSolver;

/**
 * Ordinary least squares fits of the harmonic time series model, with intercept.
 *
 * <p>Instances are stateless; the working matrices are allocated per fit.
 */
public class FitGenerator implements Fitter {

  @Override
  public FittedModel fit(double[] times, double[] values) throws FitException {
    return fit(HarmonicMatrix.coefficientMatrix(times), values);
  }

  /**
   * Fit values against an arbitrary design matrix. A column of ones is prepended for the
   * intercept.
   *
   * @param design [n][p] design matrix without intercept column
   * @param values n observed values
   * @throws FitException if there are fewer than p + 1 rows or the system can't be solved
   */
  public FittedModel fit(DenseMatrix64F design, double[] values) throws FitException {
    Preconditions.checkArgument(design.getNumRows() == values.length,
        "Design matrix has %s rows but there are %s values", design.getNumRows(), values.length);

    int numRows = design.getNumRows();
    int numCols = design.getNumCols() + 1;
    if (numRows < numCols) {
      throw new FitException(
          String.format("Need at least %d observations to fit %d unknowns, got %d",
              numCols, numCols, numRows));
    }

    DenseMatrix64F matrixA = new DenseMatrix64F(numRows, numCols);
    DenseMatrix64F matrixB = new DenseMatrix64F(numRows, 1);
    for (int i = 0; i < numRows; i++) {
      matrixA.set(i, 0, 1);
      for (int j = 1; j < numCols; j++) {
        matrixA.set(i, j, design.get(i, j - 1));
      }
      matrixB.set(i, 0, values[i]);
    }

    double[] solution = linearFit(matrixA, matrixB);
    double[] coefficients = new double[numCols - 1];
    System.arraycopy(solution, 1, coefficients, 0, coefficients.length);
    return new FittedModel(coefficients, solution[0]);
  }

  private static double[] linearFit(DenseMatrix64F matrixA, DenseMatrix64F matrixB)
      throws FitException {
    LinearSolver<DenseMatrix64F> solver =
        LinearSolverFactory.leastSquares(matrixA.getNumRows(), matrixA.getNumCols());
    if (!solver.setA(matrixA) || solver.quality() == 0) {
      throw new FitException("Design matrix is singular");
    }

    DenseMatrix64F matrixX = new DenseMatrix64F(matrixA.getNumCols(), 1);
    solver.solve(matrixB, matrixX);

    double[] solution = matrixX.getData();
    for (double v : solution) {
      if (Double.isNaN(v) || Double.isInfinite(v)) {
        throw new FitException("Least squares solution is not finite");
      }
    }
    return solution;
  }
}
