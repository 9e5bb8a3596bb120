package net.larse.ccd.helper;

import static org.junit.Assert.assertEquals;

import org.ejml.data.DenseMatrix64F;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class HarmonicMatrixTest {

  @Test
  public void testCoefficientMatrix() {
    double t = 730120;
    DenseMatrix64F matrix = HarmonicMatrix.coefficientMatrix(new double[] {t, t + 100});

    assertEquals(2, matrix.getNumRows());
    assertEquals(HarmonicMatrix.NUM_COLUMNS, matrix.getNumCols());
    assertEquals(t, matrix.get(0, 0), 0);
    assertEquals(t + 100, matrix.get(1, 0), 0);
    for (int k = 1; k <= HarmonicMatrix.NUM_HARMONICS; k++) {
      assertEquals(Math.cos(k * HarmonicMatrix.OMEGA * t), matrix.get(0, 2 * k - 1), 1e-12);
      assertEquals(Math.sin(k * HarmonicMatrix.OMEGA * t), matrix.get(0, 2 * k), 1e-12);
    }
  }

  @Test
  public void testAnnualPeriod() {
    double t = 730120;
    DenseMatrix64F matrix =
        HarmonicMatrix.coefficientMatrix(new double[] {t, t + HarmonicMatrix.SIZE_OF_A_YEAR});

    for (int j = 1; j < HarmonicMatrix.NUM_COLUMNS; j++) {
      assertEquals(matrix.get(0, j), matrix.get(1, j), 1e-9);
    }
  }

  @Test
  public void testTmaskMatrixOverSeveralYears() {
    double[] times = {730120, 730120 + 400, 730120 + 1000};
    DenseMatrix64F matrix = HarmonicMatrix.tmaskMatrix(times);

    // 1000 days start 3 years, so the observation cycle is 3 times slower.
    assertEquals(4, matrix.getNumCols());
    double w = HarmonicMatrix.OMEGA;
    assertEquals(Math.cos(w * times[1]), matrix.get(1, 0), 1e-12);
    assertEquals(Math.sin(w * times[1]), matrix.get(1, 1), 1e-12);
    assertEquals(Math.cos(w / 3 * times[1]), matrix.get(1, 2), 1e-12);
    assertEquals(Math.sin(w / 3 * times[1]), matrix.get(1, 3), 1e-12);
  }

  @Test
  public void testTmaskMatrixWithinAYear() {
    DenseMatrix64F matrix = HarmonicMatrix.tmaskMatrix(new double[] {730120, 730300, 730480});

    assertEquals(2, matrix.getNumCols());
  }
}
