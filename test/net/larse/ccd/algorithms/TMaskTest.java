package net.larse.ccd.algorithms;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import net.larse.ccd.helper.FitGenerator;
import net.larse.ccd.helper.HarmonicMatrix;
import org.ejml.data.DenseMatrix64F;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TMaskTest {
  private static final int BANDS = 6;

  private static double[][] seasonal(double[] times) {
    double[][] observations = new double[BANDS][times.length];
    for (int b = 0; b < BANDS; b++) {
      for (int i = 0; i < times.length; i++) {
        observations[b][i] = 100 + 5 * Math.cos(HarmonicMatrix.OMEGA * times[i])
            + 100 * TimeSeries.noise(i, b);
      }
    }
    return observations;
  }

  private static double[] thresholds(double value) {
    double[] thresholds = new double[BANDS];
    Arrays.fill(thresholds, value);
    return thresholds;
  }

  @Test
  public void testRemovesSpikesOnTheMaskBands() throws Exception {
    double[] times = TimeSeries.times(40);
    double[][] observations = seasonal(times);
    observations[TMask.GREEN_BAND][12] += 100;
    observations[TMask.SWIR1_BAND][30] -= 80;

    TMask.Result result = TMask.mask(times, observations, thresholds(20));

    assertEquals(2, result.getOutlierCount());
    assertTrue(result.isOutlier(12));
    assertTrue(result.isOutlier(30));
    assertFalse(result.isOutlier(13));

    double[] kept = result.getTimes();
    assertEquals(38, kept.length);
    assertEquals(times[11], kept[11], 0);
    assertEquals(times[13], kept[12], 0);
    double[][] cleaned = result.getObservations();
    assertEquals(BANDS, cleaned.length);
    for (int b = 0; b < BANDS; b++) {
      assertEquals(38, cleaned[b].length);
      assertEquals(observations[b][13], cleaned[b][12], 0);
      assertEquals(observations[b][31], cleaned[b][29], 0);
    }
  }

  @Test
  public void testOtherBandsAreIgnored() throws Exception {
    double[] times = TimeSeries.times(40);
    double[][] observations = seasonal(times);
    observations[0][12] += 100;

    TMask.Result result = TMask.mask(times, observations, thresholds(20));

    assertEquals(0, result.getOutlierCount());
    assertArrayEquals(times, result.getTimes(), 0);
  }

  @Test
  public void testExplicitBands() throws Exception {
    double[] times = TimeSeries.times(40);
    double[][] observations = seasonal(times);
    observations[0][12] += 100;

    TMask.Result result = TMask.mask(times, observations, thresholds(20), Arrays.asList(0));

    assertEquals(1, result.getOutlierCount());
    assertTrue(result.isOutlier(12));
  }

  @Test
  public void testResultIsASubsequence() throws Exception {
    double[] times = TimeSeries.times(40);
    double[][] observations = seasonal(times);
    observations[TMask.GREEN_BAND][5] += 60;

    // A tight threshold removes more than the spike.
    TMask.Result result = TMask.mask(times, observations, thresholds(1));

    double[] kept = result.getTimes();
    double[][] cleaned = result.getObservations();
    assertTrue(result.isOutlier(5));
    assertEquals(times.length - result.getOutlierCount(), kept.length);
    int j = 0;
    for (int i = 0; i < times.length; i++) {
      if (!result.isOutlier(i)) {
        assertEquals(times[i], kept[j], 0);
        for (int b = 0; b < BANDS; b++) {
          assertEquals(observations[b][i], cleaned[b][j], 0);
        }
        j++;
      }
    }
    assertEquals(kept.length, j);
  }

  /** Every kept observation is within threshold of the seasonal model on every mask band. */
  private static void assertKeptWithinThreshold(double[] times, double[][] observations,
      double[] thresholds, TMask.Result result) throws Exception {
    DenseMatrix64F matrix = HarmonicMatrix.tmaskMatrix(times);
    boolean[] outside = new boolean[times.length];
    for (int band : TMask.DEFAULT_BANDS) {
      double[] predicted = new FitGenerator().fit(matrix, observations[band]).predict(matrix);
      for (int i = 0; i < times.length; i++) {
        double residual = Math.abs(predicted[i] - observations[band][i]);
        if (!result.isOutlier(i)) {
          assertTrue("band " + band + " index " + i, residual <= thresholds[band]);
        }
        outside[i] |= residual > thresholds[band];
      }
    }
    for (int i = 0; i < times.length; i++) {
      assertEquals("index " + i, outside[i], result.isOutlier(i));
    }
  }

  @Test
  public void testKeptResidualsAreWithinThreshold() throws Exception {
    double[] times = TimeSeries.times(40);
    double[][] observations = seasonal(times);
    observations[TMask.GREEN_BAND][12] += 100;
    observations[TMask.SWIR1_BAND][30] -= 80;

    for (double threshold : new double[] {0.5, 1, 5, 20}) {
      double[] thresholds = thresholds(threshold);
      assertKeptWithinThreshold(times, observations, thresholds,
          TMask.mask(times, observations, thresholds));
    }
  }

  @Test
  public void testWithinAYearUsesTheAnnualCycleOnly() throws Exception {
    // 11 steps of 32 days: a single year.
    double[] times = TimeSeries.times(12);
    double[][] observations = new double[BANDS][];
    for (int b = 0; b < BANDS; b++) {
      observations[b] = TimeSeries.flat(12, 100, b);
    }
    observations[TMask.GREEN_BAND][5] += 50;

    TMask.Result result = TMask.mask(times, observations, thresholds(20));

    assertEquals(1, result.getOutlierCount());
    assertTrue(result.isOutlier(5));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBandOutOfRange() throws Exception {
    double[] times = TimeSeries.times(40);
    TMask.mask(times, new double[][] {TimeSeries.flat(40, 1, 0)}, thresholds(1));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testThresholdPerBand() throws Exception {
    double[] times = TimeSeries.times(40);
    TMask.mask(times, seasonal(times), new double[] {20, 20});
  }

  @Test
  public void testAdjustedRmseIsTheMedianStep() {
    double[] times = {1, 2, 3, 4};
    double[][] observations = {{0, 1, 3, 6}, {5, 5, 5, 5}, {0, -4, 0, -4}};

    assertArrayEquals(new double[] {2, 0, 4},
        TMask.adjustedRmse(times, observations), 1e-12);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testAdjustedRmseNeedsTwoObservations() {
    TMask.adjustedRmse(new double[] {1}, new double[][] {{1}});
  }
}
