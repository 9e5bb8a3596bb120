package net.larse.ccd.algorithms;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import net.larse.ccd.helper.FitGenerator;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class InitializationTest {
  private final FitGenerator fitter = new FitGenerator();

  @Test
  public void testStableFromTheStart() throws Exception {
    double[] times = TimeSeries.times(30);
    double[][] observations = {TimeSeries.flat(30, 10, 0), TimeSeries.flat(30, 20, 1)};

    WindowResult result = Initialization.initialize(times, observations, fitter, 0, 16);

    assertTrue(result.isFound());
    WindowResult.Found found = result.found();
    assertEquals(new Window(0, 15), found.getWindow());
    assertEquals(0, found.getStart());
    assertEquals(2, found.getModels().size());
    for (double error : found.getErrors()) {
      assertTrue(error < 0.01);
    }
  }

  @Test
  public void testSlidesPastLeadingDisturbance() throws Exception {
    double[] times = TimeSeries.times(30);
    double[][] observations = new double[3][];
    for (int b = 0; b < 3; b++) {
      observations[b] = TimeSeries.flat(30, 20 + 10 * b, b);
      observations[b][0] += 40;
      observations[b][1] += 40;
    }

    WindowResult result = Initialization.initialize(times, observations, fitter, 0, 16);

    assertTrue(result.isFound());
    assertEquals(new Window(2, 17), result.found().getWindow());
  }

  @Test
  public void testStartsWhereAsked() throws Exception {
    double[] times = TimeSeries.times(30);
    double[][] observations = {TimeSeries.flat(30, 10, 0)};

    WindowResult result = Initialization.initialize(times, observations, fitter, 7, 16);

    assertEquals(new Window(7, 22), result.found().getWindow());
  }

  @Test
  public void testWindowCoversTheMinimumSpan() throws Exception {
    double[] times = TimeSeries.times(40, 16);
    double[][] observations = {TimeSeries.flat(40, 5, 0)};

    WindowResult result = Initialization.initialize(times, observations, fitter, 0, 16);

    assertEquals(new Window(0, 23), result.found().getWindow());
  }

  @Test
  public void testTooFewObservations() throws Exception {
    double[] times = TimeSeries.times(15);
    double[][] observations = {TimeSeries.flat(15, 10, 0)};

    WindowResult result = Initialization.initialize(times, observations, fitter, 0, 16);

    assertFalse(result.isFound());
    assertEquals(0, result.getStart());
  }

  @Test
  public void testTooShortATimeSpan() throws Exception {
    // 19 steps of 16 days fall short of a year.
    double[] times = TimeSeries.times(20, 16);
    double[][] observations = {TimeSeries.flat(20, 10, 0)};

    WindowResult result = Initialization.initialize(times, observations, fitter, 0, 16);

    assertFalse(result.isFound());
  }

  @Test
  public void testNeverStable() throws Exception {
    double[] times = TimeSeries.times(20);
    double[][] observations = new double[1][20];
    for (int i = 0; i < 20; i++) {
      observations[0][i] = i % 2 == 0 ? 0 : 20;
    }

    WindowResult result = Initialization.initialize(times, observations, fitter, 0, 16);

    // Every start from 0 to 4 is tried.
    assertFalse(result.isFound());
    assertEquals(5, result.getStart());
  }

  @Test(expected = IllegalStateException.class)
  public void testNoWindowWhenNotFound() throws Exception {
    double[] times = TimeSeries.times(10);
    Initialization.initialize(times, new double[][] {TimeSeries.flat(10, 1, 0)}, fitter, 0, 16)
        .found();
  }

  @Test
  public void testCustomStabilityThreshold() throws Exception {
    double[] times = TimeSeries.times(20);
    double[][] observations = new double[1][20];
    for (int i = 0; i < 20; i++) {
      observations[0][i] = i % 2 == 0 ? 0 : 20;
    }

    WindowResult result = Initialization.initialize(times, observations, fitter, 0, 16,
        Initialization.DEFAULT_MIN_SPAN_DAYS, 20);

    assertEquals(new Window(0, 15), result.found().getWindow());
  }
}
