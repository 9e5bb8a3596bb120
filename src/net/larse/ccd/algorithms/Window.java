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
import java.util.OptionalInt;
import net.larse.ccd.helper.ArrayHelper;

/**
 * An immutable range [start, end) of observation indices.
 *
 * <p>Windows are never modified; sliding or growing one produces a new window.
 */
public final class Window {
  private final int start;
  private final int end;

  public Window(int start, int end) {
    Preconditions.checkArgument(start >= 0 && start <= end,
        "Invalid window [%s, %s)", start, end);
    this.start = start;
    this.end = end;
  }

  public int getStart() {
    return start;
  }

  public int getEnd() {
    return end;
  }

  public int size() {
    return end - start;
  }

  /** The window with one more observation at the end. */
  public Window grow() {
    return new Window(start, end + 1);
  }

  /** The window including the next peekSize observations after its end. */
  public Window peek(int peekSize) {
    return new Window(start, end + peekSize);
  }

  public double[] times(double[] times) {
    return ArrayHelper.slice(times, start, end);
  }

  public double[][] observations(double[][] observations) {
    return ArrayHelper.slice(observations, start, end);
  }

  /** Index of the last observation of a window of the given size starting at start. */
  public static int endIndex(int start, int size) {
    return start + size - 1;
  }

  /** True if at least size observations remain from start onward. */
  public static boolean enoughSamples(double[] times, int start, int size) {
    return start + size <= times.length;
  }

  /** True if the last observation is at least minSpanDays after the one at start. */
  public static boolean enoughTime(double[] times, int start, double minSpanDays) {
    return times[times.length - 1] - times[start] >= minSpanDays;
  }

  /**
   * Find the first index, at or after endIndex(start, size), whose time is at least minSpanDays
   * after times[start].
   *
   * @return the index, or empty if no observation is far enough from start
   */
  public static OptionalInt findTimeIndex(
      double[] times, int start, int size, double minSpanDays) {
    // If the last time is too close, scanning is futile.
    if (!enoughTime(times, start, minSpanDays)) {
      return OptionalInt.empty();
    }

    for (int end = endIndex(start, size); end < times.length; end++) {
      if (times[end] - times[start] >= minSpanDays) {
        return OptionalInt.of(end);
      }
    }
    return OptionalInt.empty();
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Window)) {
      return false;
    }
    Window other = (Window) o;
    return start == other.start && end == other.end;
  }

  @Override
  public int hashCode() {
    return 31 * start + end;
  }

  @Override
  public String toString() {
    return "[" + start + ", " + end + ")";
  }
}
