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
import net.larse.ccd.helper.FittedModel;

/**
 * Outcome of initialization: either a stable window with its models and errors, or the index
 * at which the search ran out of observations.
 */
public abstract class WindowResult {
  private final int start;

  private WindowResult(int start) {
    this.start = start;
  }

  /** Index of the first observation of the window, or where the search stopped. */
  public int getStart() {
    return start;
  }

  public abstract boolean isFound();

  /**
   * @throws IllegalStateException if no stable window was found
   */
  public abstract Found found();

  static Found stable(Window window, List<FittedModel> models, double[] errors) {
    return new Found(window, models, errors);
  }

  static InsufficientData insufficientData(int start) {
    return new InsufficientData(start);
  }

  /** A stable window. */
  public static final class Found extends WindowResult {
    private final Window window;
    private final List<FittedModel> models;
    private final double[] errors;

    private Found(Window window, List<FittedModel> models, double[] errors) {
      super(window.getStart());
      this.window = window;
      this.models = Collections.unmodifiableList(models);
      this.errors = errors.clone();
    }

    public Window getWindow() {
      return window;
    }

    public List<FittedModel> getModels() {
      return models;
    }

    /** RMSE of each band's model over the window. */
    public double[] getErrors() {
      return errors.clone();
    }

    @Override
    public boolean isFound() {
      return true;
    }

    @Override
    public Found found() {
      return this;
    }

    @Override
    public String toString() {
      return "Found" + window;
    }
  }

  /** Not enough observations (or not enough time) remain for a stable window. */
  public static final class InsufficientData extends WindowResult {
    private InsufficientData(int start) {
      super(start);
    }

    @Override
    public boolean isFound() {
      return false;
    }

    @Override
    public Found found() {
      throw new IllegalStateException("No stable window from index " + getStart());
    }

    @Override
    public String toString() {
      return "InsufficientData[" + getStart() + "]";
    }
  }
}
