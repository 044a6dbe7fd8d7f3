/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.radio2zarr;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

import com.google.common.base.Suppliers;

/**
 * A named-dimension array within a {@link Dataset}.  Data is either held
 * in memory or loaded on first access.
 */
public class Variable {

  private final List<String> dimensions;
  private final int[] shape;
  private final PixelType pixelType;
  private final Supplier<NdArray> data;

  /**
   * Create a variable over in-memory data.
   *
   * @param dimensions one dimension name per array axis
   * @param data array values
   */
  public Variable(List<String> dimensions, NdArray data) {
    this(dimensions, data.getShape(), data.getPixelType(),
      Suppliers.ofInstance(data));
  }

  /**
   * Create a variable whose data is loaded at most once, on first access.
   *
   * @param dimensions one dimension name per array axis
   * @param shape array shape
   * @param type element type
   * @param loader source of the array values
   */
  public Variable(List<String> dimensions, int[] shape, PixelType type,
    Supplier<NdArray> loader)
  {
    if (dimensions.size() != shape.length) {
      throw new IllegalArgumentException("Dimensions " + dimensions +
        " do not match shape " + Arrays.toString(shape));
    }
    if (dimensions.size() != dimensions.stream().distinct().count()) {
      throw new IllegalArgumentException(
        "Duplicate dimension in " + dimensions);
    }
    this.dimensions = Collections.unmodifiableList(
      new ArrayList<String>(dimensions));
    this.shape = shape.clone();
    this.pixelType = type;
    this.data = Suppliers.memoize(loader::get);
  }

  public List<String> getDimensions() {
    return dimensions;
  }

  public int[] getShape() {
    return shape.clone();
  }

  public PixelType getPixelType() {
    return pixelType;
  }

  /**
   * @param dimension dimension name
   * @return length of the named dimension, or -1 if not present
   */
  public int getLength(String dimension) {
    int index = dimensions.indexOf(dimension);
    return index < 0 ? -1 : shape[index];
  }

  /**
   * @return array values, loading them if necessary
   */
  public NdArray getData() {
    NdArray values = data.get();
    if (!Arrays.equals(values.getShape(), shape)) {
      throw new IllegalStateException("Loaded shape " +
        Arrays.toString(values.getShape()) + " does not match " +
        Arrays.toString(shape));
    }
    return values;
  }

  /**
   * Reorder dimensions so that the named dimensions come last, in the
   * given order.  Dimensions not named keep their relative order and are
   * placed first; named dimensions this variable lacks are ignored.
   *
   * @param order trailing dimension order
   * @return this variable if already ordered, otherwise a transposed copy
   */
  public Variable transpose(List<String> order) {
    List<String> reordered = new ArrayList<String>();
    for (String dim : dimensions) {
      if (!order.contains(dim)) {
        reordered.add(dim);
      }
    }
    for (String dim : order) {
      if (dimensions.contains(dim)) {
        reordered.add(dim);
      }
    }
    if (reordered.equals(dimensions)) {
      return this;
    }
    int[] permutation = new int[reordered.size()];
    for (int i=0; i<permutation.length; i++) {
      permutation[i] = dimensions.indexOf(reordered.get(i));
    }
    return new Variable(reordered, getData().transpose(permutation));
  }

  /**
   * @param dimension dimension to slice
   * @param start first index to keep
   * @param length number of indexes to keep
   * @return new in-memory variable
   */
  public Variable slice(String dimension, int start, int length) {
    int axis = dimensions.indexOf(dimension);
    if (axis < 0) {
      throw new IllegalArgumentException(
        "No dimension " + dimension + " in " + dimensions);
    }
    return new Variable(dimensions, getData().slice(axis, start, length));
  }

  @Override
  public String toString() {
    return "Variable" + dimensions + Arrays.toString(shape) + " " + pixelType;
  }

}
