/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.radio2zarr;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

/**
 * Row-major (C order) multi-dimensional array backed by a single
 * primitive array.  The backing array is one of <code>float[]</code>,
 * <code>double[]</code> or <code>boolean[]</code> depending on the
 * {@link PixelType}.
 */
public final class NdArray {

  private final PixelType pixelType;
  private final int[] shape;
  private final int[] strides;
  private final Object storage;

  private NdArray(PixelType type, int[] shape, Object storage) {
    this.pixelType = type;
    this.shape = shape.clone();
    this.strides = getStrides(this.shape);
    this.storage = storage;
    int length = getLength(type, storage);
    if (length != getSize(this.shape)) {
      throw new IllegalArgumentException("Storage length " + length +
        " does not match shape " + Arrays.toString(shape));
    }
  }

  private static int getLength(PixelType type, Object storage) {
    switch (type) {
      case FLOAT32:
        return ((float[]) storage).length;
      case FLOAT64:
        return ((double[]) storage).length;
      case BOOL:
        return ((boolean[]) storage).length;
      default:
        throw new IllegalArgumentException("Unsupported pixel type: " + type);
    }
  }

  /**
   * Create a zero-filled array.
   *
   * @param type element type
   * @param shape array shape
   * @return new array
   */
  public static NdArray create(PixelType type, int[] shape) {
    int size = getSize(shape);
    switch (type) {
      case FLOAT32:
        return new NdArray(type, shape, new float[size]);
      case FLOAT64:
        return new NdArray(type, shape, new double[size]);
      case BOOL:
        return new NdArray(type, shape, new boolean[size]);
      default:
        throw new IllegalArgumentException("Unsupported pixel type: " + type);
    }
  }

  /**
   * Create an array with every element set to the given value.
   * For boolean arrays any non-zero value is <code>true</code>.
   *
   * @param type element type
   * @param shape array shape
   * @param value fill value
   * @return new array
   */
  public static NdArray filled(PixelType type, int[] shape, double value) {
    NdArray array = create(type, shape);
    switch (type) {
      case FLOAT32:
        Arrays.fill((float[]) array.storage, (float) value);
        break;
      case FLOAT64:
        Arrays.fill((double[]) array.storage, value);
        break;
      case BOOL:
        Arrays.fill((boolean[]) array.storage, value != 0);
        break;
      default:
        throw new IllegalArgumentException("Unsupported pixel type: " + type);
    }
    return array;
  }

  public static NdArray wrap(float[] data, int... shape) {
    return new NdArray(PixelType.FLOAT32, shape, data);
  }

  public static NdArray wrap(double[] data, int... shape) {
    return new NdArray(PixelType.FLOAT64, shape, data);
  }

  public static NdArray wrap(boolean[] data, int... shape) {
    return new NdArray(PixelType.BOOL, shape, data);
  }

  /**
   * Decode an array from its raw (uncompressed) byte representation.
   *
   * @param type element type
   * @param shape array shape
   * @param bytes encoded elements in row-major order
   * @param order byte order of the encoded elements
   * @return decoded array
   */
  public static NdArray fromBytes(
      PixelType type, int[] shape, byte[] bytes, ByteOrder order)
  {
    int size = getSize(shape);
    if (bytes.length != size * type.getBytesPerPixel()) {
      throw new IllegalArgumentException("Expected " +
        size * type.getBytesPerPixel() + " bytes, found " + bytes.length);
    }
    ByteBuffer buffer = ByteBuffer.wrap(bytes).order(order);
    switch (type) {
      case FLOAT32: {
        float[] values = new float[size];
        buffer.asFloatBuffer().get(values);
        return wrap(values, shape);
      }
      case FLOAT64: {
        double[] values = new double[size];
        buffer.asDoubleBuffer().get(values);
        return wrap(values, shape);
      }
      case BOOL: {
        boolean[] values = new boolean[size];
        for (int i=0; i<size; i++) {
          values[i] = bytes[i] != 0;
        }
        return wrap(values, shape);
      }
      default:
        throw new IllegalArgumentException("Unsupported pixel type: " + type);
    }
  }

  public PixelType getPixelType() {
    return pixelType;
  }

  public int[] getShape() {
    return shape.clone();
  }

  public int getRank() {
    return shape.length;
  }

  public int getSize() {
    return getSize(shape);
  }

  /**
   * @param index flat (row-major) element index
   * @return element value, booleans as 0 or 1
   */
  public double getDouble(int index) {
    switch (pixelType) {
      case FLOAT32:
        return ((float[]) storage)[index];
      case FLOAT64:
        return ((double[]) storage)[index];
      case BOOL:
        return ((boolean[]) storage)[index] ? 1 : 0;
      default:
        throw new IllegalStateException("Unsupported pixel type: " + pixelType);
    }
  }

  /**
   * @param position one index per axis
   * @return element value, booleans as 0 or 1
   */
  public double getDouble(int[] position) {
    return getDouble(getIndex(position));
  }

  public boolean getBoolean(int index) {
    if (pixelType == PixelType.BOOL) {
      return ((boolean[]) storage)[index];
    }
    return getDouble(index) != 0;
  }

  /**
   * @param position one index per axis
   * @return flat (row-major) index of the position
   */
  public int getIndex(int[] position) {
    if (position.length != shape.length) {
      throw new IllegalArgumentException("Expected " + shape.length +
        " indexes, found " + position.length);
    }
    int index = 0;
    for (int d=0; d<position.length; d++) {
      if (position[d] < 0 || position[d] >= shape[d]) {
        throw new IndexOutOfBoundsException(
          "Position " + Arrays.toString(position) +
          " outside of " + Arrays.toString(shape));
      }
      index += position[d] * strides[d];
    }
    return index;
  }

  /**
   * Copy a rectangular region into a new array.
   *
   * @param offset region start, one index per axis
   * @param regionShape region size, one length per axis
   * @return new array containing the region
   */
  public NdArray region(int[] offset, int[] regionShape) {
    checkRegion(offset, regionShape);
    NdArray region = create(pixelType, regionShape);
    copyRegion(this, offset, region, new int[shape.length], regionShape);
    return region;
  }

  /**
   * Copy a range along one axis into a new array.
   *
   * @param axis axis index
   * @param start first index along the axis
   * @param length number of indexes to keep
   * @return new array
   */
  public NdArray slice(int axis, int start, int length) {
    int[] offset = new int[shape.length];
    int[] regionShape = getShape();
    offset[axis] = start;
    regionShape[axis] = length;
    return region(offset, regionShape);
  }

  /**
   * Overwrite a rectangular region of this array.
   *
   * @param offset region start, one index per axis
   * @param source values to copy; its shape is the region size
   */
  public void setRegion(int[] offset, NdArray source) {
    if (source.pixelType != pixelType) {
      throw new IllegalArgumentException("Cannot copy " + source.pixelType +
        " values into " + pixelType + " array");
    }
    checkRegion(offset, source.shape);
    copyRegion(source, new int[shape.length], this, offset, source.shape);
  }

  /**
   * Permute the axes of this array.
   *
   * @param permutation for each output axis, the input axis it comes from
   * @return new array with permuted axes
   */
  public NdArray transpose(int[] permutation) {
    if (permutation.length != shape.length) {
      throw new IllegalArgumentException(
        "Invalid permutation " + Arrays.toString(permutation));
    }
    int[] permuted = new int[shape.length];
    int[] inputStrides = new int[shape.length];
    boolean[] seen = new boolean[shape.length];
    for (int d=0; d<permutation.length; d++) {
      int axis = permutation[d];
      if (axis < 0 || axis >= shape.length || seen[axis]) {
        throw new IllegalArgumentException(
          "Invalid permutation " + Arrays.toString(permutation));
      }
      seen[axis] = true;
      permuted[d] = shape[axis];
      inputStrides[d] = strides[axis];
    }

    int size = getSize();
    int[] sourceIndex = new int[size];
    int[] position = new int[shape.length];
    for (int i=0; i<size; i++) {
      int index = 0;
      for (int d=0; d<position.length; d++) {
        index += position[d] * inputStrides[d];
      }
      sourceIndex[i] = index;
      for (int d=position.length - 1; d>=0; d--) {
        position[d]++;
        if (position[d] < permuted[d]) {
          break;
        }
        position[d] = 0;
      }
    }

    NdArray result = create(pixelType, permuted);
    switch (pixelType) {
      case FLOAT32: {
        float[] in = (float[]) storage;
        float[] out = (float[]) result.storage;
        for (int i=0; i<size; i++) {
          out[i] = in[sourceIndex[i]];
        }
        break;
      }
      case FLOAT64: {
        double[] in = (double[]) storage;
        double[] out = (double[]) result.storage;
        for (int i=0; i<size; i++) {
          out[i] = in[sourceIndex[i]];
        }
        break;
      }
      case BOOL: {
        boolean[] in = (boolean[]) storage;
        boolean[] out = (boolean[]) result.storage;
        for (int i=0; i<size; i++) {
          out[i] = in[sourceIndex[i]];
        }
        break;
      }
      default:
        throw new IllegalStateException("Unsupported pixel type: " + pixelType);
    }
    return result;
  }

  /**
   * Reinterpret the elements with a different shape of the same size.
   * The returned array shares storage with this one.
   *
   * @param newShape new shape
   * @return reshaped view
   */
  public NdArray reshape(int[] newShape) {
    if (getSize(newShape) != getSize()) {
      throw new IllegalArgumentException("Cannot reshape " +
        Arrays.toString(shape) + " to " + Arrays.toString(newShape));
    }
    return new NdArray(pixelType, newShape, storage);
  }

  /**
   * @return boolean array that is <code>true</code> wherever this
   *         array is non-zero
   */
  public NdArray toBoolean() {
    if (pixelType == PixelType.BOOL) {
      return this;
    }
    int size = getSize();
    boolean[] values = new boolean[size];
    for (int i=0; i<size; i++) {
      values[i] = getDouble(i) != 0;
    }
    return wrap(values, shape);
  }

  /**
   * @param order byte order to use
   * @return raw encoding of every element in row-major order
   */
  public byte[] toBytes(ByteOrder order) {
    int size = getSize();
    ByteBuffer buffer =
      ByteBuffer.allocate(size * pixelType.getBytesPerPixel()).order(order);
    switch (pixelType) {
      case FLOAT32:
        buffer.asFloatBuffer().put((float[]) storage);
        break;
      case FLOAT64:
        buffer.asDoubleBuffer().put((double[]) storage);
        break;
      case BOOL: {
        boolean[] values = (boolean[]) storage;
        for (int i=0; i<size; i++) {
          buffer.put(i, values[i] ? (byte) 1 : (byte) 0);
        }
        break;
      }
      default:
        throw new IllegalStateException("Unsupported pixel type: " + pixelType);
    }
    return buffer.array();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof NdArray)) {
      return false;
    }
    NdArray other = (NdArray) o;
    if (pixelType != other.pixelType || !Arrays.equals(shape, other.shape)) {
      return false;
    }
    switch (pixelType) {
      case FLOAT32:
        return Arrays.equals((float[]) storage, (float[]) other.storage);
      case FLOAT64:
        return Arrays.equals((double[]) storage, (double[]) other.storage);
      case BOOL:
        return Arrays.equals((boolean[]) storage, (boolean[]) other.storage);
      default:
        return false;
    }
  }

  @Override
  public int hashCode() {
    int hash = 31 * pixelType.hashCode() + Arrays.hashCode(shape);
    switch (pixelType) {
      case FLOAT32:
        return 31 * hash + Arrays.hashCode((float[]) storage);
      case FLOAT64:
        return 31 * hash + Arrays.hashCode((double[]) storage);
      case BOOL:
        return 31 * hash + Arrays.hashCode((boolean[]) storage);
      default:
        return hash;
    }
  }

  @Override
  public String toString() {
    return "NdArray[" + pixelType + " " + Arrays.toString(shape) + "]";
  }

  /**
   * @param shape array shape
   * @return number of elements, 1 for a zero-rank shape
   */
  public static int getSize(int[] shape) {
    long size = 1;
    for (int length : shape) {
      if (length < 0) {
        throw new IllegalArgumentException(
          "Invalid shape " + Arrays.toString(shape));
      }
      size *= length;
    }
    if (size > Integer.MAX_VALUE) {
      throw new IllegalArgumentException(
        "Shape " + Arrays.toString(shape) + " is too large");
    }
    return (int) size;
  }

  private static int[] getStrides(int[] shape) {
    int[] strides = new int[shape.length];
    int stride = 1;
    for (int d=shape.length - 1; d>=0; d--) {
      strides[d] = stride;
      stride *= shape[d];
    }
    return strides;
  }

  private void checkRegion(int[] offset, int[] regionShape) {
    if (offset.length != shape.length || regionShape.length != shape.length) {
      throw new IllegalArgumentException("Region rank does not match " +
        Arrays.toString(shape));
    }
    for (int d=0; d<shape.length; d++) {
      if (offset[d] < 0 || regionShape[d] < 0 ||
        offset[d] + regionShape[d] > shape[d])
      {
        throw new IndexOutOfBoundsException("Region " +
          Arrays.toString(offset) + " + " + Arrays.toString(regionShape) +
          " outside of " + Arrays.toString(shape));
      }
    }
  }

  /**
   * Copy a block of elements between arrays of the same type, one
   * contiguous run along the last axis at a time.
   */
  private static void copyRegion(NdArray src, int[] srcOffset,
    NdArray dst, int[] dstOffset, int[] count)
  {
    int rank = count.length;
    if (getSize(count) == 0) {
      return;
    }
    if (rank == 0) {
      System.arraycopy(src.storage, 0, dst.storage, 0, 1);
      return;
    }
    int run = count[rank - 1];
    int[] position = new int[rank - 1];
    while (true) {
      int srcIndex = srcOffset[rank - 1];
      int dstIndex = dstOffset[rank - 1];
      for (int d=0; d<rank - 1; d++) {
        srcIndex += (srcOffset[d] + position[d]) * src.strides[d];
        dstIndex += (dstOffset[d] + position[d]) * dst.strides[d];
      }
      System.arraycopy(src.storage, srcIndex, dst.storage, dstIndex, run);

      int d = rank - 2;
      while (d >= 0) {
        position[d]++;
        if (position[d] < count[d]) {
          break;
        }
        position[d] = 0;
        d--;
      }
      if (d < 0) {
        break;
      }
    }
  }
}
