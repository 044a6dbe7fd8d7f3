/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.radio2zarr;

import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

import com.google.common.math.IntMath;

/**
 * Half-open range of channels <code>[start, start + size)</code>
 * converted together.
 */
public final class ChannelBatch {

  private final int start;
  private final int size;

  public ChannelBatch(int start, int size) {
    if (start < 0 || size <= 0) {
      throw new IllegalArgumentException(
        "Invalid channel batch " + start + "+" + size);
    }
    this.start = start;
    this.size = size;
  }

  /**
   * Split a channel axis into consecutive batches.  Every batch but the
   * last has the requested size.
   *
   * @param channels number of channels
   * @param batchSize channels per batch
   * @return batches in ascending order
   */
  public static List<ChannelBatch> partition(int channels, int batchSize) {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("Invalid batch size " + batchSize);
    }
    int count = IntMath.divide(channels, batchSize, RoundingMode.CEILING);
    List<ChannelBatch> batches = new ArrayList<ChannelBatch>(count);
    for (int i=0; i<count; i++) {
      int first = i * batchSize;
      batches.add(new ChannelBatch(first, Math.min(batchSize, channels - first)));
    }
    return batches;
  }

  public int getStart() {
    return start;
  }

  public int getSize() {
    return size;
  }

  /**
   * @return first channel after this batch
   */
  public int getEnd() {
    return start + size;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof ChannelBatch)) {
      return false;
    }
    ChannelBatch other = (ChannelBatch) o;
    return start == other.start && size == other.size;
  }

  @Override
  public int hashCode() {
    return 31 * start + size;
  }

  @Override
  public String toString() {
    return "[" + start + ", " + getEnd() + ")";
  }

}
