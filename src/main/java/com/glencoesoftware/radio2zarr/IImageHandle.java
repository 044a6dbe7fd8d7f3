/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.radio2zarr;

import java.io.Closeable;
import java.io.IOException;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * An open image artifact.  Axes are indexed in storage order, the
 * first axis being the one that varies fastest on disk (e.g. FITS
 * NAXIS1).
 */
public interface IImageHandle extends Closeable {

  /**
   * Return the summary record of the image.  This includes at least
   * <code>axisnames</code>, <code>axisunits</code>, <code>shape</code>
   * and a <code>messages</code> list of free-text descriptions.
   *
   * @return summary record; callers may not modify it
   */
  ObjectNode getSummary();

  /**
   * @return number of pixels along each axis
   */
  int[] getShape();

  /**
   * Convert pixel positions to world coordinates.
   *
   * @param pixels zero-based pixel positions, indexed
   *               <code>[axis][point]</code>
   * @return world coordinates, indexed <code>[axis][point]</code>;
   *         angular axes are in radians
   */
  double[][] toWorld(double[][] pixels);

  /**
   * @return true if the image carries a validity mask
   */
  boolean hasMask();

  /**
   * Read a rectangular region of pixels.
   *
   * @param offset first pixel along each axis
   * @param shape number of pixels along each axis
   * @param getMask true to read the validity mask instead of pixel values
   * @return region with axes in the same order as {@link #getShape()};
   *         boolean if <code>getMask</code> is set
   * @throws IOException if the pixels could not be read
   */
  NdArray getChunk(int[] offset, int[] shape, boolean getMask)
    throws IOException;

}
