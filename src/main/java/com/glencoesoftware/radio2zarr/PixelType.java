/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.radio2zarr;

/**
 * Element types that can be held by an {@link NdArray}.
 */
public enum PixelType {
  FLOAT32(4),
  FLOAT64(8),
  BOOL(1);

  private final int bytesPerPixel;

  private PixelType(int bytes) {
    bytesPerPixel = bytes;
  }

  /**
   * @return number of bytes used to store one element
   */
  public int getBytesPerPixel() {
    return bytesPerPixel;
  }
}
