/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.radio2zarr;

public final class ZarrTypes {

  private ZarrTypes() {
  }

  /**
   * Convert a FITS BITPIX value to the pixel type used for the
   * converted array.  Integer data is always scaled to 32-bit floats.
   *
   * @param bitpix FITS BITPIX value
   * @return corresponding pixel type
   */
  public static PixelType getPixelType(int bitpix) {
    switch (bitpix) {
      case 8:
      case 16:
      case 32:
      case 64:
      case -32:
        return PixelType.FLOAT32;
      case -64:
        return PixelType.FLOAT64;
      default:
        throw new IllegalArgumentException("Unsupported BITPIX: " + bitpix);
    }
  }

  /**
   * Convert pixel type to Zarr v2 data type string.
   *
   * @param type pixel type
   * @return corresponding little-endian Zarr data type
   */
  public static String getZarrType(PixelType type) {
    switch (type) {
      case FLOAT32:
        return "<f4";
      case FLOAT64:
        return "<f8";
      case BOOL:
        return "|b1";
      default:
        throw new IllegalArgumentException("Unsupported pixel type: " + type);
    }
  }

  /**
   * Convert Zarr v2 data type string to pixel type.
   *
   * @param dtype Zarr data type, e.g. "&lt;f4"
   * @return corresponding pixel type
   */
  public static PixelType getPixelType(String dtype) {
    switch (dtype) {
      case "<f4":
        return PixelType.FLOAT32;
      case "<f8":
        return PixelType.FLOAT64;
      case "|b1":
        return PixelType.BOOL;
      default:
        throw new IllegalArgumentException("Unsupported data type: " + dtype);
    }
  }

}
