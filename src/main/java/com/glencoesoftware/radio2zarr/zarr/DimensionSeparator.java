/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.radio2zarr.zarr;

/**
 * Separator placed between chunk indexes in chunk keys.
 */
public enum DimensionSeparator {
  DOT("."),
  SLASH("/");

  private final String separator;

  private DimensionSeparator(String separator) {
    this.separator = separator;
  }

  /**
   * @param separator separator as stored in <code>.zarray</code>
   * @return matching separator
   */
  public static DimensionSeparator fromString(String separator) {
    for (DimensionSeparator s : values()) {
      if (s.separator.equals(separator)) {
        return s;
      }
    }
    throw new IllegalArgumentException(
      "Unsupported dimension separator: " + separator);
  }

  /**
   * @param indexes chunk index along each axis
   * @return chunk key, "0" for zero-rank arrays
   */
  public String getChunkKey(int[] indexes) {
    if (indexes.length == 0) {
      return "0";
    }
    StringBuilder key = new StringBuilder();
    for (int i=0; i<indexes.length; i++) {
      if (i > 0) {
        key.append(separator);
      }
      key.append(indexes[i]);
    }
    return key.toString();
  }

  @Override
  public String toString() {
    return separator;
  }
}
