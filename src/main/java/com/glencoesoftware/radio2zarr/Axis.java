/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.radio2zarr;

/**
 * Describe an image axis, including its normalized name, unit and length.
 */
public class Axis {

  private final String name;
  private final String unit;
  private final int length;

  /**
   * Create a new Axis.
   *
   * @param name normalized axis name (e.g. "chan")
   * @param unit axis unit; "rad" for spherically coupled axes
   * @param len axis length (expected to be positive)
   */
  public Axis(String name, String unit, int len) {
    if (len <= 0) {
      throw new IllegalArgumentException(
        "Axis " + name + " has invalid length " + len);
    }
    this.name = name;
    this.unit = unit == null ? "" : unit;
    this.length = len;
  }

  /**
   * @return normalized axis name
   */
  public String getName() {
    return name;
  }

  /**
   * @return axis unit, never null
   */
  public String getUnit() {
    return unit;
  }

  /**
   * @return axis length
   */
  public int getLength() {
    return length;
  }

  @Override
  public String toString() {
    return name + "[" + length + " " + unit + "]";
  }

}
