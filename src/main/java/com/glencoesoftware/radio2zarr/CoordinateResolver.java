/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.radio2zarr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Derives dimension names and world coordinates for an image.
 * Axes measured in radians are spherically coupled and resolved together
 * over synthetic <code>d&lt;axis&gt;</code> dimensions; every other axis is
 * resolved independently over its own name.
 */
public final class CoordinateResolver {

  /** Unit identifying spherically coupled axes. */
  public static final String ANGULAR_UNIT = "rad";

  public static final String CHANNEL = "chan";
  public static final String POLARIZATION = "pol";

  private CoordinateResolver() {
  }

  /**
   * @param name axis name as reported by the image
   * @return name with spaces replaced by underscores, lower-cased,
   *         "stokes" renamed "pol" and "frequency" renamed "chan"
   */
  public static String normalizeAxisName(String name) {
    return name.replace(' ', '_').toLowerCase()
      .replace("stokes", POLARIZATION)
      .replace("frequency", CHANNEL);
  }

  /**
   * @param summary image summary record
   * @param shape image shape
   * @return one axis per image axis, in storage order
   */
  public static List<Axis> getAxes(ObjectNode summary, int[] shape) {
    JsonNode names = summary.path("axisnames");
    JsonNode units = summary.path("axisunits");
    if (names.size() != shape.length) {
      throw new IllegalArgumentException("Found " + names.size() +
        " axis names for " + shape.length + " axes");
    }
    List<Axis> axes = new ArrayList<Axis>();
    for (int i=0; i<shape.length; i++) {
      axes.add(new Axis(normalizeAxisName(names.get(i).asText()),
        units.path(i).asText(""), shape[i]));
    }
    return Collections.unmodifiableList(axes);
  }

  /**
   * @param axes image axes
   * @return dimension name of each axis; spherical axes are named
   *         "d" followed by the axis index
   */
  public static List<String> getDimensions(List<Axis> axes) {
    List<String> dims = new ArrayList<String>();
    for (int i=0; i<axes.size(); i++) {
      dims.add(isSpherical(axes.get(i)) ? "d" + i : axes.get(i).getName());
    }
    return Collections.unmodifiableList(dims);
  }

  /**
   * @param axis image axis
   * @return true if the axis is measured in radians
   */
  public static boolean isSpherical(Axis axis) {
    return ANGULAR_UNIT.equals(axis.getUnit());
  }

  /**
   * Compute world coordinates for every axis.  Spherical axes produce one
   * N-d array each over the joint pixel grid of all spherical axes;
   * other axes produce a vector along their own dimension.  Pixels of
   * axes not being resolved are held at index 0.
   *
   * @param handle open image
   * @param axes image axes, as returned by {@link #getAxes}
   * @return coordinate variables by axis name, spherical axes first
   */
  public static Map<String, Variable> resolve(
    IImageHandle handle, List<Axis> axes)
  {
    int rank = axes.size();
    List<String> dims = getDimensions(axes);
    List<Integer> spherical = new ArrayList<Integer>();
    List<Integer> cartesian = new ArrayList<Integer>();
    for (int i=0; i<rank; i++) {
      if (isSpherical(axes.get(i))) {
        spherical.add(i);
      }
      else {
        cartesian.add(i);
      }
    }

    Map<String, Variable> coords = new LinkedHashMap<String, Variable>();
    if (!spherical.isEmpty()) {
      int[] gridShape = new int[spherical.size()];
      List<String> gridDims = new ArrayList<String>();
      for (int s=0; s<gridShape.length; s++) {
        gridShape[s] = axes.get(spherical.get(s)).getLength();
        gridDims.add(dims.get(spherical.get(s)));
      }
      int points = NdArray.getSize(gridShape);
      double[][] pixels = new double[rank][points];
      int[] position = new int[gridShape.length];
      for (int p=0; p<points; p++) {
        for (int s=0; s<gridShape.length; s++) {
          pixels[spherical.get(s)][p] = position[s];
        }
        for (int s=gridShape.length - 1; s>=0; s--) {
          position[s]++;
          if (position[s] < gridShape[s]) {
            break;
          }
          position[s] = 0;
        }
      }
      double[][] world = handle.toWorld(pixels);
      for (int s=0; s<gridShape.length; s++) {
        int axis = spherical.get(s);
        coords.put(axes.get(axis).getName(),
          new Variable(gridDims, NdArray.wrap(world[axis], gridShape)));
      }
    }

    for (int axis : cartesian) {
      int length = axes.get(axis).getLength();
      double[][] pixels = new double[rank][length];
      for (int p=0; p<length; p++) {
        pixels[axis][p] = p;
      }
      double[][] world = handle.toWorld(pixels);
      coords.put(axes.get(axis).getName(),
        new Variable(Collections.singletonList(dims.get(axis)),
          NdArray.wrap(world[axis], length)));
    }
    return coords;
  }

}
