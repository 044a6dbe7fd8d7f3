/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.radio2zarr;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Shape, dimensions, coordinates and attributes of one artifact.
 */
public class ArtifactMetadata {

  private final String type;
  private final int[] shape;
  private final List<Axis> axes;
  private final List<String> dimensions;
  private final Map<String, Variable> coordinates;
  private final ObjectNode attributes;

  /**
   * @param type artifact type
   * @param shape pixel shape
   * @param axes image axes
   * @param dimensions dimension name of each axis
   * @param coordinates coordinate variables by axis name
   * @param attributes normalized attributes
   */
  public ArtifactMetadata(String type, int[] shape, List<Axis> axes,
    List<String> dimensions, Map<String, Variable> coordinates,
    ObjectNode attributes)
  {
    this.type = type;
    this.shape = shape.clone();
    this.axes = axes;
    this.dimensions = dimensions;
    this.coordinates = Collections.unmodifiableMap(coordinates);
    this.attributes = attributes;
  }

  /**
   * Resolve coordinates and normalize the summary of an open artifact.
   *
   * @param type artifact type
   * @param handle open artifact
   * @return artifact metadata
   */
  public static ArtifactMetadata read(String type, IImageHandle handle) {
    int[] shape = handle.getShape();
    ObjectNode summary = handle.getSummary();
    List<Axis> axes = CoordinateResolver.getAxes(summary, shape);
    return new ArtifactMetadata(type, shape, axes,
      CoordinateResolver.getDimensions(axes),
      CoordinateResolver.resolve(handle, axes),
      MetadataNormalizer.normalize(summary));
  }

  public String getType() {
    return type;
  }

  public int[] getShape() {
    return shape.clone();
  }

  public List<Axis> getAxes() {
    return axes;
  }

  public List<String> getDimensions() {
    return dimensions;
  }

  public Map<String, Variable> getCoordinates() {
    return coordinates;
  }

  public ObjectNode getAttributes() {
    return attributes;
  }

  /**
   * @param dimension dimension name
   * @return length of the dimension, or -1 if not present
   */
  public int getLength(String dimension) {
    int index = dimensions.indexOf(dimension);
    return index < 0 ? -1 : shape[index];
  }

  /**
   * @param other metadata to compare with
   * @return true if both artifacts have the same pixel shape
   */
  public boolean hasSameShape(ArtifactMetadata other) {
    return Arrays.equals(shape, other.shape);
  }

  @Override
  public String toString() {
    return type + dimensions + Arrays.toString(shape);
  }

}
