/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.radio2zarr.zarr;

import java.util.Arrays;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.glencoesoftware.radio2zarr.PixelType;
import com.glencoesoftware.radio2zarr.ZarrTypes;

/**
 * Contents of a Zarr v2 <code>.zarray</code> document.
 */
public class ZarrArrayMetadata {

  public static final int ZARR_FORMAT = 2;

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final int[] shape;
  private final int[] chunks;
  private final PixelType pixelType;
  private final Compressor compressor;
  private final DimensionSeparator separator;

  /**
   * @param shape array shape
   * @param chunks chunk shape; every extent must be positive
   * @param type element type
   * @param compressor chunk codec
   * @param separator chunk key separator
   */
  public ZarrArrayMetadata(int[] shape, int[] chunks, PixelType type,
    Compressor compressor, DimensionSeparator separator)
  {
    if (shape.length != chunks.length) {
      throw new IllegalArgumentException("Chunks " + Arrays.toString(chunks) +
        " do not match shape " + Arrays.toString(shape));
    }
    for (int chunk : chunks) {
      if (chunk <= 0) {
        throw new IllegalArgumentException(
          "Invalid chunk shape " + Arrays.toString(chunks));
      }
    }
    this.shape = shape.clone();
    this.chunks = chunks.clone();
    this.pixelType = type;
    this.compressor = compressor;
    this.separator = separator;
  }

  /**
   * @param node parsed <code>.zarray</code> document
   * @return array metadata
   */
  public static ZarrArrayMetadata fromJson(JsonNode node) {
    int format = node.path("zarr_format").asInt();
    if (format != ZARR_FORMAT) {
      throw new IllegalArgumentException("Unsupported zarr_format: " + format);
    }
    String order = node.path("order").asText("C");
    if (!"C".equals(order)) {
      throw new IllegalArgumentException("Unsupported order: " + order);
    }
    JsonNode filters = node.get("filters");
    if (filters != null && !filters.isNull() && filters.size() > 0) {
      throw new IllegalArgumentException("Unsupported filters: " + filters);
    }
    String separator = node.path("dimension_separator").asText(".");
    return new ZarrArrayMetadata(
      toIntArray(node.get("shape")),
      toIntArray(node.get("chunks")),
      ZarrTypes.getPixelType(node.path("dtype").asText()),
      CompressorFactory.fromConfiguration(node.get("compressor")),
      DimensionSeparator.fromString(separator));
  }

  /**
   * @return <code>.zarray</code> document
   */
  public ObjectNode toJson() {
    ObjectNode node = MAPPER.createObjectNode();
    ArrayNode chunkNode = node.putArray("chunks");
    for (int chunk : chunks) {
      chunkNode.add(chunk);
    }
    node.set("compressor", compressor.getConfiguration());
    node.put("dimension_separator", separator.toString());
    node.put("dtype", ZarrTypes.getZarrType(pixelType));
    if (pixelType == PixelType.BOOL) {
      node.put("fill_value", false);
    }
    else {
      node.put("fill_value", "NaN");
    }
    node.putNull("filters");
    node.put("order", "C");
    ArrayNode shapeNode = node.putArray("shape");
    for (int length : shape) {
      shapeNode.add(length);
    }
    node.put("zarr_format", ZARR_FORMAT);
    return node;
  }

  /**
   * @param newShape replacement shape
   * @return copy of this metadata with a different shape
   */
  public ZarrArrayMetadata withShape(int[] newShape) {
    return new ZarrArrayMetadata(
      newShape, chunks, pixelType, compressor, separator);
  }

  public int[] getShape() {
    return shape.clone();
  }

  public int[] getChunks() {
    return chunks.clone();
  }

  public PixelType getPixelType() {
    return pixelType;
  }

  public Compressor getCompressor() {
    return compressor;
  }

  public DimensionSeparator getSeparator() {
    return separator;
  }

  /**
   * @return value of elements in chunks that were never written
   */
  public double getFillValue() {
    return pixelType == PixelType.BOOL ? 0 : Double.NaN;
  }

  private static int[] toIntArray(JsonNode node) {
    if (node == null || !node.isArray()) {
      throw new IllegalArgumentException("Expected array, found " + node);
    }
    int[] values = new int[node.size()];
    for (int i=0; i<values.length; i++) {
      values[i] = node.get(i).asInt();
    }
    return values;
  }

}
