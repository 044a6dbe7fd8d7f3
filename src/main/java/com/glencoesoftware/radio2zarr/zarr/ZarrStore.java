/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.radio2zarr.zarr;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.glencoesoftware.radio2zarr.Dataset;
import com.glencoesoftware.radio2zarr.IChunkedStore;
import com.glencoesoftware.radio2zarr.NdArray;
import com.glencoesoftware.radio2zarr.Variable;

import org.perf4j.slf4j.Slf4JStopWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Zarr v2 directory store laid out the way xarray reads and writes
 * datasets: one group, one array per variable, dimension names in
 * each array's <code>_ARRAY_DIMENSIONS</code> attribute.
 */
public class ZarrStore implements IChunkedStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(ZarrStore.class);

  public static final String ZGROUP = ".zgroup";
  public static final String ZARRAY = ".zarray";
  public static final String ZATTRS = ".zattrs";
  public static final String ARRAY_DIMENSIONS = "_ARRAY_DIMENSIONS";
  public static final String COORDINATES = "coordinates";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final Path root;
  private final DimensionSeparator separator;

  /**
   * Create a store using "/" as the chunk key separator.
   *
   * @param root store directory
   */
  public ZarrStore(Path root) {
    this(root, DimensionSeparator.SLASH);
  }

  /**
   * @param root store directory
   * @param separator chunk key separator for new arrays
   */
  public ZarrStore(Path root, DimensionSeparator separator) {
    this.root = root;
    this.separator = separator;
  }

  @Override
  public void create(Dataset dataset, Map<String, Compressor> compressors,
    Map<String, Integer> chunks) throws IOException
  {
    if (Files.exists(root)) {
      throw new IOException("Output path " + root + " already exists");
    }
    Files.createDirectories(root);
    ObjectNode group = MAPPER.createObjectNode();
    group.put("zarr_format", ZarrArrayMetadata.ZARR_FORMAT);
    writeJson(root.resolve(ZGROUP), group);
    writeJson(root.resolve(ZATTRS), dataset.getAttributes());

    for (Map.Entry<String, Variable> e : dataset.getCoordinates().entrySet()) {
      createArray(e.getKey(), e.getValue(), chunks,
        compressors.get(e.getKey()), null);
    }
    for (Map.Entry<String, Variable> e :
      dataset.getDataVariables().entrySet())
    {
      createArray(e.getKey(), e.getValue(), chunks,
        compressors.get(e.getKey()),
        getCoordinateNames(e.getValue(), dataset.getCoordinates()));
    }
  }

  @Override
  public void append(Dataset dataset, String dimension) throws IOException {
    List<Map.Entry<String, Variable>> variables =
      new ArrayList<Map.Entry<String, Variable>>();
    variables.addAll(dataset.getCoordinates().entrySet());
    variables.addAll(dataset.getDataVariables().entrySet());
    for (Map.Entry<String, Variable> e : variables) {
      Variable variable = e.getValue();
      int axis = variable.getDimensions().indexOf(dimension);
      if (axis < 0) {
        continue;
      }
      Path arrayPath = root.resolve(e.getKey());
      if (!Files.exists(arrayPath.resolve(ZARRAY))) {
        throw new IOException(
          "Cannot append to " + e.getKey() + "; array does not exist");
      }
      List<String> stored = readDimensions(arrayPath);
      if (!stored.equals(variable.getDimensions())) {
        throw new IOException("Cannot append " + e.getKey() + " with " +
          "dimensions " + variable.getDimensions() + " to " + stored);
      }
      ZarrArrayMetadata metadata =
        ZarrArrayMetadata.fromJson(readJson(arrayPath.resolve(ZARRAY)));
      if (metadata.getPixelType() != variable.getPixelType()) {
        throw new IOException("Cannot append " + variable.getPixelType() +
          " values to " + e.getKey() + " of type " + metadata.getPixelType());
      }
      int[] shape = metadata.getShape();
      int[] added = variable.getShape();
      for (int d=0; d<shape.length; d++) {
        if (d != axis && shape[d] != added[d]) {
          throw new IOException("Cannot append " + Arrays.toString(added) +
            " to " + e.getKey() + " of shape " + Arrays.toString(shape));
        }
      }
      int[] offset = new int[shape.length];
      offset[axis] = shape[axis];
      shape[axis] += added[axis];
      metadata = metadata.withShape(shape);
      writeJson(arrayPath.resolve(ZARRAY), metadata.toJson());
      writeRegion(arrayPath, metadata, variable.getData(), offset);
    }
  }

  @Override
  public Dataset open() throws IOException {
    if (!Files.exists(root.resolve(ZGROUP))) {
      throw new IOException("No Zarr group found at " + root);
    }
    JsonNode rootAttributes = readJson(root.resolve(ZATTRS));
    ObjectNode attributes = rootAttributes instanceof ObjectNode ?
      (ObjectNode) rootAttributes : MAPPER.createObjectNode();

    List<Path> arrays;
    try (Stream<Path> children = Files.list(root)) {
      arrays = children
        .filter(p -> Files.exists(p.resolve(ZARRAY)))
        .sorted()
        .collect(Collectors.toList());
    }

    Map<String, Variable> variables = new LinkedHashMap<String, Variable>();
    Set<String> coordinateNames = new LinkedHashSet<String>();
    for (Path arrayPath : arrays) {
      String name = arrayPath.getFileName().toString();
      JsonNode arrayAttributes = readJson(arrayPath.resolve(ZATTRS));
      List<String> dims = readDimensions(arrayPath);
      ZarrArrayMetadata metadata =
        ZarrArrayMetadata.fromJson(readJson(arrayPath.resolve(ZARRAY)));
      if (dims.size() != metadata.getShape().length) {
        throw new IOException("Array " + name + " has dimensions " + dims +
          " but shape " + Arrays.toString(metadata.getShape()));
      }
      variables.put(name, new Variable(dims, metadata.getShape(),
        metadata.getPixelType(), () -> {
          try {
            return readArray(arrayPath, metadata);
          }
          catch (IOException e) {
            throw new UncheckedIOException(e);
          }
        }));
      if (dims.size() == 1 && dims.get(0).equals(name)) {
        coordinateNames.add(name);
      }
      String coordinates = arrayAttributes.path(COORDINATES).asText("");
      for (String coordinate : coordinates.trim().split("\\s+")) {
        if (!coordinate.isEmpty()) {
          coordinateNames.add(coordinate);
        }
      }
    }

    Map<String, Variable> data = new LinkedHashMap<String, Variable>();
    Map<String, Variable> coords = new LinkedHashMap<String, Variable>();
    for (Map.Entry<String, Variable> e : variables.entrySet()) {
      if (coordinateNames.contains(e.getKey())) {
        coords.put(e.getKey(), e.getValue());
      }
      else {
        data.put(e.getKey(), e.getValue());
      }
    }
    return new Dataset(data, coords, attributes);
  }

  private void createArray(String name, Variable variable,
    Map<String, Integer> chunks, Compressor compressor, String coordinates)
    throws IOException
  {
    int[] shape = variable.getShape();
    int[] chunkShape = new int[shape.length];
    for (int d=0; d<shape.length; d++) {
      Integer chunk = chunks.get(variable.getDimensions().get(d));
      if (chunk == null || chunk <= 0) {
        chunkShape[d] = Math.max(1, shape[d]);
      }
      else {
        // may exceed the first batch; later appends fill the chunk
        chunkShape[d] = chunk;
      }
    }
    ZarrArrayMetadata metadata = new ZarrArrayMetadata(shape, chunkShape,
      variable.getPixelType(),
      compressor == null ? new CompressorFactory.NullCompressor() : compressor,
      separator);

    LOGGER.debug("creating array {} shape {} chunks {} compressor {}",
      name, Arrays.toString(shape), Arrays.toString(chunkShape),
      metadata.getCompressor());
    Path arrayPath = root.resolve(name);
    Files.createDirectories(arrayPath);
    writeJson(arrayPath.resolve(ZARRAY), metadata.toJson());

    ObjectNode attributes = MAPPER.createObjectNode();
    ArrayNode dims = attributes.putArray(ARRAY_DIMENSIONS);
    for (String dim : variable.getDimensions()) {
      dims.add(dim);
    }
    if (coordinates != null && !coordinates.isEmpty()) {
      attributes.put(COORDINATES, coordinates);
    }
    writeJson(arrayPath.resolve(ZATTRS), attributes);

    writeRegion(arrayPath, metadata, variable.getData(),
      new int[shape.length]);
  }

  /**
   * @return space-separated names of the non-index coordinates whose
   *         dimensions are all used by the variable
   */
  private static String getCoordinateNames(
    Variable variable, Map<String, Variable> coordinates)
  {
    List<String> names = new ArrayList<String>();
    for (Map.Entry<String, Variable> e : coordinates.entrySet()) {
      List<String> dims = e.getValue().getDimensions();
      boolean index = dims.size() == 1 && dims.get(0).equals(e.getKey());
      if (!index && variable.getDimensions().containsAll(dims)) {
        names.add(e.getKey());
      }
    }
    return String.join(" ", names);
  }

  private void writeRegion(Path arrayPath, ZarrArrayMetadata metadata,
    NdArray data, int[] offset) throws IOException
  {
    int[] dataShape = data.getShape();
    if (data.getSize() == 0) {
      return;
    }
    int[] chunks = metadata.getChunks();
    int[] first = new int[chunks.length];
    int[] last = new int[chunks.length];
    for (int d=0; d<chunks.length; d++) {
      first[d] = offset[d] / chunks[d];
      last[d] = (offset[d] + dataShape[d] - 1) / chunks[d];
    }
    int[] index = first.clone();
    do {
      writeChunk(arrayPath, metadata, data, offset, index);
    } while (nextChunk(index, first, last));
  }

  private void writeChunk(Path arrayPath, ZarrArrayMetadata metadata,
    NdArray data, int[] offset, int[] index) throws IOException
  {
    int rank = index.length;
    int[] chunks = metadata.getChunks();
    int[] dataShape = data.getShape();
    int[] sourceOffset = new int[rank];
    int[] chunkOffset = new int[rank];
    int[] count = new int[rank];
    boolean complete = true;
    for (int d=0; d<rank; d++) {
      int origin = index[d] * chunks[d];
      int start = Math.max(origin, offset[d]);
      int end = Math.min(origin + chunks[d], offset[d] + dataShape[d]);
      sourceOffset[d] = start - offset[d];
      chunkOffset[d] = start - origin;
      count[d] = end - start;
      if (count[d] != chunks[d]) {
        complete = false;
      }
    }

    Slf4JStopWatch t0 = stopWatch();
    try {
      NdArray chunk;
      if (complete) {
        chunk = data.region(sourceOffset, chunks);
      }
      else {
        chunk = readChunk(arrayPath, metadata, index);
        chunk.setRegion(chunkOffset, data.region(sourceOffset, count));
      }
      byte[] encoded = metadata.getCompressor().compress(
        chunk.toBytes(ByteOrder.LITTLE_ENDIAN));
      Path chunkPath = getChunkPath(arrayPath, metadata, index);
      Files.createDirectories(chunkPath.getParent());
      Files.write(chunkPath, encoded);
    }
    finally {
      t0.stop("writeChunk");
    }
  }

  private NdArray readArray(Path arrayPath, ZarrArrayMetadata metadata)
    throws IOException
  {
    int[] shape = metadata.getShape();
    NdArray array = NdArray.create(metadata.getPixelType(), shape);
    if (array.getSize() == 0) {
      return array;
    }
    int[] chunks = metadata.getChunks();
    int[] first = new int[shape.length];
    int[] last = new int[shape.length];
    for (int d=0; d<shape.length; d++) {
      last[d] = (shape[d] - 1) / chunks[d];
    }
    int[] index = first.clone();
    do {
      int[] origin = new int[shape.length];
      int[] count = new int[shape.length];
      for (int d=0; d<shape.length; d++) {
        origin[d] = index[d] * chunks[d];
        count[d] = Math.min(chunks[d], shape[d] - origin[d]);
      }
      NdArray chunk = readChunk(arrayPath, metadata, index);
      array.setRegion(origin, chunk.region(new int[shape.length], count));
    } while (nextChunk(index, first, last));
    return array;
  }

  private NdArray readChunk(
    Path arrayPath, ZarrArrayMetadata metadata, int[] index)
    throws IOException
  {
    Path chunkPath = getChunkPath(arrayPath, metadata, index);
    if (!Files.exists(chunkPath)) {
      return NdArray.filled(metadata.getPixelType(), metadata.getChunks(),
        metadata.getFillValue());
    }
    byte[] decoded =
      metadata.getCompressor().uncompress(Files.readAllBytes(chunkPath));
    return NdArray.fromBytes(metadata.getPixelType(), metadata.getChunks(),
      decoded, ByteOrder.LITTLE_ENDIAN);
  }

  private static Path getChunkPath(
    Path arrayPath, ZarrArrayMetadata metadata, int[] index)
  {
    return arrayPath.resolve(metadata.getSeparator().getChunkKey(index));
  }

  /**
   * Advance a chunk index in row-major order.
   *
   * @return false once every index in [first, last] has been visited
   */
  private static boolean nextChunk(int[] index, int[] first, int[] last) {
    for (int d=index.length - 1; d>=0; d--) {
      index[d]++;
      if (index[d] <= last[d]) {
        return true;
      }
      index[d] = first[d];
    }
    return false;
  }

  private static List<String> readDimensions(Path arrayPath)
    throws IOException
  {
    JsonNode dims = readJson(arrayPath.resolve(ZATTRS)).get(ARRAY_DIMENSIONS);
    if (dims == null || !dims.isArray()) {
      throw new IOException("Array " + arrayPath.getFileName() +
        " has no " + ARRAY_DIMENSIONS + " attribute");
    }
    List<String> names = new ArrayList<String>();
    for (JsonNode dim : dims) {
      names.add(dim.asText());
    }
    return Collections.unmodifiableList(names);
  }

  private static JsonNode readJson(Path path) throws IOException {
    if (!Files.exists(path)) {
      return MAPPER.createObjectNode();
    }
    return MAPPER.readTree(path.toFile());
  }

  private static void writeJson(Path path, JsonNode node) throws IOException {
    MAPPER.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), node);
  }

  private static Slf4JStopWatch stopWatch() {
    return new Slf4JStopWatch(LOGGER, Slf4JStopWatch.DEBUG_LEVEL);
  }

}
