/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.radio2zarr;

import static com.glencoesoftware.radio2zarr.CoordinateResolver.CHANNEL;
import static com.glencoesoftware.radio2zarr.CoordinateResolver.POLARIZATION;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.glencoesoftware.radio2zarr.zarr.Compressor;
import com.google.common.collect.ImmutableList;

import org.perf4j.slf4j.Slf4JStopWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads compatible artifacts one channel batch at a time and writes each
 * batch to a chunked store, so that at most one batch of every artifact
 * is held in memory.
 */
public class ChannelBatchWriter {

  private static final Logger LOGGER =
    LoggerFactory.getLogger(ChannelBatchWriter.class);

  /** Trailing dimension order of every output variable. */
  public static final List<String> TRAILING_DIMENSIONS =
    ImmutableList.of(CHANNEL, POLARIZATION);

  private final IImageReader reader;
  private final String prefix;
  private IProgressListener progressListener = new NoOpProgressListener();

  /**
   * @param reader used to open each artifact
   * @param prefix primary image path without its final extension
   */
  public ChannelBatchWriter(IImageReader reader, String prefix) {
    this.reader = reader;
    this.prefix = prefix;
  }

  public void setProgressListener(IProgressListener listener) {
    progressListener = listener == null ? new NoOpProgressListener() : listener;
  }

  public IProgressListener getProgressListener() {
    return progressListener;
  }

  /**
   * Order in which chunk extents are given: spatial dimensions in
   * reference order, then channel, then polarization if present.
   *
   * @param dimensions reference dimensions
   * @return dimensions in chunk shape order
   */
  public static List<String> getChunkOrder(List<String> dimensions) {
    List<String> order = new ArrayList<String>();
    for (String dim : dimensions) {
      if (!TRAILING_DIMENSIONS.contains(dim)) {
        order.add(dim);
      }
    }
    for (String dim : TRAILING_DIMENSIONS) {
      if (dimensions.contains(dim)) {
        order.add(dim);
      }
    }
    return order;
  }

  /**
   * Resolve a chunk shape against the reference dimensions.  Extents
   * that are missing, zero or negative cover the whole dimension;
   * extents larger than the dimension are reduced to its length.
   *
   * @param reference reference artifact
   * @param chunkShape extents in {@link #getChunkOrder} order
   * @return chunk extent by dimension name
   */
  public static Map<String, Integer> getChunks(
    ArtifactMetadata reference, int[] chunkShape)
  {
    List<String> order = getChunkOrder(reference.getDimensions());
    if (chunkShape.length > order.size()) {
      int[] ignored =
        Arrays.copyOfRange(chunkShape, order.size(), chunkShape.length);
      // extents of 1 or less over a missing dimension change nothing
      boolean significant = false;
      for (int extent : ignored) {
        significant |= extent > 1;
      }
      if (significant) {
        LOGGER.warn("Ignoring chunk extents {} beyond dimensions {}",
          Arrays.toString(ignored), order);
      }
      else {
        LOGGER.debug("Ignoring chunk extents {} beyond dimensions {}",
          Arrays.toString(ignored), order);
      }
    }
    Map<String, Integer> chunks = new LinkedHashMap<String, Integer>();
    for (int i=0; i<order.size(); i++) {
      String dim = order.get(i);
      int length = reference.getLength(dim);
      int extent = i < chunkShape.length ? chunkShape[i] : -1;
      chunks.put(dim, extent <= 0 ? length : Math.min(extent, length));
    }
    return chunks;
  }

  /**
   * @param channels number of channels
   * @param channelChunk resolved channel chunk extent
   * @param requested explicit batch size, or null
   * @param inMemory true if nothing is written
   * @return number of channels read per batch
   */
  public static int getBatchSize(
    int channels, int channelChunk, Integer requested, boolean inMemory)
  {
    if (inMemory) {
      return channels;
    }
    if (requested != null && requested > 0) {
      return requested;
    }
    return channelChunk > 0 ? channelChunk : channels;
  }

  /**
   * Convert every compatible artifact, one channel batch at a time.
   * The store is created from the first batch and each later batch is
   * appended along the channel dimension.
   *
   * @param partition artifacts to convert
   * @param chunks chunk extent by dimension name
   * @param batchSize explicit channels per batch, or null
   * @param store destination, or null to convert in memory
   * @param compressor codec for data variables
   * @return the whole dataset when converting in memory, otherwise the
   *         last batch written
   * @throws IOException if an artifact could not be read or the store
   *                     could not be written
   * @throws ImageFormatException if an artifact could not be reopened
   */
  public Dataset write(ArtifactPartition partition,
    Map<String, Integer> chunks, Integer batchSize, IChunkedStore store,
    Compressor compressor) throws IOException, ImageFormatException
  {
    ArtifactMetadata reference = partition.getReference();
    int channels = reference.getLength(CHANNEL);
    if (channels < 0) {
      throw new IllegalArgumentException("Image " + reference.getType() +
        " has no " + CHANNEL + " axis: " + reference.getDimensions());
    }
    Integer channelChunk = chunks.get(CHANNEL);
    int size = getBatchSize(channels,
      channelChunk == null ? channels : channelChunk, batchSize, store == null);
    List<ChannelBatch> batches = ChannelBatch.partition(channels, size);
    List<String> types = partition.getCompatibleTypes();

    progressListener.notifyStart(types.size(), channels, batches.size());
    Dataset dataset = null;
    for (int b=0; b<batches.size(); b++) {
      ChannelBatch batch = batches.get(b);
      LOGGER.info("processing channel {} of {}", batch.getStart() + 1, channels);
      progressListener.notifyBatchStart(b, batch.getStart(), batch.getSize());

      dataset = readBatch(partition, b, batch);
      if (dataset.getDimensions().containsKey(POLARIZATION)) {
        dataset = dataset.transpose(TRAILING_DIMENSIONS);
      }

      if (store != null) {
        Slf4JStopWatch t0 = stopWatch();
        try {
          if (b == 0) {
            Map<String, Compressor> compressors =
              new LinkedHashMap<String, Compressor>();
            for (String name : dataset.getDataVariables().keySet()) {
              compressors.put(name, compressor);
            }
            store.create(dataset, compressors, chunks);
          }
          else {
            store.append(dataset, CHANNEL);
          }
        }
        finally {
          t0.stop("writeBatch");
        }
      }
      progressListener.notifyBatchEnd(b);
    }
    progressListener.notifyEnd();
    return dataset;
  }

  /**
   * Read one channel batch of every compatible artifact.
   */
  private Dataset readBatch(
    ArtifactPartition partition, int index, ChannelBatch batch)
    throws IOException, ImageFormatException
  {
    ArtifactMetadata reference = partition.getReference();
    List<String> dims = reference.getDimensions();
    Map<String, Variable> variables = new LinkedHashMap<String, Variable>();
    Variable validityMask = null;
    String maskSource = null;

    Slf4JStopWatch t0 = stopWatch();
    try {
      for (String type : partition.getCompatibleTypes()) {
        progressListener.notifyArtifactStart(index, type);
        ArtifactMetadata metadata = partition.getMetadata(type);
        Path path = ArtifactPartitioner.getArtifactPath(prefix, type);
        try (IImageHandle handle = reader.open(path)) {
          int[] offset = new int[metadata.getShape().length];
          int[] size = metadata.getShape();
          int channelAxis = metadata.getDimensions().indexOf(CHANNEL);
          if (channelAxis < 0) {
            throw new IllegalArgumentException(
              "Artifact " + type + " has no " + CHANNEL + " axis");
          }
          offset[channelAxis] = batch.getStart();
          size[channelAxis] = batch.getSize();
          NdArray pixels = handle.getChunk(offset, size, false);

          if (ArtifactTypes.SUMWT.equals(type)) {
            variables.put(type, toSumOfWeights(metadata, pixels));
          }
          else if (ArtifactTypes.MASK.equals(type)) {
            variables.put(ArtifactTypes.DECONVOLVE,
              new Variable(dims, pixels.toBoolean()));
          }
          else {
            variables.put(ArtifactTypes.getVariableName(type),
              new Variable(dims, pixels));
          }

          // sum-of-weights is not image shaped, so its mask is never used
          if (handle.hasMask() && !ArtifactTypes.SUMWT.equals(type)) {
            if (validityMask == null) {
              validityMask =
                new Variable(dims, handle.getChunk(offset, size, true));
              maskSource = type;
            }
            else {
              LOGGER.debug("Ignoring validity mask of {}; using mask of {}",
                type, maskSource);
            }
          }
        }
        progressListener.notifyArtifactEnd(index, type);
      }
    }
    finally {
      t0.stop("readBatch");
    }
    if (validityMask != null) {
      variables.put(ArtifactTypes.VALIDITY_MASK, validityMask);
    }

    Map<String, Variable> coords =
      new LinkedHashMap<String, Variable>(reference.getCoordinates());
    coords.put(CHANNEL, coords.get(CHANNEL).slice(
      CHANNEL, batch.getStart(), batch.getSize()));
    return new Dataset(variables, coords, reference.getAttributes().deepCopy());
  }

  /**
   * Reshape sum-of-weights pixels to <code>(pol, chan)</code>, or to
   * <code>(chan)</code> without a polarization axis.  Every other axis
   * must have length 1.
   */
  static Variable toSumOfWeights(ArtifactMetadata metadata, NdArray pixels) {
    List<String> dims = metadata.getDimensions();
    int pol = dims.indexOf(POLARIZATION);
    int chan = dims.indexOf(CHANNEL);
    int[] shape = pixels.getShape();
    List<Integer> permutation = new ArrayList<Integer>();
    for (int d=0; d<shape.length; d++) {
      if (d == pol || d == chan) {
        continue;
      }
      if (shape[d] != 1) {
        throw new IllegalStateException("Cannot reshape " +
          ArtifactTypes.SUMWT + " of shape " + Arrays.toString(shape) +
          " with dimensions " + dims);
      }
      permutation.add(d);
    }
    if (pol >= 0) {
      permutation.add(pol);
    }
    permutation.add(chan);
    NdArray ordered = pixels.transpose(
      permutation.stream().mapToInt(Integer::intValue).toArray());
    if (pol >= 0) {
      return new Variable(ImmutableList.of(POLARIZATION, CHANNEL),
        ordered.reshape(new int[] {shape[pol], shape[chan]}));
    }
    return new Variable(ImmutableList.of(CHANNEL),
      ordered.reshape(new int[] {shape[chan]}));
  }

  private static Slf4JStopWatch stopWatch() {
    return new Slf4JStopWatch(LOGGER, Slf4JStopWatch.DEBUG_LEVEL);
  }

}
