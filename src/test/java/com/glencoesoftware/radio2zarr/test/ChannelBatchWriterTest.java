/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.radio2zarr.test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.glencoesoftware.radio2zarr.ArtifactPartition;
import com.glencoesoftware.radio2zarr.ArtifactPartitioner;
import com.glencoesoftware.radio2zarr.ChannelBatchWriter;
import com.glencoesoftware.radio2zarr.Dataset;
import com.glencoesoftware.radio2zarr.IChunkedStore;
import com.glencoesoftware.radio2zarr.IImageHandle;
import com.glencoesoftware.radio2zarr.IImageReader;
import com.glencoesoftware.radio2zarr.ImageFormatException;
import com.glencoesoftware.radio2zarr.NdArray;
import com.glencoesoftware.radio2zarr.PixelType;
import com.glencoesoftware.radio2zarr.Variable;
import com.glencoesoftware.radio2zarr.zarr.Compressor;
import com.glencoesoftware.radio2zarr.zarr.CompressorFactory;
import com.glencoesoftware.radio2zarr.zarr.ZarrCompression;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ChannelBatchWriterTest {

  private static final String[] NAMES =
    new String[] {"Right Ascension", "Declination", "Stokes", "Frequency"};
  private static final String[] UNITS =
    new String[] {"rad", "rad", "", "Hz"};

  private String prefix;
  private Map<String, FakeImage> images;
  private IImageReader reader;
  private Compressor compressor;

  /**
   * Records the channel length of every dataset written.
   */
  static class RecordingStore implements IChunkedStore {
    List<String> calls = new ArrayList<String>();
    Map<String, Integer> chunks;

    @Override
    public void create(Dataset dataset, Map<String, Compressor> compressors,
      Map<String, Integer> chunks) throws IOException
    {
      this.chunks = chunks;
      calls.add("create " + dataset.getDimensions().get("chan"));
    }

    @Override
    public void append(Dataset dataset, String dimension) throws IOException {
      calls.add("append " + dataset.getDimensions().get(dimension));
    }

    @Override
    public Dataset open() throws IOException {
      throw new UnsupportedOperationException();
    }
  }

  @BeforeEach
  public void setup(@TempDir Path tmp) {
    prefix = tmp.resolve("target").toString();
    images = new HashMap<String, FakeImage>();
    compressor = CompressorFactory.create(ZarrCompression.zlib, null);
    reader = new IImageReader() {
      @Override
      public IImageHandle open(Path path)
        throws IOException, ImageFormatException
      {
        return images.get(path.getFileName().toString());
      }
    };
  }

  private void add(String type, FakeImage image) throws IOException {
    Path path = ArtifactPartitioner.getArtifactPath(prefix, type);
    Files.createFile(path);
    images.put(path.getFileName().toString(), image);
  }

  /**
   * @return image of the given shape whose values are their flat index
   */
  private static NdArray indexed(int... shape) {
    float[] values = new float[NdArray.getSize(shape)];
    for (int i=0; i<values.length; i++) {
      values[i] = i;
    }
    return NdArray.wrap(values, shape);
  }

  private static NdArray validity(int... shape) {
    boolean[] values = new boolean[NdArray.getSize(shape)];
    for (int i=0; i<values.length; i++) {
      values[i] = i % 3 != 0;
    }
    return NdArray.wrap(values, shape);
  }

  private void addProducts() throws IOException {
    add("image", new FakeImage(NAMES, UNITS, indexed(4, 3, 2, 5),
      validity(4, 3, 2, 5)));
    add("mask", new FakeImage(NAMES, UNITS, indexed(4, 3, 2, 5), null));
    add("psf", new FakeImage(NAMES, UNITS, indexed(4, 3, 2, 5),
      NdArray.filled(PixelType.BOOL, new int[] {4, 3, 2, 5}, 0)));
    add("sumwt", new FakeImage(NAMES, UNITS, indexed(1, 1, 2, 5), null));
  }

  private ArtifactPartition partition() throws Exception {
    return new ArtifactPartitioner(reader).partition(prefix, "image", null);
  }

  @Test
  public void testChunkOrder() {
    assertEquals(Arrays.asList("d0", "d1", "chan", "pol"),
      ChannelBatchWriter.getChunkOrder(
        Arrays.asList("d0", "d1", "pol", "chan")));
    assertEquals(Arrays.asList("d0", "d1", "chan"),
      ChannelBatchWriter.getChunkOrder(Arrays.asList("d0", "chan", "d1")));
  }

  @Test
  public void testChunks() throws Exception {
    addProducts();
    ArtifactPartition partition = partition();
    Map<String, Integer> chunks = ChannelBatchWriter.getChunks(
      partition.getReference(), new int[] {-1, 2, 10, 1});
    assertEquals(Integer.valueOf(4), chunks.get("d0"));
    assertEquals(Integer.valueOf(2), chunks.get("d1"));
    assertEquals(Integer.valueOf(5), chunks.get("chan"));
    assertEquals(Integer.valueOf(1), chunks.get("pol"));

    chunks = ChannelBatchWriter.getChunks(
      partition.getReference(), new int[] {2});
    assertEquals(Integer.valueOf(2), chunks.get("d0"));
    assertEquals(Integer.valueOf(3), chunks.get("d1"));
    assertEquals(Integer.valueOf(5), chunks.get("chan"));
    assertEquals(Integer.valueOf(2), chunks.get("pol"));
  }

  /**
   * Test that the default polarization extent is dropped quietly for
   * images without a polarization axis.
   */
  @Test
  public void testChunksWithoutPolarization() throws Exception {
    add("image", new FakeImage(
      new String[] {"Right Ascension", "Declination", "Frequency"},
      new String[] {"rad", "rad", "Hz"}, indexed(4, 3, 5), null));
    ArtifactPartition partition = partition();

    Logger logger = (Logger) LoggerFactory.getLogger(ChannelBatchWriter.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<ILoggingEvent>();
    appender.start();
    logger.addAppender(appender);
    logger.setLevel(Level.DEBUG);
    try {
      Map<String, Integer> chunks = ChannelBatchWriter.getChunks(
        partition.getReference(), new int[] {-1, -1, 1, 1});
      assertEquals(Arrays.asList("d0", "d1", "chan"),
        new ArrayList<String>(chunks.keySet()));
      assertEquals(Integer.valueOf(1), chunks.get("chan"));
      assertEquals(1, appender.list.size());
      assertEquals(Level.DEBUG, appender.list.get(0).getLevel());

      appender.list.clear();
      ChannelBatchWriter.getChunks(
        partition.getReference(), new int[] {-1, -1, 1, 4});
      assertEquals(1, appender.list.size());
      assertEquals(Level.WARN, appender.list.get(0).getLevel());
    }
    finally {
      logger.detachAppender(appender);
      logger.setLevel(null);
    }
  }

  @Test
  public void testBatchSize() {
    assertEquals(5, ChannelBatchWriter.getBatchSize(5, 1, null, true));
    assertEquals(5, ChannelBatchWriter.getBatchSize(5, 1, 2, true));
    assertEquals(2, ChannelBatchWriter.getBatchSize(5, 1, 2, false));
    assertEquals(1, ChannelBatchWriter.getBatchSize(5, 1, null, false));
    assertEquals(5, ChannelBatchWriter.getBatchSize(5, 0, null, false));
  }

  @Test
  public void testBatches() throws Exception {
    addProducts();
    ArtifactPartition partition = partition();
    Map<String, Integer> chunks = ChannelBatchWriter.getChunks(
      partition.getReference(), new int[] {-1, -1, 2, 1});
    RecordingStore store = new RecordingStore();
    TestProgressListener listener = new TestProgressListener();
    ChannelBatchWriter writer = new ChannelBatchWriter(reader, prefix);
    writer.setProgressListener(listener);

    Dataset last = writer.write(partition, chunks, null, store, compressor);
    assertEquals(Arrays.asList("create 2", "append 2", "append 1"),
      store.calls);
    assertEquals(chunks, store.chunks);
    assertArrayEquals(new Integer[] {2, 2, 1}, listener.getBatchSizes());
    assertEquals(Integer.valueOf(1), last.getDimensions().get("chan"));
    // the last batch holds channel 4 only
    NdArray image = last.getVariable("image").getData();
    assertEquals(1 * 30 + 2 * 10 + 1 * 5 + 4,
      image.getDouble(new int[] {1, 2, 0, 1}), 0);
  }

  @Test
  public void testInMemory() throws Exception {
    addProducts();
    ArtifactPartition partition = partition();
    Map<String, Integer> chunks = ChannelBatchWriter.getChunks(
      partition.getReference(), new int[] {-1, -1, 1, 1});
    ChannelBatchWriter writer = new ChannelBatchWriter(reader, prefix);
    writer.setProgressListener(new TestProgressListener());
    Dataset dataset = writer.write(partition, chunks, 2, null, compressor);

    Variable image = dataset.getVariable("image");
    assertEquals(Arrays.asList("d0", "d1", "chan", "pol"),
      image.getDimensions());
    NdArray values = image.getData();
    for (int x=0; x<4; x++) {
      for (int y=0; y<3; y++) {
        for (int p=0; p<2; p++) {
          for (int c=0; c<5; c++) {
            assertEquals(x * 30 + y * 10 + p * 5 + c,
              values.getDouble(new int[] {x, y, c, p}), 0);
          }
        }
      }
    }

    Variable sumwt = dataset.getVariable("sumwt");
    assertEquals(Arrays.asList("chan", "pol"), sumwt.getDimensions());
    assertEquals(7, sumwt.getData().getDouble(new int[] {2, 1}), 0);

    Variable deconvolve = dataset.getVariable("deconvolve");
    assertEquals(PixelType.BOOL, deconvolve.getPixelType());
    assertFalse(deconvolve.getData().getBoolean(0));
    assertTrue(deconvolve.getData().getBoolean(1));

    // the image's mask is used, not the all-false mask of the psf
    Variable mask = dataset.getVariable("mask");
    NdArray valid = mask.getData();
    assertFalse(valid.getBoolean(valid.getIndex(new int[] {0, 0, 0, 0})));
    assertTrue(valid.getBoolean(valid.getIndex(new int[] {0, 0, 1, 0})));
    assertTrue(valid.getBoolean(valid.getIndex(new int[] {0, 0, 0, 1})));
    assertEquals(5, dataset.getCoordinates().get("chan").getShape()[0]);
  }

  @Test
  public void testNoChannelAxis() throws Exception {
    add("image", new FakeImage(new String[] {"Right Ascension", "Declination"},
      new String[] {"rad", "rad"}, indexed(4, 3), null));
    ArtifactPartition partition = partition();
    Map<String, Integer> chunks = ChannelBatchWriter.getChunks(
      partition.getReference(), new int[] {-1, -1});
    ChannelBatchWriter writer = new ChannelBatchWriter(reader, prefix);
    writer.setProgressListener(new TestProgressListener());
    assertThrows(IllegalArgumentException.class,
      () -> writer.write(partition, chunks, null, null, compressor));
  }

}
