/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.radio2zarr;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

import com.glencoesoftware.radio2zarr.zarr.Compressor;
import com.glencoesoftware.radio2zarr.zarr.CompressorFactory;
import com.glencoesoftware.radio2zarr.zarr.DimensionSeparator;
import com.glencoesoftware.radio2zarr.zarr.ZarrCompression;
import com.glencoesoftware.radio2zarr.zarr.ZarrStore;

import org.perf4j.slf4j.Slf4JStopWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import picocli.CommandLine;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Command line tool for converting radio astronomy image products to Zarr.
 */
public class Converter implements Callable<Integer> {

  private static final Logger LOGGER = LoggerFactory.getLogger(Converter.class);

  /** Replaces the input's final extension when no output is given. */
  public static final String OUTPUT_SUFFIX = ".img.zarr";

  private volatile Path inputPath;
  private volatile String outputLocation;

  private volatile List<String> artifacts;
  private volatile ZarrCompression compressionType;
  private volatile Map<String, Object> compressionProperties;
  private volatile int[] chunkShape;
  private volatile Integer channelBatch;
  private volatile boolean noFile = false;
  private volatile boolean nested = true;

  private volatile String logLevel;
  private volatile boolean progressBars = false;
  private volatile boolean printVersion = false;
  private volatile boolean help = false;

  private IImageReader imageReader = new FitsImageReader();
  private IProgressListener progressListener;

  // Option setters

  /**
   * @param input path to the primary image
   */
  @Parameters(
    index = "0",
    arity = "1",
    description = "image to convert, e.g. my_target.image or my_target.fits",
    defaultValue = Option.NULL_VALUE
  )
  public void setInputPath(String input) {
    if (input != null) {
      inputPath = Paths.get(input);
    }
    else {
      inputPath = null;
    }
  }

  /**
   * @param output path where the Zarr store should be written
   */
  @Parameters(
    index = "1",
    arity = "0..1",
    description = "path to the output Zarr store " +
      "(default: input with its extension replaced by " + OUTPUT_SUFFIX + ")",
    defaultValue = Option.NULL_VALUE
  )
  public void setOutputPath(String output) {
    outputLocation = output;
  }

  /**
   * Define the artifacts to convert along with the input image.
   * If null, the default artifact list is used.
   *
   * @param types artifact types, i.e. extensions replacing the input's
   */
  @Option(
    names = {"-a", "--artifacts"},
    split = ",",
    description = "Comma-separated list of other image artifacts to " +
      "include if present (default: image.pbcor, mask, model, pb, psf, " +
      "residual, sumwt, weight)",
    defaultValue = Option.NULL_VALUE
  )
  public void setArtifacts(List<String> types) {
    artifacts = types;
  }

  /**
   * Set the compression type for the output Zarr. Defaults to zstd.
   *
   * @param compression compression type
   */
  @Option(
    names = {"-c", "--compression"},
    description = "Compression type for Zarr " +
      "(${COMPLETION-CANDIDATES}; default: ${DEFAULT-VALUE})",
    defaultValue = "zstd"
  )
  public void setCompression(ZarrCompression compression) {
    if (compression != null) {
      compressionType = compression;
    }
  }

  /**
   * Compression-specific options, e.g. "level=5".
   *
   * @param properties compression properties
   */
  @Option(
    names = {"--compression-properties"},
    description = "Properties for the chosen compression (level; " +
      "default level: " + CompressorFactory.DEFAULT_LEVEL + ")",
    defaultValue = Option.NULL_VALUE
  )
  public void setCompressionProperties(Map<String, Object> properties) {
    if (properties != null) {
      compressionProperties = properties;
    }
    else {
      compressionProperties = new HashMap<String, Object>();
    }
  }

  /**
   * Set the chunk shape, in the order spatial, spatial, channel,
   * polarization.  -1 places the whole axis in one chunk.
   *
   * @param shape chunk extent of each output axis
   */
  @Option(
    names = {"--chunk-shape", "--chunk_shape"},
    split = ",",
    description = "Comma-separated chunk shape in the order " +
      "x, y, channel, polarization; -1 for the entire axis " +
      "(default: ${DEFAULT-VALUE})",
    defaultValue = "-1,-1,1,1"
  )
  public void setChunkShape(List<Integer> shape) {
    if (shape == null || shape.isEmpty()) {
      LOGGER.warn("Ignoring empty chunk shape");
      return;
    }
    int[] extents = new int[shape.size()];
    for (int i=0; i<extents.length; i++) {
      Integer extent = shape.get(i);
      if (extent == null || extent == 0 || extent < -1) {
        LOGGER.warn("Ignoring invalid chunk shape: {}", shape);
        return;
      }
      extents[i] = extent;
    }
    chunkShape = extents;
  }

  /**
   * Set the number of channels read and written together.  By default
   * this is the channel chunk size.
   *
   * @param channels channels per batch
   */
  @Option(
    names = {"--channel-batch", "--channel_batch"},
    description = "Number of channels to process at once " +
      "(default: channel chunk size)",
    defaultValue = Option.NULL_VALUE
  )
  public void setChannelBatch(Integer channels) {
    if (channels == null || channels > 0) {
      channelBatch = channels;
    }
    else {
      LOGGER.warn("Ignoring invalid channel batch: {}", channels);
    }
  }

  /**
   * Configure whether the image is only converted in memory.
   *
   * @param inMemory true if no output should be written
   */
  @Option(
    names = {"--no-file", "--nofile"},
    description = "Convert in memory without writing output; " +
      "the whole image is held in memory",
    defaultValue = "false"
  )
  public void setNoFile(boolean inMemory) {
    noFile = inMemory;
  }

  /**
   * Set the use of nested chunk keys ("/" separator) in the output.
   *
   * @param noNested true if "." should be used as the separator
   */
  @Option(
    names = "--no-nested",
    description = "Use '.' as the chunk key separator instead of '/'",
    defaultValue = "false"
  )
  public void setNoNested(boolean noNested) {
    nested = !noNested;
  }

  /**
   * Set the slf4j logging level. Defaults to "WARN".
   *
   * @param level logging level
   */
  @Option(
    names = {"--log-level", "--debug"},
    arity = "0..1",
    description = "Change logging level; valid values are " +
      "OFF, ERROR, WARN, INFO, DEBUG, TRACE and ALL. " +
      "(default: ${DEFAULT-VALUE})",
    defaultValue = "WARN",
    fallbackValue = "DEBUG"
  )
  public void setLogLevel(String level) {
    if (level != null) {
      logLevel = level;
    }
  }

  /**
   * Configure whether or not progress bars are shown during conversion.
   * Progress bars are turned off by default.
   *
   * @param useProgressBars whether or not to show progress bars
   */
  @Option(
    names = {"-p", "--progress"},
    description = "Print progress bars during conversion",
    defaultValue = "false"
  )
  public void setProgressBars(boolean useProgressBars) {
    progressBars = useProgressBars;
  }

  /**
   * Configure whether to print version information and exit
   * without converting.
   *
   * @param versionOnly whether or not to print version information and exit
   */
  @Option(
    names = "--version",
    description = "Print version information and exit",
    help = true,
    defaultValue = "false"
  )
  public void setPrintVersionOnly(boolean versionOnly) {
    printVersion = versionOnly;
  }

  /**
   * Configure whether to print help and exit without converting.
   *
   * @param helpOnly whether or not to print help and exit
   */
  @Option(
    names = "--help",
    description = "Print usage information and exit",
    usageHelp = true,
    defaultValue = "false"
  )
  public void setHelp(boolean helpOnly) {
    help = helpOnly;
  }

  /**
   * Replace the reader used to open artifacts.
   *
   * @param reader image reader
   */
  public void setImageReader(IImageReader reader) {
    imageReader = reader;
  }

  // Option getters

  /**
   * @return path to input image
   */
  public Path getInputPath() {
    return inputPath;
  }

  /**
   * @return output location, or null if derived from the input
   */
  public String getOutputPath() {
    return outputLocation;
  }

  /**
   * @return requested artifacts, or null for the defaults
   */
  public List<String> getArtifacts() {
    return artifacts == null ? null : new ArrayList<String>(artifacts);
  }

  /**
   * @return compression type
   */
  public ZarrCompression getCompression() {
    return compressionType;
  }

  /**
   * @return compression properties
   */
  public Map<String, Object> getCompressionProperties() {
    return compressionProperties;
  }

  /**
   * @return chunk shape in x, y, channel, polarization order
   */
  public int[] getChunkShape() {
    return chunkShape == null ? null : chunkShape.clone();
  }

  /**
   * @return explicit channel batch size, or null
   */
  public Integer getChannelBatch() {
    return channelBatch;
  }

  /**
   * @return true if nothing is written
   */
  public boolean getNoFile() {
    return noFile;
  }

  /**
   * @return true if chunk keys use "/" as the separator
   */
  public boolean getNested() {
    return nested;
  }

  /**
   * @return slf4j logging level
   */
  public String getLogLevel() {
    return logLevel;
  }

  /**
   * @return true if progress bars are displayed
   */
  public boolean getProgressBars() {
    return progressBars;
  }

  /**
   * @return true if only version info is displayed
   */
  public boolean getPrintVersionOnly() {
    return printVersion;
  }

  /**
   * @return true if only usage info is displayed
   */
  public boolean getHelp() {
    return help;
  }

  // Conversion methods

  /**
   * @return 0 if conversion completed without error,
   *         -1 if conversion was not performed
   * @throws Exception on most conversion errors
   */
  @Override
  public Integer call() throws Exception {
    ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger)
        LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
    root.setLevel(Level.toLevel(logLevel));

    if (help) {
      return -1;
    }

    if (printVersion) {
      String version = Optional.ofNullable(
        this.getClass().getPackage().getImplementationVersion()
        ).orElse("development");
      System.out.println("Version = " + version);
      return -1;
    }

    if (progressBars) {
      setProgressListener(new ProgressBarListener(logLevel));
    }

    ConversionResult result = convert();
    LOGGER.info("compatible components: {}", result.getCompatibleTypes());
    LOGGER.info("separate components: {}", result.getIncompatibleTypes());
    return 0;
  }

  /**
   * Convert the input image and its artifacts according to the
   * specified options.
   *
   * @return converted dataset and artifact partition
   * @throws IOException if an artifact could not be read or the output
   *                     could not be written
   * @throws ImageFormatException if an artifact is not a valid image
   * @throws NoCompatibleArtifactsException if no artifact exists; the
   *         output location is left untouched
   */
  public ConversionResult convert() throws IOException, ImageFormatException {
    if (inputPath == null) {
      throw new IllegalArgumentException("Input path not specified");
    }
    String input = inputPath.toString();
    int dot = input.lastIndexOf('.');
    if (dot < 0 || dot < input.lastIndexOf(File.separatorChar)) {
      throw new IllegalArgumentException(
        "Input path " + input + " has no extension");
    }
    String prefix = input.substring(0, dot);
    String suffix = input.substring(dot + 1);
    Path outputPath = outputLocation == null ?
      Paths.get(prefix + OUTPUT_SUFFIX) : Paths.get(outputLocation);

    Slf4JStopWatch t0 = new Slf4JStopWatch(LOGGER, Slf4JStopWatch.INFO_LEVEL);
    ArtifactPartition partition =
      new ArtifactPartitioner(imageReader).partition(prefix, suffix, artifacts);
    LOGGER.debug("compatible components: {}", partition.getCompatibleTypes());
    LOGGER.debug("separate components: {}", partition.getIncompatibleTypes());

    IChunkedStore store = null;
    if (!noFile) {
      if (Files.exists(outputPath)) {
        LOGGER.warn("Overwriting output path {}", outputPath);
        try (Stream<Path> paths = Files.walk(outputPath)) {
          paths.sorted(Comparator.reverseOrder())
            .map(Path::toFile)
            .forEach(File::delete);
        }
      }
      store = new ZarrStore(outputPath,
        nested ? DimensionSeparator.SLASH : DimensionSeparator.DOT);
    }

    ZarrCompression compression =
      compressionType == null ? ZarrCompression.zstd : compressionType;
    Compressor compressor =
      CompressorFactory.create(compression, compressionProperties);
    int[] shape = chunkShape == null ? new int[] {-1, -1, 1, 1} : chunkShape;
    Map<String, Integer> chunks =
      ChannelBatchWriter.getChunks(partition.getReference(), shape);

    ChannelBatchWriter writer = new ChannelBatchWriter(imageReader, prefix);
    writer.setProgressListener(getProgressListener());
    Dataset dataset =
      writer.write(partition, chunks, channelBatch, store, compressor);
    if (store != null) {
      dataset = store.open();
    }

    t0.stop("convert");
    LOGGER.info("processed image size {} in {} seconds",
      Arrays.toString(partition.getReference().getShape()),
      t0.getElapsedTime() / 1000.0);
    return new ConversionResult(dataset, partition, noFile ? null : outputPath);
  }

  /**
   * Set a listener for batch processing events.
   * Intended to be used to show a status bar.
   *
   * @param listener a progress event listener
   */
  public void setProgressListener(IProgressListener listener) {
    progressListener = listener;
  }

  /**
   * Get the currrent listener for batch processing events.
   * If no listener was set, a no-op listener is returned.
   *
   * @return the current progress listener
   */
  public IProgressListener getProgressListener() {
    if (progressListener == null) {
      setProgressListener(new NoOpProgressListener());
    }
    return progressListener;
  }

  /**
   * Perform file conversion as specified by command line arguments.
   * @param args command line arguments
   */
  public static void main(String[] args) {
    int exitCode = new CommandLine(new Converter()).execute(args);
    System.exit(exitCode);
  }

}
