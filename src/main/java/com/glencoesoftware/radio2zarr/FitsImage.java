/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.radio2zarr;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.fits.ImageHDU;

import org.perf4j.slf4j.Slf4JStopWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * FITS image opened through nom-tam-fits.  The first image HDU with
 * data is the image; image extensions named <code>MASK*</code> are
 * validity masks in which non-zero pixels are valid.
 */
public class FitsImage implements IImageHandle {

  private static final Logger LOGGER = LoggerFactory.getLogger(FitsImage.class);

  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Prefix of EXTNAME values that identify validity masks. */
  public static final String MASK_EXTENSION = "MASK";

  private final Path path;
  private final Fits fits;
  private final ImageHDU image;
  private final List<ImageHDU> masks = new ArrayList<ImageHDU>();
  private final List<String> maskNames = new ArrayList<String>();
  private final List<Integer> maskBitpix = new ArrayList<Integer>();
  private final int[] shape;
  private final int bitpix;
  private final double bscale;
  private final double bzero;
  private final Long blank;
  private final WorldCoordinateSystem wcs;
  private final ObjectNode summary;

  /**
   * Open a FITS file and read all headers.  Pixel data is read on demand.
   *
   * @param path FITS file
   * @throws IOException if the file could not be read
   * @throws ImageFormatException if the file contains no image
   */
  public FitsImage(Path path) throws IOException, ImageFormatException {
    this.path = path;
    Fits file = null;
    try {
      file = new Fits(path.toFile());
      ImageHDU primary = null;
      for (BasicHDU<?> hdu : file.read()) {
        if (!(hdu instanceof ImageHDU)) {
          continue;
        }
        ImageHDU imageHDU = (ImageHDU) hdu;
        int[] axes = imageHDU.getAxes();
        if (axes == null || axes.length == 0) {
          continue;
        }
        String extname = imageHDU.getHeader().getStringValue("EXTNAME", "");
        if (primary != null &&
          extname.trim().toUpperCase().startsWith(MASK_EXTENSION))
        {
          masks.add(imageHDU);
          maskNames.add(extname.trim());
        }
        else if (primary == null) {
          primary = imageHDU;
        }
      }
      if (primary == null) {
        throw new ImageFormatException("No image data found in " + path);
      }
      image = primary;

      Header header = image.getHeader();
      int[] axes = image.getAxes();
      shape = new int[axes.length];
      for (int i=0; i<axes.length; i++) {
        shape[i] = axes[axes.length - 1 - i];
      }
      for (ImageHDU mask : masks) {
        int[] maskAxes = mask.getAxes();
        if (!Arrays.equals(maskAxes, axes)) {
          throw new ImageFormatException("Mask shape " +
            Arrays.toString(maskAxes) + " does not match image shape " +
            Arrays.toString(axes) + " in " + path);
        }
        maskBitpix.add(mask.getBitPix());
      }
      bitpix = image.getBitPix();
      ZarrTypes.getPixelType(bitpix);
      bscale = image.getBScale();
      bzero = image.getBZero();
      blank = header.containsKey("BLANK") ?
        Long.valueOf(header.getLongValue("BLANK")) : null;
      wcs = WorldCoordinateSystem.fromHeader(header, shape.length);
      summary = buildSummary(header);
      fits = file;
    }
    catch (FitsException | IllegalArgumentException e) {
      closeQuietly(file);
      throw new ImageFormatException("Could not read " + path, e);
    }
    catch (ImageFormatException e) {
      closeQuietly(file);
      throw e;
    }
    LOGGER.debug("opened {} shape {} with {} mask(s)",
      path, Arrays.toString(shape), masks.size());
  }

  @Override
  public ObjectNode getSummary() {
    return summary;
  }

  @Override
  public int[] getShape() {
    return shape.clone();
  }

  @Override
  public double[][] toWorld(double[][] pixels) {
    return wcs.toWorld(pixels);
  }

  @Override
  public boolean hasMask() {
    return !masks.isEmpty();
  }

  @Override
  public NdArray getChunk(int[] offset, int[] size, boolean getMask)
    throws IOException
  {
    if (offset.length != shape.length || size.length != shape.length) {
      throw new IllegalArgumentException("Expected " + shape.length +
        " axes, found " + offset.length + " and " + size.length);
    }
    if (getMask && masks.isEmpty()) {
      throw new IllegalStateException(path + " has no mask");
    }
    ImageHDU hdu = getMask ? masks.get(0) : image;

    // the tiler indexes axes in Java array order, last FITS axis first
    int rank = shape.length;
    int[] corners = new int[rank];
    int[] lengths = new int[rank];
    int[] permutation = new int[rank];
    for (int i=0; i<rank; i++) {
      corners[rank - 1 - i] = offset[i];
      lengths[rank - 1 - i] = size[i];
      permutation[i] = rank - 1 - i;
    }

    Object tile;
    Slf4JStopWatch t0 = stopWatch();
    try {
      tile = hdu.getTiler().getTile(corners, lengths);
    }
    catch (FitsException e) {
      throw new IOException("Could not read " + Arrays.toString(size) +
        " at " + Arrays.toString(offset) + " from " + path, e);
    }
    finally {
      t0.stop("getChunk");
    }
    NdArray stored = getMask ?
      toMask(tile, maskBitpix.get(0), lengths) : toPixels(tile, lengths);
    return stored.transpose(permutation);
  }

  @Override
  public void close() throws IOException {
    fits.close();
  }

  /**
   * Apply BSCALE, BZERO and BLANK to a tile of the image's BITPIX type.
   */
  private NdArray toPixels(Object tile, int[] tileShape) {
    boolean scaled = bscale != 1 || bzero != 0;
    switch (bitpix) {
      case -32: {
        float[] values = (float[]) tile;
        if (scaled) {
          for (int i=0; i<values.length; i++) {
            values[i] = (float) (values[i] * bscale + bzero);
          }
        }
        return NdArray.wrap(values, tileShape);
      }
      case -64: {
        double[] values = (double[]) tile;
        if (scaled) {
          for (int i=0; i<values.length; i++) {
            values[i] = values[i] * bscale + bzero;
          }
        }
        return NdArray.wrap(values, tileShape);
      }
      case 8: {
        byte[] raw = (byte[]) tile;
        float[] values = new float[raw.length];
        for (int i=0; i<raw.length; i++) {
          // BITPIX 8 is unsigned
          values[i] = scale(raw[i] & 0xff);
        }
        return NdArray.wrap(values, tileShape);
      }
      case 16: {
        short[] raw = (short[]) tile;
        float[] values = new float[raw.length];
        for (int i=0; i<raw.length; i++) {
          values[i] = scale(raw[i]);
        }
        return NdArray.wrap(values, tileShape);
      }
      case 32: {
        int[] raw = (int[]) tile;
        float[] values = new float[raw.length];
        for (int i=0; i<raw.length; i++) {
          values[i] = scale(raw[i]);
        }
        return NdArray.wrap(values, tileShape);
      }
      case 64: {
        long[] raw = (long[]) tile;
        float[] values = new float[raw.length];
        for (int i=0; i<raw.length; i++) {
          values[i] = scale(raw[i]);
        }
        return NdArray.wrap(values, tileShape);
      }
      default:
        throw new IllegalStateException("Unsupported BITPIX: " + bitpix);
    }
  }

  private float scale(long raw) {
    if (blank != null && raw == blank.longValue()) {
      return Float.NaN;
    }
    return (float) (raw * bscale + bzero);
  }

  /**
   * Non-zero, non-NaN mask pixels are valid.
   */
  private static NdArray toMask(Object tile, int maskType, int[] tileShape) {
    boolean[] values;
    switch (maskType) {
      case 8: {
        byte[] raw = (byte[]) tile;
        values = new boolean[raw.length];
        for (int i=0; i<raw.length; i++) {
          values[i] = raw[i] != 0;
        }
        break;
      }
      case 16: {
        short[] raw = (short[]) tile;
        values = new boolean[raw.length];
        for (int i=0; i<raw.length; i++) {
          values[i] = raw[i] != 0;
        }
        break;
      }
      case 32: {
        int[] raw = (int[]) tile;
        values = new boolean[raw.length];
        for (int i=0; i<raw.length; i++) {
          values[i] = raw[i] != 0;
        }
        break;
      }
      case 64: {
        long[] raw = (long[]) tile;
        values = new boolean[raw.length];
        for (int i=0; i<raw.length; i++) {
          values[i] = raw[i] != 0;
        }
        break;
      }
      case -32: {
        float[] raw = (float[]) tile;
        values = new boolean[raw.length];
        for (int i=0; i<raw.length; i++) {
          values[i] = raw[i] != 0 && !Float.isNaN(raw[i]);
        }
        break;
      }
      case -64: {
        double[] raw = (double[]) tile;
        values = new boolean[raw.length];
        for (int i=0; i<raw.length; i++) {
          values[i] = raw[i] != 0 && !Double.isNaN(raw[i]);
        }
        break;
      }
      default:
        throw new IllegalStateException("Unsupported mask BITPIX: " + maskType);
    }
    return NdArray.wrap(values, tileShape);
  }

  private ObjectNode buildSummary(Header header) {
    ObjectNode s = MAPPER.createObjectNode();
    s.put("ndim", shape.length);
    ArrayNode shapeNode = s.putArray("shape");
    ArrayNode tileShape = s.putArray("tileshape");
    ArrayNode axisNames = s.putArray("axisnames");
    ArrayNode axisUnits = s.putArray("axisunits");
    ArrayNode refpix = s.putArray("refpix");
    ArrayNode refval = s.putArray("refval");
    ArrayNode incr = s.putArray("incr");
    for (int i=0; i<shape.length; i++) {
      shapeNode.add(shape[i]);
      tileShape.add(i < 2 ? shape[i] : 1);
      axisNames.add(getAxisName(wcs.getType(i)));
      axisUnits.add(wcs.getUnit(i));
      refpix.add(wcs.getReferencePixel(i));
      refval.add(wcs.getReferenceValue(i));
      incr.add(wcs.getIncrement(i));
    }
    String unit = header.getStringValue("BUNIT", "").trim();
    String imageType = header.getStringValue("BTYPE", "Intensity").trim();
    s.put("unit", unit);
    s.put("imagetype", imageType);
    s.put("hasmask", !masks.isEmpty());
    s.put("defaultmask", maskNames.isEmpty() ? "" : maskNames.get(0));
    ArrayNode maskList = s.putArray("masks");
    for (String name : maskNames) {
      maskList.add(name);
    }

    if (header.containsKey("BMAJ") && header.containsKey("BMIN")) {
      ObjectNode beam = s.putObject("restoringbeam");
      ObjectNode major = beam.putObject("major");
      major.put("unit", "arcsec");
      major.put("value", header.getDoubleValue("BMAJ") * 3600);
      ObjectNode minor = beam.putObject("minor");
      minor.put("unit", "arcsec");
      minor.put("value", header.getDoubleValue("BMIN") * 3600);
      ObjectNode angle = beam.putObject("positionangle");
      angle.put("unit", "deg");
      angle.put("value", header.getDoubleValue("BPA", 0));
    }

    StringBuilder message = new StringBuilder();
    appendLine(message, "Image name", path.getFileName().toString());
    appendLine(message, "Object name", header.getStringValue("OBJECT", null));
    appendLine(message, "Image type", "FITSImage");
    appendLine(message, "Image quantity", imageType);
    appendLine(message, "Pixel mask(s)",
      maskNames.isEmpty() ? "None" : String.join(", ", maskNames));
    appendLine(message, "Region(s)", "None");
    appendLine(message, "Image units", unit);
    appendLine(message, "Telescope", header.getStringValue("TELESCOP", null));
    appendLine(message, "Observer", header.getStringValue("OBSERVER", null));
    appendLine(message, "Date observation",
      header.getStringValue("DATE-OBS", null));
    String radesys = header.getStringValue("RADESYS", null);
    if (radesys == null && header.containsKey("EQUINOX")) {
      radesys = header.getDoubleValue("EQUINOX") == 1950 ? "B1950" : "J2000";
    }
    appendLine(message, "Direction reference", radesys);
    appendLine(message, "Spectral reference",
      header.getStringValue("SPECSYS", null));
    if (header.containsKey("RESTFRQ")) {
      appendLine(message, "Rest frequency",
        header.getDoubleValue("RESTFRQ") + " Hz");
    }
    s.putArray("messages").add(message.toString());
    return s;
  }

  private static void appendLine(StringBuilder b, String label, String value) {
    if (value == null || value.trim().isEmpty()) {
      return;
    }
    b.append(String.format("%-20s: %s%n", label, value.trim()));
  }

  /**
   * @param ctype FITS CTYPE value
   * @return descriptive axis name, e.g. "Right Ascension"
   */
  static String getAxisName(String ctype) {
    String prefix = WorldCoordinateSystem.getPrefix(ctype);
    switch (prefix) {
      case "RA":
        return "Right Ascension";
      case "DEC":
        return "Declination";
      case "GLON":
      case "ELON":
        return "Longitude";
      case "GLAT":
      case "ELAT":
        return "Latitude";
      case "FREQ":
        return "Frequency";
      case "STOKES":
        return "Stokes";
      default:
        return ctype == null ? "" : ctype.trim();
    }
  }

  private static void closeQuietly(Fits file) {
    if (file == null) {
      return;
    }
    try {
      file.close();
    }
    catch (IOException e) {
      LOGGER.debug("Failed to close FITS file", e);
    }
  }

  private static Slf4JStopWatch stopWatch() {
    return new Slf4JStopWatch(LOGGER, Slf4JStopWatch.DEBUG_LEVEL);
  }

}
