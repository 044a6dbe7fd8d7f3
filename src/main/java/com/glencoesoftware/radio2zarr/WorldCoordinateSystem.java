/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.radio2zarr;

import java.util.Set;

import com.google.common.collect.ImmutableSet;

import nom.tam.fits.Header;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pixel to world transformation described by FITS WCS keywords.
 * A longitude/latitude axis pair using one of the zenithal projections
 * is evaluated jointly; every other axis is linear.
 */
public class WorldCoordinateSystem {

  private static final Logger LOGGER =
    LoggerFactory.getLogger(WorldCoordinateSystem.class);

  /** Projections that can be evaluated as a celestial pair. */
  public static final Set<String> ZENITHAL =
    ImmutableSet.of("SIN", "TAN", "ARC", "ZEA", "STG");

  private static final double TWO_PI = 2 * Math.PI;

  private final String[] types;
  private final String[] units;
  private final double[] crval;
  private final double[] cdelt;
  private final double[] crpix;

  private int longitudeAxis = -1;
  private int latitudeAxis = -1;
  private String projection;
  private double lonpole;

  /**
   * @param types CTYPE of each axis
   * @param units CUNIT of each axis; may contain nulls
   * @param crval reference value of each axis
   * @param cdelt increment of each axis
   * @param crpix one-based reference pixel of each axis
   * @param lonpole native longitude of the celestial pole in degrees,
   *                or NaN to use the default for the projection
   */
  public WorldCoordinateSystem(String[] types, String[] units,
    double[] crval, double[] cdelt, double[] crpix, double lonpole)
  {
    this.types = types.clone();
    this.units = units.clone();
    this.crval = crval.clone();
    this.cdelt = cdelt.clone();
    this.crpix = crpix.clone();

    int lon = -1;
    int lat = -1;
    for (int i=0; i<types.length; i++) {
      String prefix = getPrefix(types[i]);
      if (prefix.equals("RA") || prefix.endsWith("LON")) {
        lon = i;
      }
      else if (prefix.equals("DEC") || prefix.endsWith("LAT")) {
        lat = i;
      }
    }
    if (lon >= 0 && lat >= 0) {
      String lonProjection = getProjection(types[lon]);
      String latProjection = getProjection(types[lat]);
      if (ZENITHAL.contains(lonProjection) &&
        lonProjection.equals(latProjection))
      {
        longitudeAxis = lon;
        latitudeAxis = lat;
        projection = lonProjection;
      }
      else {
        LOGGER.warn("Unsupported projection {}/{}; using linear coordinates",
          types[lon], types[lat]);
      }
    }
    if (Double.isNaN(lonpole)) {
      lonpole = latitudeAxis >= 0 && crval[latitudeAxis] >= 90 ? 0 : 180;
    }
    this.lonpole = lonpole;
  }

  /**
   * Read the WCS keywords for the given number of axes.
   *
   * @param header FITS header
   * @param naxis number of axes
   * @return coordinate system described by the header
   */
  public static WorldCoordinateSystem fromHeader(Header header, int naxis) {
    String[] types = new String[naxis];
    String[] units = new String[naxis];
    double[] crval = new double[naxis];
    double[] cdelt = new double[naxis];
    double[] crpix = new double[naxis];
    for (int i=0; i<naxis; i++) {
      int n = i + 1;
      types[i] = header.getStringValue("CTYPE" + n, "");
      units[i] = header.getStringValue("CUNIT" + n, null);
      crval[i] = header.getDoubleValue("CRVAL" + n, 0);
      cdelt[i] = header.getDoubleValue("CDELT" + n, 1);
      crpix[i] = header.getDoubleValue("CRPIX" + n, 0);
    }
    return new WorldCoordinateSystem(types, units, crval, cdelt, crpix,
      header.getDoubleValue("LONPOLE", Double.NaN));
  }

  /**
   * @param ctype CTYPE value
   * @return axis type without the projection code, e.g. "RA" or "FREQ"
   */
  public static String getPrefix(String ctype) {
    String type = ctype == null ? "" : ctype.trim().toUpperCase();
    int dash = type.indexOf('-');
    return dash < 0 ? type : type.substring(0, dash);
  }

  private static String getProjection(String ctype) {
    String type = ctype.trim().toUpperCase();
    int dash = type.lastIndexOf('-');
    return dash < 0 ? "" : type.substring(dash + 1);
  }

  public int getAxisCount() {
    return types.length;
  }

  public String getType(int axis) {
    return types[axis];
  }

  /**
   * @param axis axis index
   * @return true if the axis is one of a jointly evaluated celestial pair
   */
  public boolean isCelestial(int axis) {
    return axis == longitudeAxis || axis == latitudeAxis;
  }

  /**
   * @param axis axis index
   * @return "rad" for celestial axes, otherwise the CUNIT value or ""
   */
  public String getUnit(int axis) {
    if (isCelestial(axis)) {
      return CoordinateResolver.ANGULAR_UNIT;
    }
    return units[axis] == null ? "" : units[axis].trim();
  }

  /** @return reference value, in radians for celestial axes */
  public double getReferenceValue(int axis) {
    return isCelestial(axis) ? Math.toRadians(crval[axis]) : crval[axis];
  }

  /** @return increment, in radians for celestial axes */
  public double getIncrement(int axis) {
    return isCelestial(axis) ? Math.toRadians(cdelt[axis]) : cdelt[axis];
  }

  /** @return zero-based reference pixel */
  public double getReferencePixel(int axis) {
    return crpix[axis] - 1;
  }

  /**
   * Convert zero-based pixel positions to world coordinates.
   *
   * @param pixels positions indexed <code>[axis][point]</code>
   * @return world coordinates indexed <code>[axis][point]</code>;
   *         celestial axes in radians, longitude in [0, 2&pi;)
   */
  public double[][] toWorld(double[][] pixels) {
    if (pixels.length != types.length) {
      throw new IllegalArgumentException("Expected " + types.length +
        " axes, found " + pixels.length);
    }
    int points = pixels.length == 0 ? 0 : pixels[0].length;
    double[][] world = new double[types.length][points];
    for (int axis=0; axis<types.length; axis++) {
      if (isCelestial(axis)) {
        continue;
      }
      for (int p=0; p<points; p++) {
        world[axis][p] = crval[axis] +
          cdelt[axis] * (pixels[axis][p] + 1 - crpix[axis]);
      }
    }
    if (longitudeAxis >= 0) {
      for (int p=0; p<points; p++) {
        double x = cdelt[longitudeAxis] *
          (pixels[longitudeAxis][p] + 1 - crpix[longitudeAxis]);
        double y = cdelt[latitudeAxis] *
          (pixels[latitudeAxis][p] + 1 - crpix[latitudeAxis]);
        double[] celestial = toCelestial(x, y);
        world[longitudeAxis][p] = celestial[0];
        world[latitudeAxis][p] = celestial[1];
      }
    }
    return world;
  }

  /**
   * @param x intermediate world coordinate along longitude, degrees
   * @param y intermediate world coordinate along latitude, degrees
   * @return longitude and latitude in radians
   */
  private double[] toCelestial(double x, double y) {
    double r = Math.hypot(x, y);
    double phi = r == 0 ? 0 : Math.atan2(x, -y);
    double rr = Math.toRadians(r);
    double theta;
    switch (projection) {
      case "SIN":
        theta = rr > 1 ? Double.NaN : Math.acos(rr);
        break;
      case "TAN":
        theta = Math.atan2(1, rr);
        break;
      case "ARC":
        theta = Math.PI / 2 - rr;
        break;
      case "ZEA":
        theta = rr > 2 ? Double.NaN : Math.PI / 2 - 2 * Math.asin(rr / 2);
        break;
      case "STG":
        theta = Math.PI / 2 - 2 * Math.atan(rr / 2);
        break;
      default:
        throw new IllegalStateException("Unsupported projection " + projection);
    }

    double alphaP = Math.toRadians(crval[longitudeAxis]);
    double deltaP = Math.toRadians(crval[latitudeAxis]);
    double dphi = phi - Math.toRadians(lonpole);
    double sinTheta = Math.sin(theta);
    double cosTheta = Math.cos(theta);
    double sinDeltaP = Math.sin(deltaP);
    double cosDeltaP = Math.cos(deltaP);

    double sinDelta =
      sinTheta * sinDeltaP + cosTheta * cosDeltaP * Math.cos(dphi);
    double delta = Math.asin(Math.max(-1, Math.min(1, sinDelta)));
    double alpha = alphaP + Math.atan2(-cosTheta * Math.sin(dphi),
      sinTheta * cosDeltaP - cosTheta * sinDeltaP * Math.cos(dphi));
    alpha = alpha % TWO_PI;
    if (alpha < 0) {
      alpha += TWO_PI;
    }
    return new double[] {alpha, delta};
  }

}
