/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.radio2zarr;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;

/**
 * Artifact type tags and the names under which each artifact is stored.
 * An artifact of type <code>t</code> lives next to the primary image at
 * <code>prefix + "." + t</code>.
 */
public final class ArtifactTypes {

  public static final String FITS = "fits";
  public static final String IMAGE = "image";
  public static final String IMAGE_PBCOR = "image.pbcor";
  public static final String MASK = "mask";
  public static final String MODEL = "model";
  public static final String PB = "pb";
  public static final String PSF = "psf";
  public static final String RESIDUAL = "residual";
  public static final String SUMWT = "sumwt";
  public static final String WEIGHT = "weight";

  /** Variable holding the deconvolution mask artifact. */
  public static final String DECONVOLVE = "deconvolve";

  /** Variable holding the validity mask carried by an artifact. */
  public static final String VALIDITY_MASK = "mask";

  /** Artifacts looked for when none are requested. */
  public static final List<String> DEFAULT_TYPES = ImmutableList.of(
    IMAGE_PBCOR, MASK, MODEL, PB, PSF, RESIDUAL, SUMWT, WEIGHT);

  private ArtifactTypes() {
  }

  /**
   * Build the ordered list of artifact types to look for.
   *
   * @param suffix extension of the primary image, e.g. "image" or "fits"
   * @param artifacts requested artifact types, or null for the defaults
   * @return candidate types without duplicates, primary image first
   */
  public static List<String> getCandidates(
    String suffix, List<String> artifacts)
  {
    Set<String> candidates = new LinkedHashSet<String>();
    if (artifacts == null) {
      if (!DEFAULT_TYPES.contains(suffix)) {
        candidates.add(suffix);
      }
      candidates.addAll(DEFAULT_TYPES);
    }
    else {
      candidates.add(suffix);
      candidates.addAll(artifacts);
    }
    return new ArrayList<String>(candidates);
  }

  /**
   * @param type artifact type
   * @return name of the data variable holding the artifact's pixels
   */
  public static String getVariableName(String type) {
    switch (type) {
      case FITS:
        return IMAGE;
      case MASK:
        return DECONVOLVE;
      default:
        return type;
    }
  }

}
