/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.radio2zarr;

/**
 * Result of comparing an artifact with the reference artifact.
 */
public final class ArtifactCheck {

  public enum Outcome {
    /** No reference existed; the artifact becomes the reference. */
    REFERENCE,
    /** Same pixel shape as the reference. */
    COMPATIBLE,
    /** Shape is not compared. */
    EXEMPT,
    /** Different pixel shape; the artifact is kept separate. */
    MISMATCH
  }

  private final Outcome outcome;
  private final ArtifactMetadata metadata;

  private ArtifactCheck(Outcome outcome, ArtifactMetadata metadata) {
    this.outcome = outcome;
    this.metadata = metadata;
  }

  /**
   * @param reference reference metadata, or null if none yet
   * @param candidate metadata of the artifact being checked
   * @return check result carrying the candidate's metadata
   */
  public static ArtifactCheck check(
    ArtifactMetadata reference, ArtifactMetadata candidate)
  {
    if (ArtifactTypes.SUMWT.equals(candidate.getType())) {
      return new ArtifactCheck(Outcome.EXEMPT, candidate);
    }
    if (reference == null) {
      return new ArtifactCheck(Outcome.REFERENCE, candidate);
    }
    if (reference.hasSameShape(candidate)) {
      return new ArtifactCheck(Outcome.COMPATIBLE, candidate);
    }
    return new ArtifactCheck(Outcome.MISMATCH, candidate);
  }

  public Outcome getOutcome() {
    return outcome;
  }

  public ArtifactMetadata getMetadata() {
    return metadata;
  }

  /**
   * @return true unless the outcome is {@link Outcome#MISMATCH}
   */
  public boolean isCompatible() {
    return outcome != Outcome.MISMATCH;
  }

  @Override
  public String toString() {
    return metadata.getType() + ": " + outcome;
  }

}
