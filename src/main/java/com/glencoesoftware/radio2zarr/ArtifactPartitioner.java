/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.radio2zarr;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the artifacts that exist next to a primary image and decides
 * which of them can share dimensions with it.
 */
public class ArtifactPartitioner {

  private static final Logger LOGGER =
    LoggerFactory.getLogger(ArtifactPartitioner.class);

  private final IImageReader reader;

  /**
   * @param reader used to open each artifact
   */
  public ArtifactPartitioner(IImageReader reader) {
    this.reader = reader;
  }

  /**
   * @param prefix primary image path without its final extension
   * @param type artifact type
   * @return location of the artifact
   */
  public static Path getArtifactPath(String prefix, String type) {
    return Paths.get(prefix + "." + type);
  }

  /**
   * Open every candidate artifact in order and compare its shape with
   * the first one found.  Only shapes are compared, not coordinate values.
   *
   * @param prefix primary image path without its final extension
   * @param suffix final extension of the primary image
   * @param artifacts requested artifact types, or null for the defaults
   * @return partition of the artifacts that exist
   * @throws NoCompatibleArtifactsException if no artifact exists
   * @throws IOException if an existing artifact could not be read
   * @throws ImageFormatException if an existing artifact is not an image
   */
  public ArtifactPartition partition(
    String prefix, String suffix, List<String> artifacts)
    throws IOException, ImageFormatException
  {
    List<String> candidates = ArtifactTypes.getCandidates(suffix, artifacts);
    ArtifactPartition partition = new ArtifactPartition();
    for (String type : candidates) {
      Path path = getArtifactPath(prefix, type);
      if (!Files.exists(path)) {
        LOGGER.debug("No {} artifact at {}", type, path);
        continue;
      }
      ArtifactCheck check;
      try (IImageHandle handle = reader.open(path)) {
        ArtifactMetadata metadata = ArtifactMetadata.read(type, handle);
        check = ArtifactCheck.check(partition.getReference(), metadata);
      }
      LOGGER.debug("{} {}", path, check);
      if (!check.isCompatible()) {
        LOGGER.warn("Artifact {} has shape {}, expected {}; not converting",
          type, Arrays.toString(check.getMetadata().getShape()),
          Arrays.toString(partition.getReference().getShape()));
      }
      partition.add(check);
    }
    if (partition.getReference() == null) {
      throw new NoCompatibleArtifactsException(
        "No image artifacts found at " + prefix + ".* (looked for " +
        candidates + ")");
    }
    return partition;
  }

}
