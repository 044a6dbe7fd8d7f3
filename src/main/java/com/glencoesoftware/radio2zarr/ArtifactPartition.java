/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.radio2zarr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Artifacts found next to a primary image, split into those that can be
 * stored together with the reference and those that cannot.
 */
public class ArtifactPartition {

  private final List<String> presentTypes = new ArrayList<String>();
  private final Map<String, ArtifactMetadata> compatible =
    new LinkedHashMap<String, ArtifactMetadata>();
  private final Map<String, ArtifactMetadata> incompatible =
    new LinkedHashMap<String, ArtifactMetadata>();
  private ArtifactMetadata reference;

  /**
   * Record the outcome of checking one present artifact.
   *
   * @param check check result
   */
  void add(ArtifactCheck check) {
    ArtifactMetadata metadata = check.getMetadata();
    presentTypes.add(metadata.getType());
    switch (check.getOutcome()) {
      case REFERENCE:
        reference = metadata;
        compatible.put(metadata.getType(), metadata);
        break;
      case COMPATIBLE:
      case EXEMPT:
        compatible.put(metadata.getType(), metadata);
        break;
      case MISMATCH:
        incompatible.put(metadata.getType(), metadata);
        break;
      default:
        throw new IllegalStateException("Unknown outcome " + check);
    }
  }

  /**
   * @return every artifact type that exists, in candidate order
   */
  public List<String> getPresentTypes() {
    return Collections.unmodifiableList(presentTypes);
  }

  /**
   * @return types stored together with the reference, in candidate order
   */
  public List<String> getCompatibleTypes() {
    return Collections.unmodifiableList(
      new ArrayList<String>(compatible.keySet()));
  }

  /**
   * @return types whose shape differs from the reference
   */
  public List<String> getIncompatibleTypes() {
    return Collections.unmodifiableList(
      new ArrayList<String>(incompatible.keySet()));
  }

  /**
   * @return metadata of each incompatible artifact, by type
   */
  public Map<String, ArtifactMetadata> getIncompatibleMetadata() {
    return Collections.unmodifiableMap(incompatible);
  }

  /**
   * @param type compatible artifact type
   * @return metadata of the artifact, or null if it is not compatible
   */
  public ArtifactMetadata getMetadata(String type) {
    return compatible.get(type);
  }

  /**
   * @return metadata of the first artifact found, or null if none
   *         other than sum-of-weights exist
   */
  public ArtifactMetadata getReference() {
    return reference;
  }

  @Override
  public String toString() {
    return "compatible=" + compatible.keySet() +
      ", incompatible=" + incompatible.keySet();
  }

}
