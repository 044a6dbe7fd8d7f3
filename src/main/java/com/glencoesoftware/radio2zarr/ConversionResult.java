/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.radio2zarr;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a conversion.
 */
public class ConversionResult {

  private final Dataset dataset;
  private final ArtifactPartition partition;
  private final Path outputPath;

  /**
   * @param dataset converted dataset
   * @param partition artifacts found next to the input
   * @param outputPath store location, or null if nothing was written
   */
  public ConversionResult(
    Dataset dataset, ArtifactPartition partition, Path outputPath)
  {
    this.dataset = dataset;
    this.partition = partition;
    this.outputPath = outputPath;
  }

  /**
   * @return dataset reopened from the store, or held in memory if
   *         nothing was written
   */
  public Dataset getDataset() {
    return dataset;
  }

  public ArtifactPartition getPartition() {
    return partition;
  }

  public List<String> getCompatibleTypes() {
    return partition.getCompatibleTypes();
  }

  public List<String> getIncompatibleTypes() {
    return partition.getIncompatibleTypes();
  }

  public Map<String, ArtifactMetadata> getIncompatibleMetadata() {
    return partition.getIncompatibleMetadata();
  }

  /**
   * @return store location, or null if nothing was written
   */
  public Path getOutputPath() {
    return outputPath;
  }

}
