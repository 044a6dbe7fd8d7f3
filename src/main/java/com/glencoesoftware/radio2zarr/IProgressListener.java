/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.radio2zarr;

import java.util.EventListener;

public interface IProgressListener extends EventListener {

  /**
   * Indicates the amount of work in this conversion operation.
   *
   * @param artifactCount number of artifacts being converted
   * @param channelCount total number of channels
   * @param batchCount number of channel batches
   */
  void notifyStart(int artifactCount, int channelCount, int batchCount);

  /**
   * Indicates the beginning of processing a channel batch.
   *
   * @param batch the batch index being processed
   * @param startChannel first channel in the batch
   * @param channelCount number of channels in the batch
   */
  void notifyBatchStart(int batch, int startChannel, int channelCount);

  /**
   * Indicates that an artifact is about to be read for the current batch.
   *
   * @param batch the batch index being processed
   * @param type artifact type
   */
  void notifyArtifactStart(int batch, String type);

  /**
   * Indicates that an artifact has been read for the current batch.
   *
   * @param batch the batch index being processed
   * @param type artifact type
   */
  void notifyArtifactEnd(int batch, String type);

  /**
   * Indicates the end of processing a channel batch, including
   * writing it to the output.
   *
   * @param batch the batch index being processed
   */
  void notifyBatchEnd(int batch);

  /**
   * Indicates that every batch has been processed.
   */
  void notifyEnd();

}
