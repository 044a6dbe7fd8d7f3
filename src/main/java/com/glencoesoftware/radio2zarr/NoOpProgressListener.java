/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.radio2zarr;

public class NoOpProgressListener implements IProgressListener {

  @Override
  public void notifyStart(int artifactCount, int channelCount,
    int batchCount)
  {
  }

  @Override
  public void notifyBatchStart(int batch, int startChannel,
    int channelCount)
  {
  }

  @Override
  public void notifyArtifactStart(int batch, String type) {
  }

  @Override
  public void notifyArtifactEnd(int batch, String type) {
  }

  @Override
  public void notifyBatchEnd(int batch) {
  }

  @Override
  public void notifyEnd() {
  }

}
