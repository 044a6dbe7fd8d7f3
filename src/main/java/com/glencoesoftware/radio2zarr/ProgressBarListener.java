/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.radio2zarr;

import me.tongfei.progressbar.DelegatingProgressBarConsumer;
import me.tongfei.progressbar.ProgressBar;
import me.tongfei.progressbar.ProgressBarBuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ProgressBarListener implements IProgressListener {

  // not a typo - the progress bar consumes Converter's logging output
  private static final Logger LOGGER = LoggerFactory.getLogger(Converter.class);

  private String logLevel;
  private ProgressBar pb;
  private int currentBatchSize;

  /**
   * Create a new progress listener that displays a progress bar.
   *
   * @param level logging level
   */
  public ProgressBarListener(String level) {
    logLevel = level;
  }

  @Override
  public void notifyStart(int artifactCount, int channelCount,
    int batchCount)
  {
    ProgressBarBuilder builder = new ProgressBarBuilder()
      .setInitialMax(channelCount)
      .setTaskName(String.format("[%d artifacts]", artifactCount))
      .setUnit(" channels", 1);

    if (!(logLevel.equals("OFF") ||
      logLevel.equals("ERROR") ||
      logLevel.equals("WARN")))
    {
      builder.setConsumer(new DelegatingProgressBarConsumer(LOGGER::trace));
    }
    pb = builder.build();
  }

  @Override
  public void notifyBatchStart(int batch, int startChannel,
    int channelCount)
  {
    currentBatchSize = channelCount;
  }

  @Override
  public void notifyArtifactStart(int batch, String type) {
    if (pb != null) {
      pb.setExtraMessage(type);
    }
  }

  @Override
  public void notifyArtifactEnd(int batch, String type) {
    // intentional no-op
  }

  @Override
  public void notifyBatchEnd(int batch) {
    if (pb != null) {
      pb.stepBy(currentBatchSize);
    }
  }

  @Override
  public void notifyEnd() {
    if (pb != null) {
      pb.close();
      pb = null;
    }
  }

}
