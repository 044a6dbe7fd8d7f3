/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.radio2zarr.test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

import com.glencoesoftware.radio2zarr.ChannelBatch;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ChannelBatchTest {

  static Stream<Arguments> getBatchSizes() {
    return Stream.of(
      Arguments.of(5, 2, Arrays.asList(
        new ChannelBatch(0, 2), new ChannelBatch(2, 2),
        new ChannelBatch(4, 1))),
      Arguments.of(5, 5, Collections.singletonList(new ChannelBatch(0, 5))),
      Arguments.of(5, 10, Collections.singletonList(new ChannelBatch(0, 5))),
      Arguments.of(3, 1, Arrays.asList(
        new ChannelBatch(0, 1), new ChannelBatch(1, 1),
        new ChannelBatch(2, 1)))
    );
  }

  /**
   * Test that batches cover every channel once, in order.
   */
  @ParameterizedTest
  @MethodSource("getBatchSizes")
  public void testPartition(
    int channels, int batchSize, List<ChannelBatch> expected)
  {
    List<ChannelBatch> batches = ChannelBatch.partition(channels, batchSize);
    assertEquals(expected, batches);
    int next = 0;
    for (ChannelBatch batch : batches) {
      assertEquals(next, batch.getStart());
      next = batch.getEnd();
    }
    assertEquals(channels, next);
  }

  @Test
  public void testInvalid() {
    assertThrows(IllegalArgumentException.class,
      () -> ChannelBatch.partition(5, 0));
    assertThrows(IllegalArgumentException.class,
      () -> new ChannelBatch(-1, 2));
    assertThrows(IllegalArgumentException.class,
      () -> new ChannelBatch(0, 0));
  }

  @Test
  public void testToString() {
    assertEquals("[2, 4)", new ChannelBatch(2, 2).toString());
  }

}
