/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.radio2zarr.test;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.glencoesoftware.radio2zarr.zarr.Compressor;
import com.glencoesoftware.radio2zarr.zarr.CompressorFactory;
import com.glencoesoftware.radio2zarr.zarr.ZarrCompression;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class CompressorFactoryTest {

  private static byte[] sample() {
    byte[] data = new byte[4096];
    for (int i=0; i<data.length; i++) {
      data[i] = (byte) (i % 7);
    }
    return data;
  }

  @ParameterizedTest
  @EnumSource(ZarrCompression.class)
  public void testRoundTrip(ZarrCompression type) throws Exception {
    Compressor compressor = CompressorFactory.create(type, null);
    byte[] data = sample();
    byte[] encoded = compressor.compress(data);
    assertArrayEquals(data, compressor.uncompress(encoded));
  }

  @Test
  public void testDefaultLevel() {
    Compressor zlib =
      CompressorFactory.create(ZarrCompression.zlib, Collections.emptyMap());
    assertEquals("zlib", zlib.getConfiguration().get("id").asText());
    assertEquals(CompressorFactory.DEFAULT_LEVEL,
      zlib.getConfiguration().get("level").asInt());
    assertNull(
      CompressorFactory.create(ZarrCompression.raw, null).getConfiguration());
  }

  @Test
  public void testLevel() {
    Map<String, Object> properties = new HashMap<String, Object>();
    properties.put("level", "9");
    Compressor gzip = CompressorFactory.create(ZarrCompression.gzip, properties);
    assertEquals(9, gzip.getConfiguration().get("level").asInt());
    properties.put("level", 0);
    gzip = CompressorFactory.create(ZarrCompression.gzip, properties);
    assertEquals(0, gzip.getConfiguration().get("level").asInt());
  }

  @Test
  public void testZstdLevel() {
    Map<String, Object> properties = new HashMap<String, Object>();
    Compressor zstd = CompressorFactory.create(ZarrCompression.zstd, null);
    assertEquals("zstd", zstd.getId());
    assertEquals(CompressorFactory.DEFAULT_LEVEL,
      zstd.getConfiguration().get("level").asInt());
    properties.put("level", "22");
    zstd = CompressorFactory.create(ZarrCompression.zstd, properties);
    assertEquals(22, zstd.getConfiguration().get("level").asInt());
    properties.put("level", "23");
    assertThrows(IllegalArgumentException.class,
      () -> CompressorFactory.create(ZarrCompression.zstd, properties));
  }

  @ParameterizedTest
  @ValueSource(strings = {"10", "-1", "fast"})
  public void testInvalidLevel(String level) {
    Map<String, Object> properties = new HashMap<String, Object>();
    properties.put("level", level);
    assertThrows(IllegalArgumentException.class,
      () -> CompressorFactory.create(ZarrCompression.zlib, properties));
  }

  @Test
  public void testFromConfiguration() throws Exception {
    ObjectNode config = new ObjectMapper().createObjectNode();
    config.put("id", "gzip");
    config.put("level", 4);
    Compressor gzip = CompressorFactory.fromConfiguration(config);
    assertEquals(config, gzip.getConfiguration());
    assertEquals("null", CompressorFactory.fromConfiguration(null).getId());

    config.put("id", "zstd");
    config.put("level", 7);
    Compressor zstd = CompressorFactory.fromConfiguration(config);
    assertEquals(config, zstd.getConfiguration());
    assertArrayEquals(sample(), zstd.uncompress(zstd.compress(sample())));

    config.put("id", "blosc");
    assertThrows(IllegalArgumentException.class,
      () -> CompressorFactory.fromConfiguration(config));
  }

}
