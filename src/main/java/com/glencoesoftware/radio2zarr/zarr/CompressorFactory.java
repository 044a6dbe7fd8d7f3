/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.radio2zarr.zarr;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.zip.Deflater;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import java.util.zip.InflaterInputStream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.luben.zstd.Zstd;
import com.github.luben.zstd.ZstdInputStream;
import com.google.common.io.ByteStreams;

/**
 * Creates {@link Compressor} instances from command line options or
 * from stored <code>.zarray</code> metadata.
 */
public final class CompressorFactory {

  /** Compression level used when none is specified. */
  public static final int DEFAULT_LEVEL = 2;

  /** Highest zlib and gzip level. */
  public static final int MAX_DEFLATE_LEVEL = 9;

  /** Highest zstd level. */
  public static final int MAX_ZSTD_LEVEL = 22;

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private CompressorFactory() {
  }

  /**
   * @param type compression type
   * @param properties codec options; only "level" is recognized
   * @return new compressor
   */
  public static Compressor create(
    ZarrCompression type, Map<String, Object> properties)
  {
    if (properties == null) {
      properties = Collections.emptyMap();
    }
    switch (type) {
      case raw:
        return new NullCompressor();
      case zstd:
        return new ZstdCompressor(getLevel(properties, MAX_ZSTD_LEVEL));
      case zlib:
        return new ZlibCompressor(getLevel(properties, MAX_DEFLATE_LEVEL));
      case gzip:
        return new GzipCompressor(getLevel(properties, MAX_DEFLATE_LEVEL));
      default:
        throw new IllegalArgumentException("Unsupported compression: " + type);
    }
  }

  /**
   * @param config <code>compressor</code> entry of a <code>.zarray</code>
   * @return matching compressor
   */
  public static Compressor fromConfiguration(JsonNode config) {
    if (config == null || config.isNull()) {
      return new NullCompressor();
    }
    String id = config.path("id").asText();
    Map<String, Object> properties = new HashMap<String, Object>();
    if (config.has("level")) {
      properties.put("level", config.get("level").asInt());
    }
    for (ZarrCompression type : ZarrCompression.values()) {
      if (type != ZarrCompression.raw && type.toString().equals(id)) {
        return create(type, properties);
      }
    }
    throw new IllegalArgumentException("Unsupported compressor: " + config);
  }

  private static int getLevel(Map<String, Object> properties, int max) {
    Object level = properties.get("level");
    if (level == null) {
      return DEFAULT_LEVEL;
    }
    int value;
    try {
      value = Integer.parseInt(String.valueOf(level).trim());
    }
    catch (NumberFormatException e) {
      throw new IllegalArgumentException(
        "Invalid compression level: " + level, e);
    }
    if (value < 0 || value > max) {
      throw new IllegalArgumentException(
        "Compression level must be in [0, " + max + "]: " + value);
    }
    return value;
  }

  private static byte[] transfer(InputStream in) throws IOException {
    try (InputStream stream = in) {
      return ByteStreams.toByteArray(stream);
    }
  }

  static class NullCompressor extends Compressor {
    @Override
    public String getId() {
      return ZarrCompression.raw.toString();
    }

    @Override
    public ObjectNode getConfiguration() {
      return null;
    }

    @Override
    public byte[] compress(byte[] raw) {
      return raw;
    }

    @Override
    public byte[] uncompress(byte[] compressed) {
      return compressed;
    }
  }

  /**
   * Plain zstd frames, as written by the numcodecs "zstd" codec.
   */
  static class ZstdCompressor extends Compressor {
    private final int level;

    ZstdCompressor(int level) {
      this.level = level;
    }

    @Override
    public String getId() {
      return ZarrCompression.zstd.toString();
    }

    @Override
    public ObjectNode getConfiguration() {
      ObjectNode config = MAPPER.createObjectNode();
      config.put("id", getId());
      config.put("level", level);
      return config;
    }

    @Override
    public byte[] compress(byte[] raw) {
      return Zstd.compress(raw, level);
    }

    @Override
    public byte[] uncompress(byte[] compressed) throws IOException {
      return transfer(
        new ZstdInputStream(new ByteArrayInputStream(compressed)));
    }
  }

  static class ZlibCompressor extends Compressor {
    private final int level;

    ZlibCompressor(int level) {
      this.level = level;
    }

    @Override
    public String getId() {
      return ZarrCompression.zlib.toString();
    }

    @Override
    public ObjectNode getConfiguration() {
      ObjectNode config = MAPPER.createObjectNode();
      config.put("id", getId());
      config.put("level", level);
      return config;
    }

    @Override
    public byte[] compress(byte[] raw) throws IOException {
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      Deflater deflater = new Deflater(level);
      try (OutputStream stream = new DeflaterOutputStream(out, deflater)) {
        stream.write(raw);
      }
      finally {
        deflater.end();
      }
      return out.toByteArray();
    }

    @Override
    public byte[] uncompress(byte[] compressed) throws IOException {
      return transfer(
        new InflaterInputStream(new ByteArrayInputStream(compressed)));
    }
  }

  static class GzipCompressor extends Compressor {
    private final int level;

    GzipCompressor(int level) {
      this.level = level;
    }

    @Override
    public String getId() {
      return ZarrCompression.gzip.toString();
    }

    @Override
    public ObjectNode getConfiguration() {
      ObjectNode config = MAPPER.createObjectNode();
      config.put("id", getId());
      config.put("level", level);
      return config;
    }

    @Override
    public byte[] compress(byte[] raw) throws IOException {
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      try (OutputStream stream = new GZIPOutputStream(out) {
          {
            def.setLevel(level);
          }
        })
      {
        stream.write(raw);
      }
      return out.toByteArray();
    }

    @Override
    public byte[] uncompress(byte[] compressed) throws IOException {
      return transfer(
        new GZIPInputStream(new ByteArrayInputStream(compressed)));
    }
  }

}
