/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.radio2zarr.zarr;

import java.io.IOException;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Codec applied to each encoded chunk before it is written.
 */
public abstract class Compressor {

  /**
   * @return codec identifier as stored in <code>.zarray</code>
   */
  public abstract String getId();

  /**
   * @return <code>compressor</code> entry for <code>.zarray</code>,
   *         or null if chunks are not compressed
   */
  public abstract ObjectNode getConfiguration();

  public abstract byte[] compress(byte[] raw) throws IOException;

  public abstract byte[] uncompress(byte[] compressed) throws IOException;

  @Override
  public String toString() {
    ObjectNode config = getConfiguration();
    return config == null ? getId() : config.toString();
  }

}
