/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.radio2zarr;

import java.io.IOException;
import java.util.Map;

import com.glencoesoftware.radio2zarr.zarr.Compressor;

/**
 * Destination for converted datasets.
 */
public interface IChunkedStore {

  /**
   * Create the store from a first dataset, replacing nothing.
   *
   * @param dataset first batch of data
   * @param compressors compressor to use for each data variable;
   *                    variables without an entry are stored uncompressed
   * @param chunks chunk extent by dimension name, used as given even
   *               where it exceeds the first dataset; dimensions
   *               without a positive entry use a single chunk
   * @throws IOException if the store could not be written
   */
  void create(Dataset dataset, Map<String, Compressor> compressors,
    Map<String, Integer> chunks) throws IOException;

  /**
   * Extend every variable that has the given dimension by the dataset's
   * values along that dimension.  Variables without the dimension are
   * left as written by {@link #create}.
   *
   * @param dataset next batch of data
   * @param dimension dimension to grow
   * @throws IOException if the store could not be updated
   */
  void append(Dataset dataset, String dimension) throws IOException;

  /**
   * @return dataset view of the store, with data loaded on demand
   * @throws IOException if the store metadata could not be read
   */
  Dataset open() throws IOException;

}
