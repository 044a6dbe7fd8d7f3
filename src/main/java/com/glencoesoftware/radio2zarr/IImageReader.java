/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.radio2zarr;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Opens legacy image artifacts.
 */
public interface IImageReader {

  /**
   * @param path artifact location
   * @return open handle; the caller must close it
   * @throws IOException if the artifact could not be read
   * @throws ImageFormatException if the artifact is not a valid image
   */
  IImageHandle open(Path path) throws IOException, ImageFormatException;

}
