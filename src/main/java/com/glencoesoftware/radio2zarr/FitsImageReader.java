/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.radio2zarr;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Opens FITS image artifacts.
 */
public class FitsImageReader implements IImageReader {

  @Override
  public IImageHandle open(Path path)
    throws IOException, ImageFormatException
  {
    if (Files.isDirectory(path)) {
      throw new ImageFormatException(path + " is a directory, not a FITS file");
    }
    return new FitsImage(path);
  }

}
