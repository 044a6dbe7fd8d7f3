/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.radio2zarr;

/**
 * Thrown when none of the candidate artifacts exist, so there is
 * nothing to convert.
 */
public class NoCompatibleArtifactsException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  public NoCompatibleArtifactsException(String message) {
    super(message);
  }

}
