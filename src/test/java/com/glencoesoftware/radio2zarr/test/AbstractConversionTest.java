/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.radio2zarr.test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.glencoesoftware.radio2zarr.ConversionResult;
import com.glencoesoftware.radio2zarr.Converter;
import com.glencoesoftware.radio2zarr.Dataset;
import com.glencoesoftware.radio2zarr.IProgressListener;
import com.glencoesoftware.radio2zarr.Variable;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import picocli.CommandLine;

public abstract class AbstractConversionTest {
  Path tmp;
  Path input;
  Path output;
  Converter converter;

  /**
   * Set logging to warn before all methods.
   *
   * @param tmp temporary directory for input and output files
   */
  @BeforeEach
  public void setup(@TempDir Path tmp) throws Exception {
    this.tmp = tmp;
    input = tmp.resolve("sky.image");
    output = tmp.resolve("test");
    ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger)
        LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
    root.setLevel(Level.WARN);
  }

  /**
   * Run the Converter main method and check the exit code.
   *
   * @param additionalArgs CLI arguments as needed beyond "input output"
   */
  void assertTool(String...additionalArgs) {
    List<String> args = new ArrayList<String>();
    for (String arg : additionalArgs) {
      args.add(arg);
    }
    args.add(input.toString());
    args.add(output.toString());
    converter = new Converter();
    int exitCode =
      new CommandLine(converter).execute(args.toArray(new String[]{}));
    assertEquals(0, exitCode);
  }

  /**
   * Parse CLI arguments and convert, returning the conversion result.
   *
   * @param listener progress listener, or null
   * @param args all CLI arguments, including input and output
   */
  ConversionResult convertWith(IProgressListener listener, String...args)
    throws Exception
  {
    converter = new Converter();
    new CommandLine(converter).parseArgs(args);
    if (listener != null) {
      converter.setProgressListener(listener);
    }
    return converter.convert();
  }

  /**
   * Convert {@link #input} to {@link #output}.
   *
   * @param additionalArgs CLI arguments as needed beyond "input output"
   */
  ConversionResult convert(String...additionalArgs) throws Exception {
    List<String> args = new ArrayList<String>();
    for (String arg : additionalArgs) {
      args.add(arg);
    }
    args.add(input.toString());
    args.add(output.toString());
    return convertWith(null, args.toArray(new String[]{}));
  }

  static JsonNode readJson(Path path) throws IOException {
    ObjectMapper objectMapper = new ObjectMapper();
    return objectMapper.readTree(path.toFile());
  }

  /**
   * Check that two datasets have the same variables, dimensions and values.
   */
  static void assertSameContent(Dataset expected, Dataset actual) {
    assertSameVariables(
      expected.getDataVariables(), actual.getDataVariables());
    assertSameVariables(expected.getCoordinates(), actual.getCoordinates());
    assertEquals(expected.getAttributes(), actual.getAttributes());
  }

  private static void assertSameVariables(
    Map<String, Variable> expected, Map<String, Variable> actual)
  {
    assertEquals(expected.keySet(), actual.keySet());
    for (Map.Entry<String, Variable> e : expected.entrySet()) {
      Variable other = actual.get(e.getKey());
      assertNotNull(other, e.getKey());
      assertEquals(e.getValue().getDimensions(), other.getDimensions(),
        e.getKey());
      assertEquals(e.getValue().getData(), other.getData(), e.getKey());
    }
  }
}
