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
import java.util.Map;

import com.glencoesoftware.radio2zarr.Axis;
import com.glencoesoftware.radio2zarr.CoordinateResolver;
import com.glencoesoftware.radio2zarr.NdArray;
import com.glencoesoftware.radio2zarr.Variable;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CoordinateResolverTest {

  @Test
  public void testNormalizeAxisName() {
    assertEquals("right_ascension",
      CoordinateResolver.normalizeAxisName("Right Ascension"));
    assertEquals("pol", CoordinateResolver.normalizeAxisName("Stokes"));
    assertEquals("chan", CoordinateResolver.normalizeAxisName("Frequency"));
    assertEquals("velocity", CoordinateResolver.normalizeAxisName("VELOCITY"));
  }

  @Test
  public void testAxes() {
    FakeImage image = FakeImage.cube(4, 3, 2, 5);
    List<Axis> axes =
      CoordinateResolver.getAxes(image.getSummary(), image.getShape());
    assertEquals(4, axes.size());
    assertEquals("right_ascension", axes.get(0).getName());
    assertEquals("rad", axes.get(0).getUnit());
    assertEquals(4, axes.get(0).getLength());
    assertEquals("pol", axes.get(2).getName());
    assertEquals("", axes.get(2).getUnit());
    assertEquals("chan", axes.get(3).getName());
    assertTrue(CoordinateResolver.isSpherical(axes.get(1)));
    assertFalse(CoordinateResolver.isSpherical(axes.get(3)));

    assertEquals(Arrays.asList("d0", "d1", "pol", "chan"),
      CoordinateResolver.getDimensions(axes));
  }

  @Test
  public void testAxisCountMismatch() {
    FakeImage image = FakeImage.cube(4, 3, 2, 5);
    assertThrows(IllegalArgumentException.class,
      () -> CoordinateResolver.getAxes(image.getSummary(), new int[] {4, 3}));
  }

  /**
   * Spherical coordinates cover the joint grid with the last axis
   * varying fastest; world(y) = 20 * y + 10 * x.
   */
  @Test
  public void testSphericalGrid() {
    FakeImage image = FakeImage.cube(4, 3, 2, 5);
    List<Axis> axes =
      CoordinateResolver.getAxes(image.getSummary(), image.getShape());
    Map<String, Variable> coords = CoordinateResolver.resolve(image, axes);
    assertEquals(Arrays.asList("right_ascension", "declination", "pol", "chan"),
      Arrays.asList(coords.keySet().toArray()));

    Variable ra = coords.get("right_ascension");
    Variable dec = coords.get("declination");
    assertEquals(Arrays.asList("d0", "d1"), ra.getDimensions());
    assertEquals(Arrays.asList("d0", "d1"), dec.getDimensions());
    NdArray raValues = ra.getData();
    NdArray decValues = dec.getData();
    for (int x=0; x<4; x++) {
      for (int y=0; y<3; y++) {
        assertEquals(10 * x, raValues.getDouble(new int[] {x, y}), 0);
        assertEquals(20 * y + 10 * x,
          decValues.getDouble(new int[] {x, y}), 0);
      }
    }
    // one call for the spherical grid, one per other axis
    assertEquals(3, image.getWorldCalls());
  }

  @Test
  public void testLinearAxes() {
    FakeImage image = FakeImage.cube(4, 3, 2, 5);
    List<Axis> axes =
      CoordinateResolver.getAxes(image.getSummary(), image.getShape());
    Map<String, Variable> coords = CoordinateResolver.resolve(image, axes);

    Variable chan = coords.get("chan");
    assertEquals(Collections.singletonList("chan"), chan.getDimensions());
    assertEquals(5, chan.getShape()[0]);
    for (int c=0; c<5; c++) {
      assertEquals(40 * c, chan.getData().getDouble(c), 0);
    }
    Variable pol = coords.get("pol");
    assertEquals(30, pol.getData().getDouble(1), 0);
  }

  @Test
  public void testDeterministic() {
    FakeImage image = FakeImage.cube(3, 2, 1, 2);
    List<Axis> axes =
      CoordinateResolver.getAxes(image.getSummary(), image.getShape());
    Map<String, Variable> first = CoordinateResolver.resolve(image, axes);
    Map<String, Variable> second = CoordinateResolver.resolve(image, axes);
    for (String name : first.keySet()) {
      assertEquals(first.get(name).getData(), second.get(name).getData());
    }
  }

}
