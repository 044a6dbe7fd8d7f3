/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.radio2zarr.test;

import java.nio.ByteOrder;

import com.glencoesoftware.radio2zarr.NdArray;
import com.glencoesoftware.radio2zarr.PixelType;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class NdArrayTest {

  /**
   * @return 2 x 3 x 4 array holding 100 * i + 10 * j + k
   */
  private static NdArray sample() {
    float[] values = new float[24];
    for (int i=0; i<2; i++) {
      for (int j=0; j<3; j++) {
        for (int k=0; k<4; k++) {
          values[i * 12 + j * 4 + k] = 100 * i + 10 * j + k;
        }
      }
    }
    return NdArray.wrap(values, 2, 3, 4);
  }

  @Test
  public void testIndexing() {
    NdArray array = sample();
    assertEquals(24, array.getSize());
    assertEquals(3, array.getRank());
    assertEquals(123, array.getDouble(new int[] {1, 2, 3}), 0);
    assertEquals(23, array.getIndex(new int[] {1, 2, 3}));
    assertThrows(IndexOutOfBoundsException.class,
      () -> array.getDouble(new int[] {2, 0, 0}));
  }

  @Test
  public void testInvalidStorage() {
    assertThrows(IllegalArgumentException.class,
      () -> NdArray.wrap(new float[5], 2, 3));
    assertThrows(IllegalArgumentException.class,
      () -> NdArray.wrap(new double[7], 2, 3));
    assertThrows(IllegalArgumentException.class,
      () -> NdArray.wrap(new boolean[0], 1));
    assertEquals(0, NdArray.wrap(new boolean[0], 0, 3).getSize());
  }

  @Test
  public void testRegion() {
    NdArray region = sample().region(new int[] {1, 1, 2}, new int[] {1, 2, 2});
    assertArrayEquals(new int[] {1, 2, 2}, region.getShape());
    assertEquals(112, region.getDouble(new int[] {0, 0, 0}), 0);
    assertEquals(123, region.getDouble(new int[] {0, 1, 1}), 0);
    assertThrows(IndexOutOfBoundsException.class,
      () -> sample().region(new int[] {0, 2, 0}, new int[] {1, 2, 1}));
  }

  @Test
  public void testSetRegion() {
    NdArray array = NdArray.filled(PixelType.FLOAT32, new int[] {3, 3}, -1);
    array.setRegion(new int[] {1, 1},
      NdArray.wrap(new float[] {1, 2, 3, 4}, 2, 2));
    assertEquals(-1, array.getDouble(new int[] {0, 0}), 0);
    assertEquals(1, array.getDouble(new int[] {1, 1}), 0);
    assertEquals(4, array.getDouble(new int[] {2, 2}), 0);
    assertThrows(IllegalArgumentException.class, () -> array.setRegion(
      new int[] {0, 0}, NdArray.wrap(new double[] {1}, 1, 1)));
  }

  @Test
  public void testTranspose() {
    NdArray transposed = sample().transpose(new int[] {2, 0, 1});
    assertArrayEquals(new int[] {4, 2, 3}, transposed.getShape());
    for (int i=0; i<2; i++) {
      for (int j=0; j<3; j++) {
        for (int k=0; k<4; k++) {
          assertEquals(100 * i + 10 * j + k,
            transposed.getDouble(new int[] {k, i, j}), 0);
        }
      }
    }
    assertThrows(IllegalArgumentException.class,
      () -> sample().transpose(new int[] {0, 0, 1}));
  }

  @Test
  public void testReshapeAndSlice() {
    NdArray flat = sample().reshape(new int[] {6, 4});
    assertEquals(21, flat.getDouble(new int[] {2, 1}), 0);
    assertThrows(IllegalArgumentException.class,
      () -> sample().reshape(new int[] {5, 5}));

    NdArray slice = sample().slice(2, 1, 2);
    assertArrayEquals(new int[] {2, 3, 2}, slice.getShape());
    assertEquals(122, slice.getDouble(new int[] {1, 2, 1}), 0);
  }

  @Test
  public void testToBoolean() {
    NdArray mask = NdArray.wrap(new float[] {0, 1, Float.NaN, -2}, 4)
      .toBoolean();
    assertEquals(PixelType.BOOL, mask.getPixelType());
    assertFalse(mask.getBoolean(0));
    assertTrue(mask.getBoolean(1));
    assertTrue(mask.getBoolean(2));
    assertTrue(mask.getBoolean(3));
  }

  @Test
  public void testBytes() {
    NdArray array = sample();
    byte[] bytes = array.toBytes(ByteOrder.LITTLE_ENDIAN);
    assertEquals(24 * 4, bytes.length);
    assertEquals(array, NdArray.fromBytes(
      PixelType.FLOAT32, array.getShape(), bytes, ByteOrder.LITTLE_ENDIAN));

    byte[] flags = NdArray.wrap(new boolean[] {true, false}, 2)
      .toBytes(ByteOrder.LITTLE_ENDIAN);
    assertArrayEquals(new byte[] {1, 0}, flags);
    assertThrows(IllegalArgumentException.class, () -> NdArray.fromBytes(
      PixelType.FLOAT64, new int[] {2}, new byte[8], ByteOrder.LITTLE_ENDIAN));
  }

  @Test
  public void testEquality() {
    NdArray nan = NdArray.wrap(new double[] {Double.NaN}, 1);
    assertEquals(nan, NdArray.wrap(new double[] {Double.NaN}, 1));
    assertNotEquals(NdArray.wrap(new float[] {1}, 1),
      NdArray.wrap(new double[] {1}, 1));
    assertNotEquals(NdArray.wrap(new float[] {1, 2}, 2),
      NdArray.wrap(new float[] {1, 2}, 1, 2));
  }

}
