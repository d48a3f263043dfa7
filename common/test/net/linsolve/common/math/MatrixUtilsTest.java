/*
 * Copyright Myrrix Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.linsolve.common.math;

import org.apache.commons.math3.linear.RealMatrix;
import org.junit.Test;

import net.linsolve.common.LinSolveTest;

/**
 * Tests {@link MatrixUtils}.
 */
public final class MatrixUtilsTest extends LinSolveTest {

  @Test
  public void testToMatrixCopies() {
    double[][] data = {{1.0, 2.0}, {3.0, 4.0}};
    RealMatrix M = MatrixUtils.toMatrix(data);
    data[0][0] = -1.0;
    assertEquals(1.0, M.getEntry(0, 0));
  }

  @Test
  public void testToColumnMatrix() {
    RealMatrix M = MatrixUtils.toColumnMatrix(new double[] {1.0, -2.0, 3.0});
    assertEquals(3, M.getRowDimension());
    assertEquals(1, M.getColumnDimension());
    assertArrayEquals(new double[] {1.0, -2.0, 3.0}, M.getColumn(0));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNoRows() {
    MatrixUtils.toMatrix(new double[0][]);
  }

  @Test
  public void testDeterminant() {
    assertEquals(-2.0, MatrixUtils.determinant(MatrixUtils.toMatrix(new double[][] {{1.0, 2.0}, {3.0, 4.0}})));
    assertEquals(-1.0, MatrixUtils.determinant(
        MatrixUtils.toMatrix(new double[][] {{2.0, 1.0, -1.0}, {-3.0, -1.0, 2.0}, {-2.0, 1.0, 2.0}})));
    assertEquals(0.0, MatrixUtils.determinant(MatrixUtils.toMatrix(new double[][] {{1.0, 2.0}, {2.0, 4.0}})));
  }

  @Test
  public void testDeterminantBadlyScaled() {
    RealMatrix A = MatrixUtils.toMatrix(new double[][] {{1.0e-12, 0.0}, {0.0, 1.0e13}});
    assertEquals(10.0, MatrixUtils.determinant(A), 1.0e-9);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDeterminantNotSquare() {
    MatrixUtils.determinant(MatrixUtils.toMatrix(new double[][] {{1.0, 2.0}}));
  }

  @Test
  public void testResidual() {
    RealMatrix A = MatrixUtils.toMatrix(new double[][] {{1.0, 2.0}, {3.0, 4.0}});
    RealMatrix B = MatrixUtils.toColumnMatrix(new double[] {5.0, 11.0});
    assertEquals(0.0, MatrixUtils.residual(A, new double[] {1.0, 2.0}, B));
    assertEquals(2.0, MatrixUtils.residual(A, new double[] {1.0, 2.5}, B));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testResidualMismatch() {
    RealMatrix A = MatrixUtils.toMatrix(new double[][] {{1.0, 2.0}, {3.0, 4.0}});
    MatrixUtils.residual(A, new double[] {1.0}, MatrixUtils.toColumnMatrix(new double[] {5.0, 11.0}));
  }

  @Test
  public void testMatrixToString() {
    RealMatrix M = MatrixUtils.toMatrix(new double[][] {{1.0, -2.5}, {0.0, 0.12345678901234}});
    String[] lines = MatrixUtils.matrixToString(M).split("\n");
    assertEquals(2, lines.length);
    assertEquals("         1.0\t        -2.5", lines[0]);
    assertEquals("         0.0\t 0.123456789", lines[1]);
  }

}
