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

import com.google.common.base.Preconditions;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.util.FastMath;

/**
 * Contains utility methods for dealing with dense matrices, which are here represented as
 * {@link RealMatrix} or {@code double[][]}.
 */
public final class MatrixUtils {

  private static final int PRINT_COLUMN_WIDTH = 12;

  private MatrixUtils() {
  }

  /**
   * @param data rows of a matrix, all the same length
   * @return a new dense matrix holding a copy of {@code data}
   */
  public static RealMatrix toMatrix(double[][] data) {
    Preconditions.checkNotNull(data);
    Preconditions.checkArgument(data.length > 0, "No rows");
    return new Array2DRowRealMatrix(data, true);
  }

  /**
   * @param vector column vector entries
   * @return a new {@code n x 1} matrix holding a copy of {@code vector}
   */
  public static RealMatrix toColumnMatrix(double[] vector) {
    Preconditions.checkNotNull(vector);
    Preconditions.checkArgument(vector.length > 0, "Empty vector");
    double[][] data = new double[vector.length][1];
    for (int i = 0; i < vector.length; i++) {
      data[i][0] = vector[i];
    }
    return new Array2DRowRealMatrix(data, false);
  }

  /**
   * @param A square matrix
   * @return determinant of {@code A}, computed by LU decomposition with partial pivoting. It is exactly 0
   *  only when a pivot is exactly 0; small pivots are not rounded to 0
   */
  public static double determinant(RealMatrix A) {
    Preconditions.checkArgument(A.isSquare(), "Not square: %s x %s", A.getRowDimension(), A.getColumnDimension());
    // Only an exactly zero pivot marks the decomposition singular
    return new LUDecomposition(A, Double.MIN_VALUE).getDeterminant();
  }

  /**
   * @param A {@code n x n} coefficient matrix
   * @param x candidate solution, of length {@code n}
   * @param B {@code n x 1} constants
   * @return largest absolute entry of {@code A x - B}
   */
  public static double residual(RealMatrix A, double[] x, RealMatrix B) {
    Preconditions.checkArgument(A.getColumnDimension() == x.length,
                                "Incompatible dimensions: A is %s x %s but x has %s entries",
                                A.getRowDimension(), A.getColumnDimension(), x.length);
    Preconditions.checkArgument(A.getRowDimension() == B.getRowDimension() && B.getColumnDimension() == 1,
                                "Incompatible dimensions: A is %s x %s but B is %s x %s",
                                A.getRowDimension(), A.getColumnDimension(),
                                B.getRowDimension(), B.getColumnDimension());
    double[] Ax = A.operate(x);
    double max = 0.0;
    for (int i = 0; i < Ax.length; i++) {
      max = FastMath.max(max, FastMath.abs(Ax[i] - B.getEntry(i, 0)));
    }
    return max;
  }

  /**
   * @param M matrix to print
   * @return a print-friendly rendering of a dense matrix, one row per line. Not useful for wide matrices.
   */
  public static String matrixToString(RealMatrix M) {
    StringBuilder result = new StringBuilder();
    for (int row = 0; row < M.getRowDimension(); row++) {
      for (int col = 0; col < M.getColumnDimension(); col++) {
        if (col > 0) {
          result.append('\t');
        }
        appendWithPadOrTruncate(M.getEntry(row, col), result);
      }
      result.append('\n');
    }
    return result.toString();
  }

  private static void appendWithPadOrTruncate(double value, StringBuilder to) {
    String stringValue = Double.toString(value);
    if (value >= 0.0) {
      stringValue = ' ' + stringValue;
    }
    int length = stringValue.length();
    if (length >= PRINT_COLUMN_WIDTH) {
      to.append(stringValue, 0, PRINT_COLUMN_WIDTH);
    } else {
      for (int i = length; i < PRINT_COLUMN_WIDTH; i++) {
        to.append(' ');
      }
      to.append(stringValue);
    }
  }

}
