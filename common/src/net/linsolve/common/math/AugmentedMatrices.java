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
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Builds augmented matrices {@code [A | B]}.
 */
public final class AugmentedMatrices {

  private AugmentedMatrices() {
  }

  /**
   * @param A {@code n x m} coefficient matrix
   * @param B {@code n x k} matrix of constants
   * @return a new {@code n x (m+k)} matrix whose rows are each row of {@code A} followed by the same row of
   *  {@code B}
   * @throws IllegalArgumentException if {@code A} and {@code B} have different numbers of rows
   */
  public static RealMatrix augment(RealMatrix A, RealMatrix B) {
    Preconditions.checkNotNull(A);
    Preconditions.checkNotNull(B);
    int rows = A.getRowDimension();
    Preconditions.checkArgument(rows == B.getRowDimension(),
                                "Incompatible dimensions: A is %s x %s but B is %s x %s",
                                rows, A.getColumnDimension(), B.getRowDimension(), B.getColumnDimension());
    int aColumns = A.getColumnDimension();
    int bColumns = B.getColumnDimension();
    double[][] data = new double[rows][aColumns + bColumns];
    for (int row = 0; row < rows; row++) {
      double[] augmentedRow = data[row];
      System.arraycopy(A.getRow(row), 0, augmentedRow, 0, aColumns);
      System.arraycopy(B.getRow(row), 0, augmentedRow, aColumns, bColumns);
    }
    return new Array2DRowRealMatrix(data, false);
  }

}
