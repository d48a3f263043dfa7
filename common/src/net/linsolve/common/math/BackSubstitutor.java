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
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Recovers the solution of a system from its augmented matrix in row echelon form, by eliminating each
 * row's pivot variable from every row above it, bottom row first.
 */
public final class BackSubstitutor {

  private BackSubstitutor() {
  }

  /**
   * The input is assumed to be in row echelon form with unit pivots, as produced by
   * {@link RowEchelonReducer}; this is not checked. A row with no non-zero coefficient eliminates nothing.
   *
   * @param reduced {@code n x (n+1)} augmented matrix in row echelon form; not modified
   * @return the {@code n} values in the last column once all pivot variables above each row are eliminated;
   *  entry {@code i} is the value of variable {@code i}
   */
  public static double[] backSubstitute(RealMatrix reduced) {
    Preconditions.checkNotNull(reduced);
    int n = reduced.getRowDimension();
    int columns = reduced.getColumnDimension();
    Preconditions.checkArgument(columns == n + 1, "Not an augmented n x (n+1) matrix: %s x %s", n, columns);

    RealMatrix M = reduced.copy();
    for (int row = n - 1; row >= 0; row--) {
      int pivotColumn = PivotSearch.firstNonZeroInRow(M, row, true);
      if (pivotColumn == PivotSearch.NOT_FOUND) {
        continue;
      }
      for (int k = 0; k < row; k++) {
        double factor = M.getEntry(k, pivotColumn);
        for (int col = 0; col < columns; col++) {
          M.setEntry(k, col, M.getEntry(k, col) - factor * M.getEntry(row, col));
        }
      }
    }

    return M.getColumn(columns - 1);
  }

}
