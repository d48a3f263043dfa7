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
import org.apache.commons.math3.util.FastMath;

import net.linsolve.common.LangUtils;

/**
 * Scans for candidate pivots. An entry counts as zero when its magnitude is at most
 * {@link #ZERO_THRESHOLD}; entries are never compared to 0 exactly.
 */
public final class PivotSearch {

  /**
   * Threshold at or below which an entry's magnitude is considered 0. Distinct from
   * {@link LinearSystemSolver#SINGULARITY_THRESHOLD}, which applies to the determinant.
   */
  public static final double ZERO_THRESHOLD = LangUtils.parseThreshold("linsolve.matrix.zeroThreshold", 1.0e-5);

  /** Returned when no non-zero entry is found. */
  public static final int NOT_FOUND = -1;

  private PivotSearch() {
  }

  /**
   * @return true iff {@code |value| <= ZERO_THRESHOLD}
   */
  public static boolean isZero(double value) {
    return FastMath.abs(value) <= ZERO_THRESHOLD;
  }

  /**
   * @param M matrix to scan
   * @param column column to scan down
   * @param startingRow first row to consider; may be past the last row
   * @return the smallest row index {@code r >= startingRow} such that {@code M[r][column]} is not zero,
   *  or {@link #NOT_FOUND}
   */
  public static int firstNonZeroInColumn(RealMatrix M, int column, int startingRow) {
    Preconditions.checkArgument(column >= 0 && column < M.getColumnDimension(), "Bad column: %s", column);
    Preconditions.checkArgument(startingRow >= 0, "Bad starting row: %s", startingRow);
    int rows = M.getRowDimension();
    for (int row = startingRow; row < rows; row++) {
      if (!isZero(M.getEntry(row, column))) {
        return row;
      }
    }
    return NOT_FOUND;
  }

  /**
   * @param M matrix to scan
   * @param row row to scan, left to right
   * @param augmented if true, the last column holds constants and is not scanned
   * @return the smallest column index such that {@code M[row][column]} is not zero, or {@link #NOT_FOUND}
   */
  public static int firstNonZeroInRow(RealMatrix M, int row, boolean augmented) {
    Preconditions.checkArgument(row >= 0 && row < M.getRowDimension(), "Bad row: %s", row);
    int columns = augmented ? M.getColumnDimension() - 1 : M.getColumnDimension();
    for (int column = 0; column < columns; column++) {
      if (!isZero(M.getEntry(row, column))) {
        return column;
      }
    }
    return NOT_FOUND;
  }

}
