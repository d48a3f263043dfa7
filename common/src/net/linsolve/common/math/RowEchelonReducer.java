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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>Reduces a system Ax = b to row echelon form by Gaussian elimination. The augmented matrix
 * {@code [A | b]} is reduced row by row: each row's pivot is the diagonal entry, replaced by the first
 * non-zero entry below it in the same column when it is zero, and is normalized to 1 before it is
 * eliminated from all rows below.</p>
 *
 * <p>Singularity is decided up front, from the determinant of A. A zero pivot with no replacement
 * below it that slips past that test (a near-singular A) does not fail the reduction: the row is left
 * as is and reduction moves on to the next row.</p>
 */
public final class RowEchelonReducer {

  private static final Logger log = LoggerFactory.getLogger(RowEchelonReducer.class);

  private final double singularityThreshold;

  public RowEchelonReducer() {
    this(LinearSystemSolver.SINGULARITY_THRESHOLD);
  }

  /**
   * @param singularityThreshold magnitude at or below which A's determinant is considered 0
   */
  public RowEchelonReducer(double singularityThreshold) {
    Preconditions.checkArgument(singularityThreshold >= 0.0, "Bad threshold: %s", singularityThreshold);
    this.singularityThreshold = singularityThreshold;
  }

  /**
   * @return true iff the magnitude of A's determinant exceeds the singularity threshold
   */
  boolean isNonSingular(RealMatrix A) {
    return FastMath.abs(MatrixUtils.determinant(A)) > singularityThreshold;
  }

  /**
   * @param A {@code n x n} coefficient matrix; not modified
   * @param B {@code n x 1} constants; not modified
   * @return the {@code n x (n+1)} augmented matrix in row echelon form, or a singular result
   * @throws IllegalArgumentException if A is not square or B is not {@code n x 1}
   */
  public RowEchelonForm reduce(RealMatrix A, RealMatrix B) {
    checkDimensions(A, B);
    int n = A.getRowDimension();

    double determinant = MatrixUtils.determinant(A);
    if (FastMath.abs(determinant) <= singularityThreshold) {
      log.warn("{} x {} matrix is singular (determinant {}, threshold {})", n, n, determinant, singularityThreshold);
      return RowEchelonForm.singular(n);
    }

    RealMatrix M = AugmentedMatrices.augment(A, B);
    int columns = M.getColumnDimension();

    for (int row = 0; row < n; row++) {
      double pivot = M.getEntry(row, row);
      if (PivotSearch.isZero(pivot)) {
        int replacement = PivotSearch.firstNonZeroInColumn(M, row, row + 1);
        if (replacement == PivotSearch.NOT_FOUND) {
          log.debug("No usable pivot in column {}; leaving row {} unreduced", row, row);
          continue;
        }
        M = RowOperations.swapRows(M, row, replacement);
        pivot = M.getEntry(row, row);
      }

      // Normalize pivot row
      for (int col = 0; col < columns; col++) {
        M.setEntry(row, col, M.getEntry(row, col) / pivot);
      }

      // Eliminate below
      for (int j = row + 1; j < n; j++) {
        double factor = M.getEntry(j, row);
        for (int col = 0; col < columns; col++) {
          M.setEntry(j, col, M.getEntry(j, col) - factor * M.getEntry(row, col));
        }
      }
    }

    if (log.isDebugEnabled()) {
      log.debug("Row echelon form:\n{}", MatrixUtils.matrixToString(M));
    }
    return RowEchelonForm.of(M);
  }

  private static void checkDimensions(RealMatrix A, RealMatrix B) {
    Preconditions.checkNotNull(A);
    Preconditions.checkNotNull(B);
    Preconditions.checkArgument(A.isSquare(),
                                "Incompatible dimensions: A is %s x %s, not square",
                                A.getRowDimension(), A.getColumnDimension());
    Preconditions.checkArgument(B.getRowDimension() == A.getRowDimension() && B.getColumnDimension() == 1,
                                "Incompatible dimensions: A is %s x %s but B is %s x %s",
                                A.getRowDimension(), A.getColumnDimension(),
                                B.getRowDimension(), B.getColumnDimension());
  }

}
