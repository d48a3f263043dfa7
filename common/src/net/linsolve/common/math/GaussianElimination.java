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
 * A {@link LinearSystemSolver} based on Gaussian elimination with pivoting: the system is reduced by a
 * {@link RowEchelonReducer}, and the solution recovered by {@link BackSubstitutor}. Instances are
 * immutable and may be shared across threads.
 */
public final class GaussianElimination implements LinearSystemSolver {

  private final RowEchelonReducer reducer;

  public GaussianElimination() {
    this(new RowEchelonReducer());
  }

  public GaussianElimination(RowEchelonReducer reducer) {
    Preconditions.checkNotNull(reducer);
    this.reducer = reducer;
  }

  @Override
  public SolveResult solve(RealMatrix A, RealMatrix B) {
    RowEchelonForm echelonForm = reducer.reduce(A, B);
    if (echelonForm.isSingular()) {
      return SolveResult.singular(A.getRowDimension());
    }
    return SolveResult.solved(BackSubstitutor.backSubstitute(echelonForm.getMatrix()));
  }

  /**
   * @param A rows of the {@code n x n} coefficient matrix
   * @param B rows of the {@code n x 1} constants
   * @see #solve(RealMatrix, RealMatrix)
   */
  public SolveResult solve(double[][] A, double[][] B) {
    return solve(MatrixUtils.toMatrix(A), MatrixUtils.toMatrix(B));
  }

  /**
   * @param A rows of the {@code n x n} coefficient matrix
   * @param b the {@code n} constants
   * @see #solve(RealMatrix, RealMatrix)
   */
  public SolveResult solve(double[][] A, double[] b) {
    return solve(MatrixUtils.toMatrix(A), MatrixUtils.toColumnMatrix(b));
  }

  @Override
  public boolean isNonSingular(RealMatrix A) {
    Preconditions.checkArgument(A.isSquare(), "Not square: %s x %s", A.getRowDimension(), A.getColumnDimension());
    return reducer.isNonSingular(A);
  }

}
