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
 * Outcome of {@link RowEchelonReducer#reduce(RealMatrix, RealMatrix)}: either an augmented matrix in
 * row echelon form, or a marker that the coefficient matrix was singular.
 */
public final class RowEchelonForm {

  private final RealMatrix reduced;
  private final int dimension;

  private RowEchelonForm(RealMatrix reduced, int dimension) {
    this.reduced = reduced;
    this.dimension = dimension;
  }

  static RowEchelonForm of(RealMatrix reduced) {
    Preconditions.checkNotNull(reduced);
    return new RowEchelonForm(reduced, reduced.getRowDimension());
  }

  /**
   * @param dimension number of rows of the singular coefficient matrix
   */
  static RowEchelonForm singular(int dimension) {
    return new RowEchelonForm(null, dimension);
  }

  /**
   * @return true if the coefficient matrix was singular, in which case there is no reduced matrix
   */
  public boolean isSingular() {
    return reduced == null;
  }

  /**
   * @return a copy of the reduced {@code n x (n+1)} augmented matrix
   * @throws SingularMatrixSolverException if {@link #isSingular()}
   */
  public RealMatrix getMatrix() {
    if (reduced == null) {
      throw new SingularMatrixSolverException(dimension,
                                              dimension + " x " + dimension + " matrix is singular; not reduced");
    }
    return reduced.copy();
  }

  @Override
  public String toString() {
    return reduced == null ?
        "RowEchelonForm[singular]" :
        "RowEchelonForm[\n" + MatrixUtils.matrixToString(reduced) + ']';
  }

}
