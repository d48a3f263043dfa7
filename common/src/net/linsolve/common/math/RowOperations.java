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
 * Elementary row operations on a dense matrix. These never modify their argument.
 */
public final class RowOperations {

  private RowOperations() {
  }

  /**
   * @param M matrix whose rows are exchanged
   * @param i first row index
   * @param j second row index
   * @return a new matrix equal to {@code M} but with rows {@code i} and {@code j} exchanged; a copy
   *  of {@code M} when {@code i == j}
   * @throws IllegalArgumentException if either index is not a row of {@code M}
   */
  public static RealMatrix swapRows(RealMatrix M, int i, int j) {
    Preconditions.checkNotNull(M);
    int rows = M.getRowDimension();
    Preconditions.checkArgument(i >= 0 && i < rows, "Row %s is not in [0,%s)", i, rows);
    Preconditions.checkArgument(j >= 0 && j < rows, "Row %s is not in [0,%s)", j, rows);
    RealMatrix swapped = M.copy();
    if (i != j) {
      swapped.setRow(i, M.getRow(j));
      swapped.setRow(j, M.getRow(i));
    }
    return swapped;
  }

}
