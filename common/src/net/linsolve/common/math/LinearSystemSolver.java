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

import net.linsolve.common.LangUtils;

/**
 * Encapsulates a strategy for solving a linear system Ax = b.
 * This allows for swapping in other strategies later.
 */
public interface LinearSystemSolver {

  /**
   * Threshold at or below which the magnitude of a matrix's determinant is considered 0, and the matrix
   * therefore singular
   */
  double SINGULARITY_THRESHOLD = LangUtils.parseThreshold("linsolve.matrix.singularityThreshold", 1.0e-5);

  /**
   * @param A {@code n x n} coefficient matrix
   * @param B {@code n x 1} constants
   * @return the solution x of Ax = B, or a singular result if A has no inverse
   * @throws IllegalArgumentException if A is not square or B does not have shape {@code n x 1}
   */
  SolveResult solve(RealMatrix A, RealMatrix B);

  /**
   * @return true if A appears to be invertible ({@link #solve(RealMatrix, RealMatrix)} would find a solution)
   */
  boolean isNonSingular(RealMatrix A);

}
