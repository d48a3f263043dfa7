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

import java.util.Arrays;

import com.google.common.base.Preconditions;

/**
 * Result of solving a linear system: either {@linkplain #solved(double[]) a solution} or
 * {@linkplain #singular(int) a report} that the system has no unique solution. Callers check
 * {@link #isSingular()} before asking for {@link #getSolution()}.
 */
public final class SolveResult {

  private final double[] solution;
  private final int dimension;

  private SolveResult(double[] solution, int dimension) {
    this.solution = solution;
    this.dimension = dimension;
  }

  /**
   * @param solution values of each variable, in column order; not copied
   */
  static SolveResult solved(double[] solution) {
    Preconditions.checkNotNull(solution);
    return new SolveResult(solution, solution.length);
  }

  /**
   * @param dimension number of variables in the singular system
   */
  static SolveResult singular(int dimension) {
    return new SolveResult(null, dimension);
  }

  public boolean isSingular() {
    return solution == null;
  }

  /**
   * @return number of variables in the system
   */
  public int getDimension() {
    return dimension;
  }

  /**
   * @return a copy of the solution vector
   * @throws SingularMatrixSolverException if the system was singular
   */
  public double[] getSolution() {
    if (solution == null) {
      throw new SingularMatrixSolverException(dimension,
                                              dimension + " x " + dimension + " system is singular; no unique solution");
    }
    return solution.clone();
  }

  @Override
  public String toString() {
    return solution == null ? "Singular" : "Solved" + Arrays.toString(solution);
  }

}
