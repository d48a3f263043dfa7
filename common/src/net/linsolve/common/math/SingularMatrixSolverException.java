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

/**
 * Thrown when a caller asks for a solution, or a reduced matrix, of a system that was found to be singular.
 */
public final class SingularMatrixSolverException extends SolverException {

  private final int dimension;

  public SingularMatrixSolverException(int dimension, String message) {
    super(message);
    this.dimension = dimension;
  }

  /**
   * @return number of rows (and columns) of the singular coefficient matrix
   */
  public int getDimension() {
    return dimension;
  }

}
