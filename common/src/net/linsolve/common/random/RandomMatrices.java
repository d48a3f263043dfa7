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

package net.linsolve.common.random;

import java.util.Map;
import java.util.WeakHashMap;

import com.google.common.base.Preconditions;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.util.FastMath;

/**
 * Generates random dense matrices, for exercising solvers. Generators handed out here can be reset
 * to a known state for testing.
 */
public final class RandomMatrices {

  private static final long TEST_SEED = 1234567890L;

  private static final Map<RandomGenerator,Boolean> INSTANCES = new WeakHashMap<RandomGenerator,Boolean>();
  private static boolean useTestSeed = false;

  private RandomMatrices() {
  }

  public static RandomGenerator getRandom() {
    if (useTestSeed) {
      return new MersenneTwister(TEST_SEED);
    }
    RandomGenerator random = new MersenneTwister();
    synchronized (INSTANCES) {
      INSTANCES.put(random, Boolean.TRUE);
    }
    return random;
  }

  /**
   * Resets all generators handed out so far, and all future ones, to a fixed seed.
   */
  public static void useTestSeed() {
    useTestSeed = true;
    synchronized (INSTANCES) {
      for (RandomGenerator random : INSTANCES.keySet()) {
        random.setSeed(TEST_SEED);
      }
      INSTANCES.clear();
    }
  }

  /**
   * @return {@code rows x columns} matrix with entries drawn uniformly from [-1,1)
   */
  public static RealMatrix randomMatrix(int rows, int columns, RandomGenerator random) {
    Preconditions.checkArgument(rows > 0 && columns > 0, "Bad dimensions: %s x %s", rows, columns);
    double[][] data = new double[rows][columns];
    for (double[] row : data) {
      for (int col = 0; col < columns; col++) {
        row[col] = 2.0 * random.nextDouble() - 1.0;
      }
    }
    return new Array2DRowRealMatrix(data, false);
  }

  /**
   * @return square matrix like {@link #randomMatrix(int, int, RandomGenerator)} but strictly diagonally
   *  dominant, and therefore invertible with a determinant well away from 0
   */
  public static RealMatrix randomInvertibleMatrix(int dimension, RandomGenerator random) {
    RealMatrix matrix = randomMatrix(dimension, dimension, random);
    for (int i = 0; i < dimension; i++) {
      double diagonal = matrix.getEntry(i, i);
      // Each off-diagonal entry is < 1 in magnitude
      matrix.setEntry(i, i, (diagonal < 0.0 ? -1.0 : 1.0) * (dimension + FastMath.abs(diagonal)));
    }
    return matrix;
  }

}
