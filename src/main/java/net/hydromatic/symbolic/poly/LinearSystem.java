/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.symbolic.poly;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Solver for systems of linear equations over a field. */
public class LinearSystem {
  private LinearSystem() {}

  /** Solves {@code A v = b} by Gaussian elimination.
   *
   * <p>Returns one solution, with free variables set to zero, or null if
   * the system is inconsistent.
   *
   * @param field Field of the coefficients
   * @param rows Rows of {@code A}, each of length {@code n}
   * @param rhs Right-hand side {@code b}, one element per row
   * @param n Number of unknowns
   */
  public static <E> @Nullable List<E> solve(Field<E> field,
      List<? extends List<E>> rows, List<E> rhs, int n) {
    checkArgument(rows.size() == rhs.size(), "%s rows but %s values",
        rows.size(), rhs.size());
    final int m = rows.size();
    final List<List<E>> a = new ArrayList<>();
    for (int i = 0; i < m; i++) {
      checkArgument(rows.get(i).size() == n, "row %s has wrong length", i);
      final List<E> row = new ArrayList<>(rows.get(i));
      row.add(rhs.get(i));
      a.add(row);
    }
    final int[] pivotColumn = new int[m];
    int r = 0;
    for (int col = 0; col < n && r < m; col++) {
      int pivot = -1;
      for (int i = r; i < m; i++) {
        if (!field.isZero(a.get(i).get(col))) {
          pivot = i;
          break;
        }
      }
      if (pivot < 0) {
        continue;
      }
      final List<E> tmp = a.get(pivot);
      a.set(pivot, a.get(r));
      a.set(r, tmp);
      final List<E> pr = a.get(r);
      final E inv = field.reciprocal(pr.get(col));
      for (int j = col; j <= n; j++) {
        pr.set(j, field.multiply(pr.get(j), inv));
      }
      for (int i = 0; i < m; i++) {
        if (i == r) {
          continue;
        }
        final List<E> row = a.get(i);
        final E f = row.get(col);
        if (field.isZero(f)) {
          continue;
        }
        for (int j = col; j <= n; j++) {
          row.set(j, field.subtract(row.get(j), field.multiply(f, pr.get(j))));
        }
      }
      pivotColumn[r] = col;
      ++r;
    }
    // rows below the rank must read 0 = 0
    for (int i = r; i < m; i++) {
      if (!field.isZero(a.get(i).get(n))) {
        return null;
      }
    }
    final List<E> solution = new ArrayList<>();
    for (int j = 0; j < n; j++) {
      solution.add(field.zero());
    }
    for (int i = 0; i < r; i++) {
      solution.set(pivotColumn[i], a.get(i).get(n));
    }
    return solution;
  }
}

// End LinearSystem.java
