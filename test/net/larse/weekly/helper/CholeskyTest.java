package net.larse.weekly.helper;

import static org.junit.Assert.assertEquals;

import java.util.Random;
import org.ejml.data.DenseMatrix64F;
import org.ejml.ops.CommonOps;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CholeskyTest {
  private static final int N = 6;

  private DenseMatrix64F xtx;

  @Before
  public void setUp() {
    Random random = new Random(21);
    DenseMatrix64F x = new DenseMatrix64F(30, N);
    for (int i = 0; i < x.numRows; i++) {
      for (int j = 0; j < N; j++) {
        x.set(i, j, random.nextGaussian());
      }
    }
    xtx = new DenseMatrix64F(N, N);
    CommonOps.multTransA(x, x, xtx);
  }

  @Test
  public void testSolve() {
    double[] expected = {1, -2, 0.5, 3, 0, -1};
    DenseMatrix64F b = new DenseMatrix64F(N, 1);
    CommonOps.mult(xtx, DenseMatrix64F.wrap(N, 1, expected.clone()), b);
    double[] actual = Cholesky.solve(xtx, b.getData(), "test");
    for (int i = 0; i < N; i++) {
      assertEquals(expected[i], actual[i], 1e-10);
    }
  }

  @Test
  public void testInvert() {
    DenseMatrix64F inverse = Cholesky.invert(xtx, "test");
    DenseMatrix64F product = new DenseMatrix64F(N, N);
    CommonOps.mult(xtx, inverse, product);
    for (int i = 0; i < N; i++) {
      for (int j = 0; j < N; j++) {
        assertEquals(i == j ? 1 : 0, product.get(i, j), 1e-10);
      }
    }
  }

  @Test
  public void testInputUnchanged() {
    DenseMatrix64F copy = xtx.copy();
    Cholesky.invert(xtx, "test");
    Cholesky.solve(xtx, new double[N], "test");
    for (int i = 0; i < N; i++) {
      for (int j = 0; j < N; j++) {
        assertEquals(copy.get(i, j), xtx.get(i, j), 0);
      }
    }
  }

  @Test(expected = SingularDesignException.class)
  public void testZeroRowAndColumn() {
    for (int i = 0; i < N; i++) {
      xtx.set(2, i, 0);
      xtx.set(i, 2, 0);
    }
    Cholesky.solve(xtx, new double[N], "test");
  }

  @Test(expected = SingularDesignException.class)
  public void testNearlyDependentColumns() {
    DenseMatrix64F a = new DenseMatrix64F(new double[][] {{1, 1}, {1, 1 + 1e-15}});
    Cholesky.invert(a, "test");
  }
}
