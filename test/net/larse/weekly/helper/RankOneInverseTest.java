package net.larse.weekly.helper;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.util.Random;
import org.ejml.data.DenseMatrix64F;
import org.ejml.ops.CommonOps;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class RankOneInverseTest {
  private static final int ROWS = 40;
  private static final int COLS = 5;

  private DenseMatrix64F x;
  private DenseMatrix64F xt;
  private DenseMatrix64F xtxInv;

  @Before
  public void setUp() {
    Random random = new Random(17);
    x = new DenseMatrix64F(ROWS, COLS);
    for (int i = 0; i < ROWS; i++) {
      for (int j = 0; j < COLS; j++) {
        x.set(i, j, random.nextGaussian());
      }
    }
    xt = CommonOps.transpose(x, null);
    xtxInv = inverseCrossProduct(x);
  }

  private static DenseMatrix64F inverseCrossProduct(DenseMatrix64F design) {
    DenseMatrix64F xtx = new DenseMatrix64F(design.numCols, design.numCols);
    CommonOps.multTransA(design, design, xtx);
    if (!CommonOps.invert(xtx)) {
      fail("test design is singular");
    }
    return xtx;
  }

  private static DenseMatrix64F withColumn(DenseMatrix64F design, DenseMatrix64F v) {
    DenseMatrix64F augmented = new DenseMatrix64F(design.numRows, design.numCols + 1);
    CommonOps.insert(design, augmented, 0, 0);
    CommonOps.insert(v, augmented, 0, design.numCols);
    return augmented;
  }

  private static void assertMatrixEquals(DenseMatrix64F expected, DenseMatrix64F actual) {
    assertEquals(expected.numRows, actual.numRows);
    assertEquals(expected.numCols, actual.numCols);
    for (int i = 0; i < expected.numRows; i++) {
      for (int j = 0; j < expected.numCols; j++) {
        assertEquals("element " + i + "," + j, expected.get(i, j), actual.get(i, j), 1e-9);
      }
    }
  }

  @Test
  public void testAppendMatchesDirectInverse() throws Exception {
    Random random = new Random(3);
    DenseMatrix64F v = new DenseMatrix64F(ROWS, 1);
    for (int i = 0; i < ROWS; i++) {
      v.set(i, 0, random.nextGaussian());
    }

    DenseMatrix64F updated = RankOneInverse.append(xtxInv, xt, v);
    assertMatrixEquals(inverseCrossProduct(withColumn(x, v)), updated);
  }

  @Test
  public void testUnitColumnMatchesGeneralUpdate() throws Exception {
    int row = 11;
    DenseMatrix64F v = new DenseMatrix64F(ROWS, 1);
    v.set(row, 0, 1);

    RankOneInverse.Update general = RankOneInverse.update(xtxInv, xt, v);
    RankOneInverse.Update unit = RankOneInverse.updateUnitColumn(xtxInv, xt, row);
    assertEquals(general.getD(), unit.getD(), 1e-12);
    assertEquals(COLS + 1, unit.size());
    assertMatrixEquals(general.toMatrix(), unit.toMatrix());

    double[] lastRow = unit.lastRow();
    DenseMatrix64F full = unit.toMatrix();
    for (int j = 0; j <= COLS; j++) {
      assertEquals(full.get(COLS, j), lastRow[j], 1e-12);
    }
    assertEquals(full.get(COLS, COLS), unit.lastDiagonal(), 1e-12);
  }

  @Test
  public void testLastCoefficientMatchesLeastSquares() throws Exception {
    Random random = new Random(5);
    double[] y = new double[ROWS];
    for (int i = 0; i < ROWS; i++) {
      y[i] = random.nextGaussian();
    }
    int row = 23;
    DenseMatrix64F v = new DenseMatrix64F(ROWS, 1);
    v.set(row, 0, 1);

    double[] xty = new double[COLS];
    for (int j = 0; j < COLS; j++) {
      for (int i = 0; i < ROWS; i++) {
        xty[j] += x.get(i, j) * y[i];
      }
    }
    double coefficient =
        RankOneInverse.updateUnitColumn(xtxInv, xt, row).lastCoefficient(xty, y[row]);

    RegressionModel model = OrdinaryLeastSquares.fit(withColumn(x, v), y);
    assertEquals(model.getCoefficients()[COLS], coefficient, 1e-9);
  }

  @Test(expected = CollinearColumnException.class)
  public void testCollinearColumnRejected() throws Exception {
    DenseMatrix64F v = new DenseMatrix64F(ROWS, 1);
    for (int i = 0; i < ROWS; i++) {
      v.set(i, 0, 2 * x.get(i, 1) - x.get(i, 3));
    }
    RankOneInverse.update(xtxInv, xt, v);
  }
}
