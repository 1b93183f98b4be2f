package io.github.yok.if97.core.linearalgebra;

import com.google.common.base.Preconditions;
import java.util.Arrays;
import org.ejml.data.Complex_F64;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.EigenDecomposition_F64;

/**
 * EJML を用いて、コンパニオン行列の固有値として 3 次方程式の根を求めるクラスです。
 *
 * <p>
 * {@code x³ + a2 x² + a1 x + a0} のコンパニオン行列
 * {@code [[-a2, -a1, -a0], [1, 0, 0], [0, 1, 0]]} の固有値のうち、虚部が十分小さいものを実根として返します。
 * </p>
 */
public final class EjmlCompanionMatrixCubicSolver implements CubicEquationSolver {

    /**
     * 固有値を実数とみなす虚部の相対許容値です。
     */
    private static final double IMAGINARY_TOLERANCE = 1.0e-9;

    /**
     * モニックな 3 次方程式の実根を昇順で返します。
     *
     * @param a2 2 次の係数です
     * @param a1 1 次の係数です
     * @param a0 定数項です
     * @return 実根の昇順配列です
     * @throws IllegalArgumentException 係数が有限値でない場合に発生します
     * @throws IllegalStateException 固有値計算に失敗した場合、または実根が得られない場合に発生します
     */
    @Override
    public double[] realRoots(double a2, double a1, double a0) {
        Preconditions.checkArgument(
                Double.isFinite(a2) && Double.isFinite(a1) && Double.isFinite(a0),
                "3 次方程式の係数は有限値である必要があります。a2=%s, a1=%s, a0=%s", a2, a1, a0);

        DMatrixRMaj companion = new DMatrixRMaj(new double[][] {
                {-a2, -a1, -a0},
                {1.0, 0.0, 0.0},
                {0.0, 1.0, 0.0}});

        // 一般（非対称）行列の固有値のみを計算します。
        EigenDecomposition_F64<DMatrixRMaj> decomposition =
                DecompositionFactory_DDRM.eig(3, false, false);

        // 入力行列を書き換える実装があるため、コピーを渡します。
        DMatrixRMaj work = decomposition.inputModified() ? companion.copy() : companion;
        if (!decomposition.decompose(work)) {
            throw new IllegalStateException("固有値計算に失敗しました（EJML）");
        }

        double[] buffer = new double[decomposition.getNumberOfEigenvalues()];
        int count = 0;
        for (int k = 0; k < decomposition.getNumberOfEigenvalues(); k++) {
            Complex_F64 eigenvalue = decomposition.getEigenvalue(k);
            double re = eigenvalue.getReal();
            double im = eigenvalue.getImaginary();
            if (Math.abs(im) <= IMAGINARY_TOLERANCE * (1.0 + Math.abs(re))) {
                buffer[count++] = re;
            }
        }
        if (count == 0) {
            throw new IllegalStateException("実数の固有値が得られませんでした: a2=" + a2 + ", a1=" + a1
                    + ", a0=" + a0);
        }

        double[] roots = Arrays.copyOf(buffer, count);
        Arrays.sort(roots);
        return roots;
    }
}
