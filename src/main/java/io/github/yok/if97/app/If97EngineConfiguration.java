package io.github.yok.if97.app;

import io.github.yok.if97.core.engine.If97SteamPropertyEngine;
import io.github.yok.if97.core.engine.SteamPropertyEngine;
import io.github.yok.if97.core.equation.Region1Equation;
import io.github.yok.if97.core.equation.Region2Equation;
import io.github.yok.if97.core.equation.Region3Equation;
import io.github.yok.if97.core.guard.SingularityGuard;
import io.github.yok.if97.core.linearalgebra.AnalyticCubicEquationSolver;
import io.github.yok.if97.core.linearalgebra.CubicEquationSolver;
import io.github.yok.if97.core.linearalgebra.EjmlCompanionMatrixCubicSolver;
import io.github.yok.if97.core.router.RegionClassifier;
import io.github.yok.if97.core.saturation.SaturationCalculator;
import io.github.yok.if97.core.saturation.SaturationLine;
import io.github.yok.if97.core.solver.BrentRootFinder;
import io.github.yok.if97.core.solver.PengRobinsonEquation;
import io.github.yok.if97.core.solver.Region3DensitySolver;
import io.github.yok.if97.core.verification.ReferencePointCsvLoader;
import io.github.yok.if97.core.verification.ReferencePointVerifier;
import io.github.yok.if97.out.CsvResultWriter;
import io.github.yok.if97.out.ResultWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * IAPWS-IF97 物性エンジン一式の Bean 定義を行う設定クラスです。
 *
 * <p>
 * 状態式・求根器・領域判定・特異点ガードを組み立て、{@link SteamPropertyEngine} として公開します。
 * </p>
 */
@Configuration
@RequiredArgsConstructor
public class If97EngineConfiguration {

    /**
     * if97-solver の設定値（if97.*）です。
     */
    private final If97Properties p;

    /**
     * 領域 1 の状態式を生成します。
     *
     * @return 領域 1 の状態式です
     */
    @Bean
    public Region1Equation region1Equation() {
        return new Region1Equation();
    }

    /**
     * 領域 2 の状態式を生成します。
     *
     * @return 領域 2 の状態式です
     */
    @Bean
    public Region2Equation region2Equation() {
        return new Region2Equation();
    }

    /**
     * 領域 3 の状態式を生成します。
     *
     * @return 領域 3 の状態式です
     */
    @Bean
    public Region3Equation region3Equation() {
        return new Region3Equation();
    }

    /**
     * 設定に応じた 3 次方程式の解法を生成します。
     *
     * @return 3 次方程式の解法です
     */
    @Bean
    public CubicEquationSolver cubicEquationSolver() {
        switch (p.getRegion3().getCubicSolver()) {
            case EJML:
                return new EjmlCompanionMatrixCubicSolver();
            case ANALYTIC:
            default:
                return new AnalyticCubicEquationSolver();
        }
    }

    /**
     * 領域 3 の密度逆算器を生成します。
     *
     * @param region3Equation 領域 3 の状態式です
     * @param cubicEquationSolver 3 次方程式の解法です
     * @return 密度逆算器です
     */
    @Bean
    public Region3DensitySolver region3DensitySolver(Region3Equation region3Equation,
            CubicEquationSolver cubicEquationSolver) {
        If97Properties.Region3 r3 = p.getRegion3();
        return new Region3DensitySolver(region3Equation,
                new PengRobinsonEquation(cubicEquationSolver), r3.getPressureTolerance(),
                r3.getMaxIterations());
    }

    /**
     * 飽和線を生成します。
     *
     * @return 飽和線です
     */
    @Bean
    public SaturationLine saturationLine() {
        If97Properties.Saturation s = p.getSaturation();
        return new SaturationLine(
                new BrentRootFinder(s.getTemperatureTolerance(), s.getMaxIterations()));
    }

    /**
     * 特異点ガードを生成します。
     *
     * @return 特異点ガードです
     */
    @Bean
    public SingularityGuard singularityGuard() {
        return new SingularityGuard(p.getSingularity().getThreshold());
    }

    /**
     * 領域判定器を生成します。
     *
     * @param saturationLine 飽和線です
     * @return 領域判定器です
     */
    @Bean
    public RegionClassifier regionClassifier(SaturationLine saturationLine) {
        If97Properties.Saturation s = p.getSaturation();
        return new RegionClassifier(saturationLine, s.getBoundaryRelativeTolerance(),
                s.getBoundaryAbsoluteTolerance());
    }

    /**
     * 飽和物性の計算器を生成します。
     *
     * @param region1Equation 領域 1 の状態式です
     * @param region2Equation 領域 2 の状態式です
     * @param region3Equation 領域 3 の状態式です
     * @param region3DensitySolver 領域 3 の密度逆算器です
     * @param singularityGuard 特異点ガードです
     * @return 飽和物性の計算器です
     */
    @Bean
    public SaturationCalculator saturationCalculator(Region1Equation region1Equation,
            Region2Equation region2Equation, Region3Equation region3Equation,
            Region3DensitySolver region3DensitySolver, SingularityGuard singularityGuard) {
        return new SaturationCalculator(region1Equation, region2Equation, region3Equation,
                region3DensitySolver, singularityGuard);
    }

    /**
     * 物性エンジンを生成します。
     *
     * @param regionClassifier 領域判定器です
     * @param saturationLine 飽和線です
     * @param saturationCalculator 飽和物性の計算器です
     * @param region1Equation 領域 1 の状態式です
     * @param region2Equation 領域 2 の状態式です
     * @param region3Equation 領域 3 の状態式です
     * @param region3DensitySolver 領域 3 の密度逆算器です
     * @param singularityGuard 特異点ガードです
     * @return 物性エンジンです
     */
    @Bean
    public SteamPropertyEngine steamPropertyEngine(RegionClassifier regionClassifier,
            SaturationLine saturationLine, SaturationCalculator saturationCalculator,
            Region1Equation region1Equation, Region2Equation region2Equation,
            Region3Equation region3Equation, Region3DensitySolver region3DensitySolver,
            SingularityGuard singularityGuard) {
        return new If97SteamPropertyEngine(regionClassifier, saturationLine, saturationCalculator,
                region1Equation, region2Equation, region3Equation, region3DensitySolver,
                singularityGuard, p.getSaturation().getConsistencyTolerance());
    }

    /**
     * 参照値 CSV の読み込み器を生成します。
     *
     * @return 読み込み器です
     */
    @Bean
    public ReferencePointCsvLoader referencePointCsvLoader() {
        return new ReferencePointCsvLoader();
    }

    /**
     * 参照値の検証器を生成します。
     *
     * @param steamPropertyEngine 物性エンジンです
     * @return 検証器です
     */
    @Bean
    public ReferencePointVerifier referencePointVerifier(SteamPropertyEngine steamPropertyEngine) {
        return new ReferencePointVerifier(steamPropertyEngine);
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @return 結果出力ロジックです
     */
    @Bean
    public ResultWriter resultWriter() {
        return new CsvResultWriter(p.getOutput().getDir());
    }
}
