package io.github.yok.if97.app;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.if97.EngineFixtures;
import io.github.yok.if97.app.If97Properties.Query.QueryType;
import io.github.yok.if97.core.engine.SteamPropertyEngine;
import io.github.yok.if97.core.verification.ReferencePointCsvLoader;
import io.github.yok.if97.core.verification.ReferencePointVerifier;
import io.github.yok.if97.out.CsvResultWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class If97CliRunnerTest {

    @TempDir
    Path tempDir;

    @Test
    void propertiesQueryWritesCsv() {
        If97Properties p = properties(QueryType.PROPERTIES, 1.0e5, 473.15);
        runner(p).run();
        assertTrue(Files.exists(tempDir.resolve("if97_properties_P=1.000000e+05_T=473.150.csv")));
    }

    @Test
    void saturationQueriesWriteCsv() {
        runner(properties(QueryType.SATURATION_AT_PRESSURE, 1.0e6, null)).run();
        assertTrue(Files.exists(tempDir.resolve("if97_saturation_T=453.036.csv")));

        runner(properties(QueryType.SATURATION_AT_TEMPERATURE, null, 500.0)).run();
        assertTrue(Files.exists(tempDir.resolve("if97_saturation_T=500.000.csv")));
    }

    @Test
    void verificationQueryWritesReport() {
        runner(properties(QueryType.VERIFICATION, null, null)).run();
        assertTrue(Files.exists(tempDir.resolve("if97_verification.csv")));
    }

    @Test
    void failuresSurfaceAsExceptions() {
        assertThrows(IllegalArgumentException.class,
                () -> runner(properties(QueryType.PROPERTIES, -1.0, 300.0)).run());
        assertThrows(IllegalStateException.class,
                () -> runner(properties(QueryType.PROPERTIES, 22.1e6, 647.15)).run());
        assertThrows(IllegalStateException.class,
                () -> runner(properties(QueryType.PROPERTIES, null, 300.0)).run());
    }

    private If97Properties properties(QueryType type, Double pressure, Double temperature) {
        If97Properties p = new If97Properties();
        p.getQuery().setType(type);
        p.getQuery().setPressure(pressure);
        p.getQuery().setTemperature(temperature);
        p.getOutput().setDir(tempDir.toString());
        return p;
    }

    private If97CliRunner runner(If97Properties p) {
        SteamPropertyEngine engine = EngineFixtures.engine(p);
        return new If97CliRunner(p, engine, new ReferencePointCsvLoader(),
                new ReferencePointVerifier(engine), new CsvResultWriter(p.getOutput().getDir()));
    }
}
