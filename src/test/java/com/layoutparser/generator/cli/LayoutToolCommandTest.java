package com.layoutparser.generator.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.layoutparser.generator.TestFixtures;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

class LayoutToolCommandTest {

    @TempDir
    Path tempDir;

    private Path layoutsDir;

    @BeforeEach
    void setUp() throws IOException {
        layoutsDir = Files.createDirectory(tempDir.resolve("layouts"));
        Files.writeString(layoutsDir.resolve("nota.xml"), TestFixtures.LAYOUT_XML);
        Files.writeString(layoutsDir.resolve("nota-mapper.xml"), TestFixtures.MAPPER_XML);
    }

    @Test
    void testValidateValidRecord() throws IOException {
        Path input = Files.write(tempDir.resolve("registro.txt"), TestFixtures.RECORD);

        int exitCode = run("validate", "-l", "LAY_0001", "-d", layoutsDir.toString(), "-i", input.toString());

        assertThat(exitCode).isZero();
    }

    @Test
    void testValidateInvalidRecord() throws IOException {
        List<String> lines = new ArrayList<>(TestFixtures.RECORD);
        lines.set(1, "01000001");
        Path input = Files.write(tempDir.resolve("registro.txt"), lines);

        int exitCode = run("validate", "-l", "LAY_0001", "-d", layoutsDir.toString(), "-i", input.toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void testGenerateMapWritesArtifact() {
        Path out = tempDir.resolve("out");

        int exitCode = run("generate-map", "-l", "NotaFiscalEntrada", "-d", layoutsDir.toString(), "-o", out.toString());

        assertThat(exitCode).isZero();
        assertThat(out.resolve("NotaFiscalEntrada.tcl")).exists();
    }

    @Test
    void testGenerateTransformWritesArtifact() {
        Path out = tempDir.resolve("out");

        int exitCode = run("generate-transform", "-l", "LAY_0001", "-d", layoutsDir.toString(), "-o", out.toString());

        assertThat(exitCode).isZero();
        assertThat(out.resolve("NotaFiscalParaNFe_NotaFiscalEntrada.xsl")).exists();
    }

    @Test
    void testSynthesizeRandomWritesRecords() throws IOException {
        Path out = tempDir.resolve("out");

        int exitCode = run("synthesize", "-l", "LAY_0001", "-d", layoutsDir.toString(), "-o", out.toString(),
                "--mode", "random", "--seed", "11", "-r", "2", "--parallelism", "1");

        assertThat(exitCode).isZero();
        assertThat(Files.readAllLines(out.resolve("NotaFiscalEntrada_synthetic.txt"))).hasSize(8);
    }

    @Test
    void testTransformWritesOutputDocument() throws IOException {
        Path input = Files.write(tempDir.resolve("registro.txt"), TestFixtures.RECORD);
        Path out = tempDir.resolve("out");

        int exitCode = run("transform", "-l", "LAY_0001", "-d", layoutsDir.toString(), "-i", input.toString(),
                "-o", out.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(out.resolve("NotaFiscalParaNFe_NotaFiscalEntrada_output.xml")))
                .contains("<nNF>000000123</nNF>");
    }

    @Test
    void testTransformWithoutInputIsUsageError() {
        assertThat(run("transform", "-l", "LAY_0001", "-d", layoutsDir.toString(),
                "-i", tempDir.resolve("ausente.txt").toString()))
                .isEqualTo(CommandLine.ExitCode.USAGE);
    }

    @Test
    void testUnknownLayoutFails() {
        int exitCode = run("generate-map", "-l", "LAY_9999", "-d", layoutsDir.toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void testInvalidOptionsGiveUsageExitCode() {
        assertThat(run("generate-map", "-l", "LAY_0001", "-d", tempDir.resolve("nada").toString()))
                .isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(run("synthesize", "-l", "LAY_0001", "-d", layoutsDir.toString(), "--mode", "LLM"))
                .isEqualTo(CommandLine.ExitCode.USAGE);
    }

    @Test
    void testMissingSubcommand() {
        assertThat(run()).isEqualTo(CommandLine.ExitCode.USAGE);
    }

    private static int run(String... args) {
        return new CommandLine(new LayoutToolCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
    }
}
