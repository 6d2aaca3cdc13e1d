package com.radioss.translator.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class TranslateCommandTest {

    private static final String PLATE = """
        NBLOCK
        1, 0.0, 0.0, 0.0
        2, 1.0, 0.0, 0.0
        3, 1.0, 1.0, 0.0
        4, 0.0, 1.0, 0.0
        -1
        EBLOCK
        1, 181, 1, 2, 3, 4
        -1
        CMBLOCK,PLATE,ELEM,       1
        (8i10)
                 1
        """;

    @TempDir
    Path tempDir;

    @Test
    void testSuccessfulRunWritesDeck() throws IOException {
        Path input = write("plate.cdb", PLATE);
        Path out = tempDir.resolve("out");

        int exitCode = execute(input.toString(), "-o", out.toString(), "-b", "plate", "--validate");

        assertThat(exitCode).isZero();
        assertThat(out.resolve("mesh.inc")).exists();
        assertThat(out.resolve("plate_0001.rad")).exists();
        assertThat(Files.readString(out.resolve("plate_0000.rad")))
                .startsWith("#RADIOSS STARTER\n/BEGIN\nplate\n")
                .contains("/SUBSET/")
                .contains("\nPLATE\n");
    }

    @Test
    void testInvalidOptionsExitWithTwo() {
        assertThat(execute(tempDir.resolve("missing.cdb").toString(), "-o", tempDir.toString())).isEqualTo(2);
    }

    @Test
    void testUnknownOptionIsAUsageError() throws IOException {
        Path input = write("plate.cdb", PLATE);

        assertThat(execute(input.toString(), "--no-such-flag")).isEqualTo(CommandLine.ExitCode.USAGE);
    }

    @Test
    void testFailedTranslationExitsWithOneAndWritesNothing() throws IOException {
        Path input = write("broken.cdb", "EBLOCK\n1, 181, 1, 2, 3, 4\n-1\n");
        Path out = tempDir.resolve("out");

        int exitCode = execute(input.toString(), "-o", out.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out).doesNotExist();
    }

    @Test
    void testSecondRunNeedsForce() throws IOException {
        Path input = write("plate.cdb", PLATE);
        String out = tempDir.resolve("out").toString();

        assertThat(execute(input.toString(), "-o", out)).isZero();
        assertThat(execute(input.toString(), "-o", out)).isEqualTo(2);
        assertThat(execute(input.toString(), "-o", out, "--force")).isZero();
    }

    @Test
    void testHelpExitsWithZero() {
        StringWriter help = new StringWriter();
        CommandLine cmd = new CommandLine(new TranslateCommand());
        cmd.setOut(new PrintWriter(help));

        assertThat(cmd.execute("--help")).isZero();
        assertThat(help.toString()).contains("cdb2rad").contains("--deck");
    }

    private int execute(String... args) {
        CommandLine cmd = new CommandLine(new TranslateCommand()).setCaseInsensitiveEnumValuesAllowed(true);
        cmd.setErr(new PrintWriter(new StringWriter()));
        return cmd.execute(args);
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }
}
