package org.kiln.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

class KilnCliTest {

    @Test
    @DisplayName("버전 옵션")
    void version() {
        StringWriter out = new StringWriter();

        int exitCode = new CommandLine(new KilnCli()).setOut(new PrintWriter(out)).execute("--version");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("kiln 0.1.0");
    }

    @Test
    @DisplayName("migrate 서브커맨드 등록")
    void registersMigrate() {
        CommandLine cli = new CommandLine(new KilnCli());

        assertThat(cli.getSubcommands()).containsKey("migrate");
        assertThat(cli.getSubcommands().get("migrate").getSubcommands())
                .containsKeys("diff", "create", "deploy", "status", "verify");
    }

    @Test
    @DisplayName("알 수 없는 서브커맨드는 사용법 오류")
    void unknownSubcommand() {
        StringWriter err = new StringWriter();

        int exitCode = new CommandLine(new KilnCli()).setErr(new PrintWriter(err)).execute("rollback");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("rollback");
    }
}
