package xyz.vvrf.ascii.dag.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import xyz.vvrf.ascii.dag.execution.StandardGraphRenderer;
import xyz.vvrf.ascii.dag.io.DotGraphReader;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ascii-dag 命令行")
class AsciiDagCommandTest {

    @TempDir
    Path dir;

    private AsciiDagCommand command;
    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;
    private Path input;

    @BeforeEach
    void setUp() throws IOException {
        command = new AsciiDagCommand(new StandardGraphRenderer(), new DotGraphReader());
        command.setConsoleCharset(StandardCharsets.UTF_8);
        out = new StringWriter();
        err = new StringWriter();
        commandLine = new CommandLine(command);
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        input = dir.resolve("graph.dot");
        Files.write(input, "digraph { A -> B }".getBytes(StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString().replace(System.lineSeparator(), "\n");
    }

    @Test
    @DisplayName("默认输出 Unicode")
    void rendersWithDefaults() {
        int exitCode = commandLine.execute(input.toString());

        assertThat(exitCode).isZero();
        assertThat(stdout()).isEqualTo("[A]\n │\n ↓\n[B]\n");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    @DisplayName("命令行参数覆盖默认配置")
    void appliesFlags() {
        int exitCode = commandLine.execute("--ascii", "--style", "round", "--layer-spacing", "1", "--no-arrows", input.toString());

        assertThat(exitCode).isZero();
        assertThat(stdout()).isEqualTo("(A)\n |\n(B)\n");
    }

    @Test
    @DisplayName("--delimiters 隐含 custom 样式")
    void delimitersImplyCustomStyle() {
        int exitCode = commandLine.execute("--delimiters", "{,}", "--charset", "ascii", input.toString());

        assertThat(exitCode).isZero();
        assertThat(stdout()).startsWith("{A}\n");
    }

    @Test
    @DisplayName("输出编码无法表示制表符时退回 ascii")
    void fallsBackToAscii() {
        command.setConsoleCharset(StandardCharsets.US_ASCII);

        assertThat(commandLine.execute(input.toString())).isZero();
        assertThat(stdout()).isEqualTo("[A]\n |\n v\n[B]\n");
    }

    @Test
    @DisplayName("显式指定字符集时不退回")
    void explicitCharsetWins() {
        command.setConsoleCharset(StandardCharsets.US_ASCII);

        assertThat(commandLine.execute("--charset", "unicode", input.toString())).isZero();
        assertThat(stdout()).contains("↓");
    }

    @Test
    @DisplayName("-o 写入 UTF-8 文件")
    void writesOutputFile() throws IOException {
        Path target = dir.resolve("out.txt");

        int exitCode = commandLine.execute("-o", target.toString(), input.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEmpty();
        String written = new String(Files.readAllBytes(target), StandardCharsets.UTF_8);
        assertThat(written.trim()).isEqualTo("[A]\n │\n ↓\n[B]");
    }

    @Test
    @DisplayName("输入错误时退出码为 1，错误信息写到 stderr")
    void inputErrors() throws IOException {
        Path broken = dir.resolve("broken.dot");
        Files.write(broken, "digraph { A -> ".getBytes(StandardCharsets.UTF_8));

        assertThat(commandLine.execute(broken.toString())).isEqualTo(1);
        assertThat(err.toString()).contains("Error: DOT syntax error");

        assertThat(commandLine.execute(dir.resolve("missing.dot").toString())).isEqualTo(1);
        assertThat(commandLine.execute(dir.resolve("graph.json").toString())).isEqualTo(1);
        assertThat(err.toString()).contains("Unsupported file format");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    @DisplayName("配置错误时退出码为 1")
    void configurationErrors() {
        assertThat(commandLine.execute("--style", "hexagon", input.toString())).isEqualTo(1);
        assertThat(err.toString()).contains("Unknown node style 'hexagon'");

        assertThat(commandLine.execute("--node-spacing", "0", input.toString())).isEqualTo(1);
        assertThat(commandLine.execute("--delimiters", "abc", input.toString())).isEqualTo(1);
        assertThat(err.toString()).contains("exactly one comma");
    }

    @Test
    @DisplayName("--ascii 与 --charset unicode 冲突时报错，与 --charset ascii 一起使用则正常")
    void asciiConflictsWithUnicodeCharset() {
        assertThat(commandLine.execute("--ascii", "--charset", "unicode", input.toString())).isEqualTo(1);
        assertThat(err.toString()).contains("--ascii conflicts with --charset unicode");
        assertThat(out.toString()).isEmpty();

        assertThat(commandLine.execute("--ascii", "--charset", "ascii", input.toString())).isZero();
        assertThat(stdout()).contains("[A]").doesNotContain("│");
    }

    @Test
    @DisplayName("用法错误时退出码为 2")
    void usageErrors() {
        assertThat(commandLine.execute()).isEqualTo(2);
        assertThat(commandLine.execute("--node-spacing", "many", input.toString())).isEqualTo(2);
        assertThat(commandLine.execute("--unknown", input.toString())).isEqualTo(2);
    }

    @Test
    @DisplayName("--help 输出用法")
    void help() {
        assertThat(commandLine.execute("--help")).isZero();
        assertThat(stdout()).contains("ascii-dag").contains("--no-arrows").contains("--delimiters");
    }
}
