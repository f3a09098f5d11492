package xyz.vvrf.ascii.dag.cli;

import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import xyz.vvrf.ascii.dag.config.RenderOptionOverrides;
import xyz.vvrf.ascii.dag.core.CharSet;
import xyz.vvrf.ascii.dag.core.ConfigurationException;
import xyz.vvrf.ascii.dag.core.Graph;
import xyz.vvrf.ascii.dag.core.GraphInputException;
import xyz.vvrf.ascii.dag.core.NodeStyle;
import xyz.vvrf.ascii.dag.core.RenderOptions;
import xyz.vvrf.ascii.dag.execution.GraphRenderer;
import xyz.vvrf.ascii.dag.execution.StandardGraphRenderer;
import xyz.vvrf.ascii.dag.io.DotGraphReader;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * 命令行入口：读取 DOT 文件，按命令行参数渲染为字符画。
 * <p>
 * 命令行参数作为 {@link RenderOptionOverrides} 覆盖在默认配置之上。
 * 没有显式指定字符集时，如果输出编码无法表示制表符，则退回 ascii。
 * 退出码: 0 成功；1 输入、配置或 IO 错误 (信息写到 stderr)；2 命令行用法错误。
 *
 * @author ruifeng.wen
 */
@Slf4j
@Command(
        name = "ascii-dag",
        mixinStandardHelpOptions = true,
        version = "ascii-dag 1.0.0",
        description = "Render a graph from a DOT file as ASCII/Unicode text."
)
public class AsciiDagCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;

    private static final String BOX_DRAWING_SAMPLE = "│─┌↓↺";

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Parameters(index = "0", paramLabel = "INPUT", description = "Input file in DOT format (.dot or .gv), or '-' for stdin")
    private String input;

    @Option(names = "--style", paramLabel = "STYLE", description = "Node style: minimal, square, round, diamond, custom (default: square)")
    private String style;

    @Option(names = "--delimiters", paramLabel = "LEFT,RIGHT", description = "Delimiters for the custom style, e.g. '{,}'. Implies --style custom.")
    private String delimiters;

    @Option(names = "--ascii", description = "Force ASCII output (no Unicode box characters)")
    private boolean ascii;

    @Option(names = "--charset", paramLabel = "CHARSET", description = "Output charset: ascii or unicode")
    private String charset;

    @Option(names = "--node-spacing", paramLabel = "N", description = "Horizontal space between nodes (default: 4)")
    private Integer nodeSpacing;

    @Option(names = "--layer-spacing", paramLabel = "N", description = "Vertical space between layers (default: 2)")
    private Integer layerSpacing;

    @Option(names = "--no-arrows", description = "Do not draw direction markers")
    private boolean noArrows;

    @Option(names = "--max-sweeps", paramLabel = "N", description = "Maximum crossing reduction passes (default: 24, 0 disables)")
    private Integer maxSweeps;

    @Option(names = {"-o", "--output"}, paramLabel = "FILE", description = "Write the diagram to FILE (UTF-8) instead of stdout")
    private Path output;

    private final GraphRenderer renderer;
    private final DotGraphReader reader;
    private Charset consoleCharset = Charset.defaultCharset();

    public AsciiDagCommand() {
        this(new StandardGraphRenderer(), new DotGraphReader());
    }

    AsciiDagCommand(GraphRenderer renderer, DotGraphReader reader) {
        this.renderer = renderer;
        this.reader = reader;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new AsciiDagCommand()).execute(args);
        System.exit(exitCode);
    }

    /**
     * 标准输出使用的编码，用于判断是否需要退回 ascii。
     */
    void setConsoleCharset(Charset consoleCharset) {
        this.consoleCharset = consoleCharset;
    }

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        try {
            Graph graph = readInput();
            RenderOptions options = toOverrides().applyTo(RenderOptions.defaults());
            String text = renderer.render(graph, options);
            writeOutput(text);
            return EXIT_OK;
        } catch (ConfigurationException | GraphInputException e) {
            log.debug("ascii-dag failed for input {}: {}", input, e.getMessage());
            err.println("Error: " + e.getMessage());
            err.flush();
            return EXIT_ERROR;
        } catch (IOException e) {
            log.debug("ascii-dag I/O failure for input {}", input, e);
            err.println("Error: " + e.getMessage());
            err.flush();
            return EXIT_ERROR;
        }
    }

    /**
     * 把命令行参数转换为配置覆盖，未给出的参数保持为 null。
     */
    RenderOptionOverrides toOverrides() {
        RenderOptionOverrides.RenderOptionOverridesBuilder builder = RenderOptionOverrides.builder()
                .nodeSpacing(nodeSpacing)
                .layerSpacing(layerSpacing)
                .maxCrossingSweeps(maxSweeps);
        if (style != null) {
            builder.nodeStyle(NodeStyle.fromName(style));
        }
        if (delimiters != null) {
            builder.customDelimiters(parseDelimiters(delimiters));
            if (style == null) {
                builder.nodeStyle(NodeStyle.CUSTOM);
            }
        }
        builder.charset(resolveCharset());
        if (noArrows) {
            builder.showArrows(false);
        }
        return builder.build();
    }

    private CharSet resolveCharset() {
        if (charset != null) {
            CharSet requested = CharSet.fromName(charset);
            if (ascii && requested != CharSet.ASCII) {
                throw new ConfigurationException(String.format("--ascii conflicts with --charset %s", requested));
            }
            return requested;
        }
        if (ascii) {
            return CharSet.ASCII;
        }
        if (output == null && !consoleCharset.newEncoder().canEncode(BOX_DRAWING_SAMPLE)) {
            log.debug("Console charset {} cannot encode box drawing characters, falling back to ascii", consoleCharset);
            return CharSet.ASCII;
        }
        return null;
    }

    private static RenderOptions.Delimiters parseDelimiters(String value) {
        int comma = value.indexOf(',');
        if (comma < 0 || value.indexOf(',', comma + 1) >= 0) {
            throw new ConfigurationException(String.format("--delimiters expects LEFT,RIGHT with exactly one comma, got '%s'", value));
        }
        return RenderOptions.Delimiters.of(value.substring(0, comma), value.substring(comma + 1));
    }

    private Graph readInput() throws IOException {
        if ("-".equals(input)) {
            try (Reader in = new InputStreamReader(System.in, StandardCharsets.UTF_8)) {
                return reader.read(in);
            }
        }
        String lower = input.toLowerCase(Locale.ROOT);
        if (!lower.endsWith(".dot") && !lower.endsWith(".gv")) {
            throw new GraphInputException("Unsupported file format: " + input);
        }
        return reader.read(Paths.get(input));
    }

    private void writeOutput(String text) throws IOException {
        if (output != null) {
            Files.write(output, (text + System.lineSeparator()).getBytes(StandardCharsets.UTF_8));
            log.info("Diagram written to {}", output);
            return;
        }
        PrintWriter out = spec.commandLine().getOut();
        out.println(text);
        out.flush();
    }
}
