package com.astwriter.cli;

import com.astwriter.core.ast.AstNode;
import com.astwriter.core.ast.IrNode;
import com.astwriter.core.config.ConfigLoader;
import com.astwriter.core.config.WriterConfig;
import com.astwriter.core.format.SourceFormatter;
import com.astwriter.core.json.AstJsonException;
import com.astwriter.core.json.AstJsonReader;
import com.astwriter.core.json.SourceMapJsonWriter;
import com.astwriter.core.util.Versions;
import com.astwriter.core.writer.SourceMap;
import com.astwriter.core.writer.WriterException;
import com.astwriter.core.writer.WriterMappingProvider;
import com.astwriter.core.writer.WriterMappingProviders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to render a JSON syntax tree to source code.
 *
 * <p>Options given on the command line override the configuration file. Without
 * {@code -c}, {@code astwriter.yaml} in the working directory is used when present.
 *
 * <p><b>Exit codes:</b> 0 on success, 1 for unreadable or invalid input and unknown
 * mappings, 2 when the writers cannot render the tree.
 */
@Command(
    name = "render",
    description = "Render a JSON syntax tree to source code",
    mixinStandardHelpOptions = true
)
public class RenderCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RenderCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_INPUT_ERROR = 1;
    static final int EXIT_WRITER_ERROR = 2;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "JSON file holding the tree")
    private Path input;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: ./astwriter.yaml if present)")
    private Path configPath;

    @Option(names = {"-o", "--output"}, description = "Output file for the source (default: stdout)")
    private Path output;

    @Option(names = {"-m", "--source-map"}, description = "Output file for the source map JSON")
    private Path sourceMapPath;

    @Option(names = "--ir", description = "Input is an IR tree (no source map)")
    private boolean ir;

    @Option(names = "--mapping", description = "Writer mapping id, overrides the configuration")
    private String mapping;

    @Option(names = "--target-version", description = "Target language version, overrides the configuration")
    private String targetVersion;

    @Override
    public Integer call() {
        WriterConfig config = loadConfig()
            .withMapping(mapping)
            .withTargetVersion(targetVersion);

        if (!Versions.isValid(config.targetVersion())) {
            log.error("Not a version: {}", config.targetVersion());
            return EXIT_INPUT_ERROR;
        }

        WriterMappingProvider provider;
        try {
            provider = WriterMappingProviders.require(config.mapping());
        } catch (IllegalArgumentException e) {
            log.error(e.getMessage());
            return EXIT_INPUT_ERROR;
        }

        SourceFormatter formatter = config.createFormatter();
        AstJsonReader reader = new AstJsonReader();

        try {
            String source;
            SourceMap sourceMap = null;

            if (ir) {
                if (sourceMapPath != null) {
                    log.warn("IR trees carry no source map; ignoring {}", sourceMapPath);
                }
                IrNode root = reader.readIr(input);
                source = provider.createIrWriter(formatter).write(root);
            } else {
                AstNode root = reader.read(input);
                sourceMap = new SourceMap();
                source = provider.createAstWriter(formatter, config.targetVersion()).write(root, sourceMap);
            }

            writeSource(source);
            if (sourceMap != null && sourceMapPath != null) {
                new SourceMapJsonWriter().write(sourceMap, sourceMapPath);
                log.info("Wrote source map with {} entries to: {}", sourceMap.size(), sourceMapPath);
            }
            return EXIT_OK;
        } catch (IOException e) {
            log.error("I/O error: {}", e.getMessage());
            return EXIT_INPUT_ERROR;
        } catch (AstJsonException e) {
            log.error("Invalid input {}: {}", input, e.getMessage());
            return EXIT_INPUT_ERROR;
        } catch (WriterException e) {
            log.error("Rendering failed: {}", e.getMessage());
            return EXIT_WRITER_ERROR;
        }
    }

    private WriterConfig loadConfig() {
        if (configPath != null) {
            return ConfigLoader.load(configPath);
        }
        Path defaultPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);
        return Files.exists(defaultPath) ? ConfigLoader.load(defaultPath) : WriterConfig.defaults();
    }

    private void writeSource(String source) throws IOException {
        if (output == null) {
            PrintWriter out = spec.commandLine().getOut();
            out.println(source);
            out.flush();
            return;
        }
        Files.writeString(output, source, StandardCharsets.UTF_8);
        log.info("Wrote {} to: {}", input.getFileName(), output);
    }
}
