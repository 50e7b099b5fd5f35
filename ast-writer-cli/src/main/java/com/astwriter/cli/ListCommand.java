package com.astwriter.cli;

import com.astwriter.core.writer.WriterMappingProvider;
import com.astwriter.core.writer.WriterMappingProviders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to list available writer mappings.
 *
 * <p>Discovers providers via Java Service Provider Interface (SPI) and prints the node
 * types and IR tags each one can write.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * astwriter list
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available writer mappings",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        List<WriterMappingProvider> providers = WriterMappingProviders.all();
        log.info("Discovered {} writer mappings", providers.size());

        out.println("Available Writer Mappings:");
        out.println();

        if (providers.isEmpty()) {
            out.println("  No writer mappings found.");
            out.flush();
            return 0;
        }

        for (WriterMappingProvider provider : providers) {
            out.printf("  • %s (ID: %s)%n", provider.getDisplayName(), provider.getId());
            out.printf("    Node types: %s%n", String.join(", ", provider.getAstMapping().nodeTypes().stream()
                .map(Class::getSimpleName)
                .sorted()
                .toList()));
            out.printf("    IR tags: %s%n", String.join(", ", provider.getIrMapping().nodeTypes().stream()
                .sorted()
                .toList()));
            out.println();
        }
        out.flush();
        return 0;
    }
}
