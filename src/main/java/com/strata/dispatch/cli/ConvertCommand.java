package com.strata.dispatch.cli;

import com.strata.core.convert.ConversionOptions;
import com.strata.core.convert.StaticStructure;
import com.strata.core.convert.StaticStructureConverter;
import com.strata.core.model.DagCodec;
import com.strata.core.model.DagStructure;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * CLI command: strata convert &lt;structure.json&gt;
 * <p>
 * Converts a static-analysis structure into an executable DAG and prints it as JSON,
 * or writes it to {@code --output}.
 */
@Command(name = "convert", mixinStandardHelpOptions = true,
        description = "Convert a static structure into a DAG")
@Component
public class ConvertCommand implements Runnable {

    @Parameters(index = "0", description = "Static structure file in JSON format")
    private Path structureFile;

    @Option(names = "--include-decisions", description = "Emit internal:decision tasks for decision nodes")
    private boolean includeDecisions;

    @Option(names = "--prefix", description = "Task id prefix", defaultValue = ConversionOptions.DEFAULT_PREFIX)
    private String prefix;

    @Option(names = {"--output", "-o"}, description = "Write the DAG to this file instead of standard output")
    private Path output;

    private final StaticStructureConverter converter;
    private final DagCodec dagCodec;

    public ConvertCommand(StaticStructureConverter converter, DagCodec dagCodec) {
        this.converter = converter;
        this.dagCodec = dagCodec;
    }

    @Override
    public void run() {
        DagStructure dag;
        StaticStructure structure;
        try {
            structure = converter.read(Files.readString(structureFile));
            dag = converter.convert(structure, new ConversionOptions(includeDecisions, prefix));
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read " + structureFile + ": " + e.getMessage());
            return;
        } catch (RuntimeException e) {
            ConsoleOutput.error("Conversion failed: " + RunCommand.rootCauseMessage(e));
            return;
        }

        String json = dagCodec.write(dag);
        if (output == null) {
            System.out.println(json);
            return;
        }
        try {
            Files.writeString(output, json);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot write " + output + ": " + e.getMessage());
            return;
        }
        ConsoleOutput.success(String.format("Wrote %d task(s) to %s (about %d layer(s); tools: %s)",
                dag.size(), output, converter.estimateParallelLayers(structure),
                String.join(", ", converter.getToolsFromStaticStructure(structure))));
    }
}
