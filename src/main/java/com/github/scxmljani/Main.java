package com.github.scxmljani;

import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.scxmljani.CompilerConfiguration.CompilerConfigurationBuilder;
import com.github.scxmljani.StatechartCompiler.StatechartCompilerBuilder;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(
    name = "scxml-jani",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    description = "Compiles a network of SCXML statecharts into a JANI model")
public final class Main implements Callable<Integer> {
  private static final Logger logger = LogManager.getLogger(Main.class.getSimpleName());

  @Parameters(index = "0", paramLabel = "<network.xml>",
      description = "Network description listing the statecharts to compile.")
  private Path network;

  @Parameters(index = "1", paramLabel = "<output.jani>",
      description = "Where to write the JANI model.")
  private Path output;

  @Option(names = {"-q", "--queue-bound"},
      description = "Bound of the internal event queue of every automaton.", defaultValue = "16")
  private int internalQueueBound;

  @Option(names = {"-r", "--random-options"},
      description = "Equally likely outcomes of one Math.random() draw.", defaultValue = "100")
  private int randomOptions;

  @Option(names = {"-t", "--model-type"},
      description = "JANI model type: ${COMPLETION-CANDIDATES}.", defaultValue = "MDP")
  private CompilerConfiguration.ModelType modelType;

  public static void main(final String[] args) {
    final int exitCode = new CommandLine(new Main()).execute(args);
    System.exit(exitCode);
  }

  @Override
  public Integer call() {
    try {
      final CompilerConfiguration config = CompilerConfigurationBuilder.newBuilder()
          .internalQueueBound(internalQueueBound).randomOptions(randomOptions)
          .modelType(modelType).build();
      final StatechartCompiler compiler =
          StatechartCompilerBuilder.newBuilder().config(config).build();
      compiler.compile(NetworkDescriptionParser.parse(network), output);
      logger.info(compiler.getStatistics());
      return 0;
    } catch (CompilerException problem) {
      logger.error(problem.getMessage());
      return 1;
    }
  }

}
