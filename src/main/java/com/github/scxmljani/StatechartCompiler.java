package com.github.scxmljani;

import java.nio.file.Path;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Translates a network of SCXML statecharts, possibly expanded from a behavior tree, into one JANI
 * automata network.
 *
 * A compiler is stateless between compilations apart from its statistics; the same instance can
 * compile any number of networks.
 */
public interface StatechartCompiler {

  ///// Pipeline API /////
  /**
   * Runs every stage up to composition: expansion, parsing, event classification, resolution.
   */
  AutomataNetwork compile(final NetworkDescription description) throws CompilerException;

  /**
   * Compiles and emits the JANI document. A model that fails validation is never returned.
   */
  ObjectNode compileToJani(final NetworkDescription description) throws CompilerException;

  void compile(final NetworkDescription description, final Path output) throws CompilerException;


  ///// Compiler-wide functions /////
  String getId();

  CompilerConfiguration getConfiguration();

  CompilationStatistics getStatistics();

  public final static class StatechartCompilerBuilder {
    private CompilerConfiguration config;

    public static StatechartCompilerBuilder newBuilder() {
      return new StatechartCompilerBuilder();
    }

    public StatechartCompilerBuilder config(final CompilerConfiguration config) {
      this.config = config;
      return this;
    }

    public StatechartCompiler build() throws CompilerException {
      return new StatechartCompilerImpl(config == null ? CompilerConfiguration.defaults() : config);
    }

    private StatechartCompilerBuilder() {}
  }

}
