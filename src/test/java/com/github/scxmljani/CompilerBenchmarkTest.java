package com.github.scxmljani;

import java.util.Arrays;
import java.util.Collections;

import org.openjdk.jmh.annotations.Benchmark;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.scxmljani.NetworkDescription.NetworkDescriptionBuilder;
import com.github.scxmljani.StatechartCompiler.StatechartCompilerBuilder;

public class CompilerBenchmarkTest {

  @Benchmark
  public void testCompileRelayNetwork() throws CompilerException {
    // 1. prep the statecharts
    final StatechartDocument producer =
        StatechartDocument.fromString("p.scxml", NetworkComposerTest.producer);
    final StatechartDocument consumer =
        StatechartDocument.fromString("c.scxml", NetworkComposerTest.consumer);

    // 2. describe the network with a few listeners
    final NetworkDescription description = NetworkDescriptionBuilder.newBuilder().name("relay")
        .automaton(producer).automaton(consumer)
        .automaton(consumer, "C2", Collections.<String, String>emptyMap())
        .automaton(consumer, "C3", Collections.<String, String>emptyMap()).build();

    // 3. compile and validate
    final StatechartCompiler compiler = StatechartCompilerBuilder.newBuilder().build();
    final ObjectNode model = compiler.compileToJani(description);

    // 4. render
    JaniModelEmitter.render(model);
  }

  @Benchmark
  public void testCompileBehaviorTree() throws CompilerException {
    final NetworkDescription description = NetworkDescriptionBuilder.newBuilder().name("mission")
        .behaviorTree("bt.xml",
            XmlDocuments.parse("bt.xml", BehaviorTreeExpanderTest.sequenceTree), Arrays.asList(
                StatechartDocument.fromString("x.scxml", BehaviorTreeExpanderTest.succeeding),
                StatechartDocument.fromString("y.scxml", BehaviorTreeExpanderTest.failing)))
        .build();
    StatechartCompilerBuilder.newBuilder().build().compileToJani(description);
  }

  public static void main(String args[]) throws CompilerException {
    CompilerBenchmarkTest test = new CompilerBenchmarkTest();
    test.testCompileRelayNetwork();
    test.testCompileBehaviorTree();
  }

}
