package com.github.scxmljani;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import picocli.CommandLine;

/**
 * Tests for the command line entry point.
 */
public class MainTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private Path write(final String name, final String content) throws IOException {
    final Path file = folder.getRoot().toPath().resolve(name);
    Files.write(file, content.getBytes(StandardCharsets.UTF_8));
    return file;
  }

  private static int run(final String... args) {
    return new CommandLine(new Main()).execute(args);
  }

  @Test
  public void testCompilesNetworkFile() throws Exception {
    write("p.scxml", NetworkComposerTest.producer);
    write("c.scxml", NetworkComposerTest.consumer);
    final Path network = write("net.xml", "<network name='relay'>"
        + "<automaton src='p.scxml'/><automaton src='c.scxml'/></network>");
    final Path output = folder.getRoot().toPath().resolve("relay.jani");

    assertEquals(0, run("-t", "DTMC", "-q", "4", network.toString(), output.toString()));
    final JsonNode model = new ObjectMapper().readTree(output.toFile());
    assertEquals("dtmc", model.path("type").asText());
    assertEquals(2, model.path("automata").size());
  }

  @Test
  public void testReportsCompilationErrors() throws Exception {
    final Path network = write("net.xml", "<network name='broken'/>");
    final Path output = folder.getRoot().toPath().resolve("broken.jani");
    assertEquals(1, run(network.toString(), output.toString()));
    assertFalse(Files.exists(output));
  }

  @Test
  public void testUsageErrors() {
    assertTrue(run() != 0);
    assertTrue(run("-t", "GAME", "a.xml", "b.jani") != 0);
    // every model is validated, there is nothing to turn off
    assertTrue(run("--no-validation", "a.xml", "b.jani") != 0);
  }
}
