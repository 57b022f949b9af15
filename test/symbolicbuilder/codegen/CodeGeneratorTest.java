/*
 * Copyright 2010 Google Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package symbolicbuilder.codegen;

import com.google.common.collect.ImmutableList;

import junit.framework.TestCase;

import symbolicbuilder.ConstructionOptions;
import symbolicbuilder.ConstructionResult;
import symbolicbuilder.Context;
import symbolicbuilder.FileLoader;
import symbolicbuilder.Kind;
import symbolicbuilder.Value;
import symbolicbuilder.strings.SymbolicStrings;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.util.List;

public class CodeGeneratorTest extends TestCase {
  /** The first character of an input string */
  private static final SymbolicComputation STR_HEAD = new SymbolicComputation() {
    @Override
    public List<Value<?>> run(Context context) {
      Value<String> s = context.input(Kind.STRING, "s");
      return ImmutableList.<Value<?>>of(SymbolicStrings.head(context, s));
    }
  };

  /** Renders one line per node and constraint, and remembers what it saw */
  private static final class ListingRenderer implements ProgramRenderer {
    ConstructionResult seen;

    @Override
    public RenderedProgram render(String name, ConstructionResult result) {
      seen = result;
      return new RenderedProgram(ImmutableList.of("all: " + name),
          ImmutableList.of("// " + name),
          ImmutableList.copyOf(result.toString().split("\n")));
    }

    @Override
    public String headerExtension() {
      return "hdr";
    }

    @Override
    public String bodyExtension() {
      return "txt";
    }
  }

  private ByteArrayOutputStream output;
  private PrintStream out;

  @Override
  protected void setUp() {
    output = new ByteArrayOutputStream();
    out = new PrintStream(output, true);
  }

  private CodeGenerator generator(ProgramRenderer renderer) {
    return new CodeGenerator(renderer, new ConstructionOptions(), new FileLoader(), out);
  }

  public void testPrintsWithoutDirectory() throws IOException {
    RenderedProgram program =
        generator(new PlaceholderRenderer()).compile(null, "strHead", STR_HEAD);
    assertTrue(program.getHeader().isEmpty());
    String printed = output.toString();
    assertTrue(printed, printed.contains("== BEGIN: \"Makefile\" =="));
    assertTrue(printed, printed.contains("== BEGIN: \"strHead.h\" =="));
    assertTrue(printed, printed.contains("== END: \"strHead.c\" =="));
  }

  public void testRendererSeesFinishedConstruction() throws IOException {
    ListingRenderer renderer = new ListingRenderer();
    generator(renderer).compile(null, "strHead", STR_HEAD);
    assertEquals(1, renderer.seen.getRoots().size());
    assertEquals(1, renderer.seen.getConstraints().size());
    // the input and the witness
    assertEquals(2, renderer.seen.getVariables().size());
    String printed = output.toString();
    assertTrue(printed, printed.contains("== BEGIN: \"strHead.txt\" =="));
    assertTrue(printed, printed.contains("(str.at n0 0)"));
    assertTrue(printed, printed.contains("all: strHead"));
  }

  public void testWritesToDirectory() throws IOException {
    File directory = Files.createTempDirectory("codegen").toFile();
    generator(new ListingRenderer()).compile(directory.getPath(), "strHead", STR_HEAD);
    FileLoader loader = new FileLoader(directory.getPath());
    assertEquals("all: strHead\n", loader.toString("Makefile"));
    assertEquals("// strHead\n", loader.toString("strHead.hdr"));
    assertTrue(loader.toString("strHead.txt").contains("(witness w0)"));
    assertEquals("", output.toString());

    generator(new PlaceholderRenderer()).compile(directory.getPath(), "empty", STR_HEAD);
    assertEquals("", loader.toString("empty.h"));
    assertEquals("", loader.toString("empty.c"));
  }

  public void testRejectsInvalidName() throws IOException {
    try {
      generator(new PlaceholderRenderer()).compile(null, "2fast", STR_HEAD);
      fail("Should have thrown an exception");
    } catch (IllegalArgumentException e) {
      // expected
    }
  }
}
