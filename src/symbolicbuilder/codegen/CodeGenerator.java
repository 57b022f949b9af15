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

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import symbolicbuilder.ConstructionOptions;
import symbolicbuilder.ConstructionResult;
import symbolicbuilder.Context;
import symbolicbuilder.FileLoader;
import symbolicbuilder.Value;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;

/**
 * Runs a symbolic computation and renders it as a program through a pluggable
 * {@link ProgramRenderer}. The artifacts are written to a directory, or
 * printed when no directory is given.
 */
public class CodeGenerator {
  private static final Logger log = LogManager.getLogger(CodeGenerator.class);

  static final String MAKEFILE_NAME = "Makefile";

  private static final CharMatcher IDENTIFIER_CHARS = CharMatcher.inRange('a', 'z')
      .or(CharMatcher.inRange('A', 'Z'))
      .or(CharMatcher.inRange('0', '9'))
      .or(CharMatcher.is('_'));

  private final ProgramRenderer renderer;
  private final ConstructionOptions options;
  private final FileLoader loader;
  private final PrintStream out;

  /**
   * @param renderer the backend producing the program text
   * @param options options for the context the computation runs in
   * @param loader resolves the output directory
   * @param out where artifacts go when no directory is given
   */
  public CodeGenerator(ProgramRenderer renderer, ConstructionOptions options,
      FileLoader loader, PrintStream out) {
    this.renderer = Preconditions.checkNotNull(renderer);
    this.options = Preconditions.checkNotNull(options);
    this.loader = Preconditions.checkNotNull(loader);
    this.out = Preconditions.checkNotNull(out);
  }

  /** A generator printing to standard output with default options */
  public static CodeGenerator create(ProgramRenderer renderer) {
    return new CodeGenerator(renderer, new ConstructionOptions(), new FileLoader(),
        System.out);
  }

  /**
   * Runs {@code computation} in a fresh context and renders it.
   *
   * @param directory the directory to write the makefile, header and body to,
   *        or null to print them instead
   * @param name the entry point name; also names the header and body files
   * @return the rendered program
   * @throws IOException if an artifact cannot be written
   * @throws IllegalArgumentException if {@code name} is not an identifier
   */
  public RenderedProgram compile(String directory, String name,
      SymbolicComputation computation) throws IOException {
    Preconditions.checkArgument(isIdentifier(name), "Not an identifier: '%s'", name);
    log.info("Performing symbolic execution..");
    Context context = Context.create(options);
    List<Value<?>> roots = computation.run(context);
    ConstructionResult result = context.finish(roots);
    log.info("Rendering program {} ({} nodes, {} constraints)..", name,
        result.getNodes().size(), result.getConstraints().size());
    RenderedProgram program = renderer.render(name, result);
    if (directory == null) {
      print(name, program);
    } else {
      write(directory, name, program);
    }
    log.info("Done.");
    return program;
  }

  private void print(String name, RenderedProgram program) {
    printArtifact(MAKEFILE_NAME, program.getMakefile());
    printArtifact(headerName(name), program.getHeader());
    printArtifact(bodyName(name), program.getBody());
    out.flush();
  }

  private void printArtifact(String filename, List<String> lines) {
    out.println("== BEGIN: \"" + filename + "\" ==");
    for (String line : lines) {
      out.println(line);
    }
    out.println("== END: \"" + filename + "\" ==");
  }

  private void write(String directory, String name, RenderedProgram program)
      throws IOException {
    writeArtifact(directory, MAKEFILE_NAME, program.getMakefile());
    writeArtifact(directory, headerName(name), program.getHeader());
    writeArtifact(directory, bodyName(name), program.getBody());
  }

  private void writeArtifact(String directory, String filename, List<String> lines)
      throws IOException {
    String path = new File(directory, filename).getPath();
    loader.write(path, RenderedProgram.text(lines));
    log.info("Generated: {}", loader.getPath(path));
  }

  private String headerName(String name) {
    return name + "." + renderer.headerExtension();
  }

  private String bodyName(String name) {
    return name + "." + renderer.bodyExtension();
  }

  private static boolean isIdentifier(String name) {
    return name != null && !name.isEmpty()
        && !CharMatcher.inRange('0', '9').matches(name.charAt(0))
        && IDENTIFIER_CHARS.matchesAllOf(name);
  }
}
