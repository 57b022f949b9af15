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

package symbolicbuilder;

import junit.framework.TestCase;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;

public class FileLoaderTest extends TestCase {
  public void testWriteThenRead() throws IOException {
    File base = Files.createTempDirectory("loader").toFile();
    FileLoader loader = new FileLoader(base.getPath());
    loader.write("nested/out.txt", "line one\nline two\n");
    assertTrue(new File(base, "nested/out.txt").isFile());
    assertEquals("line one\nline two\n", loader.toString("nested/out.txt"));
  }

  public void testPaths() {
    FileLoader loader = new FileLoader("base");
    String absolute = new File("x.properties").getAbsolutePath();
    assertEquals(absolute, loader.getPath(absolute));
    assertEquals(new File("base").getAbsolutePath() + File.separator + "x.properties",
        loader.getPath("x.properties"));
  }
}
