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

import java.math.BigInteger;

public class KindTest extends TestCase {
  public void testBounds() {
    assertEquals(BigInteger.ZERO, Kind.WORD8.minValue());
    assertEquals(BigInteger.valueOf(255), Kind.WORD8.maxValue());
    assertEquals(BigInteger.valueOf(-128), Kind.INT8.minValue());
    assertEquals(BigInteger.valueOf(127), Kind.INT8.maxValue());
    assertEquals(BigInteger.valueOf(Long.MAX_VALUE), Kind.INT64.maxValue());
    assertSame(Kind.WORD8, Kind.CHAR);
  }

  public void testUnboundedHasNoMinimum() {
    try {
      Kind.INTEGER.minValue();
      fail("Should have thrown an exception");
    } catch (IllegalStateException e) {
      // expected
    }
  }

  public void testValidLiterals() {
    assertTrue(Kind.CHAR.isValidLiteral(BigInteger.valueOf(255)));
    assertFalse(Kind.CHAR.isValidLiteral(BigInteger.valueOf(256)));
    assertFalse(Kind.CHAR.isValidLiteral(BigInteger.valueOf(-1)));
    assertTrue(Kind.INTEGER.isValidLiteral(BigInteger.TEN.pow(40)));
    assertTrue(Kind.STRING.isValidLiteral("caf\u00e9"));
    assertFalse(Kind.STRING.isValidLiteral("\u0100"));
    assertTrue(Kind.BOOL.isValidLiteral(Boolean.TRUE));
    assertFalse(Kind.BOOL.isValidLiteral(BigInteger.ONE));
    assertFalse(Kind.STRING.isValidLiteral(null));
  }

  public void testWrap() {
    assertEquals(BigInteger.ZERO, Kind.WORD8.wrap(BigInteger.valueOf(256)));
    assertEquals(BigInteger.valueOf(255), Kind.WORD8.wrap(BigInteger.valueOf(-1)));
    assertEquals(BigInteger.valueOf(-128), Kind.INT8.wrap(BigInteger.valueOf(128)));
    assertEquals(BigInteger.valueOf(-1), Kind.INT16.wrap(BigInteger.valueOf(65535)));
    BigInteger big = BigInteger.TEN.pow(30);
    assertEquals(big, Kind.INTEGER.wrap(big));
  }
}
