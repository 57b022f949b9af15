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

import com.google.common.base.Preconditions;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Synthesizes operations the backend has no operator for. The result is a
 * fresh variable, pinned down by one asserted equality between a form of the
 * variable and a term the backend can state.
 * <p>
 * Within one synthesis the fresh variable is allocated first, then the wrapped
 * form, then the target, then the equality, so the constructed graph is the
 * same on every run.
 */
public final class Witness {
  private static final Logger log = LogManager.getLogger(Witness.class);

  private Witness() {}

  /**
   * Allocates a fresh variable {@code w} of {@code kind}, asserts
   * {@code relation.wrap(w) == relation.target()} and returns {@code w}.
   */
  public static <T, U> Value<T> synthesize(Context context, Kind<T> kind,
      WitnessRelation<T, U> relation) {
    Value<T> witness = context.freshVariable(kind);
    Value<U> wrapped = relation.wrap(context, witness);
    Value<U> target = relation.target(context);
    Preconditions.checkArgument(wrapped.getKind() == target.getKind(),
        "Witness form %s compared with %s", wrapped.getKind(), target.getKind());
    assertRelation(context, witness, Operations.equal(context, wrapped, target));
    return witness;
  }

  /**
   * Allocates a fresh variable, asserts {@code condition(w)} and returns the
   * variable. Used when the relation has to be weakened, for instance guarded
   * by the region where it is meaningful.
   */
  public static <T> Value<T> synthesize(Context context, Kind<T> kind,
      WitnessCondition<T> condition) {
    Value<T> witness = context.freshVariable(kind);
    assertRelation(context, witness, condition.apply(context, witness));
    return witness;
  }

  /** Allocates a fresh variable {@code w}, asserts {@code w == target} */
  public static <T> Value<T> synthesize(Context context, Kind<T> kind,
      final Value<T> target) {
    Preconditions.checkArgument(target.getKind() == kind,
        "Witness of kind %s for a %s", kind, target.getKind());
    return synthesize(context, kind, new WitnessRelation<T, T>() {
      @Override
      public Value<T> wrap(Context context, Value<T> witness) {
        return witness;
      }

      @Override
      public Value<T> target(Context context) {
        return target;
      }
    });
  }

  private static void assertRelation(Context context, Value<?> witness,
      Value<Boolean> relation) {
    context.addConstraint(relation);
    if (log.isDebugEnabled()) {
      log.debug("Witness {} constrained by {}", witness,
          relation.isKnown() ? relation : context.node(relation.node()));
    }
  }

  /**
   * A condition on a fresh witness.
   *
   * @param <T> the literal class of the witness
   */
  public interface WitnessCondition<T> {
    Value<Boolean> apply(Context context, Value<T> witness);
  }
}
