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

/**
 * The identity of one node in a {@link Context}'s expression graph. Ids are
 * handed out in increasing order and are never reused. An id only has meaning
 * inside the context that allocated it.
 */
public final class NodeId implements Comparable<NodeId> {
  private final Context owner;
  private final int index;

  NodeId(Context owner, int index) {
    this.owner = owner;
    this.index = index;
  }

  public int getIndex() {
    return index;
  }

  /** True if this id was allocated by {@code context} */
  public boolean belongsTo(Context context) {
    return owner == context;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof NodeId)) {
      return false;
    }
    NodeId other = (NodeId) obj;
    return owner == other.owner && index == other.index;
  }

  @Override
  public int hashCode() {
    return index;
  }

  // Orders ids of the same context by allocation order.
  @Override
  public int compareTo(NodeId other) {
    return Integer.compare(index, other.index);
  }

  @Override
  public String toString() {
    return "n" + index;
  }
}
