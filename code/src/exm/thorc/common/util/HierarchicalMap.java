/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.thorc.common.util;

import java.util.HashMap;
import java.util.Map.Entry;

/**
 * A map for lexical scopes.  Lookups that fail in the current map
 * continue in the parent map.  Writes always go to the innermost map,
 * so a child can shadow a parent binding without changing it.
 */
public class HierarchicalMap<K, V> {
  private final HashMap<K, V> map;
  private final HierarchicalMap<K, V> parent;

  public HierarchicalMap() {
    this(null);
  }

  private HierarchicalMap(HierarchicalMap<K, V> parent) {
    this.map = new HashMap<K, V>();
    this.parent = parent;
  }

  public HierarchicalMap<K, V> makeChildMap() {
    return new HierarchicalMap<K,V>(this);
  }

  public HierarchicalMap<K, V> getParent() {
    return parent;
  }

  public boolean containsKey(K key) {
    return map.containsKey(key)
        || (parent != null && parent.containsKey(key));
  }

  /**
   * @param key
   * @return true if bound in this scope, ignoring parents
   */
  public boolean containsLocal(K key) {
    return map.containsKey(key);
  }

  public V get(K key) {
    if (map.containsKey(key)) {
      return map.get(key);
    } else if (parent != null) {
      return parent.get(key);
    } else {
      return null;
    }
  }

  /**
   * @param key
   * @return the depth at which the key is defined, 0 being this map,
   *         or -1 if not defined
   */
  public int getDepth(K key) {
    int depth = 0;
    HierarchicalMap<K, V> curr = this;
    while (curr != null) {
      if (curr.map.containsKey(key)) {
        return depth;
      }
      depth++;
      curr = curr.parent;
    }
    return -1;
  }

  public V put(K key, V value) {
    return map.put(key, value);
  }

  public boolean isEmpty() {
    return map.isEmpty() && (parent == null || parent.isEmpty());
  }

  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("{");
    int written = writeContents(sb, true);
    if (parent != null) {
      parent.writeContents(sb, written == 0);
    }
    sb.append("}");
    return sb.toString();
  }

  private int writeContents(StringBuilder sb, boolean first) {
    for (Entry<K, V> e: this.map.entrySet()) {
      if (first) {
        first = false;
      } else {
        sb.append(",");
      }
      sb.append(e.getKey());
      sb.append(":");
      sb.append(e.getValue());
    }
    return map.size();
  }
}
