/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.stager.foreign;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableTable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Declaration loader whose modules are held in memory. */
public class MapDeclarationLoader implements DeclarationLoader {
  private final ImmutableTable<String, String, Signature> table;

  private MapDeclarationLoader(
      ImmutableTable<String, String, Signature> table) {
    this.table = table;
  }

  /** Returns a loader that knows no modules. */
  public static MapDeclarationLoader empty() {
    return new MapDeclarationLoader(ImmutableTable.of());
  }

  /** Returns a builder. */
  public static Builder builder() {
    return new Builder();
  }

  @Override public Map<String, Signature> load(String module,
      List<String> names) {
    final Map<String, Signature> map = new LinkedHashMap<>();
    for (String name : names) {
      final Signature signature = table.get(module, name);
      if (signature != null) {
        map.put(name, signature);
      }
    }
    return ImmutableMap.copyOf(map);
  }

  /** Builder for {@link MapDeclarationLoader}. */
  public static class Builder {
    private final ImmutableTable.Builder<String, String, Signature> b =
        ImmutableTable.builder();

    /** Declares an export of a module. */
    public Builder add(String module, String name, Signature signature) {
      b.put(module, name, signature);
      return this;
    }

    public MapDeclarationLoader build() {
      return new MapDeclarationLoader(b.build());
    }
  }
}

// End MapDeclarationLoader.java
