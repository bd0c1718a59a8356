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

import java.util.List;
import java.util.Map;

/** Source of the signatures of values exported by external modules.
 *
 * <p>An {@code import} expression asks the loader for the exports it
 * names; the staging engine binds each one as a value that will be known
 * only at run time.
 *
 * @see MapDeclarationLoader */
public interface DeclarationLoader {
  /** Returns the signatures of some of the exports of a module. Names that
   * the module does not export are absent from the result.
   *
   * @param module Module specifier, e.g. "lodash"
   * @param names Names of exports */
  Map<String, Signature> load(String module, List<String> names);
}

// End DeclarationLoader.java
