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
package net.hydromatic.stager.ast;

/** Kind of expression, and operator precedence for unparsing. */
public enum Op {
  // atoms
  LITERAL(true),
  ID(true),
  OBJECT(true),
  ARRAY(true),
  BLOCK(true),
  COMPTIME(true),
  RUNTIME(true),
  ASSERT(true),
  ASSERT_COND(true),
  TRUST(true),
  TYPE_OF(true),

  // patterns
  VAR_PAT(true),
  ARRAY_PAT(true),
  OBJECT_PAT(true),

  // postfix
  APPLY("", 8),
  METHOD_CALL(".", 8),
  FIELD(".", 8),
  INDEX("", 8),

  // prefix
  NEGATE("-", 7, false),
  NOT("!", 7, false),

  // infix
  TIMES(" * ", 6),
  DIVIDE(" / ", 6),
  MOD(" % ", 6),
  PLUS(" + ", 5),
  MINUS(" - ", 5),
  LT(" < ", 4),
  LE(" <= ", 4),
  GT(" > ", 4),
  GE(" >= ", 4),
  EQ(" == ", 3),
  NE(" != ", 3),
  ANDALSO(" && ", 2),
  ORELSE(" || ", 1),

  // extend as far to the right as possible
  IF,
  LET,
  LET_PATTERN,
  LET_REC,
  FN,
  IMPORT;

  /** Padded name, e.g. " + ". */
  public final String padded;
  /** Left precedence */
  public final int left;
  /** Right precedence */
  public final int right;

  Op() {
    this("", 0, 0);
  }

  Op(boolean atom) {
    this("", 99, 99);
    assert atom;
  }

  Op(String padded, int leftPrecedence) {
    this(padded, leftPrecedence, true);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0));
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }

  /** Returns the operator's symbol, e.g. "+" for {@link #PLUS}. */
  public String symbol() {
    return padded.trim();
  }

  /** Returns whether this is a binary operator. */
  public boolean isBinary() {
    return ordinal() >= TIMES.ordinal() && ordinal() <= ORELSE.ordinal();
  }

  /** Returns whether this is a unary operator. */
  public boolean isUnary() {
    return this == NEGATE || this == NOT;
  }

  /** Returns the binary operator with a given symbol, or null. */
  public static Op binaryOp(String symbol) {
    for (Op op : values()) {
      if (op.isBinary() && op.symbol().equals(symbol)) {
        return op;
      }
    }
    return null;
  }
}

// End Op.java
