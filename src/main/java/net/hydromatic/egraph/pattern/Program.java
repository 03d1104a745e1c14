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
package net.hydromatic.egraph.pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.egraph.lang.Node;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A pattern compiled into a linear sequence of instructions for the
 * {@link Machine}.
 *
 * <p>Register 0 holds the class being matched. Each {@link Bind} instruction
 * reads a class from a register, chooses one of its nodes that has the
 * expected operator, and writes the node's children into fresh registers; it
 * is the only instruction that can be resumed on backtracking. A pattern that
 * repeats a variable gets a {@link Compare} instruction for each repeat. A
 * sub-pattern whose variables are all bound by the time it is reached is
 * resolved with a single {@link Lookup} in the hashcons table rather than by
 * enumerating nodes.
 *
 * <p>A program has no mutable state, so it can be compiled once and run
 * against a changing e-graph.
 *
 * @param <N> Node type
 */
public final class Program<N extends Node<N>> {
  public final ImmutableList<Instruction<N>> instructions;

  /** Register that holds each variable's class, in order of binding. */
  public final ImmutableMap<Var, Integer> varRegisters;

  public final int registerCount;

  private Program(
      List<Instruction<N>> instructions,
      Map<Var, Integer> varRegisters,
      int registerCount) {
    this.instructions = ImmutableList.copyOf(instructions);
    this.varRegisters = ImmutableMap.copyOf(varRegisters);
    this.registerCount = registerCount;
  }

  /**
   * Compiles a pattern.
   *
   * @throws PatternCompileException if the pattern is malformed
   */
  public static <N extends Node<N>> Program<N> compile(PatternAst<N> ast) {
    validate(ast);
    final List<Instruction<N>> instructions = new ArrayList<>();
    final Map<Var, Integer> varRegisters = new LinkedHashMap<>();
    final List<Todo<N>> todos = new ArrayList<>();
    todos.add(new Todo<>(0, ast));
    int next = 1;
    while (!todos.isEmpty()) {
      final Todo<N> todo = todos.remove(choose(todos, varRegisters));
      if (todo.ast instanceof PatternAst.VarTerm) {
        final Var var = ((PatternAst.VarTerm<N>) todo.ast).var;
        final Integer register = varRegisters.get(var);
        if (register == null) {
          varRegisters.put(var, todo.register);
        } else {
          instructions.add(new Compare<>(register, todo.register));
        }
        continue;
      }
      final PatternAst.NodeTerm<N> nodeTerm =
          (PatternAst.NodeTerm<N>) todo.ast;
      if (todo.register != 0
          && varRegisters.keySet().containsAll(nodeTerm.vars())) {
        instructions.add(
            new Lookup<>(nodeTerm, varRegisters, todo.register));
        continue;
      }
      instructions.add(new Bind<>(todo.register, nodeTerm.template, next));
      for (PatternAst<N> arg : nodeTerm.args) {
        todos.add(new Todo<>(next++, arg));
      }
    }
    return new Program<>(instructions, varRegisters, next);
  }

  /**
   * Chooses which pending sub-pattern to compile next. Variables first
   * (binding them is free, and a repeated variable prunes early), then
   * sub-patterns that can be looked up, then the oldest.
   */
  private static <N extends Node<N>> int choose(
      List<Todo<N>> todos, Map<Var, Integer> varRegisters) {
    for (int i = 0; i < todos.size(); i++) {
      if (todos.get(i).ast instanceof PatternAst.VarTerm) {
        return i;
      }
    }
    for (int i = 0; i < todos.size(); i++) {
      if (varRegisters.keySet().containsAll(todos.get(i).ast.vars())) {
        return i;
      }
    }
    return 0;
  }

  /** Checks that every node term is well formed. */
  private static <N extends Node<N>> void validate(PatternAst<N> ast) {
    ast.accept(
        new PatternAst.Visitor<N, Void>() {
          @Override
          public @Nullable Void visit(PatternAst.VarTerm<N> varTerm) {
            return null;
          }

          @Override
          public @Nullable Void visit(PatternAst.NodeTerm<N> nodeTerm) {
            final Object operator = nodeTerm.template.operator();
            if (operator instanceof String
                && Var.isVar((String) operator)) {
              throw new PatternCompileException(
                  format(
                      "variable %s is used as an operator in %s",
                      operator, nodeTerm));
            }
            if (nodeTerm.template.arity() != nodeTerm.args.size()) {
              throw new PatternCompileException(
                  format(
                      "operator %s has arity %d but is applied to %d"
                          + " arguments",
                      operator,
                      nodeTerm.template.arity(),
                      nodeTerm.args.size()));
            }
            for (PatternAst<N> arg : nodeTerm.args) {
              arg.accept(this);
            }
            return null;
          }
        });
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder();
    for (Instruction<N> instruction : instructions) {
      b.append(instruction).append('\n');
    }
    return b.append("yield ").append(varRegisters).toString();
  }

  /** Sub-pattern waiting to be compiled, and the register it will be in. */
  private static class Todo<N extends Node<N>> {
    final int register;
    final PatternAst<N> ast;

    Todo(int register, PatternAst<N> ast) {
      this.register = register;
      this.ast = ast;
    }
  }

  /**
   * Instruction.
   *
   * @param <N> Node type
   */
  public abstract static class Instruction<N extends Node<N>> {
    private Instruction() {}
  }

  /**
   * For each node in the class in register {@code input} that has the same
   * operator and arity as {@code template}, writes its children into
   * registers {@code output}, {@code output + 1}, etc.
   *
   * @param <N> Node type
   */
  public static final class Bind<N extends Node<N>> extends Instruction<N> {
    public final int input;
    public final N template;
    public final int output;

    Bind(int input, N template, int output) {
      this.input = input;
      this.template = requireNonNull(template);
      this.output = output;
    }

    @Override
    public String toString() {
      return format(
          "bind r%d %s/%d -> r%d", input, template.operator(),
          template.arity(), output);
    }
  }

  /**
   * Fails unless registers {@code a} and {@code b} hold the same class.
   *
   * @param <N> Node type
   */
  public static final class Compare<N extends Node<N>>
      extends Instruction<N> {
    public final int a;
    public final int b;

    Compare(int a, int b) {
      this.a = a;
      this.b = b;
    }

    @Override
    public String toString() {
      return format("compare r%d r%d", a, b);
    }
  }

  /**
   * Instantiates {@code term} using classes already in registers, finds it in
   * the hashcons table, and fails unless it is in the class held by register
   * {@code input}.
   *
   * @param <N> Node type
   */
  public static final class Lookup<N extends Node<N>>
      extends Instruction<N> {
    public final PatternAst.NodeTerm<N> term;
    public final ImmutableMap<Var, Integer> varRegisters;
    public final int input;

    Lookup(
        PatternAst.NodeTerm<N> term,
        Map<Var, Integer> varRegisters,
        int input) {
      this.term = requireNonNull(term);
      this.varRegisters = ImmutableMap.copyOf(varRegisters);
      this.input = input;
    }

    @Override
    public String toString() {
      return format("lookup %s = r%d", term, input);
    }
  }
}

// End Program.java
