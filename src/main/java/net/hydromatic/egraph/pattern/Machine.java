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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import net.hydromatic.egraph.graph.EGraph;
import net.hydromatic.egraph.lang.Id;
import net.hydromatic.egraph.lang.Node;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Executes a {@link Program} against an e-graph.
 *
 * <p>Execution is depth-first. Instead of recursion, the machine keeps a
 * register file and a stack of choice points, one for each {@link
 * Program.Bind} instruction that might have more nodes to try, so memory is
 * bounded by the size of the pattern.
 *
 * <p>A machine is not thread-safe; create one per search.
 *
 * @param <N> Node type
 */
public class Machine<N extends Node<N>> {
  private final Program<N> program;
  private final Id[] registers;
  private final ArrayDeque<ChoicePoint<N>> stack = new ArrayDeque<>();

  public Machine(Program<N> program) {
    this.program = program;
    this.registers = new Id[program.registerCount];
  }

  /**
   * Finds substitutions under which the pattern matches a node of a class,
   * and passes each to a consumer. Stops after {@code limit} substitutions.
   * Returns the number of substitutions found.
   *
   * <p>The e-graph must have been rebuilt.
   */
  public int run(
      EGraph<N, ?> egraph, Id eclass, int limit, Consumer<Subst> consumer) {
    checkArgument(limit >= 0, "negative limit");
    if (limit == 0) {
      return 0;
    }
    stack.clear();
    registers[0] = egraph.find(eclass);
    final List<Program.Instruction<N>> instructions = program.instructions;
    int found = 0;
    int pc = 0;
    for (;;) {
      if (pc == instructions.size()) {
        consumer.accept(substitution());
        if (++found >= limit) {
          return found;
        }
        pc = backtrack();
      } else {
        final Program.Instruction<N> instruction = instructions.get(pc);
        if (execute(egraph, instruction, pc)) {
          ++pc;
        } else {
          pc = backtrack();
        }
      }
      if (pc < 0) {
        return found;
      }
    }
  }

  /** Runs a program against one class and returns all substitutions. */
  public List<Subst> run(EGraph<N, ?> egraph, Id eclass) {
    final List<Subst> substs = new ArrayList<>();
    run(egraph, eclass, Integer.MAX_VALUE, substs::add);
    return substs;
  }

  private boolean execute(
      EGraph<N, ?> egraph, Program.Instruction<N> instruction, int pc) {
    if (instruction instanceof Program.Bind) {
      final Program.Bind<N> bind = (Program.Bind<N>) instruction;
      final List<N> nodes = egraph.getClass(registers[bind.input]).nodes();
      return bind(bind, pc, nodes, 0);
    } else if (instruction instanceof Program.Compare) {
      final Program.Compare<N> compare = (Program.Compare<N>) instruction;
      return egraph
          .find(registers[compare.a])
          .equals(egraph.find(registers[compare.b]));
    } else if (instruction instanceof Program.Lookup) {
      final Program.Lookup<N> lookup = (Program.Lookup<N>) instruction;
      final Id id = lookup(egraph, lookup.term, lookup.varRegisters);
      return id != null && id.equals(egraph.find(registers[lookup.input]));
    } else {
      throw new AssertionError("unknown instruction " + instruction);
    }
  }

  /**
   * Starting at position {@code start}, finds the next node that matches
   * {@code bind}'s template, writes its children to registers, and pushes a
   * choice point so that the search can resume after it.
   */
  private boolean bind(
      Program.Bind<N> bind, int pc, List<N> nodes, int start) {
    for (int i = start; i < nodes.size(); i++) {
      final N node = nodes.get(i);
      if (node.matches(bind.template)) {
        final List<Id> children = node.children();
        for (int j = 0; j < children.size(); j++) {
          registers[bind.output + j] = children.get(j);
        }
        stack.push(new ChoicePoint<>(pc, nodes, i + 1));
        return true;
      }
    }
    return false;
  }

  /**
   * Resumes the most recent choice point that has another node to try.
   * Returns the instruction to continue at, or -1 if the search is over.
   */
  private int backtrack() {
    while (!stack.isEmpty()) {
      final ChoicePoint<N> choicePoint = stack.pop();
      final Program.Bind<N> bind =
          (Program.Bind<N>) program.instructions.get(choicePoint.pc);
      if (bind(bind, choicePoint.pc, choicePoint.nodes, choicePoint.next)) {
        return choicePoint.pc + 1;
      }
    }
    return -1;
  }

  private @Nullable Id lookup(
      EGraph<N, ?> egraph,
      PatternAst<N> term,
      Map<Var, Integer> varRegisters) {
    if (term instanceof PatternAst.VarTerm) {
      final Var var = ((PatternAst.VarTerm<N>) term).var;
      return egraph.find(registers[varRegisters.get(var)]);
    }
    final PatternAst.NodeTerm<N> nodeTerm = (PatternAst.NodeTerm<N>) term;
    final List<Id> children = new ArrayList<>(nodeTerm.args.size());
    for (PatternAst<N> arg : nodeTerm.args) {
      final Id id = lookup(egraph, arg, varRegisters);
      if (id == null) {
        return null;
      }
      children.add(id);
    }
    return egraph.lookup(nodeTerm.template.withChildren(children));
  }

  private Subst substitution() {
    final Subst subst = new Subst();
    program.varRegisters.forEach((var, register) ->
        subst.insert(var, registers[register]));
    return subst;
  }

  /**
   * Point to which the machine can backtrack: a {@link Program.Bind}
   * instruction, the nodes it is enumerating, and the next one to try.
   */
  private static class ChoicePoint<N extends Node<N>> {
    final int pc;
    final List<N> nodes;
    final int next;

    ChoicePoint(int pc, List<N> nodes, int next) {
      this.pc = pc;
      this.nodes = nodes;
      this.next = next;
    }
  }
}

// End Machine.java
