/*
 * Copyright 2018 The Closure Compiler Authors.
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
package com.google.borrowck.mir;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.borrowck.ty.Ty;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The typed control-flow graph of one function or closure body.
 *
 * <p>Local {@code _0} is the return place and locals {@code _1} to {@code _argCount} are the
 * arguments. The body of a closure additionally lists the variables it captures; they are reached
 * through the fields of its first argument, the closure environment.
 */
public final class Body {

  private final String name;
  private final SourceSpan span;
  private final ImmutableList<BasicBlockData> blocks;
  private final ImmutableList<LocalDecl> localDecls;
  private final int argCount;
  private final ImmutableList<UpvarDecl> upvars;
  private final ImmutableListMultimap<Integer, Integer> predecessors;

  private Body(Builder builder) {
    this.name = builder.name;
    this.span = builder.span;
    this.localDecls = ImmutableList.copyOf(builder.localDecls);
    this.argCount = builder.argCount;
    this.upvars = ImmutableList.copyOf(builder.upvars);
    ImmutableList.Builder<BasicBlockData> blocks = ImmutableList.builder();
    ImmutableListMultimap.Builder<Integer, Integer> predecessors = ImmutableListMultimap.builder();
    for (int i = 0; i < builder.statements.size(); i++) {
      Terminator terminator = builder.terminators.get(i);
      checkState(terminator != null, "bb%s of %s has no terminator", i, name);
      blocks.add(new BasicBlockData(ImmutableList.copyOf(builder.statements.get(i)), terminator));
      for (int successor : terminator.successors()) {
        checkState(
            successor >= 0 && successor < builder.statements.size(),
            "bb%s jumps to unknown block bb%s",
            i,
            successor);
        predecessors.put(successor, i);
      }
    }
    this.blocks = blocks.build();
    this.predecessors = predecessors.build();
  }

  /**
   * Starts a body whose return place has type {@code returnTy}. Arguments must be added before any
   * other local.
   */
  public static Builder builder(String name, Ty returnTy) {
    return new Builder(name, returnTy);
  }

  public String getName() {
    return name;
  }

  public SourceSpan getSpan() {
    return span;
  }

  public ImmutableList<BasicBlockData> getBlocks() {
    return blocks;
  }

  public BasicBlockData block(int index) {
    return blocks.get(index);
  }

  public int blockCount() {
    return blocks.size();
  }

  public ImmutableList<LocalDecl> getLocalDecls() {
    return localDecls;
  }

  public LocalDecl localDecl(Local local) {
    return localDecls.get(local.index());
  }

  public int localCount() {
    return localDecls.size();
  }

  public int getArgCount() {
    return argCount;
  }

  /** The argument locals, {@code _1} to {@code _argCount}. */
  public ImmutableList<Local> args() {
    ImmutableList.Builder<Local> args = ImmutableList.builder();
    for (int i = 1; i <= argCount; i++) {
      args.add(Local.of(i));
    }
    return args.build();
  }

  public Ty returnTy() {
    return localDecls.get(0).ty();
  }

  public ImmutableList<UpvarDecl> getUpvars() {
    return upvars;
  }

  public boolean isClosure() {
    return !upvars.isEmpty();
  }

  public ImmutableList<Integer> predecessors(int block) {
    return predecessors.get(block);
  }

  public Location terminatorLocation(int block) {
    return Location.of(block, blocks.get(block).terminatorIndex());
  }

  public boolean isTerminatorLocation(Location location) {
    return location.statementIndex() == blocks.get(location.block()).terminatorIndex();
  }

  /** The statement at {@code location}, or null if the location is a terminator. */
  public @Nullable Statement statementAt(Location location) {
    BasicBlockData data = blocks.get(location.block());
    return location.statementIndex() < data.statements().size()
        ? data.statements().get(location.statementIndex())
        : null;
  }

  public SourceSpan sourceSpan(Location location) {
    Statement statement = statementAt(location);
    return statement != null ? statement.span() : blocks.get(location.block()).terminator().span();
  }

  /** The locations control may reach directly after {@code location}. */
  public ImmutableList<Location> successors(Location location) {
    if (!isTerminatorLocation(location)) {
      return ImmutableList.of(location.successorWithinBlock());
    }
    ImmutableList.Builder<Location> result = ImmutableList.builder();
    for (int target : blocks.get(location.block()).terminator().successors()) {
      result.add(Location.of(target, 0));
    }
    return result.build();
  }

  /** Total number of statement and terminator locations. */
  public int numLocations() {
    int count = 0;
    for (BasicBlockData data : blocks) {
      count += data.statements().size() + 1;
    }
    return count;
  }

  @Override
  public String toString() {
    return "fn " + name;
  }

  /** Builds a {@link Body} block by block. */
  public static final class Builder {
    private final String name;
    private SourceSpan span = SourceSpan.UNKNOWN;
    private final List<LocalDecl> localDecls = new ArrayList<>();
    private final List<UpvarDecl> upvars = new ArrayList<>();
    private final List<List<Statement>> statements = new ArrayList<>();
    private final List<@Nullable Terminator> terminators = new ArrayList<>();
    private int argCount = 0;

    private Builder(String name, Ty returnTy) {
      this.name = requireNonNull(name);
      localDecls.add(new LocalDecl(returnTy, null, SourceSpan.UNKNOWN));
    }

    @CanIgnoreReturnValue
    public Builder setSpan(SourceSpan span) {
      this.span = requireNonNull(span);
      return this;
    }

    public Local addArg(@Nullable String argName, Ty ty, SourceSpan declSpan) {
      checkState(localDecls.size() == argCount + 1, "arguments must be added before locals");
      argCount++;
      return addDecl(new LocalDecl(ty, argName, declSpan));
    }

    /** Adds a user variable. */
    public Local addLocal(String localName, Ty ty, SourceSpan declSpan) {
      return addDecl(new LocalDecl(ty, requireNonNull(localName), declSpan));
    }

    /** Adds an unnamed compiler temporary. */
    public Local addTemp(Ty ty) {
      return addDecl(new LocalDecl(ty, null, SourceSpan.UNKNOWN));
    }

    private Local addDecl(LocalDecl decl) {
      localDecls.add(decl);
      return Local.of(localDecls.size() - 1);
    }

    /** Declares a captured variable; its field index in the environment is its index here. */
    @CanIgnoreReturnValue
    public Builder addUpvar(String upvarName, Ty ty, boolean byRef, SourceSpan declSpan) {
      checkState(argCount == 0, "upvars must be declared before the closure environment");
      upvars.add(new UpvarDecl(upvarName, ty, byRef, declSpan));
      return this;
    }

    /**
     * Adds the closure environment as the first argument: a tuple holding the declared upvars.
     */
    public Local addClosureEnv() {
      checkState(!upvars.isEmpty(), "a closure environment needs upvars");
      ImmutableList.Builder<Ty> fields = ImmutableList.builder();
      for (UpvarDecl upvar : upvars) {
        fields.add(upvar.ty());
      }
      return addArg(null, new Ty.Tuple(fields.build()), span);
    }

    /** Opens a new, empty basic block and returns its index. */
    public int newBlock() {
      statements.add(new ArrayList<>());
      terminators.add(null);
      return statements.size() - 1;
    }

    /** Appends {@code statement} to {@code block} and returns its location. */
    @CanIgnoreReturnValue
    public Location push(int block, Statement statement) {
      checkState(terminators.get(block) == null, "bb%s is already terminated", block);
      List<Statement> blockStatements = statements.get(block);
      blockStatements.add(requireNonNull(statement));
      return Location.of(block, blockStatements.size() - 1);
    }

    @CanIgnoreReturnValue
    public Location assign(int block, Place place, Rvalue rvalue, SourceSpan stmtSpan) {
      return push(block, new Statement.Assign(place, rvalue, stmtSpan));
    }

    /** Ends {@code block} with {@code terminator} and returns the terminator's location. */
    @CanIgnoreReturnValue
    public Location terminate(int block, Terminator terminator) {
      checkState(terminators.get(block) == null, "bb%s is already terminated", block);
      terminators.set(block, requireNonNull(terminator));
      return Location.of(block, statements.get(block).size());
    }

    public Body build() {
      checkArgument(!statements.isEmpty(), "%s has no basic blocks", name);
      return new Body(this);
    }
  }
}
