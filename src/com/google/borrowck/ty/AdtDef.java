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
package com.google.borrowck.ty;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * The definition of a struct or enum: its generic parameters with their variances, the types of
 * its fields expressed over those parameters, and whether it has a destructor.
 *
 * <p>Definitions have identity semantics. Field types refer to type parameters through {@link
 * Ty.Param} and to region parameters through {@link Region.EarlyBound}, both indexed into {@link
 * #getParams()}.
 */
public final class AdtDef {

  /**
   * A generic parameter of an ADT.
   *
   * @param mayDangle whether the destructor promises not to access data of this parameter
   *     ({@code #[may_dangle]})
   */
  public record GenericParamDef(
      String name, boolean isRegion, Variance variance, boolean mayDangle) {
    public GenericParamDef {
      requireNonNull(name, "name");
      requireNonNull(variance, "variance");
    }
  }

  private final String name;
  private final ImmutableList<GenericParamDef> params;
  private final ImmutableList<Ty> fields;
  private final boolean hasDestructor;
  private final boolean isPhantomData;

  private AdtDef(Builder builder) {
    this.name = builder.name;
    this.params = builder.params.build();
    this.fields = builder.fields.build();
    this.hasDestructor = builder.hasDestructor;
    this.isPhantomData = builder.isPhantomData;
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public String getName() {
    return name;
  }

  public ImmutableList<GenericParamDef> getParams() {
    return params;
  }

  public ImmutableList<Variance> getVariances() {
    ImmutableList.Builder<Variance> variances = ImmutableList.builder();
    for (GenericParamDef param : params) {
      variances.add(param.variance());
    }
    return variances.build();
  }

  /** Field types over the generic parameters; substitute before use. */
  public ImmutableList<Ty> getFields() {
    return fields;
  }

  public boolean hasDestructor() {
    return hasDestructor;
  }

  public boolean isPhantomData() {
    return isPhantomData;
  }

  @Override
  public String toString() {
    return name;
  }

  /** Builder for {@link AdtDef}. */
  public static final class Builder {
    private final String name;
    private final ImmutableList.Builder<GenericParamDef> params = ImmutableList.builder();
    private final ImmutableList.Builder<Ty> fields = ImmutableList.builder();
    private int paramCount = 0;
    private boolean hasDestructor = false;
    private boolean isPhantomData = false;

    private Builder(String name) {
      this.name = requireNonNull(name);
    }

    /** Adds a region parameter and returns the region that refers to it in field types. */
    public Region addRegionParam(String paramName, Variance variance, boolean mayDangle) {
      params.add(new GenericParamDef(paramName, true, variance, mayDangle));
      return Region.earlyBound(paramCount++, paramName);
    }

    /** Adds a type parameter and returns the type that refers to it in field types. */
    public Ty addTypeParam(String paramName, Variance variance, boolean mayDangle) {
      params.add(new GenericParamDef(paramName, false, variance, mayDangle));
      return Ty.param(paramCount++, paramName);
    }

    @CanIgnoreReturnValue
    public Builder addField(Ty fieldTy) {
      fields.add(requireNonNull(fieldTy));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setHasDestructor(boolean hasDestructor) {
      this.hasDestructor = hasDestructor;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setPhantomData(boolean isPhantomData) {
      this.isPhantomData = isPhantomData;
      return this;
    }

    public AdtDef build() {
      AdtDef def = new AdtDef(this);
      if (def.isPhantomData) {
        checkState(def.params.size() == 1, "PhantomData takes exactly one parameter");
        checkArgument(!def.params.get(0).isRegion(), "PhantomData parameter must be a type");
      }
      return def;
    }
  }
}
