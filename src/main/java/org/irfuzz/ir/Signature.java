/*
 * Copyright 2025 The Irfuzz Authors
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

package org.irfuzz.ir;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.irfuzz.util.StringUtil;

/** The parameter types and result type of something callable. */
public record Signature(ImmutableList<Type> params, Type result) {

  public Signature {
    Preconditions.checkArgument(
        params.stream().allMatch(Type::isConcrete), "Parameters must be numeric: %s", params);
    Preconditions.checkArgument(
        result != Type.UNREACHABLE, "A signature cannot return unreachable");
  }

  public static Signature of(Type result, Type... params) {
    return new Signature(ImmutableList.copyOf(params), result);
  }

  @Override
  public String toString() {
    return StringUtil.joinElements("", "(param", ")", params.size(), i -> " " + params.get(i))
        + " (result "
        + result
        + ")";
  }
}
