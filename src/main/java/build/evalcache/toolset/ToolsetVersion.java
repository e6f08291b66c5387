// Copyright 2025 The Buildfarm Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package build.evalcache.toolset;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import java.util.List;
import javax.annotation.Nullable;
import lombok.EqualsAndHashCode;

/**
 * A dotted numeric version such as {@code 12.0}, as used to name tool sets and sub-toolsets. A
 * leading {@code v} is ignored and a lone major number gets a minor of zero, so {@code v12},
 * {@code 12} and {@code 12.0} are equal.
 */
@EqualsAndHashCode
final class ToolsetVersion implements Comparable<ToolsetVersion> {
  private static final Splitter DOTS = Splitter.on('.');

  private final ImmutableList<Integer> components;

  private ToolsetVersion(ImmutableList<Integer> components) {
    this.components = components;
  }

  static ToolsetVersion of(int major, int minor) {
    return new ToolsetVersion(ImmutableList.of(major, minor));
  }

  /** Returns null if {@code name} is not a version. */
  @Nullable
  static ToolsetVersion parse(@Nullable String name) {
    if (name == null) {
      return null;
    }
    String text = name.trim();
    if (text.startsWith("v") || text.startsWith("V")) {
      text = text.substring(1);
    }
    List<String> parts = DOTS.splitToList(text);
    if (parts.size() > 4) {
      return null;
    }
    ImmutableList.Builder<Integer> components = ImmutableList.builder();
    for (String part : parts) {
      Integer component = Ints.tryParse(part);
      if (component == null || component < 0) {
        return null;
      }
      components.add(component);
    }
    if (parts.size() == 1) {
      components.add(0);
    }
    ImmutableList<Integer> built = components.build();
    // trailing zeros beyond minor do not distinguish versions
    int length = built.size();
    while (length > 2 && built.get(length - 1) == 0) {
      length--;
    }
    return new ToolsetVersion(built.subList(0, length));
  }

  @Override
  public int compareTo(ToolsetVersion other) {
    int shared = Math.min(components.size(), other.components.size());
    for (int i = 0; i < shared; i++) {
      int result = Integer.compare(components.get(i), other.components.get(i));
      if (result != 0) {
        return result;
      }
    }
    return Integer.compare(components.size(), other.components.size());
  }

  @Override
  public String toString() {
    return Joiner.on('.').join(components);
  }
}
