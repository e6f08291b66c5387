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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableSortedMap;
import java.util.Map;
import lombok.Getter;
import lombok.ToString;

/** Properties layered over a {@link Toolset} when its sub-toolset version is selected. */
@Getter
@ToString
public final class SubToolset {
  private final String subToolsetVersion;
  private final ImmutableSortedMap<String, String> properties;

  public SubToolset(String subToolsetVersion, Map<String, String> properties) {
    this.subToolsetVersion = checkNotNull(subToolsetVersion);
    this.properties = ImmutableSortedMap.copyOf(properties, String.CASE_INSENSITIVE_ORDER);
  }
}
