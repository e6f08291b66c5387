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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** A raw property as found in a toolset definition, with where it was found. */
@Getter
@EqualsAndHashCode
@ToString
public final class ToolsetPropertyDefinition {
  private final String name;
  private final String value;
  private final String source;

  public ToolsetPropertyDefinition(String name, String value, String source) {
    this.name = checkNotNull(name);
    this.value = checkNotNull(value);
    this.source = checkNotNull(source);
  }
}
