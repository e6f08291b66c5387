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

import javax.annotation.Nullable;
import lombok.Getter;
import lombok.ToString;

/** The settings a {@link ToolsetReader} found next to its toolset definitions. */
@Getter
@ToString
public final class ToolsetReadResult {
  @Nullable private final String defaultToolsVersion;
  @Nullable private final String overrideTasksPath;
  @Nullable private final String defaultOverrideToolsVersion;

  public ToolsetReadResult(
      @Nullable String defaultToolsVersion,
      @Nullable String overrideTasksPath,
      @Nullable String defaultOverrideToolsVersion) {
    this.defaultToolsVersion = defaultToolsVersion;
    this.overrideTasksPath = overrideTasksPath;
    this.defaultOverrideToolsVersion = defaultOverrideToolsVersion;
  }
}
