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
package build.evalcache.evaluation;

import build.evalcache.sdk.SdkResult;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSortedMap;
import java.nio.file.Path;
import javax.annotation.Nullable;
import lombok.Getter;
import lombok.ToString;

/** What one evaluation of a project produced. */
@Getter
@ToString
public final class EvaluationResult {
  private final ImmutableSortedMap<String, String> properties;
  private final ImmutableListMultimap<String, String> items;
  private final ImmutableList<Path> imports;
  private final ImmutableList<SdkResult> sdks;
  @Nullable private final String toolsVersion;
  @Nullable private final String subToolsetVersion;

  EvaluationResult(
      ImmutableSortedMap<String, String> properties,
      ImmutableListMultimap<String, String> items,
      ImmutableList<Path> imports,
      ImmutableList<SdkResult> sdks,
      @Nullable String toolsVersion,
      @Nullable String subToolsetVersion) {
    this.properties = properties;
    this.items = items;
    this.imports = imports;
    this.sdks = sdks;
    this.toolsVersion = toolsVersion;
    this.subToolsetVersion = subToolsetVersion;
  }

  @Nullable
  public String getProperty(String name) {
    return properties.get(name);
  }

  public ImmutableList<String> getItems(String itemType) {
    return items.get(itemType);
  }
}
