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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import build.evalcache.sdk.SdkReference;
import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import javax.annotation.Nullable;
import lombok.Getter;
import lombok.ToString;

/**
 * The parts of a project file that drive cache usage during evaluation. The directory containing
 * {@link #getProjectFile()} anchors every relative path and pattern in the definition.
 */
@Getter
@ToString
public final class ProjectDefinition {
  private final Path projectFile;
  private final ImmutableList<PropertyDefinition> properties;
  private final ImmutableList<SdkReference> sdks;
  private final ImmutableList<String> imports;
  private final ImmutableList<ItemDefinition> items;
  @Nullable private final String toolsVersion;
  private final int solutionVersion;

  private ProjectDefinition(Builder builder) {
    projectFile = builder.projectFile;
    properties = builder.properties.build();
    sdks = builder.sdks.build();
    imports = builder.imports.build();
    items = builder.items.build();
    toolsVersion = builder.toolsVersion;
    solutionVersion = builder.solutionVersion;
  }

  public Path getDirectory() {
    return projectFile.getParent();
  }

  public static Builder newBuilder(Path projectFile) {
    return new Builder(projectFile);
  }

  public static final class Builder {
    private final Path projectFile;
    private final ImmutableList.Builder<PropertyDefinition> properties = ImmutableList.builder();
    private final ImmutableList.Builder<SdkReference> sdks = ImmutableList.builder();
    private final ImmutableList.Builder<String> imports = ImmutableList.builder();
    private final ImmutableList.Builder<ItemDefinition> items = ImmutableList.builder();
    @Nullable private String toolsVersion;
    private int solutionVersion;

    private Builder(Path projectFile) {
      Path absolute = checkNotNull(projectFile).toAbsolutePath().normalize();
      checkArgument(absolute.getParent() != null, "project file has no directory: %s", projectFile);
      this.projectFile = absolute;
    }

    public Builder addProperty(PropertyDefinition property) {
      properties.add(property);
      return this;
    }

    public Builder addProperty(String name, String value) {
      return addProperty(PropertyDefinition.of(name, value));
    }

    public Builder addSdk(SdkReference sdk) {
      sdks.add(sdk);
      return this;
    }

    public Builder addImport(String pattern) {
      imports.add(checkNotNull(pattern));
      return this;
    }

    public Builder addItem(String itemType, String include) {
      items.add(new ItemDefinition(itemType, include));
      return this;
    }

    public Builder setToolsVersion(@Nullable String toolsVersion) {
      this.toolsVersion = toolsVersion;
      return this;
    }

    public Builder setSolutionVersion(int solutionVersion) {
      checkArgument(solutionVersion >= 0, "negative solution version %s", solutionVersion);
      this.solutionVersion = solutionVersion;
      return this;
    }

    public ProjectDefinition build() {
      return new ProjectDefinition(this);
    }
  }
}
