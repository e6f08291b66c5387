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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import javax.annotation.Nullable;
import lombok.Getter;
import lombok.ToString;

/**
 * A named set of tools: where they live, the properties they define, and the sub-toolsets that
 * can override those properties.
 */
@Getter
@ToString
public final class Toolset {
  /** Selects the sub-toolset, whether set as a global or an environment property. */
  public static final String SUB_TOOLSET_VERSION_PROPERTY = "VisualStudioVersion";

  private final String toolsVersion;
  private final String toolsPath;
  private final ImmutableSortedMap<String, String> properties;
  @ToString.Exclude private final ImmutableSortedMap<String, String> environmentProperties;
  private final ImmutableSortedMap<String, SubToolset> subToolsets;
  @Nullable private final String overrideTasksPath;
  @Nullable private final String defaultOverrideToolsVersion;
  @Nullable private final String defaultSubToolsetVersion;

  /**
   * @param environmentProperties the environment as it was when the toolset was read; consulted
   *     for the sub-toolset version instead of the live process environment.
   */
  public Toolset(
      String toolsVersion,
      String toolsPath,
      Map<String, String> properties,
      Map<String, String> environmentProperties,
      Map<String, SubToolset> subToolsets,
      @Nullable String overrideTasksPath,
      @Nullable String defaultOverrideToolsVersion) {
    checkArgument(!Strings.isNullOrEmpty(toolsVersion), "toolsVersion must not be empty");
    checkArgument(!Strings.isNullOrEmpty(toolsPath), "toolsPath must not be empty");
    this.toolsVersion = toolsVersion;
    this.toolsPath = toolsPath;
    this.properties = ImmutableSortedMap.copyOf(properties, String.CASE_INSENSITIVE_ORDER);
    this.environmentProperties =
        ImmutableSortedMap.copyOf(environmentProperties, String.CASE_INSENSITIVE_ORDER);
    this.subToolsets = ImmutableSortedMap.copyOf(subToolsets, String.CASE_INSENSITIVE_ORDER);
    this.overrideTasksPath = overrideTasksPath;
    this.defaultOverrideToolsVersion = defaultOverrideToolsVersion;
    defaultSubToolsetVersion = highestSubToolsetVersion(this.subToolsets.keySet());
  }

  public Toolset(
      String toolsVersion,
      String toolsPath,
      Map<String, String> properties,
      Map<String, SubToolset> subToolsets) {
    this(toolsVersion, toolsPath, properties, ImmutableMap.of(), subToolsets, null, null);
  }

  /**
   * Names that are not versions come first, in the order found, followed by versions in ascending
   * order; the last of them is the default.
   */
  @Nullable
  private static String highestSubToolsetVersion(Iterable<String> names) {
    List<String> ordered = new ArrayList<>();
    TreeMap<ToolsetVersion, String> versioned = new TreeMap<>();
    for (String name : names) {
      ToolsetVersion version = ToolsetVersion.parse(name);
      if (version != null) {
        versioned.put(version, name);
      } else {
        ordered.add(name);
      }
    }
    ordered.addAll(versioned.values());
    return ordered.isEmpty() ? null : ordered.get(ordered.size() - 1);
  }

  /**
   * Looks up {@code propertyName} in the sub-toolset named {@code subToolsetVersion} first, then in
   * this toolset. A sub-toolset value wins even when it is empty.
   *
   * @return the value, or null if neither defines the property.
   */
  @Nullable
  public String getProperty(String propertyName, @Nullable String subToolsetVersion) {
    if (subToolsetVersion != null) {
      SubToolset subToolset = subToolsets.get(subToolsetVersion);
      if (subToolset != null && subToolset.getProperties().containsKey(propertyName)) {
        return subToolset.getProperties().get(propertyName);
      }
    }
    return properties.get(propertyName);
  }

  /** Every property visible with {@code subToolsetVersion} selected. */
  public ImmutableSortedMap<String, String> getProperties(@Nullable String subToolsetVersion) {
    SubToolset subToolset = subToolsetVersion == null ? null : subToolsets.get(subToolsetVersion);
    if (subToolset == null) {
      return properties;
    }
    TreeMap<String, String> merged = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    merged.putAll(properties);
    merged.putAll(subToolset.getProperties());
    return ImmutableSortedMap.copyOfSorted(merged);
  }

  @Nullable
  public String generateSubToolsetVersion() {
    return generateSubToolsetVersion(null, 0);
  }

  /**
   * Chooses the sub-toolset version for an evaluation, in order of precedence:
   *
   * <ol>
   *   <li>the {@value #SUB_TOOLSET_VERSION_PROPERTY} entry of {@code explicitGlobalProperties}
   *   <li>the {@value #SUB_TOOLSET_VERSION_PROPERTY} environment property
   *   <li>{@code solutionVersion - 1}, if a sub-toolset with that version exists
   *   <li>the default sub-toolset version
   * </ol>
   *
   * <p>The result may be null, meaning the base toolset alone, and may name a sub-toolset that
   * does not exist.
   *
   * @param solutionVersion the format version declared by a solution file, or 0 if none.
   */
  @Nullable
  public String generateSubToolsetVersion(
      @Nullable Map<String, String> explicitGlobalProperties, int solutionVersion) {
    if (explicitGlobalProperties != null) {
      for (Map.Entry<String, String> entry : explicitGlobalProperties.entrySet()) {
        if (SUB_TOOLSET_VERSION_PROPERTY.equalsIgnoreCase(entry.getKey())) {
          return entry.getValue();
        }
      }
    }

    String environmentVersion = environmentProperties.get(SUB_TOOLSET_VERSION_PROPERTY);
    if (environmentVersion != null) {
      return environmentVersion;
    }

    int visualStudioVersionFromSolution = solutionVersion - 1;
    if (visualStudioVersionFromSolution > 0) {
      ToolsetVersion wanted = ToolsetVersion.of(visualStudioVersionFromSolution, 0);
      for (String name : subToolsets.keySet()) {
        if (wanted.equals(ToolsetVersion.parse(name))) {
          return name;
        }
      }
    }

    return defaultSubToolsetVersion;
  }
}
