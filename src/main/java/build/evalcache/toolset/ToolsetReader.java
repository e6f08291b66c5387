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

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Level;
import javax.annotation.Nullable;
import lombok.extern.java.Log;

/**
 * Reads toolset definitions from some location. Subclasses expose the raw definitions; this class
 * validates them and builds the {@link Toolset}s.
 */
@Log
public abstract class ToolsetReader {
  /** The setting naming the directory that holds a toolset's tools. */
  public static final String TOOLS_PATH = "ToolsPath";
  /** Older name for {@link #TOOLS_PATH}; both may be given if they agree. */
  public static final String BIN_PATH = "BinPath";

  private final ImmutableMap<String, String> environmentProperties;

  protected ToolsetReader(Map<String, String> environmentProperties) {
    this.environmentProperties = ImmutableMap.copyOf(environmentProperties);
  }

  /** Names of the toolsets defined at this location, in definition order. */
  protected abstract Iterable<String> getToolsVersions();

  @Nullable
  protected abstract String getDefaultToolsVersion();

  @Nullable
  protected abstract String getOverrideTasksPath();

  @Nullable
  protected abstract String getDefaultOverrideToolsVersion();

  protected abstract Iterable<ToolsetPropertyDefinition> getPropertyDefinitions(
      String toolsVersion);

  protected abstract Iterable<String> getSubToolsetVersions(String toolsVersion);

  protected abstract Iterable<ToolsetPropertyDefinition> getSubToolsetPropertyDefinitions(
      String toolsVersion, String subToolsetVersion);

  /**
   * Adds the toolsets found at this location to {@code toolsets}. Toolsets already present came
   * from a location of higher precedence and are left alone; toolsets without a tools path are
   * skipped.
   *
   * @throws InvalidToolsetDefinitionException if a definition is malformed.
   */
  public ToolsetReadResult readToolsets(Map<String, Toolset> toolsets) {
    checkNotNull(toolsets);
    String overrideTasksPath = getOverrideTasksPath();
    String defaultOverrideToolsVersion = getDefaultOverrideToolsVersion();
    for (String toolsVersion : getToolsVersions()) {
      if (toolsets.containsKey(toolsVersion)) {
        continue;
      }
      Toolset toolset = readToolset(toolsVersion, overrideTasksPath, defaultOverrideToolsVersion);
      if (toolset != null) {
        toolsets.put(toolset.getToolsVersion(), toolset);
      }
    }
    // the default need not name a toolset that was read
    return new ToolsetReadResult(
        getDefaultToolsVersion(), overrideTasksPath, defaultOverrideToolsVersion);
  }

  @Nullable
  private Toolset readToolset(
      String toolsVersion,
      @Nullable String overrideTasksPath,
      @Nullable String defaultOverrideToolsVersion) {
    String toolsPath = null;
    String binPath = null;
    Map<String, String> properties = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    for (ToolsetPropertyDefinition property : getPropertyDefinitions(toolsVersion)) {
      if (TOOLS_PATH.equalsIgnoreCase(property.getName())) {
        toolsPath = property.getValue();
      } else if (BIN_PATH.equalsIgnoreCase(property.getName())) {
        binPath = property.getValue();
      } else {
        properties.put(property.getName(), property.getValue());
      }
    }

    Map<String, SubToolset> subToolsets = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    for (String subToolsetVersion : getSubToolsetVersions(toolsVersion)) {
      Map<String, String> subToolsetProperties = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
      for (ToolsetPropertyDefinition property :
          getSubToolsetPropertyDefinitions(toolsVersion, subToolsetVersion)) {
        if (TOOLS_PATH.equalsIgnoreCase(property.getName())
            || BIN_PATH.equalsIgnoreCase(property.getName())) {
          throw new InvalidToolsetDefinitionException(
              String.format(
                  "%s may not be set in sub-toolset %s of toolset %s (%s)",
                  property.getName(), subToolsetVersion, toolsVersion, property.getSource()));
        }
        subToolsetProperties.put(property.getName(), property.getValue());
      }
      subToolsets.put(subToolsetVersion, new SubToolset(subToolsetVersion, subToolsetProperties));
    }

    if (Strings.isNullOrEmpty(toolsPath) && Strings.isNullOrEmpty(binPath)) {
      log.log(
          Level.FINE,
          String.format(
              "ignoring toolset %s, neither %s nor %s is set", toolsVersion, TOOLS_PATH, BIN_PATH));
      return null;
    }
    if (toolsPath != null && binPath != null && !toolsPath.equalsIgnoreCase(binPath)) {
      throw new InvalidToolsetDefinitionException(
          String.format(
              "toolset %s has conflicting %s \"%s\" and %s \"%s\"",
              toolsVersion, TOOLS_PATH, toolsPath, BIN_PATH, binPath));
    }

    return new Toolset(
        toolsVersion,
        Strings.isNullOrEmpty(toolsPath) ? binPath : toolsPath,
        properties,
        environmentProperties,
        subToolsets,
        overrideTasksPath,
        defaultOverrideToolsVersion);
  }
}
