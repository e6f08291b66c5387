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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import javax.annotation.Nullable;
import lombok.extern.java.Log;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads toolsets from a YAML document of the form:
 *
 * <pre>
 * defaultToolsVersion: "4.0"
 * overrideTasksPath: /tasks
 * toolsVersions:
 *   "4.0":
 *     ToolsPath: /tools/4.0
 *     SomeProperty: value
 *     "11.0":
 *       SomeProperty: overridden
 * </pre>
 *
 * <p>Within a toolset, string values are properties and mappings are sub-toolsets. Anything else
 * is an error. Scalars directly under {@code toolsVersions}, and mappings nested inside a
 * sub-toolset, are ignored.
 */
@Log
public class YamlToolsetReader extends ToolsetReader {
  public static final String DEFAULT_TOOLS_VERSION = "defaultToolsVersion";
  public static final String OVERRIDE_TASKS_PATH = "overrideTasksPath";
  public static final String DEFAULT_OVERRIDE_TOOLS_VERSION = "defaultOverrideToolsVersion";
  public static final String TOOLS_VERSIONS = "toolsVersions";

  private final String source;
  private final Map<?, ?> root;
  private final ImmutableMap<String, Map<?, ?>> toolsets;

  YamlToolsetReader(String source, @Nullable Object document, Map<String, String> environment) {
    super(environment);
    this.source = checkNotNull(source);
    if (document == null) {
      root = ImmutableMap.of();
    } else if (document instanceof Map) {
      root = (Map<?, ?>) document;
    } else {
      throw new InvalidToolsetDefinitionException(source + ": expected a mapping at the top level");
    }
    toolsets = collectToolsets();
  }

  public static YamlToolsetReader load(Path path, Map<String, String> environment)
      throws IOException {
    try (InputStream in = Files.newInputStream(path)) {
      return load(path.toString(), in, environment);
    }
  }

  public static YamlToolsetReader load(
      String source, InputStream in, Map<String, String> environment) {
    Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
    Object document;
    try {
      document = yaml.load(in);
    } catch (YAMLException e) {
      throw new InvalidToolsetDefinitionException(source + ": " + e.getMessage(), e);
    }
    return new YamlToolsetReader(source, document, environment);
  }

  private ImmutableMap<String, Map<?, ?>> collectToolsets() {
    Object value = root.get(TOOLS_VERSIONS);
    if (value == null) {
      return ImmutableMap.of();
    }
    if (!(value instanceof Map)) {
      throw new InvalidToolsetDefinitionException(
          String.format("%s: %s must be a mapping", source, TOOLS_VERSIONS));
    }
    Map<String, Map<?, ?>> collected = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
      String name = String.valueOf(entry.getKey());
      if (entry.getValue() instanceof Map) {
        collected.put(name, (Map<?, ?>) entry.getValue());
      } else {
        log.log(Level.FINE, String.format("%s: ignoring %s/%s", source, TOOLS_VERSIONS, name));
      }
    }
    return ImmutableMap.copyOf(collected);
  }

  @Nullable
  private String setting(String key) {
    Object value = root.get(key);
    if (value == null) {
      return null;
    }
    if (!(value instanceof String)) {
      throw new InvalidToolsetDefinitionException(
          String.format("%s: %s must be a string, was %s", source, key, value));
    }
    return (String) value;
  }

  private Map<?, ?> toolset(String toolsVersion) {
    Map<?, ?> toolset = toolsets.get(toolsVersion);
    if (toolset == null) {
      throw new IllegalArgumentException("no toolset " + toolsVersion + " in " + source);
    }
    return toolset;
  }

  private Map<?, ?> subToolset(String toolsVersion, String subToolsetVersion) {
    for (Map.Entry<?, ?> entry : toolset(toolsVersion).entrySet()) {
      if (String.valueOf(entry.getKey()).equals(subToolsetVersion)
          && entry.getValue() instanceof Map) {
        return (Map<?, ?>) entry.getValue();
      }
    }
    throw new IllegalArgumentException(
        String.format(
            "no sub-toolset %s in toolset %s of %s", subToolsetVersion, toolsVersion, source));
  }

  @Override
  protected Iterable<String> getToolsVersions() {
    return toolsets.keySet();
  }

  @Override
  @Nullable
  protected String getDefaultToolsVersion() {
    return setting(DEFAULT_TOOLS_VERSION);
  }

  @Override
  @Nullable
  protected String getOverrideTasksPath() {
    return setting(OVERRIDE_TASKS_PATH);
  }

  @Override
  @Nullable
  protected String getDefaultOverrideToolsVersion() {
    return setting(DEFAULT_OVERRIDE_TOOLS_VERSION);
  }

  @Override
  protected Iterable<ToolsetPropertyDefinition> getPropertyDefinitions(String toolsVersion) {
    String location = String.format("%s: %s/%s", source, TOOLS_VERSIONS, toolsVersion);
    ImmutableList.Builder<ToolsetPropertyDefinition> properties = ImmutableList.builder();
    for (Map.Entry<?, ?> entry : toolset(toolsVersion).entrySet()) {
      String name = String.valueOf(entry.getKey());
      Object value = entry.getValue();
      if (value instanceof String) {
        properties.add(new ToolsetPropertyDefinition(name, (String) value, location));
      } else if (!(value instanceof Map)) {
        throw nonStringValue(location, name, value);
      }
    }
    return properties.build();
  }

  @Override
  protected Iterable<String> getSubToolsetVersions(String toolsVersion) {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (Map.Entry<?, ?> entry : toolset(toolsVersion).entrySet()) {
      if (entry.getValue() instanceof Map) {
        names.add(String.valueOf(entry.getKey()));
      }
    }
    return names.build();
  }

  @Override
  protected Iterable<ToolsetPropertyDefinition> getSubToolsetPropertyDefinitions(
      String toolsVersion, String subToolsetVersion) {
    String location =
        String.format("%s: %s/%s/%s", source, TOOLS_VERSIONS, toolsVersion, subToolsetVersion);
    ImmutableList.Builder<ToolsetPropertyDefinition> properties = ImmutableList.builder();
    for (Map.Entry<?, ?> entry : subToolset(toolsVersion, subToolsetVersion).entrySet()) {
      String name = String.valueOf(entry.getKey());
      Object value = entry.getValue();
      if (value instanceof String) {
        properties.add(new ToolsetPropertyDefinition(name, (String) value, location));
      } else if (value instanceof Map) {
        log.log(Level.FINE, String.format("%s: ignoring nested %s", location, name));
      } else {
        throw nonStringValue(location, name, value);
      }
    }
    return properties.build();
  }

  private static InvalidToolsetDefinitionException nonStringValue(
      String location, String name, @Nullable Object value) {
    return new InvalidToolsetDefinitionException(
        String.format(
            "%s: property %s must have a string value, was %s",
            location, name, value == null ? "null" : value.getClass().getSimpleName()));
  }
}
