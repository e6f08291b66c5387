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

import static com.google.common.base.Preconditions.checkNotNull;

import build.evalcache.common.config.EvaluationConfigs;
import build.evalcache.context.EvaluationContext;
import build.evalcache.context.EvaluationContext.SharingPolicy;
import build.evalcache.sdk.DefaultSdkResolver;
import build.evalcache.sdk.ResolverChainSdkResolverService;
import build.evalcache.sdk.SdkResolver;
import build.evalcache.sdk.SdkResolverService;
import build.evalcache.toolset.Toolset;
import build.evalcache.toolset.ToolsetReadResult;
import build.evalcache.toolset.YamlToolsetReader;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Level;
import javax.annotation.Nullable;
import lombok.extern.java.Log;

/**
 * The toolsets, sdk resolvers and global properties shared by a set of projects, and the projects
 * loaded with them.
 */
@Log
public class ProjectCollection {
  private final EvaluationConfigs configs;
  private final ImmutableSortedMap<String, String> globalProperties;
  private final ImmutableSortedMap<String, Toolset> toolsets;
  @Nullable private final String defaultToolsVersion;
  private final SdkResolverService sdkResolverService;
  private final Evaluator evaluator;
  private final List<Project> loadedProjects = new ArrayList<>();

  private ProjectCollection(Builder builder) throws IOException {
    configs = builder.configs;
    globalProperties =
        ImmutableSortedMap.copyOf(builder.globalProperties, String.CASE_INSENSITIVE_ORDER);
    evaluator = builder.evaluator;

    Map<String, Toolset> table = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    for (Toolset toolset : builder.toolsets) {
      table.put(toolset.getToolsVersion(), toolset);
    }
    String defaultVersion = null;
    if (!Strings.isNullOrEmpty(configs.getToolsetDefinitions())) {
      Path definitions = builder.fileSystem.getPath(configs.getToolsetDefinitions());
      ToolsetReadResult result =
          YamlToolsetReader.load(definitions, builder.environmentProperties).readToolsets(table);
      defaultVersion = result.getDefaultToolsVersion();
    }
    toolsets = ImmutableSortedMap.copyOf(table, String.CASE_INSENSITIVE_ORDER);
    if (defaultVersion == null && toolsets.size() == 1) {
      defaultVersion = toolsets.firstKey();
    }
    defaultToolsVersion = defaultVersion;

    ImmutableList.Builder<SdkResolver> resolvers = ImmutableList.builder();
    resolvers.addAll(builder.sdkResolvers);
    if (!Strings.isNullOrEmpty(configs.getSdksPath())) {
      resolvers.add(new DefaultSdkResolver(builder.fileSystem.getPath(configs.getSdksPath())));
    }
    sdkResolverService = new ResolverChainSdkResolverService(resolvers.build());
    log.log(
        Level.FINE,
        String.format(
            "project collection with toolsets %s, default %s",
            toolsets.keySet(),
            defaultToolsVersion));
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public Project loadProject(ProjectDefinition definition) throws IOException {
    return loadProject(definition, null);
  }

  /**
   * Loads and evaluates {@code definition}.
   *
   * @param context the context to load with, subject to its sharing policy; null for a new
   *     isolated context.
   */
  public Project loadProject(ProjectDefinition definition, @Nullable EvaluationContext context)
      throws IOException {
    Project project = new Project(definition, this, context);
    synchronized (loadedProjects) {
      loadedProjects.add(project);
    }
    return project;
  }

  EvaluationContext newDefaultContext() {
    return EvaluationContext.create(
        SharingPolicy.ISOLATED, null, sdkResolverService, configs.isRecordCacheStats());
  }

  EvaluationResult evaluate(ProjectDefinition definition, EvaluationContext context)
      throws IOException {
    String toolsVersion =
        definition.getToolsVersion() != null ? definition.getToolsVersion() : defaultToolsVersion;
    Toolset toolset = null;
    if (toolsVersion != null) {
      toolset = toolsets.get(toolsVersion);
      if (toolset == null) {
        throw new InvalidProjectException(
            definition.getProjectFile(), "unknown tools version " + toolsVersion);
      }
    }
    return evaluator.evaluate(
        definition, context, sdkResolverService, toolset, globalProperties);
  }

  public ImmutableList<Project> getLoadedProjects() {
    synchronized (loadedProjects) {
      return ImmutableList.copyOf(loadedProjects);
    }
  }

  public ImmutableSortedMap<String, Toolset> getToolsets() {
    return toolsets;
  }

  @Nullable
  public Toolset getToolset(String toolsVersion) {
    return toolsets.get(toolsVersion);
  }

  @Nullable
  public String getDefaultToolsVersion() {
    return defaultToolsVersion;
  }

  public ImmutableSortedMap<String, String> getGlobalProperties() {
    return globalProperties;
  }

  /**
   * The resolver chain shared by every context this collection creates, and used by contexts
   * created without resolvers.
   */
  public SdkResolverService getSdkResolverService() {
    return sdkResolverService;
  }

  public EvaluationConfigs getConfigs() {
    return configs;
  }

  public static final class Builder {
    private EvaluationConfigs configs = new EvaluationConfigs();
    private FileSystem fileSystem = FileSystems.getDefault();
    private Map<String, String> globalProperties = ImmutableMap.of();
    private Map<String, String> environmentProperties = ImmutableMap.of();
    private final List<Toolset> toolsets = new ArrayList<>();
    private final List<SdkResolver> sdkResolvers = new ArrayList<>();
    private Evaluator evaluator = new Evaluator();

    private Builder() {}

    public Builder setConfigs(EvaluationConfigs configs) {
      this.configs = checkNotNull(configs);
      return this;
    }

    /** The file system the configured paths are resolved in. */
    public Builder setFileSystem(FileSystem fileSystem) {
      this.fileSystem = checkNotNull(fileSystem);
      return this;
    }

    public Builder setGlobalProperties(Map<String, String> globalProperties) {
      this.globalProperties = ImmutableMap.copyOf(globalProperties);
      return this;
    }

    /** The environment toolsets read their sub-toolset version from. */
    public Builder setEnvironmentProperties(Map<String, String> environmentProperties) {
      this.environmentProperties = ImmutableMap.copyOf(environmentProperties);
      return this;
    }

    /** Adds a toolset that takes precedence over any read from the configured definitions. */
    public Builder addToolset(Toolset toolset) {
      toolsets.add(checkNotNull(toolset));
      return this;
    }

    public Builder addSdkResolver(SdkResolver resolver) {
      sdkResolvers.add(checkNotNull(resolver));
      return this;
    }

    public Builder setEvaluator(Evaluator evaluator) {
      this.evaluator = checkNotNull(evaluator);
      return this;
    }

    /**
     * @throws IOException if the toolset definitions cannot be read.
     * @throws build.evalcache.toolset.InvalidToolsetDefinitionException if they are malformed.
     */
    public ProjectCollection build() throws IOException {
      return new ProjectCollection(this);
    }
  }
}
