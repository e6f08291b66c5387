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

import build.evalcache.common.io.EvaluationFileSystem;
import build.evalcache.context.EvaluationContext;
import build.evalcache.glob.FileSpec;
import build.evalcache.sdk.ResolverChainSdkResolverService;
import build.evalcache.sdk.SdkReference;
import build.evalcache.sdk.SdkResolverContext;
import build.evalcache.sdk.SdkResolverService;
import build.evalcache.sdk.SdkResult;
import build.evalcache.toolset.Toolset;
import build.evalcache.toolset.ToolsetReader;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSortedMap;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Level;
import javax.annotation.Nullable;
import lombok.extern.java.Log;

/**
 * Evaluates a {@link ProjectDefinition} against an {@link EvaluationContext}. Every file system
 * probe, glob expansion and sdk resolution goes through the context's caches.
 */
@Log
public class Evaluator {
  public static final String TOOLS_VERSION_PROPERTY = "ToolsVersion";

  public EvaluationResult evaluate(
      ProjectDefinition definition,
      EvaluationContext context,
      @Nullable Toolset toolset,
      Map<String, String> globalProperties)
      throws IOException {
    return evaluate(
        definition,
        context,
        ResolverChainSdkResolverService.empty(),
        toolset,
        globalProperties);
  }

  /**
   * Properties are layered with global properties over project properties over toolset
   * properties, with the selected sub-toolset over its base toolset.
   *
   * @param sdkResolvers used through the context's sdk cache when the context has no resolvers of
   *     its own.
   * @param toolset the toolset to evaluate with, or null for none.
   * @throws InvalidProjectException if an sdk cannot be resolved or a literal import is missing.
   * @throws IOException if a directory cannot be listed while expanding a pattern.
   */
  public EvaluationResult evaluate(
      ProjectDefinition definition,
      EvaluationContext context,
      SdkResolverService sdkResolvers,
      @Nullable Toolset toolset,
      Map<String, String> globalProperties)
      throws IOException {
    checkNotNull(definition);
    checkNotNull(context);
    Path projectFile = definition.getProjectFile();
    Path directory = definition.getDirectory();
    EvaluationFileSystem fileSystem = context.getFileSystem();
    log.log(Level.FINE, String.format("evaluating %s with %s", projectFile, context));

    Map<String, String> properties = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    String subToolsetVersion = null;
    if (toolset != null) {
      subToolsetVersion =
          toolset.generateSubToolsetVersion(globalProperties, definition.getSolutionVersion());
      properties.putAll(toolset.getProperties(subToolsetVersion));
      properties.put(ToolsetReader.TOOLS_PATH, toolset.getToolsPath());
      properties.put(TOOLS_VERSION_PROPERTY, toolset.getToolsVersion());
      if (subToolsetVersion != null) {
        properties.put(Toolset.SUB_TOOLSET_VERSION_PROPERTY, subToolsetVersion);
      }
    }

    ImmutableList.Builder<SdkResult> sdks = ImmutableList.builder();
    SdkResolverContext resolverContext = new SdkResolverContext(projectFile, fileSystem);
    SdkResolverService sdkResolverService = context.getSdkResolverService(sdkResolvers);
    for (SdkReference reference : definition.getSdks()) {
      SdkResult result = sdkResolverService.resolveSdk(reference, resolverContext);
      for (String warning : result.getWarnings()) {
        log.log(Level.WARNING, String.format("%s: sdk %s: %s", projectFile, reference, warning));
      }
      if (!result.isSuccess()) {
        throw new InvalidProjectException(
            projectFile,
            String.format(
                "could not resolve sdk %s: %s",
                reference,
                Joiner.on("; ").join(result.getErrors())));
      }
      sdks.add(result);
    }

    for (PropertyDefinition property : definition.getProperties()) {
      String condition = property.getExistsCondition();
      if (condition != null && !fileSystem.exists(directory.resolve(condition))) {
        continue;
      }
      properties.put(property.getName(), property.getValue());
    }
    properties.putAll(globalProperties);

    ImmutableList.Builder<Path> imports = ImmutableList.builder();
    for (String pattern : definition.getImports()) {
      if (FileSpec.hasWildcards(pattern)) {
        for (String match : context.getGlobCache().expand(pattern, directory)) {
          imports.add(directory.resolve(match).normalize());
        }
      } else {
        Path path = directory.resolve(pattern).normalize();
        if (!fileSystem.exists(path)) {
          throw new InvalidProjectException(projectFile, "imported project not found: " + path);
        }
        imports.add(path);
      }
    }

    ImmutableListMultimap.Builder<String, String> items = ImmutableListMultimap.builder();
    for (ItemDefinition item : definition.getItems()) {
      if (FileSpec.hasWildcards(item.getInclude())) {
        items.putAll(
            item.getItemType(), context.getGlobCache().expand(item.getInclude(), directory));
      } else {
        items.put(item.getItemType(), item.getInclude());
      }
    }

    return new EvaluationResult(
        ImmutableSortedMap.copyOf(properties, String.CASE_INSENSITIVE_ORDER),
        items.build(),
        imports.build(),
        sdks.build(),
        toolset == null ? null : toolset.getToolsVersion(),
        subToolsetVersion);
  }
}
