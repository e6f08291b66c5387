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

import static com.google.common.truth.Truth.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import build.evalcache.context.EvaluationContext;
import build.evalcache.context.EvaluationContext.SharingPolicy;
import build.evalcache.sdk.ResolverChainSdkResolverService;
import build.evalcache.sdk.SdkReference;
import build.evalcache.sdk.SdkResolver;
import build.evalcache.sdk.SdkResolverContext;
import build.evalcache.sdk.SdkResult;
import com.google.common.collect.ImmutableList;
import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ProjectTest {
  private final FileSystem fileSystem = Jimfs.newFileSystem(Configuration.unix());
  private ProjectCollection collection;

  private void touch(String path) throws IOException {
    Path file = fileSystem.getPath(path);
    Files.createDirectories(file.getParent());
    Files.write(file, new byte[0]);
  }

  private ProjectDefinition globbing(String projectFile, String include) {
    return ProjectDefinition.newBuilder(fileSystem.getPath(projectFile))
        .addItem("Compile", include)
        .build();
  }

  @Before
  public void setUp() throws IOException {
    touch("/A/a.cs");
    touch("/A/Glob/one.cs");
    touch("/A/Glob/sub/two.cs");
    touch("/B/b.cs");
    collection = ProjectCollection.newBuilder().setFileSystem(fileSystem).build();
  }

  @Test
  public void reevaluationKeepsTheIsolatedContext() throws IOException {
    EvaluationContext context = EvaluationContext.create(SharingPolicy.ISOLATED);
    Project project = collection.loadProject(globbing("/A/a.proj", "*.cs"), context);
    EvaluationContext first = project.getLastEvaluationContext();
    touch("/A/added.cs");

    EvaluationResult result = project.reevaluate();

    assertThat(first).isNotSameInstanceAs(context);
    assertThat(project.getLastEvaluationContext()).isSameInstanceAs(first);
    assertThat(result.getItems("Compile")).containsExactly("a.cs");
  }

  @Test
  public void reevaluationKeepsTheSharedContext() throws IOException {
    EvaluationContext context = EvaluationContext.create(SharingPolicy.SHARED);
    Project project = collection.loadProject(globbing("/A/a.proj", "*.cs"), context);

    project.reevaluate();
    project.reevaluate();

    assertThat(project.getLastEvaluationContext()).isSameInstanceAs(context);
  }

  @Test
  public void reevaluationWithAnotherContextAdoptsIt() throws IOException {
    Project project = collection.loadProject(globbing("/A/a.proj", "*.cs"));
    touch("/A/added.cs");
    EvaluationContext fresh = EvaluationContext.create(SharingPolicy.ISOLATED);

    EvaluationResult result = project.reevaluate(fresh);

    assertThat(project.getLastEvaluationContext()).isSameInstanceAs(fresh);
    assertThat(result.getItems("Compile")).containsExactly("a.cs", "added.cs").inOrder();
    project.reevaluate();
    assertThat(project.getLastEvaluationContext()).isSameInstanceAs(fresh);
  }

  @Test
  public void defaultContextsAreNeverPooled() throws IOException {
    Project first = collection.loadProject(globbing("/A/a.proj", "*.cs"));
    Project second = collection.loadProject(globbing("/A/a.proj", "*.cs"));

    assertThat(first.getLastEvaluationContext())
        .isNotSameInstanceAs(second.getLastEvaluationContext());
    assertThat(first.getLastEvaluationContext().getPolicy()).isEqualTo(SharingPolicy.ISOLATED);
    first.reevaluate();
    assertThat(first.getLastEvaluationContext())
        .isNotSameInstanceAs(second.getLastEvaluationContext());
    assertThat(collection.getLoadedProjects()).containsExactly(first, second).inOrder();
  }

  @Test
  public void isolatedProjectsSeeFreshFilesAndOnlyTheirOwnCone() throws IOException {
    EvaluationContext context = EvaluationContext.create(SharingPolicy.ISOLATED);
    Project a = collection.loadProject(globbing("/A/a.proj", "**/*.cs"), context);
    Project b = collection.loadProject(globbing("/B/b.proj", "**/*.cs"), context);
    assertThat(a.getLastResult().getItems("Compile"))
        .containsExactly("a.cs", "Glob/one.cs", "Glob/sub/two.cs")
        .inOrder();
    assertThat(b.getLastResult().getItems("Compile")).containsExactly("b.cs");

    touch("/A/newA.cs");
    touch("/B/newB.cs");
    Project laterA = collection.loadProject(globbing("/A/other.proj", "**/*.cs"), context);
    Project laterB = collection.loadProject(globbing("/B/other.proj", "**/*.cs"), context);

    assertThat(laterA.getLastResult().getItems("Compile")).contains("newA.cs");
    assertThat(laterA.getLastResult().getItems("Compile")).doesNotContain("newB.cs");
    assertThat(laterB.getLastResult().getItems("Compile")).containsExactly("b.cs", "newB.cs");
    assertThat(b.reevaluate().getItems("Compile")).containsExactly("b.cs");
  }

  @Test
  public void sharedProjectsKeepSeparateConesButStaleResults() throws IOException {
    EvaluationContext context = EvaluationContext.create(SharingPolicy.SHARED);
    collection.loadProject(globbing("/A/a.proj", "**/*.cs"), context);
    collection.loadProject(globbing("/B/b.proj", "**/*.cs"), context);
    touch("/A/newA.cs");
    touch("/B/newB.cs");

    Project laterA = collection.loadProject(globbing("/A/other.proj", "**/*.cs"), context);
    Project laterB = collection.loadProject(globbing("/B/other.proj", "**/*.cs"), context);

    assertThat(laterA.getLastResult().getItems("Compile"))
        .containsExactly("a.cs", "Glob/one.cs", "Glob/sub/two.cs");
    assertThat(laterB.getLastResult().getItems("Compile")).containsExactly("b.cs");
    assertThat(context.getGlobCache().size()).isEqualTo(2);
  }

  @Test
  public void absoluteGlobIntoAnotherConeSharesItsEntry() throws IOException {
    EvaluationContext context = EvaluationContext.create(SharingPolicy.SHARED);
    collection.loadProject(globbing("/A/a.proj", "Glob/**/*.cs"), context);
    touch("/A/Glob/added.cs");

    Project b = collection.loadProject(globbing("/B/b.proj", "/A/Glob/**/*.cs"), context);

    assertThat(b.getLastResult().getItems("Compile"))
        .containsExactly("/A/Glob/one.cs", "/A/Glob/sub/two.cs")
        .inOrder();
    assertThat(context.getGlobCache().size()).isEqualTo(1);
  }

  @Test
  public void sharedContextResolvesEachSdkOnce() throws IOException {
    SdkResolver resolver = mock(SdkResolver.class);
    when(resolver.getName()).thenReturn("pinned");
    when(resolver.resolve(any(SdkReference.class), any(SdkResolverContext.class)))
        .thenAnswer(
            invocation ->
                SdkResult.success(
                    invocation.getArgument(0), fileSystem.getPath("/sdks/Foo/Sdk"), null));
    EvaluationContext context =
        EvaluationContext.create(
            SharingPolicy.SHARED,
            null,
            new ResolverChainSdkResolverService(ImmutableList.of(resolver)));
    ProjectDefinition a =
        ProjectDefinition.newBuilder(fileSystem.getPath("/A/a.proj"))
            .addSdk(SdkReference.of("Foo"))
            .build();
    ProjectDefinition b =
        ProjectDefinition.newBuilder(fileSystem.getPath("/B/b.proj"))
            .addSdk(SdkReference.of("foo"))
            .build();

    collection.loadProject(a, context).reevaluate();
    collection.loadProject(b, context);

    verify(resolver, times(1)).resolve(any(SdkReference.class), any(SdkResolverContext.class));
  }

  @Test
  public void isolatedContextResolvesSdksPerProject() throws IOException {
    SdkResolver resolver = mock(SdkResolver.class);
    when(resolver.getName()).thenReturn("pinned");
    when(resolver.resolve(any(SdkReference.class), any(SdkResolverContext.class)))
        .thenAnswer(
            invocation ->
                SdkResult.success(
                    invocation.getArgument(0), fileSystem.getPath("/sdks/Foo/Sdk"), null));
    EvaluationContext context =
        EvaluationContext.create(
            SharingPolicy.ISOLATED,
            null,
            new ResolverChainSdkResolverService(ImmutableList.of(resolver)));
    ProjectDefinition definition =
        ProjectDefinition.newBuilder(fileSystem.getPath("/A/a.proj"))
            .addSdk(SdkReference.of("Foo"))
            .build();

    collection.loadProject(definition, context).reevaluate();
    collection.loadProject(definition, context);

    verify(resolver, times(2)).resolve(any(SdkReference.class), any(SdkResolverContext.class));
  }

  @Test
  public void contextWithoutResolversUsesTheCollectionResolvers() throws IOException {
    SdkResolver resolver = mock(SdkResolver.class);
    when(resolver.getName()).thenReturn("pinned");
    when(resolver.resolve(any(SdkReference.class), any(SdkResolverContext.class)))
        .thenAnswer(
            invocation ->
                SdkResult.success(
                    invocation.getArgument(0), fileSystem.getPath("/sdks/Foo/Sdk"), null));
    ProjectCollection resolving =
        ProjectCollection.newBuilder().setFileSystem(fileSystem).addSdkResolver(resolver).build();
    EvaluationContext context = EvaluationContext.create(SharingPolicy.SHARED);
    ProjectDefinition definition =
        ProjectDefinition.newBuilder(fileSystem.getPath("/A/a.proj"))
            .addSdk(SdkReference.of("Foo"))
            .build();

    EvaluationResult result = resolving.loadProject(definition, context).reevaluate();
    resolving.loadProject(definition, context);

    assertThat(result.getSdks()).hasSize(1);
    assertThat(result.getSdks().get(0).isSuccess()).isTrue();
    assertThat(context.getSdkCache().size()).isEqualTo(1);
    verify(resolver, times(1)).resolve(any(SdkReference.class), any(SdkResolverContext.class));
  }
}
