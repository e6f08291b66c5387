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
package build.evalcache.common.io;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import java.nio.file.FileSystem;
import java.nio.file.Path;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class PathNormalizerTest {
  private final FileSystem fileSystem =
      Jimfs.newFileSystem(Configuration.unix().toBuilder().setWorkingDirectory("/work").build());

  @Test
  public void normalizeMakesAbsoluteAndRemovesDots() {
    assertThat((Object) PathNormalizer.normalize(fileSystem.getPath("a/./b/../c")))
        .isEqualTo(fileSystem.getPath("/work/a/c"));
    assertThat((Object) PathNormalizer.normalize(fileSystem.getPath("/x/y/..")))
        .isEqualTo(fileSystem.getPath("/x"));
  }

  @Test
  public void resolveDirectoryAgainstBase() {
    Path base = fileSystem.getPath("/A");
    assertThat((Object) PathNormalizer.resolveDirectory(base, "")).isEqualTo(base);
    assertThat((Object) PathNormalizer.resolveDirectory(base, "Glob/"))
        .isEqualTo(fileSystem.getPath("/A/Glob"));
    assertThat((Object) PathNormalizer.resolveDirectory(base, "./Glob/../Other/"))
        .isEqualTo(fileSystem.getPath("/A/Other"));
  }

  @Test
  public void resolveDirectoryIgnoresBaseForAbsoluteDirectory() {
    Path base = fileSystem.getPath("/B");
    assertThat((Object) PathNormalizer.resolveDirectory(base, "/A/Glob/"))
        .isEqualTo(fileSystem.getPath("/A/Glob"));
    assertThat((Object) PathNormalizer.resolveDirectory(base, "/"))
        .isEqualTo(fileSystem.getPath("/"));
  }

  @Test
  public void isAbsoluteFollowsTheFileSystem() {
    Path base = fileSystem.getPath("/A");
    assertThat(PathNormalizer.isAbsolute(base, "/A/Glob/")).isTrue();
    assertThat(PathNormalizer.isAbsolute(base, "Glob/")).isFalse();
    assertThat(PathNormalizer.isAbsolute(base, "")).isFalse();
  }

  @Test
  public void stripCurrentDirectoryRemovesLeadingSegments() {
    assertThat(PathNormalizer.stripCurrentDirectory("././src/")).isEqualTo("src/");
    assertThat(PathNormalizer.stripCurrentDirectory("src/./")).isEqualTo("src/./");
    assertThat(PathNormalizer.stripCurrentDirectory("")).isEmpty();
  }
}
