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
package build.evalcache.cache;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import java.nio.file.FileSystem;
import java.nio.file.Path;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class GlobCacheKeyTest {
  private final FileSystem fileSystem = Jimfs.newFileSystem(Configuration.unix());
  private final Path a = fileSystem.getPath("/A");
  private final Path b = fileSystem.getPath("/B");

  @Test
  public void samePatternInDifferentConesDiffers() {
    GlobCacheKey fromA = GlobCacheKey.of("**/*.cs", a);
    GlobCacheKey fromB = GlobCacheKey.of("**/*.cs", b);

    assertThat(fromA).isNotEqualTo(fromB);
    assertThat((Object) fromA.getFixedDirectoryRoot()).isEqualTo(a);
    assertThat((Object) fromB.getFixedDirectoryRoot()).isEqualTo(b);
  }

  @Test
  public void absolutePatternIntoAnotherConeMatchesThatConesKey() {
    GlobCacheKey relative = GlobCacheKey.of("Glob/**/*.cs", a);
    GlobCacheKey absolute = GlobCacheKey.of("/A/Glob/**/*.cs", b);

    assertThat(absolute).isEqualTo(relative);
    assertThat(absolute.hashCode()).isEqualTo(relative.hashCode());
    assertThat((Object) relative.getFixedDirectoryRoot())
        .isEqualTo(fileSystem.getPath("/A/Glob"));
    assertThat(relative.getPatternRemainder()).isEqualTo("**/*.cs");
  }

  @Test
  public void relativeSegmentsAreNormalized() {
    assertThat(GlobCacheKey.of("../A/Glob/**/*.cs", b))
        .isEqualTo(GlobCacheKey.of("./Glob/**/*.cs", a));
  }

  @Test
  public void differentRemaindersDiffer() {
    assertThat(GlobCacheKey.of("Glob/**/*.cs", a)).isNotEqualTo(GlobCacheKey.of("Glob/*.cs", a));
  }

  @Test
  public void rootMustBeAbsolute() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new GlobCacheKey(fileSystem.getPath("relative"), "*.cs"));
  }
}
