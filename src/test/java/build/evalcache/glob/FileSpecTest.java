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
package build.evalcache.glob;

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class FileSpecTest {
  private static void assertParts(
      String filespec,
      String fixedDirectoryPart,
      String wildcardDirectoryPart,
      String filenamePart) {
    FileSpec spec = FileSpec.parse(filespec);
    assertThat(spec.getFixedDirectoryPart()).isEqualTo(fixedDirectoryPart);
    assertThat(spec.getWildcardDirectoryPart()).isEqualTo(wildcardDirectoryPart);
    assertThat(spec.getFilenamePart()).isEqualTo(filenamePart);
  }

  @Test
  public void filenameOnly() {
    assertParts("Source.cs", "", "", "Source.cs");
    assertParts("*.cs", "", "", "*.cs");
  }

  @Test
  public void fixedDirectoryWithoutWildcardDirectories() {
    assertParts("dir1/Source.cs", "dir1/", "", "Source.cs");
    assertParts("dir1/dir2/*.cs", "dir1/dir2/", "", "*.cs");
  }

  @Test
  public void wildcardDirectoriesFollowTheFixedPart() {
    assertParts("Glob/**/*.cs", "Glob/", "**/", "*.cs");
    assertParts("**/*.cs", "", "**/", "*.cs");
    assertParts("src/a?/**/b/*.java", "src/", "a?/**/b/", "*.java");
  }

  @Test
  public void absolutePatternKeepsItsRoot() {
    assertParts("/A/Glob/**/*.cs", "/A/Glob/", "**/", "*.cs");
  }

  @Test
  public void recursiveFilenameMeansEveryFile() {
    assertParts("**", "", "**/", "*");
    assertParts("dir/**", "dir/", "**/", "*");
    assertParts("a/*/**", "a/", "*/**/", "*");
  }

  @Test
  public void backslashesSeparateDirectories() {
    assertParts("Glob\\**\\*.cs", "Glob/", "**/", "*.cs");
  }

  @Test
  public void patternRemainderJoinsWildcardAndFilename() {
    assertThat(FileSpec.parse("Glob/**/*.cs").getPatternRemainder()).isEqualTo("**/*.cs");
    assertThat(FileSpec.parse("dir/a.txt").getPatternRemainder()).isEqualTo("a.txt");
  }

  @Test
  public void hasWildcards() {
    assertThat(FileSpec.hasWildcards("a/*.cs")).isTrue();
    assertThat(FileSpec.hasWildcards("a?.cs")).isTrue();
    assertThat(FileSpec.hasWildcards("a/b.cs")).isFalse();
  }
}
