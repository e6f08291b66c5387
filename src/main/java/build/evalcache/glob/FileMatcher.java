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

import build.evalcache.common.io.EvaluationFileSystem;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Walks a directory tree to find the files matched by a pattern remainder below a fixed directory
 * root. All probes go through the supplied {@link EvaluationFileSystem}, so a caching file system
 * makes repeated walks of the same tree cheap.
 */
public final class FileMatcher {
  private static final Splitter SEGMENTS = Splitter.on('/').omitEmptyStrings();

  private final EvaluationFileSystem fileSystem;

  public FileMatcher(EvaluationFileSystem fileSystem) {
    this.fileSystem = fileSystem;
  }

  /**
   * Returns the files below {@code fixedDirectoryRoot} matching {@code patternRemainder}, relative
   * to the root and separated with {@code /}, in traversal order. Files directly in a directory
   * are reported before the contents of its subdirectories.
   */
  public ImmutableList<String> getFiles(Path fixedDirectoryRoot, String patternRemainder)
      throws IOException {
    if (!fileSystem.directoryExists(fixedDirectoryRoot)) {
      return ImmutableList.of();
    }
    FileSpec spec = FileSpec.parse(patternRemainder);
    ImmutableList.Builder<WildcardPattern> segments = ImmutableList.builder();
    for (String segment :
        SEGMENTS.split(spec.getFixedDirectoryPart() + spec.getWildcardDirectoryPart())) {
      segments.add(WildcardPattern.compile(segment));
    }
    // recursive segments may reach the same file more than once
    Set<String> matches = new LinkedHashSet<>();
    visit(
        fixedDirectoryRoot,
        "",
        segments.build(),
        0,
        WildcardPattern.compile(spec.getFilenamePart()),
        matches);
    return ImmutableList.copyOf(matches);
  }

  private void visit(
      Path directory,
      String relativeDirectory,
      List<WildcardPattern> segments,
      int index,
      WildcardPattern filename,
      Set<String> matches)
      throws IOException {
    List<String> entries = fileSystem.directoryEntries(directory);
    if (index == segments.size()) {
      for (String name : entries) {
        if (filename.matches(name) && !fileSystem.directoryExists(directory.resolve(name))) {
          matches.add(relativeDirectory + name);
        }
      }
      return;
    }

    WildcardPattern segment = segments.get(index);
    if (segment.isRecursive()) {
      // ** matches zero directories here, then every subdirectory keeps the **
      visit(directory, relativeDirectory, segments, index + 1, filename, matches);
      for (String name : entries) {
        Path child = directory.resolve(name);
        // linked directories may loop back on an ancestor
        if (fileSystem.directoryExists(child) && !fileSystem.isSymbolicLink(child)) {
          visit(child, relativeDirectory + name + "/", segments, index, filename, matches);
        }
      }
      return;
    }

    for (String name : entries) {
      Path child = directory.resolve(name);
      if (segment.matches(name) && fileSystem.directoryExists(child)) {
        visit(child, relativeDirectory + name + "/", segments, index + 1, filename, matches);
      }
    }
  }
}
