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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.CharMatcher;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A file pattern split into the three parts that drive matching.
 *
 * <p>For {@code src/gen/**}{@code /*.java} the parts are:
 *
 * <ul>
 *   <li>fixed directory part: {@code src/gen/}, the longest prefix with no wildcard
 *   <li>wildcard directory part: {@code **}{@code /}
 *   <li>filename part: {@code *.java}
 * </ul>
 *
 * <p>Both {@code /} and {@code \} separate directories; parts always use {@code /}.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class FileSpec {
  public static final String RECURSIVE_DIRECTORY_MATCH = "**";

  private static final CharMatcher WILDCARDS = CharMatcher.anyOf("*?");

  private final String fixedDirectoryPart;
  private final String wildcardDirectoryPart;
  private final String filenamePart;

  private FileSpec(String fixedDirectoryPart, String wildcardDirectoryPart, String filenamePart) {
    this.fixedDirectoryPart = fixedDirectoryPart;
    this.wildcardDirectoryPart = wildcardDirectoryPart;
    this.filenamePart = filenamePart;
  }

  public static boolean hasWildcards(String filespec) {
    return WILDCARDS.matchesAnyOf(filespec);
  }

  public static FileSpec parse(String filespec) {
    String spec = checkNotNull(filespec).replace('\\', '/');
    int lastSeparator = spec.lastIndexOf('/');
    if (lastSeparator == -1) {
      // Source.cs, *.cs or **
      return recursiveFilename("", "", spec);
    }

    String filename = spec.substring(lastSeparator + 1);
    int firstWildcard = WILDCARDS.indexIn(spec);
    if (firstWildcard == -1 || firstWildcard > lastSeparator) {
      // dir1/Source.cs, dir1/*.cs, dir1/**
      return recursiveFilename(spec.substring(0, lastSeparator + 1), "", filename);
    }

    int separatorBeforeWildcard = spec.lastIndexOf('/', firstWildcard);
    if (separatorBeforeWildcard == -1) {
      // dir?/Source.cs
      return recursiveFilename("", spec.substring(0, lastSeparator + 1), filename);
    }
    return recursiveFilename(
        spec.substring(0, separatorBeforeWildcard + 1),
        spec.substring(separatorBeforeWildcard + 1, lastSeparator + 1),
        filename);
  }

  private static FileSpec recursiveFilename(String fixed, String wildcard, String filename) {
    // a trailing ** means every file at any depth
    if (RECURSIVE_DIRECTORY_MATCH.equals(filename)) {
      return new FileSpec(fixed, wildcard + RECURSIVE_DIRECTORY_MATCH + "/", "*");
    }
    return new FileSpec(fixed, wildcard, filename);
  }

  /** The part of the pattern below the fixed directory part. */
  public String getPatternRemainder() {
    return wildcardDirectoryPart + filenamePart;
  }
}
