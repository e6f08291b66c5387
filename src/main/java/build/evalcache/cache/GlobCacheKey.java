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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import build.evalcache.common.io.PathNormalizer;
import build.evalcache.glob.FileSpec;
import java.nio.file.Path;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Identifies a glob expansion by the absolute directory its pattern is anchored to and the
 * wildcard remainder below it.
 *
 * <p>The same relative pattern written in two different project directories yields two keys,
 * while an absolute pattern pointing into another project's directory yields the key of that
 * project's equivalent relative pattern.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class GlobCacheKey {
  private final Path fixedDirectoryRoot;
  private final String patternRemainder;

  public GlobCacheKey(Path fixedDirectoryRoot, String patternRemainder) {
    checkArgument(fixedDirectoryRoot.isAbsolute(), "root must be absolute: %s", fixedDirectoryRoot);
    this.fixedDirectoryRoot = fixedDirectoryRoot.normalize();
    this.patternRemainder = checkNotNull(patternRemainder);
  }

  public static GlobCacheKey of(String pattern, Path baseDirectory) {
    return of(FileSpec.parse(pattern), baseDirectory);
  }

  static GlobCacheKey of(FileSpec spec, Path baseDirectory) {
    return new GlobCacheKey(
        PathNormalizer.resolveDirectory(baseDirectory, spec.getFixedDirectoryPart()),
        spec.getPatternRemainder());
  }
}
