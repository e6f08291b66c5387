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

import build.evalcache.common.io.PathNormalizer;
import build.evalcache.glob.FileMatcher;
import build.evalcache.glob.FileSpec;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.logging.Level;
import javax.annotation.Nullable;
import lombok.extern.java.Log;

/**
 * Memoizes glob expansions for item includes and imports, keyed by {@link GlobCacheKey}.
 *
 * <p>Entries hold matches relative to the key's fixed directory root. Each caller gets them back
 * in the shape of the pattern it wrote: relative patterns produce paths relative to the caller's
 * base directory, absolute patterns produce absolute paths.
 */
@Log
public final class GlobExpansionCache {
  private final FileMatcher fileMatcher;
  private final Cache<GlobCacheKey, ImmutableList<String>> expansions;

  /**
   * @param existenceCache the probes used while walking directories, so that repeated walks of
   *     the same tree across different patterns are served from memory.
   */
  public GlobExpansionCache(ExistenceCache existenceCache, boolean recordStats) {
    fileMatcher = new FileMatcher(existenceCache);
    Caffeine<Object, Object> builder = Caffeine.newBuilder();
    if (recordStats) {
      builder.recordStats();
    }
    expansions = builder.build();
  }

  public ImmutableList<String> expand(String pattern, Path baseDirectory) throws IOException {
    FileSpec spec = FileSpec.parse(pattern);
    ImmutableList<String> matches = getMatches(GlobCacheKey.of(spec, baseDirectory));
    return render(spec, baseDirectory, matches);
  }

  /** The cached matches for {@code key}, relative to its fixed directory root. */
  public ImmutableList<String> getMatches(GlobCacheKey key) throws IOException {
    try {
      return expansions.get(key, this::walk);
    } catch (UncheckedIOException e) {
      throw e.getCause();
    }
  }

  @Nullable
  public ImmutableList<String> getIfPresent(GlobCacheKey key) {
    return expansions.getIfPresent(key);
  }

  private ImmutableList<String> walk(GlobCacheKey key) {
    log.log(Level.FINEST, "expanding " + key);
    try {
      return fileMatcher.getFiles(key.getFixedDirectoryRoot(), key.getPatternRemainder());
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private static ImmutableList<String> render(
      FileSpec spec, Path baseDirectory, ImmutableList<String> matches) {
    String fixed = spec.getFixedDirectoryPart();
    ImmutableList.Builder<String> rendered = ImmutableList.builder();
    if (PathNormalizer.isAbsolute(baseDirectory, fixed)) {
      Path root = PathNormalizer.resolveDirectory(baseDirectory, fixed);
      for (String match : matches) {
        rendered.add(root.resolve(match).toString());
      }
    } else {
      String prefix = PathNormalizer.stripCurrentDirectory(fixed);
      for (String match : matches) {
        rendered.add(prefix + match);
      }
    }
    return rendered.build();
  }

  public long size() {
    return expansions.estimatedSize();
  }

  public void invalidateAll() {
    expansions.invalidateAll();
  }

  public CacheStats stats() {
    return expansions.stats();
  }
}
