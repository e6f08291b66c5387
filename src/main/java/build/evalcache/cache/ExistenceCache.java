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

import static com.google.common.base.Preconditions.checkNotNull;

import build.evalcache.common.io.EvaluationFileSystem;
import build.evalcache.common.io.PathNormalizer;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Level;
import javax.annotation.Nullable;
import lombok.extern.java.Log;

/**
 * Memoizes file and directory probes for the lifetime of an evaluation context.
 *
 * <p>The first query for a path reaches the delegate file system; every later query for the same
 * path returns the first answer, even if the file system has changed since. Enumeration failures
 * are remembered the same way and rethrown without probing again.
 */
@Log
public final class ExistenceCache implements EvaluationFileSystem {
  private final EvaluationFileSystem delegate;
  private final Cache<Path, Boolean> existence;
  private final Cache<Path, Boolean> directories;
  private final Cache<Path, Boolean> symbolicLinks;
  private final Cache<Path, Listing> listings;

  public ExistenceCache(EvaluationFileSystem delegate, boolean recordStats) {
    this.delegate = checkNotNull(delegate);
    existence = newCache(recordStats);
    directories = newCache(recordStats);
    symbolicLinks = newCache(recordStats);
    listings = newCache(recordStats);
  }

  private static <V> Cache<Path, V> newCache(boolean recordStats) {
    Caffeine<Object, Object> builder = Caffeine.newBuilder();
    if (recordStats) {
      builder.recordStats();
    }
    return builder.build();
  }

  public EvaluationFileSystem getDelegate() {
    return delegate;
  }

  @Override
  public boolean exists(Path path) {
    return existence.get(PathNormalizer.normalize(path), delegate::exists);
  }

  @Override
  public boolean directoryExists(Path path) {
    return directories.get(PathNormalizer.normalize(path), delegate::directoryExists);
  }

  @Override
  public boolean isSymbolicLink(Path path) {
    return symbolicLinks.get(PathNormalizer.normalize(path), delegate::isSymbolicLink);
  }

  @Override
  public List<String> directoryEntries(Path directory) throws IOException {
    return listings.get(PathNormalizer.normalize(directory), this::list).get();
  }

  private Listing list(Path directory) {
    log.log(Level.FINEST, "listing " + directory);
    try {
      return new Listing(ImmutableList.copyOf(delegate.directoryEntries(directory)), null);
    } catch (IOException e) {
      log.log(Level.FINE, "failed to list " + directory, e);
      return new Listing(null, e);
    }
  }

  public void invalidateAll() {
    existence.invalidateAll();
    directories.invalidateAll();
    symbolicLinks.invalidateAll();
    listings.invalidateAll();
  }

  public CacheStats stats() {
    return existence
        .stats()
        .plus(directories.stats())
        .plus(symbolicLinks.stats())
        .plus(listings.stats());
  }

  private static final class Listing {
    @Nullable private final ImmutableList<String> entries;
    @Nullable private final IOException failure;

    Listing(@Nullable ImmutableList<String> entries, @Nullable IOException failure) {
      this.entries = entries;
      this.failure = failure;
    }

    ImmutableList<String> get() throws IOException {
      if (failure != null) {
        throw new IOException(failure.getMessage(), failure);
      }
      return entries;
    }
  }
}
