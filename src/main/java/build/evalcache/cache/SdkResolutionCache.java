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

import build.evalcache.sdk.SdkReference;
import build.evalcache.sdk.SdkResult;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.google.common.base.Ascii;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;
import java.util.logging.Level;
import javax.annotation.Nullable;
import lombok.EqualsAndHashCode;
import lombok.extern.java.Log;

/**
 * Memoizes SDK resolutions by name and version. Failures are memoized like successes, so a
 * reference that could not be resolved stays unresolved for the lifetime of the cache.
 *
 * <p>Concurrent first requests for the same key wait on a single resolution: the first caller
 * runs the resolver and publishes its result to all of them.
 */
@Log
public final class SdkResolutionCache {
  private final Cache<Key, SdkResult> results;
  // first version resolved for each sdk name
  private final ConcurrentMap<String, String> versionsByName = new ConcurrentHashMap<>();

  public SdkResolutionCache(boolean recordStats) {
    Caffeine<Object, Object> builder = Caffeine.newBuilder();
    if (recordStats) {
      builder.recordStats();
    }
    results = builder.build();
  }

  public SdkResult resolve(SdkReference reference, Function<SdkReference, SdkResult> resolver) {
    return results.get(
        new Key(reference),
        key -> {
          String version = Objects.toString(key.version, "");
          String previous = versionsByName.putIfAbsent(key.name, version);
          if (previous != null && !previous.equals(version)) {
            log.log(
                Level.WARNING,
                String.format(
                    "sdk %s is referenced with version \"%s\" and \"%s\"",
                    reference.getName(), previous, version));
          }
          return checkNotNull(resolver.apply(reference), "resolver result");
        });
  }

  @Nullable
  public SdkResult getIfPresent(SdkReference reference) {
    return results.getIfPresent(new Key(reference));
  }

  public long size() {
    return results.estimatedSize();
  }

  public void invalidateAll() {
    results.invalidateAll();
    versionsByName.clear();
  }

  public CacheStats stats() {
    return results.stats();
  }

  @EqualsAndHashCode
  private static final class Key {
    private final String name;
    @Nullable private final String version;

    Key(SdkReference reference) {
      name = Ascii.toLowerCase(reference.getName());
      version = reference.getVersion() == null ? null : Ascii.toLowerCase(reference.getVersion());
    }
  }
}
