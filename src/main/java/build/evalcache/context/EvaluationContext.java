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

package build.evalcache.context;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import build.evalcache.cache.ExistenceCache;
import build.evalcache.cache.GlobExpansionCache;
import build.evalcache.cache.SdkResolutionCache;
import build.evalcache.common.io.DefaultEvaluationFileSystem;
import build.evalcache.common.io.EvaluationFileSystem;
import build.evalcache.sdk.CachingSdkResolverService;
import build.evalcache.sdk.ResolverChainSdkResolverService;
import build.evalcache.sdk.SdkResolverService;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import javax.annotation.Nullable;
import lombok.extern.java.Log;

/**
 * Holds the caches that evaluations consult for file system probes, glob expansions and SDK
 * resolutions.
 *
 * <p>Passing the same context to several evaluations lets them reuse each other's work. Whether
 * unrelated projects loaded from a context keep sharing it is decided by its {@link
 * SharingPolicy}: see {@link #contextForNewProject()}.
 *
 * <p>Cached state is never refreshed. Files added, removed or changed after a context first looked
 * at them stay invisible to evaluations using that context.
 */
@Log
public final class EvaluationContext {
  public enum SharingPolicy {
    /** Every project loaded from the context uses the context and its caches. */
    SHARED,
    /** Every new project gets a fresh context with empty caches. */
    ISOLATED
  }

  private static final AtomicLong nextId = new AtomicLong();

  private final long id;
  private final SharingPolicy policy;
  @Nullable private final EvaluationFileSystem fileSystemOverride;
  @Nullable private final SdkResolverService sdkResolverDelegate;
  private final boolean recordStats;
  private final ExistenceCache existenceCache;
  private final GlobExpansionCache globCache;
  private final SdkResolutionCache sdkCache;
  @Nullable private final CachingSdkResolverService sdkResolverService;

  private EvaluationContext(
      SharingPolicy policy,
      @Nullable EvaluationFileSystem fileSystemOverride,
      @Nullable SdkResolverService sdkResolverDelegate,
      boolean recordStats) {
    this.id = nextId.incrementAndGet();
    this.policy = policy;
    this.fileSystemOverride = fileSystemOverride;
    this.sdkResolverDelegate = sdkResolverDelegate;
    this.recordStats = recordStats;
    existenceCache =
        new ExistenceCache(
            fileSystemOverride != null
                ? fileSystemOverride
                : DefaultEvaluationFileSystem.getInstance(),
            recordStats);
    globCache = new GlobExpansionCache(existenceCache, recordStats);
    sdkCache = new SdkResolutionCache(recordStats);
    sdkResolverService =
        sdkResolverDelegate != null
            ? new CachingSdkResolverService(sdkResolverDelegate, sdkCache)
            : null;
    log.log(Level.FINE, "created " + this);
  }

  public static EvaluationContext create(SharingPolicy policy) {
    return create(policy, null);
  }

  /**
   * @param fileSystem replaces the real file system for every probe made through this context.
   *     Only allowed with {@link SharingPolicy#SHARED}.
   * @throws IllegalArgumentException if {@code fileSystem} is given with any other policy.
   */
  public static EvaluationContext create(
      SharingPolicy policy, @Nullable EvaluationFileSystem fileSystem) {
    return create(policy, fileSystem, null);
  }

  /**
   * @param sdkResolverService the resolvers behind this context's sdk cache; null to use the
   *     resolvers of whichever collection evaluates with the context.
   */
  public static EvaluationContext create(
      SharingPolicy policy,
      @Nullable EvaluationFileSystem fileSystem,
      @Nullable SdkResolverService sdkResolverService) {
    return create(policy, fileSystem, sdkResolverService, /* recordStats=*/ false);
  }

  public static EvaluationContext create(
      SharingPolicy policy,
      @Nullable EvaluationFileSystem fileSystem,
      @Nullable SdkResolverService sdkResolverService,
      boolean recordStats) {
    checkNotNull(policy, "policy");
    // isolated contexts are recreated per project without any override
    checkArgument(
        fileSystem == null || policy == SharingPolicy.SHARED,
        "a file system can only be supplied with the %s policy, not %s",
        SharingPolicy.SHARED,
        policy);
    return new EvaluationContext(policy, fileSystem, sdkResolverService, recordStats);
  }

  /**
   * The context a newly loaded project should use. Under {@link SharingPolicy#SHARED} this is the
   * context itself; under {@link SharingPolicy#ISOLATED} a new context with empty caches and the
   * same policy and SDK resolvers.
   */
  public EvaluationContext contextForNewProject() {
    switch (policy) {
      case SHARED:
        return this;
      case ISOLATED:
        return new EvaluationContext(policy, null, sdkResolverDelegate, recordStats);
      default:
        throw new IllegalStateException("unknown sharing policy " + policy);
    }
  }

  /** Forgets everything this context has cached. */
  public void resetCaches() {
    if (recordStats) {
      log.log(
          Level.FINE,
          String.format(
              "resetting %s: files %s, globs %s, sdks %s",
              this, existenceCache.stats(), globCache.stats(), sdkCache.stats()));
    } else {
      log.log(Level.FINE, "resetting " + this);
    }
    existenceCache.invalidateAll();
    globCache.invalidateAll();
    sdkCache.invalidateAll();
  }

  public long getId() {
    return id;
  }

  public SharingPolicy getPolicy() {
    return policy;
  }

  /** The caching view of the file system that evaluations must probe through. */
  public EvaluationFileSystem getFileSystem() {
    return existenceCache;
  }

  @Nullable
  public EvaluationFileSystem getFileSystemOverride() {
    return fileSystemOverride;
  }

  public ExistenceCache getExistenceCache() {
    return existenceCache;
  }

  public GlobExpansionCache getGlobCache() {
    return globCache;
  }

  public SdkResolutionCache getSdkCache() {
    return sdkCache;
  }

  /**
   * SDK resolution through this context's cache. A context created without resolvers resolves
   * nothing.
   */
  public SdkResolverService getSdkResolverService() {
    return getSdkResolverService(ResolverChainSdkResolverService.empty());
  }

  /**
   * SDK resolution through this context's cache, falling back to {@code resolvers} when the
   * context was created without resolvers of its own.
   */
  public SdkResolverService getSdkResolverService(SdkResolverService resolvers) {
    checkNotNull(resolvers);
    if (sdkResolverService != null) {
      return sdkResolverService;
    }
    return new CachingSdkResolverService(resolvers, sdkCache);
  }

  @Override
  public String toString() {
    return String.format("EvaluationContext[%d, %s]", id, policy);
  }
}
