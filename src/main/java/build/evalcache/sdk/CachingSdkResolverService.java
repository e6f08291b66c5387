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

package build.evalcache.sdk;

import static com.google.common.base.Preconditions.checkNotNull;

import build.evalcache.cache.SdkResolutionCache;

/** Routes every lookup through a {@link SdkResolutionCache} before the wrapped service. */
public final class CachingSdkResolverService implements SdkResolverService {
  private final SdkResolverService delegate;
  private final SdkResolutionCache cache;

  public CachingSdkResolverService(SdkResolverService delegate, SdkResolutionCache cache) {
    this.delegate = checkNotNull(delegate);
    this.cache = checkNotNull(cache);
  }

  public SdkResolverService getDelegate() {
    return delegate;
  }

  @Override
  public SdkResult resolveSdk(SdkReference reference, SdkResolverContext context) {
    return cache.resolve(reference, ref -> delegate.resolveSdk(ref, context));
  }
}
