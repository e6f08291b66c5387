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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Level;
import lombok.extern.java.Log;

/**
 * Asks each registered {@link SdkResolver}, lowest priority value first, until one of them
 * resolves the reference. When none does, the failure carries every resolver's errors.
 */
@Log
public class ResolverChainSdkResolverService implements SdkResolverService {
  private final ImmutableList<SdkResolver> resolvers;

  public ResolverChainSdkResolverService(Iterable<? extends SdkResolver> resolvers) {
    this.resolvers =
        ImmutableList.sortedCopyOf(
            Comparator.comparingInt(SdkResolver::getPriority), ImmutableList.copyOf(resolvers));
  }

  public static ResolverChainSdkResolverService empty() {
    return new ResolverChainSdkResolverService(ImmutableList.of());
  }

  public ImmutableList<SdkResolver> getResolvers() {
    return resolvers;
  }

  @Override
  public SdkResult resolveSdk(SdkReference reference, SdkResolverContext context) {
    List<String> errors = new ArrayList<>();
    List<String> warnings = new ArrayList<>();
    for (SdkResolver resolver : resolvers) {
      SdkResult result;
      try {
        result = resolver.resolve(reference, context);
      } catch (RuntimeException e) {
        log.log(
            Level.WARNING,
            String.format("sdk resolver %s failed on %s", resolver.getName(), reference),
            e);
        errors.add(String.format("%s: %s", resolver.getName(), e.getMessage()));
        continue;
      }
      if (result == null) {
        continue;
      }
      warnings.addAll(result.getWarnings());
      if (result.isSuccess()) {
        log.log(
            Level.FINE,
            String.format(
                "%s resolved %s to %s", resolver.getName(), reference, result.getPath()));
        return SdkResult.success(reference, result.getPath(), result.getVersion(), warnings);
      }
      errors.addAll(result.getErrors());
    }
    if (errors.isEmpty()) {
      errors.add(String.format("could not resolve sdk %s", reference));
    }
    return SdkResult.failure(reference, errors, warnings);
  }
}
