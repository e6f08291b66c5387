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

import java.nio.file.Path;

/** Finds SDKs laid out as {@code <sdksPath>/<name>/Sdk} in a local directory. */
public final class DefaultSdkResolver implements SdkResolver {
  public static final int PRIORITY = 10000;

  private final Path sdksPath;

  public DefaultSdkResolver(Path sdksPath) {
    this.sdksPath = checkNotNull(sdksPath);
  }

  @Override
  public String getName() {
    return "DefaultSdkResolver";
  }

  @Override
  public int getPriority() {
    return PRIORITY;
  }

  @Override
  public SdkResult resolve(SdkReference reference, SdkResolverContext context) {
    Path sdkDirectory = sdksPath.resolve(reference.getName()).resolve("Sdk");
    if (context.getFileSystem().directoryExists(sdkDirectory)) {
      return SdkResult.success(reference, sdkDirectory, reference.getVersion());
    }
    return SdkResult.failure(
        reference, String.format("sdk %s not found in %s", reference.getName(), sdksPath));
  }
}
