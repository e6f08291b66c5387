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

import javax.annotation.Nullable;

/** A pluggable strategy for locating SDKs. */
public interface SdkResolver {
  String getName();

  /** Resolvers with a lower priority value are asked first. */
  int getPriority();

  /**
   * Attempts to resolve {@code reference}.
   *
   * @return a successful or failed result, or {@code null} if this resolver does not handle the
   *     reference at all.
   */
  @Nullable
  SdkResult resolve(SdkReference reference, SdkResolverContext context);
}
