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

import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import javax.annotation.Nullable;
import lombok.Getter;
import lombok.ToString;

/**
 * The outcome of resolving an {@link SdkReference}: either the location the SDK was found at, or
 * the errors explaining why it was not.
 */
@Getter
@ToString
public final class SdkResult {
  private final SdkReference reference;
  private final boolean success;
  @Nullable private final Path path;
  @Nullable private final String version;
  private final ImmutableList<String> errors;
  private final ImmutableList<String> warnings;

  private SdkResult(
      SdkReference reference,
      boolean success,
      @Nullable Path path,
      @Nullable String version,
      Iterable<String> errors,
      Iterable<String> warnings) {
    this.reference = checkNotNull(reference);
    this.success = success;
    this.path = path;
    this.version = version;
    this.errors = ImmutableList.copyOf(errors);
    this.warnings = ImmutableList.copyOf(warnings);
  }

  public static SdkResult success(
      SdkReference reference, Path path, @Nullable String version, Iterable<String> warnings) {
    return new SdkResult(
        reference, /* success=*/ true, checkNotNull(path), version, ImmutableList.of(), warnings);
  }

  public static SdkResult success(SdkReference reference, Path path, @Nullable String version) {
    return success(reference, path, version, ImmutableList.of());
  }

  public static SdkResult failure(
      SdkReference reference, Iterable<String> errors, Iterable<String> warnings) {
    return new SdkResult(reference, /* success=*/ false, null, null, errors, warnings);
  }

  public static SdkResult failure(SdkReference reference, String error) {
    return failure(reference, ImmutableList.of(error), ImmutableList.of());
  }
}
