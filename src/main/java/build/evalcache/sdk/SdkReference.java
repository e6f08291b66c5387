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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Strings;
import javax.annotation.Nullable;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/** A project's reference to an SDK, by name and optionally by version. */
@Getter
@EqualsAndHashCode
public final class SdkReference {
  private final String name;
  @Nullable private final String version;
  @Nullable private final String minimumVersion;

  public SdkReference(String name, @Nullable String version, @Nullable String minimumVersion) {
    checkArgument(!Strings.isNullOrEmpty(name), "sdk name must not be empty");
    this.name = name;
    this.version = Strings.emptyToNull(version);
    this.minimumVersion = Strings.emptyToNull(minimumVersion);
  }

  public static SdkReference of(String name) {
    return new SdkReference(name, null, null);
  }

  public static SdkReference of(String name, @Nullable String version) {
    return new SdkReference(name, version, null);
  }

  /**
   * True if this reference accepts {@code version}. A reference without a version accepts any
   * version.
   */
  public boolean isSameVersion(@Nullable String version) {
    if (this.version == null) {
      return true;
    }
    return this.version.equalsIgnoreCase(version);
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder(name);
    if (version != null) {
      builder.append('/').append(version);
    }
    if (minimumVersion != null) {
      builder.append(" (min ").append(minimumVersion).append(')');
    }
    return builder.toString();
  }
}
