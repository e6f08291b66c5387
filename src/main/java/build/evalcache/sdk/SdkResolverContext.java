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

import build.evalcache.common.io.EvaluationFileSystem;
import java.nio.file.Path;
import lombok.Getter;
import lombok.ToString;

/** What a resolver may know about the project requesting an SDK. */
@Getter
@ToString
public final class SdkResolverContext {
  private final Path projectFile;
  @ToString.Exclude private final EvaluationFileSystem fileSystem;

  public SdkResolverContext(Path projectFile, EvaluationFileSystem fileSystem) {
    this.projectFile = checkNotNull(projectFile);
    this.fileSystem = checkNotNull(fileSystem);
  }
}
