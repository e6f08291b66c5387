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

package build.evalcache.common.io;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * The file system probes issued while evaluating a project.
 *
 * <p>Implementations may be handed to an {@link build.evalcache.context.EvaluationContext} to
 * replace the real file system, e.g. with an in-memory or virtual view of a workspace.
 */
public interface EvaluationFileSystem {
  /** True if a file or directory exists at {@code path}. */
  boolean exists(Path path);

  /** True if a directory exists at {@code path}. */
  boolean directoryExists(Path path);

  /** True if {@code path} is a symbolic link. Recursive wildcards do not descend through links. */
  default boolean isSymbolicLink(Path path) {
    return false;
  }

  /**
   * Names of the entries directly below {@code directory}, in a stable order. A directory that
   * does not exist has no entries.
   */
  List<String> directoryEntries(Path directory) throws IOException;
}
