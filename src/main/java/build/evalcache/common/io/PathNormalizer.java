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

import java.nio.file.Path;

public final class PathNormalizer {
  private PathNormalizer() {}

  /** Absolute form of {@code path} with {@code .} and {@code ..} segments removed. */
  public static Path normalize(Path path) {
    return path.toAbsolutePath().normalize();
  }

  /**
   * Resolves a directory fragment written with {@code /} separators against {@code base}. An
   * absolute fragment ignores {@code base}; an empty fragment names {@code base} itself.
   */
  public static Path resolveDirectory(Path base, String directory) {
    if (directory.isEmpty()) {
      return normalize(base);
    }
    String trimmed = directory;
    while (trimmed.length() > 1 && trimmed.endsWith("/")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    return normalize(base.resolve(trimmed));
  }

  public static boolean isAbsolute(Path base, String path) {
    return !path.isEmpty() && base.getFileSystem().getPath(path).isAbsolute();
  }

  /** Drops any number of leading {@code ./} segments. */
  public static String stripCurrentDirectory(String path) {
    String stripped = path;
    while (stripped.startsWith("./")) {
      stripped = stripped.substring(2);
    }
    return stripped;
  }
}
