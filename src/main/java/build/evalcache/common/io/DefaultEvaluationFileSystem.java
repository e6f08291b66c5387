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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link EvaluationFileSystem} backed by {@link Files}. Works against whichever {@link
 * java.nio.file.FileSystem} the queried paths belong to.
 */
public final class DefaultEvaluationFileSystem implements EvaluationFileSystem {
  private static final DefaultEvaluationFileSystem INSTANCE = new DefaultEvaluationFileSystem();

  private DefaultEvaluationFileSystem() {}

  public static DefaultEvaluationFileSystem getInstance() {
    return INSTANCE;
  }

  @Override
  public boolean exists(Path path) {
    return Files.exists(path);
  }

  @Override
  public boolean directoryExists(Path path) {
    return Files.isDirectory(path);
  }

  @Override
  public boolean isSymbolicLink(Path path) {
    return Files.isSymbolicLink(path);
  }

  @Override
  public List<String> directoryEntries(Path directory) throws IOException {
    List<String> names = new ArrayList<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
      for (Path entry : stream) {
        names.add(entry.getFileName().toString());
      }
    } catch (NoSuchFileException | NotDirectoryException e) {
      return ImmutableList.of();
    }
    // stream order is platform dependent
    return ImmutableList.sortedCopyOf(Ordering.natural(), names);
  }
}
