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
package build.evalcache.common.config;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class EvaluationConfigsTest {
  private final FileSystem fileSystem = Jimfs.newFileSystem(Configuration.unix());

  private Path write(String... lines) throws IOException {
    Path path = fileSystem.getPath("/config.yml");
    Files.write(path, ImmutableList.copyOf(lines), UTF_8);
    return path;
  }

  @Test
  public void loadsEverySetting() throws IOException {
    Path path =
        write(
            "sdksPath: /opt/sdks",
            "toolsetDefinitions: /etc/toolsets.yml",
            "recordCacheStats: true");

    EvaluationConfigs configs = EvaluationConfigs.loadConfigs(path);

    assertThat(configs.getSdksPath()).isEqualTo("/opt/sdks");
    assertThat(configs.getToolsetDefinitions()).isEqualTo("/etc/toolsets.yml");
    assertThat(configs.isRecordCacheStats()).isTrue();
  }

  @Test
  public void omittedSettingsKeepDefaults() throws IOException {
    EvaluationConfigs configs = EvaluationConfigs.loadConfigs(write("sdksPath: /opt/sdks"));

    assertThat(configs.getToolsetDefinitions()).isNull();
    assertThat(configs.isRecordCacheStats()).isFalse();
  }

  @Test
  public void emptyFileIsAnError() throws IOException {
    Path path = write();

    assertThrows(IOException.class, () -> EvaluationConfigs.loadConfigs(path));
  }

  @Test
  public void missingFileIsAnError() {
    assertThrows(
        IOException.class, () -> EvaluationConfigs.loadConfigs(fileSystem.getPath("/missing.yml")));
  }
}
