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

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.annotation.Nullable;
import lombok.Data;
import lombok.extern.java.Log;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Settings for a project collection, loaded from YAML:
 *
 * <pre>
 * sdksPath: /opt/sdks
 * toolsetDefinitions: /etc/evalcache/toolsets.yml
 * recordCacheStats: true
 * </pre>
 */
@Data
@Log
public final class EvaluationConfigs {
  /** Directory searched by the default sdk resolver. Unset disables it. */
  @Nullable private String sdksPath;

  /** YAML toolset definitions file. Unset means no toolsets are defined. */
  @Nullable private String toolsetDefinitions;

  private boolean recordCacheStats = false;

  public static EvaluationConfigs loadConfigs(Path configLocation) throws IOException {
    log.info("Loading configs from " + configLocation);
    try (InputStream inputStream = Files.newInputStream(configLocation)) {
      Yaml yaml = new Yaml(new Constructor(EvaluationConfigs.class, new LoaderOptions()));
      EvaluationConfigs configs = yaml.load(inputStream);
      if (configs == null) {
        throw new IOException("Could not load configs from path: " + configLocation);
      }
      log.info(configs.toString());
      return configs;
    }
  }
}
