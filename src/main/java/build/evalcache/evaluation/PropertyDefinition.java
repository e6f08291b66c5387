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
package build.evalcache.evaluation;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Strings;
import javax.annotation.Nullable;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A property set by a project. If {@code existsCondition} is present the property is only set
 * when that path, relative to the project directory, exists.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class PropertyDefinition {
  private final String name;
  private final String value;
  @Nullable private final String existsCondition;

  public PropertyDefinition(String name, String value, @Nullable String existsCondition) {
    checkArgument(!Strings.isNullOrEmpty(name), "property name must not be empty");
    this.name = name;
    this.value = checkNotNull(value);
    this.existsCondition = Strings.emptyToNull(existsCondition);
  }

  public static PropertyDefinition of(String name, String value) {
    return new PropertyDefinition(name, value, null);
  }

  public static PropertyDefinition ifExists(String name, String value, String path) {
    return new PropertyDefinition(name, value, path);
  }
}
