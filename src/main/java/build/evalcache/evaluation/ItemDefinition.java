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

import com.google.common.base.Strings;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** An item include: the item type and the path or wildcard pattern it includes. */
@Getter
@EqualsAndHashCode
@ToString
public final class ItemDefinition {
  private final String itemType;
  private final String include;

  public ItemDefinition(String itemType, String include) {
    checkArgument(!Strings.isNullOrEmpty(itemType), "item type must not be empty");
    checkArgument(!Strings.isNullOrEmpty(include), "include must not be empty");
    this.itemType = itemType;
    this.include = include;
  }
}
