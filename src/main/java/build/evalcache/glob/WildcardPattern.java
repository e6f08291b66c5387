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

package build.evalcache.glob;

import java.util.regex.Pattern;

/**
 * Matches a single path segment against {@code *} and {@code ?} wildcards. The segment {@code **}
 * compiles to the recursive pattern, which stands for any number of directories.
 */
final class WildcardPattern {
  static final WildcardPattern RECURSIVE =
      new WildcardPattern(
          FileSpec.RECURSIVE_DIRECTORY_MATCH, Pattern.compile(".*", Pattern.DOTALL));

  private final String text;
  private final Pattern pattern;

  private WildcardPattern(String text, Pattern pattern) {
    this.text = text;
    this.pattern = pattern;
  }

  static WildcardPattern compile(String segment) {
    if (segment.equals(FileSpec.RECURSIVE_DIRECTORY_MATCH)) {
      return RECURSIVE;
    }
    if (segment.equals("*.*")) {
      // also matches names without an extension
      return new WildcardPattern(segment, Pattern.compile(".*", Pattern.DOTALL));
    }
    StringBuilder regex = new StringBuilder();
    StringBuilder literal = new StringBuilder();
    for (char c : segment.toCharArray()) {
      if (c == '*' || c == '?') {
        if (literal.length() > 0) {
          regex.append(Pattern.quote(literal.toString()));
          literal.setLength(0);
        }
        regex.append(c == '*' ? ".*" : ".");
      } else {
        literal.append(c);
      }
    }
    if (literal.length() > 0) {
      regex.append(Pattern.quote(literal.toString()));
    }
    return new WildcardPattern(segment, Pattern.compile(regex.toString(), Pattern.DOTALL));
  }

  boolean isRecursive() {
    return this == RECURSIVE;
  }

  boolean matches(String name) {
    return pattern.matcher(name).matches();
  }

  @Override
  public String toString() {
    return text;
  }
}
