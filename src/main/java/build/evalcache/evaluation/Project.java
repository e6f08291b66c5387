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

import static com.google.common.base.Preconditions.checkNotNull;

import build.evalcache.context.EvaluationContext;
import java.io.IOException;
import javax.annotation.Nullable;

/**
 * A project loaded into a {@link ProjectCollection}, together with the context its evaluations
 * use.
 *
 * <p>Loading asks the supplied context for {@link EvaluationContext#contextForNewProject()}, or
 * creates an isolated context when none is supplied. Re-evaluations keep that context unless
 * another one is passed to {@link #reevaluate(EvaluationContext)}.
 */
public final class Project {
  private final ProjectDefinition definition;
  private final ProjectCollection collection;
  private EvaluationContext lastEvaluationContext;
  private EvaluationResult lastResult;

  Project(
      ProjectDefinition definition,
      ProjectCollection collection,
      @Nullable EvaluationContext context)
      throws IOException {
    this.definition = checkNotNull(definition);
    this.collection = checkNotNull(collection);
    reevaluate(
        context != null ? context.contextForNewProject() : collection.newDefaultContext());
  }

  public synchronized EvaluationResult reevaluate() throws IOException {
    return reevaluate(lastEvaluationContext);
  }

  /** Evaluates with {@code context} as given, and keeps it for later re-evaluations. */
  public synchronized EvaluationResult reevaluate(EvaluationContext context) throws IOException {
    checkNotNull(context);
    lastEvaluationContext = context;
    lastResult = collection.evaluate(definition, context);
    return lastResult;
  }

  public ProjectDefinition getDefinition() {
    return definition;
  }

  public synchronized EvaluationContext getLastEvaluationContext() {
    return lastEvaluationContext;
  }

  public synchronized EvaluationResult getLastResult() {
    return lastResult;
  }

  @Override
  public String toString() {
    return "Project[" + definition.getProjectFile() + "]";
  }
}
