package com.codeontology.core.builder.otp;

import com.codeontology.core.builder.AbstractEntityBuilder;
import com.codeontology.core.builder.BuildResult;
import com.codeontology.core.context.BuildContext;
import com.codeontology.core.graph.Iri;
import com.codeontology.core.graph.TripleBuilder;
import com.codeontology.core.graph.vocab.Otp;
import com.codeontology.core.model.TaskInfo;
import com.codeontology.core.model.TaskKind;

import java.util.Objects;

/**
 * Builds modules that run work through Task or Task.Supervisor.
 */
public class TaskBuilder extends AbstractEntityBuilder<TaskInfo> {

    @Override
    public BuildResult build(TaskInfo task, BuildContext context) {
        Objects.requireNonNull(task, "task must not be null");
        Iri taskIri = context.moduleIri(task.module());
        TripleBuilder triples = new TripleBuilder()
            .type(taskIri, task.kind() == TaskKind.TASK_SUPERVISOR ? Otp.TASK_SUPERVISOR : Otp.TASK);
        task.functionsUsed().forEach(function -> triples.string(taskIri, Otp.USES_TASK_FUNCTION, function));
        addLocation(triples, taskIri, task.location(), context);
        return result(taskIri, triples, context);
    }
}
