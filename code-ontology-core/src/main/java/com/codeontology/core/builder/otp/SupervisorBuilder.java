package com.codeontology.core.builder.otp;

import com.codeontology.core.builder.AbstractEntityBuilder;
import com.codeontology.core.builder.BuildResult;
import com.codeontology.core.context.BuildContext;
import com.codeontology.core.graph.Iri;
import com.codeontology.core.graph.IriGenerator;
import com.codeontology.core.graph.TripleBuilder;
import com.codeontology.core.graph.vocab.Otp;
import com.codeontology.core.model.ChildSpecInfo;
import com.codeontology.core.model.ChildType;
import com.codeontology.core.model.RestartType;
import com.codeontology.core.model.SupervisorInfo;
import com.codeontology.core.model.SupervisorKind;
import com.codeontology.core.model.SupervisorStrategy;

import java.util.List;
import java.util.Objects;

/**
 * Builds Supervisor and DynamicSupervisor modules with their child specs.
 *
 * <p>Restart intensity falls back to 3 restarts in 5 seconds when {@code init} does not set it.
 * A DynamicSupervisor always runs {@code :one_for_one}. Child specs without a restart option are
 * permanent.
 */
public class SupervisorBuilder extends AbstractEntityBuilder<SupervisorInfo> {

    @Override
    public BuildResult build(SupervisorInfo supervisor, BuildContext context) {
        Objects.requireNonNull(supervisor, "supervisor must not be null");
        Iri supervisorIri = context.moduleIri(supervisor.module());

        TripleBuilder triples = new TripleBuilder()
            .type(supervisorIri, supervisor.kind() == SupervisorKind.DYNAMIC ? Otp.DYNAMIC_SUPERVISOR : Otp.SUPERVISOR)
            .link(supervisorIri, Otp.IMPLEMENTS_OTP_BEHAVIOUR, Otp.SUPERVISOR_BEHAVIOUR)
            .nonNegative(supervisorIri, Otp.MAX_RESTARTS, supervisor.effectiveMaxRestarts())
            .nonNegative(supervisorIri, Otp.MAX_SECONDS, supervisor.effectiveMaxSeconds());

        SupervisorStrategy strategy = supervisor.strategy();
        if (strategy == null && supervisor.kind() == SupervisorKind.DYNAMIC) {
            strategy = SupervisorStrategy.ONE_FOR_ONE;
        }
        if (strategy != null) {
            triples.link(supervisorIri, Otp.HAS_STRATEGY, strategyIri(strategy));
        }
        addLocation(triples, supervisorIri, supervisor.location(), context);

        List<ChildSpecInfo> children = supervisor.children();
        for (int i = 0; i < children.size(); i++) {
            addChildSpec(triples, supervisorIri, children.get(i), i, context);
        }
        return result(supervisorIri, triples, context);
    }

    private void addChildSpec(TripleBuilder triples, Iri supervisorIri, ChildSpecInfo child, int index,
                              BuildContext context) {
        Iri childIri = IriGenerator.forChildSpec(supervisorIri, child.id(), index);
        RestartType restart = child.restart() != null ? child.restart() : RestartType.PERMANENT;
        triples.type(childIri, Otp.CHILD_SPEC)
            .link(supervisorIri, Otp.HAS_CHILD_SPEC, childIri)
            .string(childIri, Otp.CHILD_ID, child.id())
            .string(childIri, Otp.START_MODULE, child.startModule())
            .string(childIri, Otp.START_FUNCTION, child.startFunction())
            .link(childIri, Otp.HAS_RESTART_STRATEGY, restartIri(restart))
            .link(childIri, Otp.HAS_CHILD_TYPE, child.type() == ChildType.SUPERVISOR ? Otp.SUPERVISOR_TYPE : Otp.WORKER_TYPE)
            .link(supervisorIri, Otp.SUPERVISES, context.moduleIri(child.startModule()));
        addLocation(triples, childIri, child.location(), context);
    }

    static Iri strategyIri(SupervisorStrategy strategy) {
        return switch (strategy) {
            case ONE_FOR_ONE -> Otp.ONE_FOR_ONE;
            case ONE_FOR_ALL -> Otp.ONE_FOR_ALL;
            case REST_FOR_ONE -> Otp.REST_FOR_ONE;
        };
    }

    static Iri restartIri(RestartType restart) {
        return switch (restart) {
            case PERMANENT -> Otp.PERMANENT;
            case TEMPORARY -> Otp.TEMPORARY;
            case TRANSIENT -> Otp.TRANSIENT;
        };
    }
}
