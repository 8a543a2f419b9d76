package com.codeontology.core.builder.otp;

import com.codeontology.core.builder.AbstractEntityBuilder;
import com.codeontology.core.builder.BuildResult;
import com.codeontology.core.context.BuildContext;
import com.codeontology.core.graph.Iri;
import com.codeontology.core.graph.TripleBuilder;
import com.codeontology.core.graph.vocab.Otp;
import com.codeontology.core.model.AgentInfo;

import java.util.Objects;

/**
 * Builds Agent modules.
 */
public class AgentBuilder extends AbstractEntityBuilder<AgentInfo> {

    @Override
    public BuildResult build(AgentInfo agent, BuildContext context) {
        Objects.requireNonNull(agent, "agent must not be null");
        Iri agentIri = context.moduleIri(agent.module());
        TripleBuilder triples = new TripleBuilder()
            .type(agentIri, Otp.AGENT)
            .link(agentIri, Otp.IMPLEMENTS_OTP_BEHAVIOUR, Otp.AGENT);
        agent.functionsUsed().forEach(function -> triples.string(agentIri, Otp.USES_AGENT_FUNCTION, function));
        addLocation(triples, agentIri, agent.location(), context);
        return result(agentIri, triples, context);
    }
}
