package com.codeontology.core.builder.otp;

import com.codeontology.core.builder.AbstractEntityBuilder;
import com.codeontology.core.builder.BuildResult;
import com.codeontology.core.context.BuildContext;
import com.codeontology.core.graph.Iri;
import com.codeontology.core.graph.IriGenerator;
import com.codeontology.core.graph.TripleBuilder;
import com.codeontology.core.graph.vocab.Otp;
import com.codeontology.core.model.GenServerCallbackInfo;
import com.codeontology.core.model.GenServerCallbackType;
import com.codeontology.core.model.GenServerInfo;

import java.util.Objects;

/**
 * Builds GenServer implementations and their typed callbacks.
 *
 * <p>The implementation shares the module IRI; each callback is typed on the IRI of the function
 * implementing it.
 */
public class GenServerBuilder extends AbstractEntityBuilder<GenServerInfo> {

    @Override
    public BuildResult build(GenServerInfo genServer, BuildContext context) {
        Objects.requireNonNull(genServer, "genServer must not be null");
        Iri genServerIri = context.moduleIri(genServer.module());

        TripleBuilder triples = new TripleBuilder()
            .type(genServerIri, Otp.GEN_SERVER_IMPLEMENTATION)
            .link(genServerIri, Otp.IMPLEMENTS_OTP_BEHAVIOUR, Otp.GEN_SERVER);
        addLocation(triples, genServerIri, genServer.location(), context);

        for (GenServerCallbackInfo callback : genServer.callbacks()) {
            Iri callbackIri = IriGenerator.forFunction(context.baseIri(), genServer.module(),
                callback.type().functionName(), callback.arity());
            triples.type(callbackIri, Otp.GEN_SERVER_CALLBACK)
                .type(callbackIri, callbackClass(callback.type()))
                .link(genServerIri, Otp.HAS_GEN_SERVER_CALLBACK, callbackIri);
            addLocation(triples, callbackIri, callback.location(), context);
        }
        log.trace("GenServer {} detected by {} with {} callbacks", genServer.module(), genServer.detection(),
            genServer.callbacks().size());
        return result(genServerIri, triples, context);
    }

    static Iri callbackClass(GenServerCallbackType type) {
        return switch (type) {
            case INIT -> Otp.INIT_CALLBACK;
            case HANDLE_CALL -> Otp.HANDLE_CALL_CALLBACK;
            case HANDLE_CAST -> Otp.HANDLE_CAST_CALLBACK;
            case HANDLE_INFO -> Otp.HANDLE_INFO_CALLBACK;
            case HANDLE_CONTINUE -> Otp.HANDLE_CONTINUE_CALLBACK;
            case TERMINATE -> Otp.TERMINATE_CALLBACK;
            case CODE_CHANGE -> Otp.CODE_CHANGE_CALLBACK;
            case FORMAT_STATUS -> Otp.FORMAT_STATUS_CALLBACK;
        };
    }
}
