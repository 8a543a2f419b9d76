package com.codeontology.core.graph.vocab;

import com.codeontology.core.graph.Iri;

/**
 * Terms of the OTP vocabulary: GenServers, supervisors, agents and tasks.
 */
public final class Otp {

    public static final String NS = "https://w3id.org/elixir-code/otp#";

    // Behaviours
    public static final Iri GEN_SERVER = term("GenServer");
    public static final Iri SUPERVISOR_BEHAVIOUR = term("SupervisorBehaviour");
    public static final Iri GEN_SERVER_IMPLEMENTATION = term("GenServerImplementation");
    public static final Iri SUPERVISOR = term("Supervisor");
    public static final Iri DYNAMIC_SUPERVISOR = term("DynamicSupervisor");
    public static final Iri AGENT = term("Agent");
    public static final Iri TASK = term("Task");
    public static final Iri TASK_SUPERVISOR = term("TaskSupervisor");

    // GenServer callbacks
    public static final Iri GEN_SERVER_CALLBACK = term("GenServerCallback");
    public static final Iri INIT_CALLBACK = term("InitCallback");
    public static final Iri HANDLE_CALL_CALLBACK = term("HandleCallCallback");
    public static final Iri HANDLE_CAST_CALLBACK = term("HandleCastCallback");
    public static final Iri HANDLE_INFO_CALLBACK = term("HandleInfoCallback");
    public static final Iri HANDLE_CONTINUE_CALLBACK = term("HandleContinueCallback");
    public static final Iri TERMINATE_CALLBACK = term("TerminateCallback");
    public static final Iri CODE_CHANGE_CALLBACK = term("CodeChangeCallback");
    public static final Iri FORMAT_STATUS_CALLBACK = term("FormatStatusCallback");

    // Supervision
    public static final Iri CHILD_SPEC = term("ChildSpec");
    public static final Iri ONE_FOR_ONE = term("OneForOne");
    public static final Iri ONE_FOR_ALL = term("OneForAll");
    public static final Iri REST_FOR_ONE = term("RestForOne");
    public static final Iri PERMANENT = term("Permanent");
    public static final Iri TEMPORARY = term("Temporary");
    public static final Iri TRANSIENT = term("Transient");
    public static final Iri WORKER_TYPE = term("WorkerType");
    public static final Iri SUPERVISOR_TYPE = term("SupervisorType");

    // Properties
    public static final Iri IMPLEMENTS_OTP_BEHAVIOUR = term("implementsOTPBehaviour");
    public static final Iri HAS_GEN_SERVER_CALLBACK = term("hasGenServerCallback");
    public static final Iri HAS_STRATEGY = term("hasStrategy");
    public static final Iri MAX_RESTARTS = term("maxRestarts");
    public static final Iri MAX_SECONDS = term("maxSeconds");
    public static final Iri HAS_CHILD_SPEC = term("hasChildSpec");
    public static final Iri CHILD_ID = term("childId");
    public static final Iri START_MODULE = term("startModule");
    public static final Iri START_FUNCTION = term("startFunction");
    public static final Iri HAS_RESTART_STRATEGY = term("hasRestartStrategy");
    public static final Iri HAS_CHILD_TYPE = term("hasChildType");
    public static final Iri SUPERVISES = term("supervises");
    public static final Iri USES_AGENT_FUNCTION = term("usesAgentFunction");
    public static final Iri USES_TASK_FUNCTION = term("usesTaskFunction");

    private Otp() {
        // Utility class - no instantiation
    }

    private static Iri term(String localName) {
        return new Iri(NS + localName);
    }
}
