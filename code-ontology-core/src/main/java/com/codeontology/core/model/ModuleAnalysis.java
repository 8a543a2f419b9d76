package com.codeontology.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Everything extracted from one module, as consumed by the orchestrator.
 *
 * <p>Single-valued facts are null when the module does not have them.
 *
 * @param module module facts
 * @param functions named functions, macros, guards and delegates
 * @param attributes module attributes
 * @param types type definitions
 * @param specs specs and callback specs
 * @param struct struct declaration, or null
 * @param exception exception declaration, or null
 * @param behaviour behaviour facts, or null when the module neither defines nor adopts one
 * @param protocol protocol definition, or null
 * @param implementations protocol implementations defined by this module
 * @param genServer GenServer facts, or null
 * @param supervisor supervisor facts, or null
 * @param agent Agent usage, or null
 * @param task Task usage, or null
 * @param calls calls in function bodies
 * @param controlFlows control-flow and exception expressions in function bodies
 * @param anonymousFunctions anonymous functions
 * @param captures capture expressions
 * @param quotes quote blocks
 * @param macroInvocations macro invocations
 */
public record ModuleAnalysis(
    ModuleInfo module,
    List<FunctionInfo> functions,
    List<AttributeInfo> attributes,
    List<TypeDefinitionInfo> types,
    List<FunctionSpecInfo> specs,
    StructInfo struct,
    ExceptionInfo exception,
    BehaviourInfo behaviour,
    ProtocolInfo protocol,
    List<ProtocolImplementationInfo> implementations,
    GenServerInfo genServer,
    SupervisorInfo supervisor,
    AgentInfo agent,
    TaskInfo task,
    List<CallInfo> calls,
    List<ControlFlowInfo> controlFlows,
    List<AnonymousFunctionInfo> anonymousFunctions,
    List<CaptureInfo> captures,
    List<QuoteInfo> quotes,
    List<MacroInvocationInfo> macroInvocations
) {
    public ModuleAnalysis {
        functions = functions != null ? List.copyOf(functions) : List.of();
        attributes = attributes != null ? List.copyOf(attributes) : List.of();
        types = types != null ? List.copyOf(types) : List.of();
        specs = specs != null ? List.copyOf(specs) : List.of();
        implementations = implementations != null ? List.copyOf(implementations) : List.of();
        calls = calls != null ? List.copyOf(calls) : List.of();
        controlFlows = controlFlows != null ? List.copyOf(controlFlows) : List.of();
        anonymousFunctions = anonymousFunctions != null ? List.copyOf(anonymousFunctions) : List.of();
        captures = captures != null ? List.copyOf(captures) : List.of();
        quotes = quotes != null ? List.copyOf(quotes) : List.of();
        macroInvocations = macroInvocations != null ? List.copyOf(macroInvocations) : List.of();
    }

    /**
     * Creates an analysis holding only module facts.
     *
     * @param module module facts
     * @return analysis with no entities
     */
    public static ModuleAnalysis of(ModuleInfo module) {
        return builder().module(module).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String moduleName() {
        return module == null ? null : module.name();
    }

    /**
     * Mutable builder used by the extractors.
     */
    public static final class Builder {
        private ModuleInfo module;
        private List<FunctionInfo> functions = List.of();
        private List<AttributeInfo> attributes = List.of();
        private List<TypeDefinitionInfo> types = List.of();
        private List<FunctionSpecInfo> specs = List.of();
        private StructInfo struct;
        private ExceptionInfo exception;
        private BehaviourInfo behaviour;
        private ProtocolInfo protocol;
        private List<ProtocolImplementationInfo> implementations = List.of();
        private GenServerInfo genServer;
        private SupervisorInfo supervisor;
        private AgentInfo agent;
        private TaskInfo task;
        private List<CallInfo> calls = List.of();
        private List<ControlFlowInfo> controlFlows = List.of();
        private List<AnonymousFunctionInfo> anonymousFunctions = List.of();
        private List<CaptureInfo> captures = List.of();
        private List<QuoteInfo> quotes = List.of();
        private List<MacroInvocationInfo> macroInvocations = List.of();

        private Builder() {
        }

        public Builder module(ModuleInfo value) {
            this.module = Objects.requireNonNull(value, "module must not be null");
            return this;
        }

        public Builder functions(List<FunctionInfo> value) {
            this.functions = value;
            return this;
        }

        public Builder attributes(List<AttributeInfo> value) {
            this.attributes = value;
            return this;
        }

        public Builder types(List<TypeDefinitionInfo> value) {
            this.types = value;
            return this;
        }

        public Builder specs(List<FunctionSpecInfo> value) {
            this.specs = value;
            return this;
        }

        public Builder struct(StructInfo value) {
            this.struct = value;
            return this;
        }

        public Builder exception(ExceptionInfo value) {
            this.exception = value;
            return this;
        }

        public Builder behaviour(BehaviourInfo value) {
            this.behaviour = value;
            return this;
        }

        public Builder protocol(ProtocolInfo value) {
            this.protocol = value;
            return this;
        }

        public Builder implementations(List<ProtocolImplementationInfo> value) {
            this.implementations = value;
            return this;
        }

        public Builder genServer(GenServerInfo value) {
            this.genServer = value;
            return this;
        }

        public Builder supervisor(SupervisorInfo value) {
            this.supervisor = value;
            return this;
        }

        public Builder agent(AgentInfo value) {
            this.agent = value;
            return this;
        }

        public Builder task(TaskInfo value) {
            this.task = value;
            return this;
        }

        public Builder calls(List<CallInfo> value) {
            this.calls = value;
            return this;
        }

        public Builder controlFlows(List<ControlFlowInfo> value) {
            this.controlFlows = value;
            return this;
        }

        public Builder anonymousFunctions(List<AnonymousFunctionInfo> value) {
            this.anonymousFunctions = value;
            return this;
        }

        public Builder captures(List<CaptureInfo> value) {
            this.captures = value;
            return this;
        }

        public Builder quotes(List<QuoteInfo> value) {
            this.quotes = value;
            return this;
        }

        public Builder macroInvocations(List<MacroInvocationInfo> value) {
            this.macroInvocations = value;
            return this;
        }

        public ModuleAnalysis build() {
            return new ModuleAnalysis(module, functions, attributes, types, specs, struct, exception,
                behaviour, protocol, implementations, genServer, supervisor, agent, task, calls,
                controlFlows, anonymousFunctions, captures, quotes, macroInvocations);
        }
    }
}
