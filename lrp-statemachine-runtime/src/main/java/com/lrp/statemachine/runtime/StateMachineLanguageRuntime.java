package com.lrp.statemachine.runtime;

import com.lrp.config.LrpConfig;
import com.lrp.protocol.LanguageRuntime;
import com.lrp.protocol.json.LrpJson;
import com.lrp.protocol.message.BreakpointType;
import com.lrp.protocol.message.CheckBreakpointArgs;
import com.lrp.protocol.message.CheckBreakpointResponse;
import com.lrp.protocol.message.GetBreakpointTypesResponse;
import com.lrp.protocol.message.GetRuntimeStateResponse;
import com.lrp.protocol.message.InitResponse;
import com.lrp.protocol.message.ParseResponse;
import com.lrp.protocol.message.StepResponse;
import com.lrp.protocol.model.ASTElement;
import com.lrp.protocol.model.IdGenerator;
import com.lrp.statemachine.ast.StateMachine;
import com.lrp.statemachine.ast.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link LanguageRuntime} for state machines. Keeps one {@link DebugSession} per source file:
 * parsing a file creates a session with its own id generator and AST, starting an execution
 * attaches a {@link Runtime} from the {@link RuntimeFactory}. Parsing and stepping are delegated
 * to the injected collaborators; this class builds the response records.
 */
public final class StateMachineLanguageRuntime implements LanguageRuntime {

    private static final Logger log = LoggerFactory.getLogger(StateMachineLanguageRuntime.class);

    private final LrpConfig config;
    private final StateMachineParser parser;
    private final RuntimeFactory runtimeFactory;
    private final Map<String, DebugSession> sessions = new ConcurrentHashMap<>();

    public StateMachineLanguageRuntime(LrpConfig config, StateMachineParser parser, RuntimeFactory runtimeFactory) {
        this.config = Objects.requireNonNull(config, "config");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.runtimeFactory = Objects.requireNonNull(runtimeFactory, "runtimeFactory");
    }

    @Override
    public ParseResponse parse(String sourceFile) {
        Objects.requireNonNull(sourceFile, "sourceFile");
        IdGenerator ids = IdGenerator.forStrategy(config.getIdStrategy());
        StateMachine machine = parser.parse(sourceFile, ids);
        ParseResponse response = ParseResponse.of(machine, config);
        sessions.put(sourceFile, new DebugSession(sourceFile, machine, ids));
        log.info("Parsed source file={} stateMachine={} states={}", sourceFile, machine.getName(), machine.getAllStates().size());
        return response;
    }

    @Override
    public InitResponse initExecution(String sourceFile, List<String> inputs) {
        DebugSession session = requireSession(sourceFile);
        Runtime runtime = runtimeFactory.create(session.getStateMachine(), inputs != null ? List.copyOf(inputs) : List.of());
        session.setRuntime(runtime);
        log.info("Execution started for source file={} inputs={} done={}", sourceFile, runtime.getInputs().size(), runtime.isExecutionDone());
        return new InitResponse(runtime.isExecutionDone());
    }

    public InitResponse initExecution(InitArguments args) {
        return initExecution(args.getSourceFile(), args.getInputs());
    }

    @Override
    public StepResponse nextStep(String sourceFile) {
        Runtime runtime = requireSession(sourceFile).requireRuntime();
        if (!runtime.isExecutionDone()) {
            runtime.nextStep();
        }
        log.debug("Step source file={} currentState={} done={}", sourceFile, runtime.getCurrentState().getId(), runtime.isExecutionDone());
        return new StepResponse(runtime.isExecutionDone());
    }

    /** Step the next {@link #nextStep} call will perform, or empty when no transition can fire. */
    public Optional<TransitionStep> getNextStep(String sourceFile) {
        Transition next = requireSession(sourceFile).requireRuntime().getNextTransition();
        return next == null ? Optional.empty() : Optional.of(new TransitionStep(next));
    }

    @Override
    public GetRuntimeStateResponse getRuntimeState(String sourceFile) {
        DebugSession session = requireSession(sourceFile);
        RuntimeState snapshot = RuntimeState.of(session.requireRuntime(), session.getIds());
        return GetRuntimeStateResponse.of(snapshot, config);
    }

    @Override
    public GetBreakpointTypesResponse getBreakpointTypes() {
        return new GetBreakpointTypesResponse(StateMachineBreakpointTypes.all());
    }

    /**
     * Resolves breakpoint type and AST element, then lets the runtime decide. Unknown types,
     * unknown elements and elements of the wrong node type are negative answers.
     */
    @Override
    public CheckBreakpointResponse checkBreakpoint(CheckBreakpointArgs args) {
        DebugSession session = requireSession(args.getSourceFile());
        Runtime runtime = session.requireRuntime();
        Optional<BreakpointType> type = StateMachineBreakpointTypes.findById(args.getTypeId());
        if (type.isEmpty()) {
            return CheckBreakpointResponse.notActivated("Unknown breakpoint type " + args.getTypeId());
        }
        ASTElement element = session.getStateMachine().findElementById(args.getElementId());
        if (element == null) {
            return CheckBreakpointResponse.notActivated("Unknown element " + args.getElementId());
        }
        Optional<String> expectedType = StateMachineBreakpointTypes.targetElementType(type.get());
        if (expectedType.isPresent() && !expectedType.get().equals(element.getType())) {
            return CheckBreakpointResponse.notActivated("Breakpoint type " + type.get().getId()
                    + " applies to " + expectedType.get() + ", not " + element.getType());
        }
        return runtime.checkBreakpoint(type.get(), element);
    }

    /** Writes a response of this runtime as JSON for the transport, using the configured formatting. */
    public String toJson(Object response) {
        return LrpJson.toJson(response, config);
    }

    /** Session of a parsed source file, if any. */
    public Optional<DebugSession> findSession(String sourceFile) {
        return sourceFile == null ? Optional.empty() : Optional.ofNullable(sessions.get(sourceFile));
    }

    /** Drops the session of a source file; returns whether one existed. */
    public boolean closeSession(String sourceFile) {
        boolean removed = sourceFile != null && sessions.remove(sourceFile) != null;
        if (removed) {
            log.info("Closed session for source file={}", sourceFile);
        }
        return removed;
    }

    private DebugSession requireSession(String sourceFile) {
        DebugSession session = sourceFile == null ? null : sessions.get(sourceFile);
        if (session == null) {
            throw new IllegalStateException("Source file not parsed: " + sourceFile);
        }
        return session;
    }
}
