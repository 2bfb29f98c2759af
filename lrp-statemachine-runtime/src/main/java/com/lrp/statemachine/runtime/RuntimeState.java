package com.lrp.statemachine.runtime;

import com.lrp.protocol.model.IdGenerator;
import com.lrp.protocol.model.ModelElement;
import com.lrp.protocol.model.SerializationContext;
import com.lrp.protocol.model.UuidIdGenerator;
import com.lrp.protocol.model.WireRecord;
import com.lrp.statemachine.ast.State;

import java.util.List;
import java.util.Objects;

/**
 * Snapshot of a running state machine passed to the debugger: inputs, index of the next input to
 * consume, current state and outputs so far. A new snapshot is taken for every report.
 * <p>
 * When the current state is final the record carries {@code attributes.currentState = "FINAL"}
 * and no refs; otherwise {@code refs.currentState} holds the state id.
 */
public final class RuntimeState extends ModelElement {

    public static final String TYPE = "stateMachine.runtimeState";
    public static final String FINAL_MARKER = "FINAL";

    private static final String ATTR_INPUTS = "inputs";
    private static final String ATTR_NEXT_CONSUMED_INPUT_INDEX = "nextConsumedInputIndex";
    private static final String ATTR_OUTPUTS = "outputs";
    private static final String CURRENT_STATE = "currentState";

    private final List<String> inputs;
    private final Integer nextConsumedInputIndex;
    private final State currentState;
    private final List<String> outputs;

    public RuntimeState(List<String> inputs, Integer nextConsumedInputIndex, State currentState,
                        List<String> outputs, IdGenerator ids) {
        super(TYPE, ids);
        this.inputs = inputs != null ? List.copyOf(inputs) : List.of();
        this.nextConsumedInputIndex = nextConsumedInputIndex;
        this.currentState = Objects.requireNonNull(currentState, "currentState");
        this.outputs = outputs != null ? List.copyOf(outputs) : List.of();
    }

    /** Snapshot of the runtime; the next input index is null when no transition is pending. */
    public static RuntimeState of(Runtime runtime, IdGenerator ids) {
        Integer nextIndex = runtime.getNextTransition() == null ? null : runtime.getNextConsumedInputIndex();
        return new RuntimeState(runtime.getInputs(), nextIndex, runtime.getCurrentState(), runtime.getOutputs(), ids);
    }

    public static RuntimeState of(Runtime runtime) {
        return of(runtime, UuidIdGenerator.INSTANCE);
    }

    public List<String> getInputs() {
        return inputs;
    }

    /** Null when execution holds no pending input. */
    public Integer getNextConsumedInputIndex() {
        return nextConsumedInputIndex;
    }

    public State getCurrentState() {
        return currentState;
    }

    public List<String> getOutputs() {
        return outputs;
    }

    @Override
    protected WireRecord toWireRecord(SerializationContext context) {
        WireRecord.Builder record = recordBuilder()
                .attribute(ATTR_INPUTS, inputs)
                .attribute(ATTR_NEXT_CONSUMED_INPUT_INDEX, nextConsumedInputIndex)
                .attribute(ATTR_OUTPUTS, outputs);
        if (currentState.isFinal()) {
            record.attribute(CURRENT_STATE, FINAL_MARKER);
        } else {
            record.ref(CURRENT_STATE, currentState.getId());
        }
        return record.build();
    }
}
