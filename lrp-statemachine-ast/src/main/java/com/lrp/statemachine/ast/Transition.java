package com.lrp.statemachine.ast;

import com.lrp.protocol.model.ASTElement;
import com.lrp.protocol.model.IdGenerator;
import com.lrp.protocol.model.Location;
import com.lrp.protocol.model.SerializationContext;
import com.lrp.protocol.model.WireRecord;

/**
 * Directed edge between two states, fired by an optional input and producing an optional output.
 * Created only through {@link State#createTransition}.
 * <p>
 * On the wire a transition into a final state carries no {@code refs.target}: the front-end
 * only learns that the final condition is reached, not which final state.
 */
public final class Transition extends ASTElement {

    public static final String TYPE = "stateMachine.transition";

    static final String ATTR_INPUT = "input";
    /** Wire key of the output, as spelled by the front-end protocol. */
    static final String ATTR_OUTPUT = "ouptut";
    static final String REF_TARGET = "target";

    private final State source;
    private final State target;
    private final String input;
    private final String output;

    Transition(State source, State target, String input, String output, Location location, IdGenerator ids) {
        super(TYPE, location, ids);
        this.source = source;
        this.target = target;
        this.input = input;
        this.output = output;
    }

    public State getSource() {
        return source;
    }

    public State getTarget() {
        return target;
    }

    /** Input required to fire the transition; null for an unconditioned transition. */
    public String getInput() {
        return input;
    }

    /** Output produced when firing; null for a silent transition. */
    public String getOutput() {
        return output;
    }

    @Override
    protected WireRecord toWireRecord(SerializationContext context) {
        WireRecord.Builder record = recordBuilder()
                .attribute(ATTR_INPUT, input)
                .attribute(ATTR_OUTPUT, output);
        if (!target.isFinal()) {
            record.ref(REF_TARGET, target.getId());
        }
        return record.build();
    }
}
