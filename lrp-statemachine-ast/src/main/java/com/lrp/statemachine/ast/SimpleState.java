package com.lrp.statemachine.ast;

import com.lrp.protocol.model.IdGenerator;
import com.lrp.protocol.model.Location;
import com.lrp.protocol.model.SerializationContext;
import com.lrp.protocol.model.UuidIdGenerator;
import com.lrp.protocol.model.WireRecord;

/** State that contains no other states. */
public final class SimpleState extends State {

    public SimpleState(String name, boolean isFinal, Location location, IdGenerator ids) {
        super(name, isFinal, location, ids);
    }

    public SimpleState(String name, boolean isFinal) {
        this(name, isFinal, null, UuidIdGenerator.INSTANCE);
    }

    public SimpleState(String name) {
        this(name, false);
    }

    @Override
    public StateKind getKind() {
        return StateKind.SIMPLE;
    }

    @Override
    protected void contribute(WireRecord.Builder record, SerializationContext context) {
        // no nested states, no refs
    }
}
