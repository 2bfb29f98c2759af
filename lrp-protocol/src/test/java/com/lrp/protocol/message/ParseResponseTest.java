package com.lrp.protocol.message;

import com.lrp.config.LrpConfig;
import com.lrp.protocol.error.UnresolvedReferenceException;
import com.lrp.protocol.model.ModelElement;
import com.lrp.protocol.model.SequentialIdGenerator;
import com.lrp.protocol.model.SerializationContext;
import com.lrp.protocol.model.WireRecord;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ParseResponseTest {

    /** Root whose ref points at a fixed id. */
    private static final class PointingElement extends ModelElement {
        private final String target;

        PointingElement(String target) {
            super("test.pointing", new SequentialIdGenerator());
            this.target = target;
        }

        @Override
        protected WireRecord toWireRecord(SerializationContext context) {
            return recordBuilder().ref("target", target).build();
        }
    }

    @Test
    void of_rejectsDanglingRefWhenValidationEnabled() {
        assertThrows(UnresolvedReferenceException.class, () -> ParseResponse.of(new PointingElement("missing")));
    }

    @Test
    void of_skipsValidationWhenDisabled() {
        LrpConfig config = LrpConfig.builder().validateReferences(false).build();

        ParseResponse response = ParseResponse.of(new PointingElement("missing"), config);

        assertEquals("missing", response.getAstRoot().getRefs().get("target"));
    }

    @Test
    void of_acceptsSelfReference() {
        ParseResponse response = ParseResponse.of(new PointingElement("n1"));

        assertEquals("n1", response.getAstRoot().getId());
    }

    @Test
    void getRuntimeStateResponse_doesNotValidateRefs() {
        GetRuntimeStateResponse response = GetRuntimeStateResponse.of(new PointingElement("ast-node"));

        assertEquals("ast-node", response.getRuntimeStateRoot().getRefs().get("target"));
    }
}
