package com.lrp.protocol.message;

import com.lrp.config.LrpConfig;
import com.lrp.protocol.model.ModelElement;
import com.lrp.protocol.model.SerializationContext;
import com.lrp.protocol.model.WireRecord;
import com.lrp.protocol.validate.WireReferenceValidator;

import java.util.Objects;

/** Response to a parse request: the serialized AST root. */
public final class ParseResponse {

    private final WireRecord astRoot;

    public ParseResponse(WireRecord astRoot) {
        this.astRoot = Objects.requireNonNull(astRoot, "astRoot");
    }

    /**
     * Serializes the AST with the configured depth ceiling and, when enabled, checks that all
     * refs resolve inside the serialized tree.
     *
     * @throws com.lrp.protocol.error.LrpModelException when the tree is malformed, too deep or has dangling refs
     */
    public static ParseResponse of(ModelElement astRoot, LrpConfig config) {
        WireRecord record = SerializationContext.fromConfig(config).serialize(astRoot);
        if (config.isValidateReferences()) {
            WireReferenceValidator.validate(record);
        }
        return new ParseResponse(record);
    }

    public static ParseResponse of(ModelElement astRoot) {
        return of(astRoot, LrpConfig.defaults());
    }

    public WireRecord getAstRoot() {
        return astRoot;
    }
}
