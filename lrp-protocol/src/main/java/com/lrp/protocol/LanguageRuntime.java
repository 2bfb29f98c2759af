package com.lrp.protocol;

import com.lrp.protocol.message.CheckBreakpointArgs;
import com.lrp.protocol.message.CheckBreakpointResponse;
import com.lrp.protocol.message.GetBreakpointTypesResponse;
import com.lrp.protocol.message.GetRuntimeStateResponse;
import com.lrp.protocol.message.InitResponse;
import com.lrp.protocol.message.ParseResponse;
import com.lrp.protocol.message.StepResponse;

import java.util.List;

/**
 * Requests a language backend answers for the debugger front-end. The transport that carries
 * requests and responses is supplied by the embedding process; implementations only build the
 * response records.
 */
public interface LanguageRuntime {

    /** Parses the source file and returns its AST. Replaces any previous session of that file. */
    ParseResponse parse(String sourceFile);

    /** Starts an execution of a parsed source file with the given ordered inputs. */
    InitResponse initExecution(String sourceFile, List<String> inputs);

    /** Advances the execution of the source file by one step. */
    StepResponse nextStep(String sourceFile);

    GetRuntimeStateResponse getRuntimeState(String sourceFile);

    GetBreakpointTypesResponse getBreakpointTypes();

    CheckBreakpointResponse checkBreakpoint(CheckBreakpointArgs args);
}
