package ai.mapper.model;

import java.util.List;

public record CallPayload(
        String callee,                // callee expression as written
        List<CallArgument> arguments,
        boolean returnCaptured,
        String returnVar,
        String dataFlow,              // only when the callee resolved and the return is captured
        int hop                       // position in an attribute chain, 0 for plain names
) implements EdgePayload {
    public CallPayload {
        arguments = List.copyOf(arguments);
    }

    public CallPayload withReturn(String var, String flow) {
        return new CallPayload(callee, arguments, true, var, flow, hop);
    }
}
