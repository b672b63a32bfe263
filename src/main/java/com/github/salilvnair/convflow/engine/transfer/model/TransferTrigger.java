package com.github.salilvnair.convflow.engine.transfer.model;

import com.github.salilvnair.convflow.engine.constants.ConvFlowValue;
import com.github.salilvnair.convflow.engine.stack.model.InterruptionKind;

/**
 * Why a transfer fires. Each trigger fixes how the stack is changed and the
 * interruption kind recorded on the suspended frame.
 */
public enum TransferTrigger {

    EXPLICIT_CHANGE(InterruptionKind.USER_INITIATED, false),
    INTERRUPTION(InterruptionKind.USER_INITIATED, true),
    SYSTEM_SUGGESTION(InterruptionKind.SYSTEM_SUGGESTION, true),
    CONTEXT_DRIVEN(InterruptionKind.CONTEXT_SWITCH, false),
    USER_CLARIFICATION(InterruptionKind.CLARIFICATION, false),
    TIMEOUT(InterruptionKind.URGENT_INTERRUPTION, false),
    ERROR_RECOVERY(InterruptionKind.URGENT_INTERRUPTION, false);

    private final InterruptionKind interruptionKind;
    private final boolean savesContext;

    TransferTrigger(InterruptionKind interruptionKind, boolean savesContext) {
        this.interruptionKind = interruptionKind;
        this.savesContext = savesContext;
    }

    public InterruptionKind interruptionKind() {
        return interruptionKind;
    }

    public boolean savesContext() {
        return savesContext;
    }

    public TransferType transferType(String targetIntent) {
        return switch (this) {
            case EXPLICIT_CHANGE -> TransferType.POP_THEN_PUSH;
            case USER_CLARIFICATION -> ConvFlowValue.PREVIOUS.equals(targetIntent)
                    ? TransferType.POP_ONLY
                    : TransferType.PUSH_ONLY;
            default -> TransferType.PUSH_ONLY;
        };
    }
}
