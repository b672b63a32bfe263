package com.github.salilvnair.convflow.engine.exception;

import lombok.Getter;

import java.util.Map;

@Getter
public class ConvFlowException extends RuntimeException {

    private final ConvFlowErrorCode code;
    private final boolean recoverable;
    private Map<String, Object> metaData;

    public ConvFlowException(ConvFlowErrorCode code) {
        super(code.defaultMessage());
        this.code = code;
        this.recoverable = code.recoverable();
    }

    public ConvFlowException(ConvFlowErrorCode code, String overrideMessage) {
        super(overrideMessage);
        this.code = code;
        this.recoverable = code.recoverable();
    }

    public ConvFlowException(ConvFlowErrorCode code, String overrideMessage, Throwable cause) {
        super(overrideMessage, cause);
        this.code = code;
        this.recoverable = code.recoverable();
    }

    public String getErrorCode() {
        return code.name();
    }

    public ConvFlowException withMetaData(Map<String, Object> metaData) {
        this.metaData = metaData;
        return this;
    }

}
